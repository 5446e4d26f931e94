package edu.stanford.futuredata.tallyserve.expression;

public enum ComparisonOperator {
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /** True for the operators that need an ordering rather than equality. */
    public boolean isOrdering() {
        return this != EQ && this != NE;
    }

    /** Apply this operator to the result of {@code fieldValue.compareTo(literal)}. */
    public boolean test(int comparison) {
        switch (this) {
            case EQ:
                return comparison == 0;
            case NE:
                return comparison != 0;
            case LT:
                return comparison < 0;
            case LE:
                return comparison <= 0;
            case GT:
                return comparison > 0;
            case GE:
                return comparison >= 0;
            default:
                throw new IllegalStateException("Unknown operator " + this);
        }
    }
}
