package edu.stanford.futuredata.tallyserve.query;

import edu.stanford.futuredata.tallyserve.expression.And;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Compare;
import edu.stanford.futuredata.tallyserve.expression.ComparisonOperator;
import edu.stanford.futuredata.tallyserve.expression.Expression;
import edu.stanford.futuredata.tallyserve.expression.In;
import edu.stanford.futuredata.tallyserve.expression.Not;
import edu.stanford.futuredata.tallyserve.expression.Or;

/**
 * Decides whether the index an expression resolves to is exactly its match set.
 *
 * Equality and membership tests on values, and null tests, are answered by indexes exactly.  Ordering tests and
 * tests on write times only narrow candidates.  A composite is exact iff all of its parts are.
 */
public class CardinalityExactnessAnalyzer {

    public Exactness exactness(Expression expression) {
        switch (expression.getKind()) {
            case COMPARE:
                Compare compare = (Compare) expression;
                boolean equality = compare.getOp() == ComparisonOperator.EQ || compare.getOp() == ComparisonOperator.NE;
                return equality && compare.getColumn().getAttribute() == Column.Attribute.VALUE
                        ? Exactness.EXACT : Exactness.APPROX;
            case RANGE:
                return Exactness.APPROX;
            case IN:
                return ((In) expression).getColumn().getAttribute() == Column.Attribute.VALUE
                        ? Exactness.EXACT : Exactness.APPROX;
            case IS_NULL:
            case NOT_NULL:
                return Exactness.EXACT;
            case AND:
                And and = (And) expression;
                return combine(exactness(and.getLeft()), exactness(and.getRight()));
            case OR:
                Or or = (Or) expression;
                return combine(exactness(or.getLeft()), exactness(or.getRight()));
            case NOT:
                return exactness(((Not) expression).getChild());
            default:
                throw new IllegalArgumentException("Unknown expression kind " + expression.getKind());
        }
    }

    public Exactness combine(Exactness left, Exactness right) {
        return left == Exactness.EXACT && right == Exactness.EXACT ? Exactness.EXACT : Exactness.APPROX;
    }

    /** True if a query of this kind can be answered from the resolved index without reading rows. */
    public boolean isExact(Resolution resolution, QueryKind kind) {
        return kind != QueryKind.EXTENT && resolution.getExactness() == Exactness.EXACT;
    }
}
