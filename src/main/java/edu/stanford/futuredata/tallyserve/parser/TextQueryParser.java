package edu.stanford.futuredata.tallyserve.parser;

import edu.stanford.futuredata.tallyserve.exceptions.SyntaxErrorException;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.ComparisonOperator;
import edu.stanford.futuredata.tallyserve.expression.Expression;
import edu.stanford.futuredata.tallyserve.expression.Value;
import org.javatuples.Pair;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A recursive-descent parser for a small SQL-like predicate language.
 *
 * <pre>
 * or        := and (OR and)*
 * and       := unary (AND unary)*
 * unary     := NOT unary | '(' or ')' | predicate
 * predicate := column op literal
 *            | column [NOT] IN '(' literal (',' literal)* ')'
 *            | column IS [NOT] NULL
 *            | column [NOT] BETWEEN literal AND literal
 *            | literal (&lt; | &lt;=) column (&lt; | &lt;=) literal
 *            | literal (&gt; | &gt;=) column (&gt; | &gt;=) literal
 * column    := name ['.' TIME]
 * literal   := 'string' | number | DATE 'yyyy-MM-dd' | DATE 'iso-instant'
 * </pre>
 *
 * Keywords are case-insensitive.  Names are identifiers or double-quoted; quotes inside quotes are doubled.
 */
public class TextQueryParser implements QueryParser {

    private enum TokenType {
        IDENTIFIER, QUOTED_IDENTIFIER, STRING, NUMBER, OPERATOR, LEFT_PAREN, RIGHT_PAREN, COMMA, DOT, END
    }

    private static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }

        boolean isKeyword(String keyword) {
            return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(keyword);
        }

        boolean isOperator(String... symbols) {
            if (type != TokenType.OPERATOR) {
                return false;
            }
            for (String s : symbols) {
                if (text.equals(s)) {
                    return true;
                }
            }
            return false;
        }

        String describe() {
            return type == TokenType.END ? "end of input" : "'" + text + "'";
        }
    }

    private List<Token> tokens;
    private int next;

    @Override
    public synchronized Expression parse(String text) {
        start(text);
        Expression expression = parseOr();
        expect(TokenType.END, "end of input");
        return expression;
    }

    @Override
    public synchronized Pair<Column, Expression> parseExtent(String text) {
        start(text);
        Column target = parseColumn();
        Expression filter;
        if (peek().isKeyword("WHERE")) {
            advance();
            filter = parseOr();
        } else {
            filter = Expression.notNull(target);
        }
        expect(TokenType.END, "end of input");
        return Pair.with(target, filter);
    }

    @Override
    public synchronized Value parseLiteral(String text) {
        start(text);
        Value value = literal();
        expect(TokenType.END, "end of input");
        return value;
    }

    private void start(String text) {
        tokens = tokenize(text);
        next = 0;
    }

    /* Grammar */

    private Expression parseOr() {
        Expression left = parseAnd();
        while (peek().isKeyword("OR")) {
            advance();
            left = Expression.or(left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseUnary();
        while (peek().isKeyword("AND")) {
            advance();
            left = Expression.and(left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        Token token = peek();
        if (token.isKeyword("NOT")) {
            advance();
            return Expression.not(parseUnary());
        }
        if (token.type == TokenType.LEFT_PAREN) {
            advance();
            Expression inner = parseOr();
            expect(TokenType.RIGHT_PAREN, "')'");
            return inner;
        }
        if (startsLiteral(token)) {
            return parseChainedRange();
        }
        return parsePredicate();
    }

    private Expression parsePredicate() {
        Column column = parseColumn();
        Token token = peek();
        if (token.type == TokenType.OPERATOR) {
            advance();
            return Expression.compare(column, operator(token), literal());
        }
        if (token.isKeyword("IS")) {
            advance();
            boolean negated = false;
            if (peek().isKeyword("NOT")) {
                advance();
                negated = true;
            }
            expectKeyword("NULL");
            return negated ? Expression.notNull(column) : Expression.isNull(column);
        }
        boolean negated = false;
        if (token.isKeyword("NOT")) {
            advance();
            negated = true;
            token = peek();
        }
        Expression predicate;
        if (token.isKeyword("IN")) {
            advance();
            expect(TokenType.LEFT_PAREN, "'('");
            List<Value> literals = new ArrayList<>();
            literals.add(literal());
            while (peek().type == TokenType.COMMA) {
                advance();
                literals.add(literal());
            }
            expect(TokenType.RIGHT_PAREN, "')'");
            predicate = Expression.in(column, literals);
        } else if (token.isKeyword("BETWEEN")) {
            advance();
            Value lower = literal();
            expectKeyword("AND");
            Value upper = literal();
            predicate = Expression.range(column, ComparisonOperator.GE, lower, ComparisonOperator.LE, upper);
        } else {
            throw new SyntaxErrorException(token.position,
                    String.format("Expected an operator, IN, IS or BETWEEN after %s but found %s", column,
                            token.describe()));
        }
        return negated ? Expression.not(predicate) : predicate;
    }

    // lower < column <= upper, or upper > column >= lower.
    private Expression parseChainedRange() {
        Value first = literal();
        Token firstOp = expectOperator("<", "<=", ">", ">=");
        Column column = parseColumn();
        boolean ascending = firstOp.isOperator("<", "<=");
        Token secondOp = ascending ? expectOperator("<", "<=") : expectOperator(">", ">=");
        Value second = literal();
        if (ascending) {
            // first < column means column > first.
            return Expression.range(column, flip(operator(firstOp)), first, operator(secondOp), second);
        }
        return Expression.range(column, operator(secondOp), second, flip(operator(firstOp)), first);
    }

    private Column parseColumn() {
        Token token = peek();
        if (token.type != TokenType.IDENTIFIER && token.type != TokenType.QUOTED_IDENTIFIER) {
            throw new SyntaxErrorException(token.position, "Expected a column name but found " + token.describe());
        }
        if (token.type == TokenType.IDENTIFIER && isReserved(token.text)) {
            throw new SyntaxErrorException(token.position, "Expected a column name but found keyword " + token.text);
        }
        advance();
        if (peek().type == TokenType.DOT) {
            advance();
            expectKeyword("TIME");
            return Column.time(token.text);
        }
        return Column.value(token.text);
    }

    private Value literal() {
        Token token = peek();
        switch (token.type) {
            case STRING:
                advance();
                return Value.ofString(token.text);
            case NUMBER:
                advance();
                try {
                    if (token.text.contains(".") || token.text.contains("e") || token.text.contains("E")) {
                        return Value.ofFloat(Double.parseDouble(token.text));
                    }
                    return Value.ofInteger(Long.parseLong(token.text));
                } catch (NumberFormatException e) {
                    throw new SyntaxErrorException(token.position, "Malformed number " + token.text);
                }
            case IDENTIFIER:
                if (token.isKeyword("DATE")) {
                    advance();
                    Token date = peek();
                    if (date.type != TokenType.STRING) {
                        throw new SyntaxErrorException(date.position,
                                "Expected a quoted date after DATE but found " + date.describe());
                    }
                    advance();
                    return parseDate(date);
                }
                break;
            default:
                break;
        }
        throw new SyntaxErrorException(token.position, "Expected a literal but found " + token.describe());
    }

    private static Value parseDate(Token token) {
        try {
            return Value.ofDate(LocalDate.parse(token.text));
        } catch (DateTimeParseException e) {
            try {
                return Value.ofDate(Instant.parse(token.text).toEpochMilli());
            } catch (DateTimeParseException e2) {
                throw new SyntaxErrorException(token.position, "Malformed date " + token.text);
            }
        }
    }

    private static boolean startsLiteral(Token token) {
        return token.type == TokenType.STRING || token.type == TokenType.NUMBER || token.isKeyword("DATE");
    }

    private static boolean isReserved(String word) {
        switch (word.toUpperCase(Locale.ROOT)) {
            case "AND":
            case "OR":
            case "NOT":
            case "IN":
            case "IS":
            case "NULL":
            case "BETWEEN":
            case "WHERE":
            case "DATE":
                return true;
            default:
                return false;
        }
    }

    private static ComparisonOperator operator(Token token) {
        switch (token.text) {
            case "=":
                return ComparisonOperator.EQ;
            case "!=":
            case "<>":
                return ComparisonOperator.NE;
            case "<":
                return ComparisonOperator.LT;
            case "<=":
                return ComparisonOperator.LE;
            case ">":
                return ComparisonOperator.GT;
            case ">=":
                return ComparisonOperator.GE;
            default:
                throw new SyntaxErrorException(token.position, "Unknown operator " + token.text);
        }
    }

    private static ComparisonOperator flip(ComparisonOperator op) {
        switch (op) {
            case LT:
                return ComparisonOperator.GT;
            case LE:
                return ComparisonOperator.GE;
            case GT:
                return ComparisonOperator.LT;
            case GE:
                return ComparisonOperator.LE;
            default:
                return op;
        }
    }

    /* Token stream */

    private Token peek() {
        return tokens.get(next);
    }

    private Token advance() {
        Token token = tokens.get(next);
        if (token.type != TokenType.END) {
            next++;
        }
        return token;
    }

    private Token expect(TokenType type, String description) {
        Token token = peek();
        if (token.type != type) {
            throw new SyntaxErrorException(token.position,
                    String.format("Expected %s but found %s", description, token.describe()));
        }
        return advance();
    }

    private void expectKeyword(String keyword) {
        Token token = peek();
        if (!token.isKeyword(keyword)) {
            throw new SyntaxErrorException(token.position,
                    String.format("Expected %s but found %s", keyword, token.describe()));
        }
        advance();
    }

    private Token expectOperator(String... symbols) {
        Token token = peek();
        if (!token.isOperator(symbols)) {
            throw new SyntaxErrorException(token.position,
                    String.format("Expected one of %s but found %s", String.join(" ", symbols), token.describe()));
        }
        return advance();
    }

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int start = i;
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LEFT_PAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RIGHT_PAREN, ")", i++));
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", i++));
            } else if (c == '.' && !(i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)))) {
                tokens.add(new Token(TokenType.DOT, ".", i++));
            } else if (c == '\'' || c == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                while (true) {
                    if (i >= text.length()) {
                        throw new SyntaxErrorException(start, "Unterminated quote");
                    }
                    char d = text.charAt(i);
                    if (d == c) {
                        if (i + 1 < text.length() && text.charAt(i + 1) == c) {
                            sb.append(c);
                            i += 2;
                            continue;
                        }
                        i++;
                        break;
                    }
                    sb.append(d);
                    i++;
                }
                tokens.add(new Token(c == '\'' ? TokenType.STRING : TokenType.QUOTED_IDENTIFIER, sb.toString(),
                        start));
            } else if (Character.isDigit(c) || c == '.'
                    || (c == '-' && i + 1 < text.length()
                    && (Character.isDigit(text.charAt(i + 1)) || text.charAt(i + 1) == '.'))) {
                i++;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
                    i++;
                    if (i < text.length() && (text.charAt(i) == '-' || text.charAt(i) == '+')) {
                        i++;
                    }
                    while (i < text.length() && Character.isDigit(text.charAt(i))) {
                        i++;
                    }
                }
                tokens.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, text.substring(start, i), start));
            } else if (c == '=') {
                tokens.add(new Token(TokenType.OPERATOR, "=", i++));
            } else if (c == '!' || c == '<' || c == '>') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '=') {
                    i += 2;
                } else if (c == '<' && i + 1 < text.length() && text.charAt(i + 1) == '>') {
                    i += 2;
                } else if (c == '!') {
                    throw new SyntaxErrorException(i, "Expected '=' after '!'");
                } else {
                    i++;
                }
                tokens.add(new Token(TokenType.OPERATOR, text.substring(start, i), start));
            } else {
                throw new SyntaxErrorException(i, String.format("Unexpected character '%c'", c));
            }
        }
        tokens.add(new Token(TokenType.END, "", text.length()));
        return tokens;
    }
}
