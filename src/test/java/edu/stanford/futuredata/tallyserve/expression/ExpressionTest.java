package edu.stanford.futuredata.tallyserve.expression;

import edu.stanford.futuredata.tallyserve.exceptions.TypeMismatchException;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

import static edu.stanford.futuredata.tallyserve.expression.ComparisonOperator.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionTest {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTest.class);

    private static final Record ALICE = Record.builder("Alice")
            .field("Gender", Value.ofString("Female"), 1000L)
            .field("Score", Value.ofInteger(7), 2000L)
            .build();

    @Test
    public void testMatches() {
        logger.info("testMatches");
        assertTrue(Expression.compare(Column.value("Gender"), EQ, Value.ofString("Female")).matches(ALICE));
        assertFalse(Expression.compare(Column.value("Gender"), NE, Value.ofString("Female")).matches(ALICE));
        assertTrue(Expression.compare(Column.time("Score"), GE, Value.ofDate(2000L)).matches(ALICE));
        assertTrue(Expression.range(Column.value("Score"), GT, Value.ofInteger(6), LE, Value.ofFloat(7.0))
                .matches(ALICE));
        assertTrue(Expression.in(Column.value("Score"), List.of(Value.ofInteger(1), Value.ofInteger(7)))
                .matches(ALICE));
        assertTrue(Expression.notNull(Column.value("Gender")).matches(ALICE));
        assertTrue(Expression.isNull(Column.value("Age")).matches(ALICE));
    }

    @Test
    public void testAbsentFields() {
        logger.info("testAbsentFields");
        Expression ageEq = Expression.compare(Column.value("Age"), EQ, Value.ofString("Young"));
        Expression ageNe = Expression.compare(Column.value("Age"), NE, Value.ofString("Young"));
        assertFalse(ageEq.matches(ALICE));
        assertFalse(ageNe.matches(ALICE));
        assertTrue(Expression.not(ageEq).matches(ALICE));
        assertFalse(Expression.notNull(Column.value("Age")).matches(ALICE));
    }

    @Test
    public void testTypeMismatch() {
        logger.info("testTypeMismatch");
        Expression e = Expression.compare(Column.value("Score"), LT, Value.ofString("seven"));
        assertThrows(TypeMismatchException.class, () -> e.matches(ALICE));
    }

    @Test
    public void testCanonicalText() {
        logger.info("testCanonicalText");
        Expression e = Expression.and(
                Expression.compare(Column.value("Gender"), EQ, Value.ofString("Female")),
                Expression.not(Expression.isNull(Column.value("Age Group"))));
        assertEquals("(Gender = 'Female' AND NOT (\"Age Group\" IS NULL))", e.toString());
        Expression same = Expression.and(
                Expression.compare(Column.value("Gender"), EQ, Value.ofString("Female")),
                Expression.not(Expression.isNull(Column.value("Age Group"))));
        assertEquals(e, same);
        assertEquals(e.hashCode(), same.hashCode());
        assertEquals(Set.of("Gender", "Age Group"), e.columns());
    }

    @Test
    public void testInDeduplicates() {
        logger.info("testInDeduplicates");
        In in = (In) Expression.in(Column.value("Score"),
                List.of(Value.ofInteger(1), Value.ofFloat(1.0), Value.ofInteger(2)));
        assertEquals(2, in.getLiterals().size());
    }

    @Test
    public void testRangeOperators() {
        logger.info("testRangeOperators");
        assertThrows(IllegalArgumentException.class,
                () -> Expression.range(Column.value("Score"), LT, Value.ofInteger(1), LE, Value.ofInteger(5)));
        assertThrows(IllegalArgumentException.class,
                () -> Expression.range(Column.value("Score"), GE, Value.ofInteger(1), EQ, Value.ofInteger(5)));
    }
}
