package edu.stanford.futuredata.tallyserve.query;

import edu.stanford.futuredata.tallyserve.expression.And;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Compare;
import edu.stanford.futuredata.tallyserve.expression.ComparisonOperator;
import edu.stanford.futuredata.tallyserve.expression.Expression;
import edu.stanford.futuredata.tallyserve.expression.In;
import edu.stanford.futuredata.tallyserve.expression.IsNull;
import edu.stanford.futuredata.tallyserve.expression.Not;
import edu.stanford.futuredata.tallyserve.expression.NotNull;
import edu.stanford.futuredata.tallyserve.expression.Or;
import edu.stanford.futuredata.tallyserve.expression.Range;
import edu.stanford.futuredata.tallyserve.expression.Value;
import edu.stanford.futuredata.tallyserve.index.IndexCatalog;
import edu.stanford.futuredata.tallyserve.index.InvertedIndex;
import edu.stanford.futuredata.tallyserve.index.QueryScope;
import edu.stanford.futuredata.tallyserve.index.Representation;
import edu.stanford.futuredata.tallyserve.index.ScoreRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps an expression to an index containing every matching row, combining indexes with set algebra.
 *
 * The result's exactness always agrees with {@link CardinalityExactnessAnalyzer#exactness(Expression)}.  Derived
 * indexes are built in the given scope; a persisted derived index with the same signature is reused instead.
 */
public class IndexResolver {

    private static final Logger logger = LoggerFactory.getLogger(IndexResolver.class);

    private final IndexCatalog catalog;
    private final CardinalityExactnessAnalyzer analyzer;

    public IndexResolver(IndexCatalog catalog, CardinalityExactnessAnalyzer analyzer) {
        this.catalog = catalog;
        this.analyzer = analyzer;
    }

    public Resolution resolve(Expression expression, QueryScope scope) {
        if (buildsDerivedIndex(expression)) {
            Optional<InvertedIndex> cached = catalog.derived(expression.toString());
            if (cached.isPresent()) {
                logger.debug("Reusing persisted index for {}", expression);
                return new Resolution(cached.get(), analyzer.exactness(expression), null);
            }
        }
        switch (expression.getKind()) {
            case COMPARE:
                return resolveCompare((Compare) expression, scope);
            case RANGE:
                return resolveRange((Range) expression);
            case IN:
                return resolveIn((In) expression, scope);
            case IS_NULL: {
                IsNull isNull = (IsNull) expression;
                InvertedIndex index = scope.difference(expression.toString(), Representation.SET, catalog.all(),
                        catalog.any(isNull.getColumn().getName()));
                return new Resolution(index, Exactness.EXACT, null);
            }
            case NOT_NULL:
                return new Resolution(catalog.any(((NotNull) expression).getColumn().getName()), Exactness.EXACT,
                        null);
            case AND:
                return resolveAnd((And) expression, scope);
            case OR: {
                Or or = (Or) expression;
                Resolution left = resolve(or.getLeft(), scope);
                Resolution right = resolve(or.getRight(), scope);
                InvertedIndex index = scope.union(expression.toString(), Representation.SET,
                        List.of(left.getIndex(), right.getIndex()));
                return new Resolution(index, analyzer.combine(left.getExactness(), right.getExactness()), null);
            }
            case NOT: {
                Resolution child = resolve(((Not) expression).getChild(), scope);
                if (child.getExactness() == Exactness.APPROX) {
                    // The complement of a superset of the matches is not a superset of the non-matches.
                    return new Resolution(catalog.all(), Exactness.APPROX, null);
                }
                InvertedIndex index = scope.difference(expression.toString(), Representation.SET, catalog.all(),
                        child.getIndex());
                return new Resolution(index, Exactness.EXACT, null);
            }
            default:
                throw new IllegalArgumentException("Unknown expression kind " + expression.getKind());
        }
    }

    private Resolution resolveCompare(Compare compare, QueryScope scope) {
        Column column = compare.getColumn();
        String name = column.getName();
        if (column.getAttribute() == Column.Attribute.VALUE && compare.getOp() == ComparisonOperator.EQ) {
            InvertedIndex index = catalog.value(name, compare.getLiteral()).orElseGet(scope::empty);
            return new Resolution(index, Exactness.EXACT, null);
        }
        if (column.getAttribute() == Column.Attribute.VALUE && compare.getOp() == ComparisonOperator.NE) {
            InvertedIndex any = catalog.any(name);
            Optional<InvertedIndex> excluded = catalog.value(name, compare.getLiteral());
            if (excluded.isEmpty()) {
                return new Resolution(any, Exactness.EXACT, null);
            }
            InvertedIndex index = scope.difference(compare.toString(), Representation.SET, any, excluded.get());
            return new Resolution(index, Exactness.EXACT, null);
        }
        return ordered(column, ScoreRange.forComparison(column, compare.getOp(), compare.getLiteral()),
                compare.getOp().isOrdering());
    }

    private Resolution resolveRange(Range range) {
        return ordered(range.getColumn(), ScoreRange.between(range.getColumn(), range.getLower(), range.getUpper()),
                true);
    }

    // Candidates for a test the indexes cannot answer exactly: the column's non-null rows, narrowed by score when
    // the column is ordered by the tested attribute.
    private Resolution ordered(Column column, ScoreRange range, boolean ordering) {
        InvertedIndex any = catalog.any(column.getName());
        if (ordering && !any.isOrderedBy(column)) {
            catalog.recordOrderingDemand(column);
        }
        return new Resolution(any, Exactness.APPROX, range);
    }

    private Resolution resolveIn(In in, QueryScope scope) {
        Column column = in.getColumn();
        if (column.getAttribute() != Column.Attribute.VALUE) {
            return new Resolution(catalog.any(column.getName()), Exactness.APPROX, null);
        }
        List<InvertedIndex> present = new ArrayList<>();
        for (Value literal : in.getLiterals()) {
            catalog.value(column.getName(), literal).ifPresent(present::add);
        }
        if (present.isEmpty()) {
            return new Resolution(scope.empty(), Exactness.EXACT, null);
        }
        if (present.size() == 1) {
            return new Resolution(present.get(0), Exactness.EXACT, null);
        }
        return new Resolution(scope.union(in.toString(), Representation.SET, present), Exactness.EXACT, null);
    }

    private Resolution resolveAnd(And and, QueryScope scope) {
        Resolution left = resolve(and.getLeft(), scope);
        Resolution right = resolve(and.getRight(), scope);
        Exactness exactness = analyzer.combine(left.getExactness(), right.getExactness());
        // Keep a child's score range by intersecting into an ordered set scored from that child.
        Resolution scored = left.getScoreRange() != null ? left : right.getScoreRange() != null ? right : null;
        if (scored != null) {
            Resolution other = scored == left ? right : left;
            InvertedIndex index = scope.intersect(and.toString(), Representation.ORDERED_SET,
                    List.of(scored.getIndex(), other.getIndex()));
            return new Resolution(index, exactness, scored.getScoreRange());
        }
        InvertedIndex index = scope.intersect(and.toString(), Representation.SET,
                List.of(left.getIndex(), right.getIndex()));
        return new Resolution(index, exactness, null);
    }

    private static boolean buildsDerivedIndex(Expression expression) {
        switch (expression.getKind()) {
            case IN:
            case IS_NULL:
            case AND:
            case OR:
            case NOT:
                return true;
            case COMPARE:
                return ((Compare) expression).getOp() == ComparisonOperator.NE;
            default:
                return false;
        }
    }
}
