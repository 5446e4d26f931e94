package edu.stanford.futuredata.tallyserve.query;

import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Expression;
import edu.stanford.futuredata.tallyserve.expression.Record;
import edu.stanford.futuredata.tallyserve.expression.Value;
import edu.stanford.futuredata.tallyserve.index.IndexCatalog;
import edu.stanford.futuredata.tallyserve.index.InvertedIndex;
import edu.stanford.futuredata.tallyserve.index.QueryScope;
import edu.stanford.futuredata.tallyserve.store.RowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Answers a query on one shard.
 *
 * The expression is resolved to an index.  Exact counts and id sets come straight from it; otherwise each candidate
 * row is loaded and re-checked.  Extents always read rows.
 */
public class Evaluator {

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    private final IndexCatalog catalog;
    private final RowStore rowStore;
    private final IndexResolver resolver;
    private final CardinalityExactnessAnalyzer analyzer;

    public Evaluator(IndexCatalog catalog, RowStore rowStore) {
        this.catalog = catalog;
        this.rowStore = rowStore;
        this.analyzer = new CardinalityExactnessAnalyzer();
        this.resolver = new IndexResolver(catalog, analyzer);
    }

    /**
     * @param target the column whose extent is wanted; required for {@link QueryKind#EXTENT}, ignored otherwise
     * @throws edu.stanford.futuredata.tallyserve.exceptions.TypeMismatchException if a candidate row's field cannot
     * be compared with a literal, or extents meet values of incomparable kinds
     */
    public PartialResult evaluate(QueryKind kind, Expression expression, Column target) {
        if (kind == QueryKind.EXTENT && target == null) {
            throw new IllegalArgumentException("Extent queries need a target column");
        }
        try (QueryScope scope = catalog.openScope()) {
            Resolution resolution = resolver.resolve(expression, scope);
            logger.debug("{} {} resolved to {}", kind, expression, resolution);
            PartialResult result;
            if (analyzer.isExact(resolution, kind)) {
                result = fromIndex(kind, resolution.getIndex());
            } else {
                result = scan(kind, expression, target, resolution);
            }
            persistReusable(scope);
            return result;
        }
    }

    private PartialResult fromIndex(QueryKind kind, InvertedIndex index) {
        if (kind == QueryKind.COUNT) {
            return new PartialResult.Count(index.cardinality());
        }
        return new PartialResult.IdSet(new HashSet<>(index.members()));
    }

    private PartialResult scan(QueryKind kind, Expression expression, Column target, Resolution resolution) {
        Set<String> columns = new HashSet<>(expression.columns());
        if (kind == QueryKind.EXTENT) {
            columns.add(target.getName());
        }
        List<String> candidates = resolution.getScoreRange() == null
                ? resolution.getIndex().members()
                : resolution.getIndex().membersInScoreRange(resolution.getScoreRange());
        long count = 0;
        Set<String> ids = new HashSet<>();
        Value min = null;
        Value max = null;
        for (String id : candidates) {
            // Rows deleted since the index was read are skipped.
            Optional<Record> row = rowStore.getRow(id, columns);
            if (row.isEmpty() || !expression.matches(row.get())) {
                continue;
            }
            switch (kind) {
                case COUNT:
                    count++;
                    break;
                case ID_SET:
                    ids.add(id);
                    break;
                case EXTENT:
                    Optional<Value> value = row.get().get(target);
                    if (value.isPresent()) {
                        min = DistributedAggregator.lesser(min, value.get());
                        max = DistributedAggregator.greater(max, value.get());
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Unknown query kind " + kind);
            }
        }
        logger.debug("Scanned {} candidates for {}", candidates.size(), expression);
        switch (kind) {
            case COUNT:
                return new PartialResult.Count(count);
            case ID_SET:
                return new PartialResult.IdSet(ids);
            default:
                return new PartialResult.Extent(min, max);
        }
    }

    private void persistReusable(QueryScope scope) {
        for (InvertedIndex index : scope.getDerived()) {
            if (index.isPersistable() && catalog.predictsReuse(index.getSignature())) {
                index.persist();
                logger.debug("Persisted derived index for {}", index.getSignature());
            }
        }
    }
}
