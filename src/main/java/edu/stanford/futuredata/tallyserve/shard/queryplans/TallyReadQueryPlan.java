package edu.stanford.futuredata.tallyserve.shard.queryplans;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Expression;
import edu.stanford.futuredata.tallyserve.interfaces.ReadQueryPlan;
import edu.stanford.futuredata.tallyserve.query.DistributedAggregator;
import edu.stanford.futuredata.tallyserve.query.PartialResult;
import edu.stanford.futuredata.tallyserve.query.QueryKind;
import edu.stanford.futuredata.tallyserve.shard.IndexShard;
import edu.stanford.futuredata.tallyserve.utilities.Utilities;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Count, extent or id-set query over every shard of a table.
 */
public class TallyReadQueryPlan implements ReadQueryPlan<IndexShard, PartialResult> {

    private final String tableName;
    private final QueryKind kind;
    private final Expression expression;
    private final Column target;

    private TallyReadQueryPlan(String tableName, QueryKind kind, Expression expression, Column target) {
        this.tableName = Objects.requireNonNull(tableName);
        this.kind = Objects.requireNonNull(kind);
        this.expression = Objects.requireNonNull(expression);
        this.target = target;
    }

    public static TallyReadQueryPlan count(String tableName, Expression expression) {
        return new TallyReadQueryPlan(tableName, QueryKind.COUNT, expression, null);
    }

    public static TallyReadQueryPlan ids(String tableName, Expression expression) {
        return new TallyReadQueryPlan(tableName, QueryKind.ID_SET, expression, null);
    }

    public static TallyReadQueryPlan extent(String tableName, Column target, Expression expression) {
        return new TallyReadQueryPlan(tableName, QueryKind.EXTENT, expression, Objects.requireNonNull(target));
    }

    public QueryKind getKind() {
        return kind;
    }

    @Override
    public String getQueriedTable() {
        return tableName;
    }

    @Override
    public List<Integer> keysForQuery() {
        return List.of(-1);
    }

    @Override
    public ByteString queryShard(IndexShard shard) {
        return Utilities.objectToByteString(shard.evaluate(kind, expression, target));
    }

    @Override
    public PartialResult aggregateShardQueries(List<ByteString> shardQueryResults) {
        List<PartialResult> partials = shardQueryResults.stream()
                .map(b -> (PartialResult) Utilities.byteStringToObject(b))
                .collect(Collectors.toList());
        return DistributedAggregator.combine(partials, kind);
    }

    @Override
    public String toString() {
        return String.format("%s %s on %s%s", kind, expression, tableName, target == null ? "" : " of " + target);
    }
}
