package edu.stanford.futuredata.tallyserve.shard.queryplans;

import edu.stanford.futuredata.tallyserve.expression.Record;
import edu.stanford.futuredata.tallyserve.interfaces.SimpleWriteQueryPlan;
import edu.stanford.futuredata.tallyserve.shard.IndexShard;

import java.util.List;

public class RecordWriteQueryPlan implements SimpleWriteQueryPlan<Record, IndexShard> {

    private final String tableName;

    public RecordWriteQueryPlan(String tableName) {
        this.tableName = tableName;
    }

    @Override
    public String getQueriedTable() {
        return tableName;
    }

    @Override
    public boolean write(IndexShard shard, List<Record> rows) {
        shard.write(rows);
        return true;
    }
}
