package edu.stanford.futuredata.tallyserve.utilities;

/**
 * A table's identity and shard count, as registered in ZooKeeper under {@code /tables/<name>}.
 */
public class TableInfo {
    public final String name;
    public final int id;
    public final int numShards;

    public TableInfo(String name, int id, int numShards) {
        this.name = name;
        this.id = id;
        this.numShards = numShards;
    }

    public String toSummaryString() {
        return String.format("%d\n%d", id, numShards);
    }

    public static TableInfo fromSummaryString(String name, String summary) {
        String[] values = summary.split("\n");
        if (values.length != 2) {
            throw new IllegalArgumentException(String.format("Malformed description of table %s: %s", name, summary));
        }
        return new TableInfo(name, Integer.parseInt(values[0]), Integer.parseInt(values[1]));
    }
}
