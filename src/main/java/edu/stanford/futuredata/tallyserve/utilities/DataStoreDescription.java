package edu.stanford.futuredata.tallyserve.utilities;

/**
 * Where a datastore serves, as registered in ZooKeeper under {@code /dsDescription/<dsID>}.
 */
public class DataStoreDescription {

    public static final int ALIVE = 0;
    public static final int DEAD = 1;

    public final int dsID;
    public final int status;
    public final String host;
    public final int port;

    public final String summaryString;

    public DataStoreDescription(int dsID, int status, String host, int port) {
        if (status != ALIVE && status != DEAD) {
            throw new IllegalArgumentException("Unknown datastore status " + status);
        }
        this.host = host;
        this.port = port;
        this.dsID = dsID;
        this.status = status;
        this.summaryString = String.format("%d\n%d\n%s\n%d", dsID, status, host, port);
    }

    public DataStoreDescription(String summaryString) {
        this.summaryString = summaryString;
        String[] dsValues = summaryString.split("\n");
        if (dsValues.length != 4) {
            throw new IllegalArgumentException("Malformed datastore description: " + summaryString);
        }
        dsID = Integer.parseInt(dsValues[0]);
        status = Integer.parseInt(dsValues[1]);
        host = dsValues[2];
        port = Integer.parseInt(dsValues[3]);
    }

    public boolean isAlive() {
        return status == ALIVE;
    }

    @Override
    public String toString() {
        return String.format("DS%d(%s:%d, %s)", dsID, host, port, isAlive() ? "alive" : "dead");
    }
}
