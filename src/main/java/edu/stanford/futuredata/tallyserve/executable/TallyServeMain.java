package edu.stanford.futuredata.tallyserve.executable;

import edu.stanford.futuredata.tallyserve.broker.Broker;
import edu.stanford.futuredata.tallyserve.datastore.DataStore;
import edu.stanford.futuredata.tallyserve.exceptions.QueryFailedException;
import edu.stanford.futuredata.tallyserve.expression.Column;
import edu.stanford.futuredata.tallyserve.expression.Expression;
import edu.stanford.futuredata.tallyserve.expression.Record;
import edu.stanford.futuredata.tallyserve.expression.Value;
import edu.stanford.futuredata.tallyserve.index.IndexingPolicy;
import edu.stanford.futuredata.tallyserve.parser.QueryParser;
import edu.stanford.futuredata.tallyserve.parser.TextQueryParser;
import edu.stanford.futuredata.tallyserve.query.PartialResult;
import edu.stanford.futuredata.tallyserve.shard.IndexShard;
import edu.stanford.futuredata.tallyserve.shard.IndexShardFactory;
import edu.stanford.futuredata.tallyserve.shard.TallyQueryEngine;
import edu.stanford.futuredata.tallyserve.shard.queryplans.RecordWriteQueryPlan;
import edu.stanford.futuredata.tallyserve.shard.queryplans.TallyReadQueryPlan;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class TallyServeMain {

    private static final Logger logger = LoggerFactory.getLogger(TallyServeMain.class);

    public static void main(String[] args) {
        Options options = buildOptions();
        try {
            CommandLineParser parser = new DefaultParser();
            CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption("datastore")) {
                logger.info("Starting datastore!");
                runDataStore(cmd);
            } else if (cmd.hasOption("broker")) {
                logger.info("Starting broker!");
                runBroker(cmd);
            } else {
                new HelpFormatter().printHelp("tallyserve", options);
                System.exit(1);
            }
        } catch (ParseException | IllegalArgumentException | QueryFailedException | IOException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption("broker", false, "Run queries through a broker");
        options.addOption("datastore", false, "Start a datastore");

        options.addOption("zh", true, "ZooKeeper Host Address");
        options.addOption("zp", true, "ZooKeeper Port");
        options.addOption("h", true, "Local Host Address");
        options.addOption("p", true, "Local Port");
        options.addOption("id", true, "Datastore ID");
        options.addOption("d", true, "Shard directory");
        options.addOption("ordered", true, "Ordered columns, e.g. Gender:time,Age:value");

        options.addOption("table", true, "Table name");
        options.addOption("shards", true, "Create the table with this many shards");
        options.addOption("load", true, "Load rows from a file of id,column,literal,time lines");
        options.addOption("kind", true, "Query kind: count, extent or ids");
        options.addOption("q", true, "Query text");
        return options;
    }

    static IndexingPolicy parsePolicy(String ordered) {
        IndexingPolicy policy = new IndexingPolicy();
        if (ordered == null || ordered.isBlank()) {
            return policy;
        }
        for (String entry : ordered.split(",")) {
            String[] columnAttribute = entry.trim().split(":");
            if (columnAttribute.length != 2) {
                throw new IllegalArgumentException("Expected column:attribute but got " + entry);
            }
            Column.Attribute attribute = Column.Attribute.valueOf(columnAttribute[1].trim().toUpperCase(Locale.ROOT));
            policy.orderBy(columnAttribute[0].trim(), attribute);
        }
        return policy;
    }

    private static void runDataStore(CommandLine cmd) throws InterruptedException {
        IndexingPolicy policy = parsePolicy(cmd.getOptionValue("ordered"));
        DataStore<Record, IndexShard> dataStore = new DataStore<>(new IndexShardFactory(policy),
                Path.of(cmd.getOptionValue("d", "/var/tmp/TallyServe")),
                cmd.getOptionValue("zh", "localhost"), Integer.parseInt(cmd.getOptionValue("zp", "2181")),
                cmd.getOptionValue("h", "localhost"), Integer.parseInt(cmd.getOptionValue("p", "8200")),
                Integer.parseInt(cmd.getOptionValue("id", "0")));
        if (!dataStore.startServing()) {
            throw new IllegalArgumentException("Datastore failed to start");
        }
        Thread.sleep(Long.MAX_VALUE);
    }

    private static void runBroker(CommandLine cmd) throws IOException {
        Broker broker = new Broker(cmd.getOptionValue("zh", "localhost"),
                Integer.parseInt(cmd.getOptionValue("zp", "2181")), new TallyQueryEngine());
        try {
            String table = cmd.getOptionValue("table", "respondents");
            QueryParser parser = new TextQueryParser();
            if (cmd.hasOption("shards")) {
                int numShards = Integer.parseInt(cmd.getOptionValue("shards"));
                if (!broker.createTable(table, numShards)) {
                    throw new IllegalArgumentException(String.format("Table %s exists with a different shard count",
                            table));
                }
            }
            if (cmd.hasOption("load")) {
                List<Record> records = readRecords(Path.of(cmd.getOptionValue("load")), parser);
                if (!broker.writeQuery(new RecordWriteQueryPlan(table), records)) {
                    throw new QueryFailedException("Load failed");
                }
                logger.info("Loaded {} rows into {}", records.size(), table);
            }
            if (cmd.hasOption("q")) {
                PartialResult result = broker.readQuery(plan(table, cmd.getOptionValue("kind", "count"),
                        cmd.getOptionValue("q"), parser));
                System.out.println(result);
            }
        } finally {
            broker.shutdown();
        }
    }

    static TallyReadQueryPlan plan(String table, String kind, String query, QueryParser parser) {
        switch (kind.toLowerCase(Locale.ROOT)) {
            case "count":
                return TallyReadQueryPlan.count(table, parser.parse(query));
            case "ids":
                return TallyReadQueryPlan.ids(table, parser.parse(query));
            case "extent":
                Pair<Column, Expression> extent = parser.parseExtent(query);
                return TallyReadQueryPlan.extent(table, extent.getValue0(), extent.getValue1());
            default:
                throw new IllegalArgumentException("Unknown query kind " + kind);
        }
    }

    // Each line is id,column,literal,time.  The literal may itself contain commas.
    static List<Record> readRecords(Path file, QueryParser parser) throws IOException {
        Map<String, Record.Builder> builders = new HashMap<>();
        List<String> order = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            int first = line.indexOf(',');
            int second = first < 0 ? -1 : line.indexOf(',', first + 1);
            int last = line.lastIndexOf(',');
            if (first < 0 || second < 0 || last <= second) {
                throw new IllegalArgumentException(String.format("%s:%d: expected id,column,literal,time", file,
                        lineNumber));
            }
            String id = line.substring(0, first).trim();
            String column = line.substring(first + 1, second).trim();
            Value value = parser.parseLiteral(line.substring(second + 1, last).trim());
            long time = parseTime(line.substring(last + 1).trim());
            if (!builders.containsKey(id)) {
                builders.put(id, Record.builder(id));
                order.add(id);
            }
            builders.get(id).field(column, value, time);
        }
        List<Record> records = new ArrayList<>();
        for (String id : order) {
            records.add(builders.get(id).build());
        }
        return records;
    }

    static long parseTime(String text) {
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(text).toEpochMilli();
            } catch (DateTimeParseException e2) {
                try {
                    return Long.parseLong(text);
                } catch (NumberFormatException e3) {
                    throw new IllegalArgumentException("Malformed time " + text);
                }
            }
        }
    }
}
