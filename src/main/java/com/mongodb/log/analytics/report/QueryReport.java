package com.mongodb.log.analytics.report;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.log.analytics.LogAnalyticsException;
import com.mongodb.log.analytics.grouping.GroupKeys;
import com.mongodb.log.analytics.grouping.GroupResult;
import com.mongodb.log.analytics.grouping.GroupStatistics;
import com.mongodb.log.analytics.grouping.Grouping;
import com.mongodb.log.analytics.io.LogReaders;
import com.mongodb.log.analytics.record.LogBounds;
import com.mongodb.log.analytics.record.OpType;
import com.mongodb.log.analytics.record.ParsedRecord;
import com.mongodb.log.analytics.record.ParserConfig;
import com.mongodb.log.analytics.record.RecordParser;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Summarizes the query operations of MongoDB log files per query shape.
 */
@Command(name = "logQueries", mixinStandardHelpOptions = true, version = "0.1",
        description = "Groups query operations by shape and reports duration statistics")
public class QueryReport implements Callable<Integer> {

    private static Logger logger = LoggerFactory.getLogger(QueryReport.class);

    static final String OTHERS = "others";

    private static final Set<String> QUERY_COMMANDS = Set.of("count", "findandmodify", "find", "geonear");

    @Option(names = { "-f", "--files" }, arity = "1..*", required = true, description = "Log files")
    private List<File> files;

    @Option(names = "--group", defaultValue = "shape",
            description = "Group by namespace, operation, thread, pattern or shape (default: ${DEFAULT-VALUE})")
    private String groupBy;

    @Option(names = "--limit", description = "Show only the N largest groups, the rest as '" + OTHERS + "'")
    private Integer limit;

    @Option(names = "--percentile", defaultValue = "95", description = "Percentile column (default: ${DEFAULT-VALUE})")
    private double percentile;

    private PrintStream out = System.out;

    public QueryReport() {
    }

    QueryReport(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() throws Exception {
        try {
            Grouping<ParsedRecord, Object> grouping = new Grouping<ParsedRecord, Object>(GroupKeys.byName(groupBy));
            for (File file : files) {
                read(file, grouping);
            }
            if (limit != null) {
                grouping.limit(limit, OTHERS);
            } else {
                grouping.sortBySize();
            }
            report(grouping.results(ParsedRecord::getDurationMs));
            return 0;
        } catch (LogAnalyticsException | IllegalArgumentException e) {
            logger.error("Error: {}", e.getMessage());
            return 1;
        }
    }

    private void read(File file, Grouping<ParsedRecord, Object> grouping) throws IOException {
        LogBounds bounds = LogReaders.scanBounds(file, ParserConfig.defaults());
        RecordParser parser = new RecordParser(bounds.parserConfig(ParserConfig.defaults()));
        int count = 0;
        try (BufferedReader in = LogReaders.createReader(file)) {
            Iterator<String> lines = LogReaders.lines(in);
            while (lines.hasNext()) {
                ParsedRecord record = parser.tryParse(lines.next());
                if (record != null && isQuery(record)) {
                    grouping.add(record);
                    count++;
                }
            }
        }
        logger.info("{}: {} query operations", file.getName(), count);
    }

    static boolean isQuery(ParsedRecord record) {
        OpType op = record.getOperation();
        if (op == null || record.getNamespace() == null) {
            return false;
        }
        return op.hasQueryPattern() || QUERY_COMMANDS.contains(record.getCommand());
    }

    void report(List<GroupResult<Object, ParsedRecord>> results) {
        String pHeader = String.format("p%s_ms", formatPercentile(percentile));
        out.println(String.format("%-80s %10s %10s %10s %10s %10s %12s",
                "group", "count", "min_ms", "max_ms", "mean_ms", pHeader, "sum_ms"));
        out.println("=".repeat(148));
        for (GroupResult<Object, ParsedRecord> result : results) {
            GroupStatistics stats = result.getStatistics();
            out.println(String.format("%-80s %10d %10.0f %10.0f %10.0f %10.0f %12.0f",
                    String.valueOf(result.getKey()), result.getRecords().size(), stats.getMin(), stats.getMax(),
                    stats.getMean(), stats.getPercentile(percentile), stats.getSum()));
        }
        out.flush();
    }

    private static String formatPercentile(double p) {
        return p == Math.floor(p) ? String.valueOf((long) p) : String.valueOf(p);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new QueryReport()).execute(args);
        System.exit(exitCode);
    }
}
