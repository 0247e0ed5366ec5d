package com.mongodb.log.analytics.filter;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.log.analytics.LogAnalyticsException;
import com.mongodb.log.analytics.io.LogReaders;
import com.mongodb.log.analytics.record.LogBounds;
import com.mongodb.log.analytics.record.ParsedRecord;
import com.mongodb.log.analytics.record.ParserConfig;
import com.mongodb.log.analytics.record.RecordParser;
import com.mongodb.log.analytics.time.DateTimeBoundaries;
import com.mongodb.log.analytics.time.ResolvedBounds;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Prints the lines of MongoDB log files that pass time, duration, namespace and word filters.
 */
@Command(name = "logFilter", mixinStandardHelpOptions = true, version = "0.3",
        description = "MongoDB log filter with time range and configurable ignore patterns")
public class LogFilter implements Callable<Integer> {

    private static Logger logger = LoggerFactory.getLogger(LogFilter.class);

    @Option(names = "-f", description = "File names (if not provided, reads from stdin)")
    private List<File> files;

    @Option(names = "--config", description = "Properties file for filter configuration")
    private String configFile;

    @Option(names = "--from", description = "Start of the time range, e.g. 'Sat 10:00', 'start +1h', '2013-08-03'")
    private String from;

    @Option(names = "--to", description = "End of the time range, e.g. 'end', '+30min', 'Aug 5 20:00'")
    private String to;

    @Option(names = "--slow", description = "Only lines of operations that took at least this many ms")
    private Long slowMs;

    @Option(names = "--ns", arity = "1..*", description = "Only lines of these namespaces")
    private List<String> namespaces;

    @Option(names = "--word", arity = "1..*", description = "Only lines containing one of these words")
    private List<String> words;

    @Option(names = "--no-ignore", description = "Do not drop lines matching the ignore patterns")
    private boolean noIgnore = false;

    private PrintStream out = System.out;
    private FilterConfig filterConfig;

    public LogFilter() {
    }

    LogFilter(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() throws Exception {
        try {
            loadConfiguration();
            if (files == null || files.isEmpty()) {
                if (filterConfig.hasTimeRange()) {
                    logger.error("--from/--to need log files, the time range of stdin is unknown");
                    return 1;
                }
                readFromStdin();
            } else {
                for (File file : files) {
                    read(file);
                }
            }
            out.flush();
            return 0;
        } catch (LogAnalyticsException | IllegalArgumentException e) {
            logger.error("Error: {}", e.getMessage());
            return 1;
        }
    }

    private void loadConfiguration() throws IOException {
        filterConfig = configFile != null ? FilterConfig.load(configFile) : new FilterConfig();
        if (from != null) {
            filterConfig.setFrom(from);
        }
        if (to != null) {
            filterConfig.setTo(to);
        }
        if (slowMs != null) {
            filterConfig.setSlowMs(slowMs);
        }
        if (namespaces != null) {
            namespaces.forEach(filterConfig::addNamespace);
        }
    }

    public void read(File file) throws IOException {
        ParserConfig config = ParserConfig.defaults();
        DateTimeFilter dateFilter = null;
        if (filterConfig.hasTimeRange()) {
            LogBounds bounds = LogReaders.scanBounds(file, config);
            config = bounds.parserConfig(config);
            ResolvedBounds resolved = new DateTimeBoundaries(bounds.getRange())
                    .resolve(filterConfig.getFrom(), filterConfig.getTo());
            logger.info("{}: filtering {}", file.getName(), resolved);
            dateFilter = new DateTimeFilter(resolved);
        }

        long start = System.currentTimeMillis();
        try (BufferedReader in = LogReaders.createReader(file)) {
            filter(LogReaders.lines(in), new RecordParser(config), dateFilter, file.getName());
        }
        logger.info("Processed file: {} in {}ms", file.getName(), System.currentTimeMillis() - start);
    }

    public void readFromStdin() throws IOException {
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            filter(LogReaders.lines(in), new RecordParser(), null, "stdin");
        }
    }

    private void filter(Iterator<String> lines, RecordParser parser, DateTimeFilter dateFilter, String name) {
        int lineNum = 0;
        int printed = 0;
        while (lines.hasNext()) {
            String line = lines.next();
            lineNum++;
            ParsedRecord record = parser.tryParse(line);
            if (record == null) {
                continue;
            }
            if (accept(record, dateFilter)) {
                out.println(record.getRawText());
                printed++;
            }
        }
        logger.info("{}: lines: {}, printed: {}", name, lineNum, printed);
    }

    boolean accept(ParsedRecord record, DateTimeFilter dateFilter) {
        if (dateFilter != null && !dateFilter.accept(record)) {
            return false;
        }
        if (!noIgnore && filterConfig.shouldIgnore(record.getRawText())) {
            return false;
        }
        Long slow = filterConfig.getSlowMs();
        if (slow != null) {
            Long duration = record.getDurationMs();
            if (duration == null || duration < slow) {
                return false;
            }
        }
        Set<String> ns = filterConfig.getNamespaces();
        if (!ns.isEmpty() && !ns.contains(record.getNamespace())) {
            return false;
        }
        if (words != null && !words.isEmpty()) {
            return words.stream().anyMatch(record.getRawText()::contains);
        }
        return true;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LogFilter()).execute(args);
        System.exit(exitCode);
    }
}
