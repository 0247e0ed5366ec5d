package com.mongodb.log.analytics.merge;

import java.io.BufferedReader;
import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.log.analytics.LogAnalyticsException;
import com.mongodb.log.analytics.io.LogReaders;
import com.mongodb.log.analytics.record.LogBounds;
import com.mongodb.log.analytics.record.ParserConfig;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Merges several MongoDB log files by their timestamps.
 */
@Command(name = "logMerge", mixinStandardHelpOptions = true, version = "0.1",
        description = "Merges MongoDB log files chronologically")
public class LogMerge implements Callable<Integer> {

    private static Logger logger = LoggerFactory.getLogger(LogMerge.class);

    @Option(names = { "-f", "--files" }, arity = "1..*", required = true, description = "Log files to merge")
    private List<File> files;

    @Option(names = "--labels", arity = "0..*", defaultValue = "enum",
            description = "Labels to distinguish the files: none, enum, alpha, filename, or one label per file")
    private List<String> labels;

    @Option(names = "--pos", defaultValue = "0",
            description = "Position of the label: 0 (front of line), eol, or a token index")
    private String position;

    @Option(names = "--timezone", arity = "0..*", description = "Hours to add to each file's timestamps")
    private List<Integer> timezone = new ArrayList<>();

    private PrintStream out = System.out;

    public LogMerge() {
    }

    LogMerge(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() throws Exception {
        List<BufferedReader> readers = new ArrayList<>();
        try {
            List<MergeSource> sources = new ArrayList<>();
            for (File file : files) {
                // one pass for the year rollover, then the merge pass
                LogBounds bounds = LogReaders.scanBounds(file, ParserConfig.defaults());
                BufferedReader reader = LogReaders.createReader(file);
                readers.add(reader);
                sources.add(new MergeSource(file.getName(), LogReaders.lines(reader),
                        bounds.parserConfig(ParserConfig.defaults())));
            }

            long start = System.currentTimeMillis();
            long count = 0;
            Iterator<MergedLine> merged = new StreamMerger().merge(sources, labels, timezone,
                    LabelPosition.parse(position));
            while (merged.hasNext()) {
                out.println(merged.next().getText());
                count++;
            }
            out.flush();
            logger.info("Merged {} lines from {} files in {}ms", count, files.size(),
                    System.currentTimeMillis() - start);
            return 0;
        } catch (LogAnalyticsException | IllegalArgumentException e) {
            logger.error("Error: {}", e.getMessage());
            return 1;
        } finally {
            for (BufferedReader reader : readers) {
                reader.close();
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LogMerge()).execute(args);
        System.exit(exitCode);
    }
}
