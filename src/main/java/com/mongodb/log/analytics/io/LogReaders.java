package com.mongodb.log.analytics.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.log.analytics.record.LogBounds;
import com.mongodb.log.analytics.record.ParserConfig;

/**
 * Opens plain or gzip compressed log files.
 */
public final class LogReaders {

    private static final Logger logger = LoggerFactory.getLogger(LogReaders.class);

    private LogReaders() {
    }

    public static boolean isGzip(File file) {
        return file.getName().toLowerCase(Locale.ROOT).endsWith(".gz");
    }

    public static BufferedReader createReader(File file) throws IOException {
        InputStream in = new FileInputStream(file);
        if (isGzip(file)) {
            logger.debug("Reading {} as gzip", file);
            in = new GZIPInputStream(in);
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    /**
     * Lazy line iterator over an open reader. I/O failures surface as {@link UncheckedIOException}.
     */
    public static Iterator<String> lines(BufferedReader reader) {
        return reader.lines().iterator();
    }

    /**
     * Scans a whole file for its first and last timestamp.
     */
    public static LogBounds scanBounds(File file, ParserConfig config) throws IOException {
        try (BufferedReader reader = createReader(file)) {
            LogBounds bounds = LogBounds.scan(lines(reader), config);
            logger.debug("{}: {} lines, range {}", file.getName(), bounds.getLineCount(), bounds.getRange());
            return bounds;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
