package com.mongodb.log.analytics.record;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.log.analytics.MalformedInputException;
import com.mongodb.log.analytics.pattern.PatternNormalizer;

/**
 * Entry point for turning raw log lines into {@link ParsedRecord}s. A parser holds the
 * session settings (year hint, rollover threshold) and the ordered timestamp grammars.
 */
public class RecordParser {

    private static final Logger logger = LoggerFactory.getLogger(RecordParser.class);

    /** Timestamps are only searched for among the leading tokens. */
    public static final int MAX_TIMESTAMP_OFFSET = 10;

    private final ParserConfig config;
    private final List<TimestampMatcher> matchers;
    private final PatternNormalizer normalizer;

    public RecordParser() {
        this(ParserConfig.defaults());
    }

    public RecordParser(ParserConfig config) {
        this(config, List.of(new CtimeMatcher(), new Iso8601Matcher()));
    }

    public RecordParser(ParserConfig config, List<TimestampMatcher> matchers) {
        this.config = config;
        this.matchers = List.copyOf(matchers);
        this.normalizer = new PatternNormalizer();
    }

    public ParsedRecord parse(String rawText) {
        if (rawText == null) {
            throw new MalformedInputException("Log line is null");
        }
        String stripped = rawText.stripTrailing();
        if (stripped.isEmpty()) {
            throw new MalformedInputException("Log line is empty");
        }
        return new ParsedRecord(stripped, this);
    }

    public ParsedRecord parse(byte[] rawBytes) {
        if (rawBytes == null) {
            throw new MalformedInputException("Log line is null");
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return parse(decoder.decode(ByteBuffer.wrap(rawBytes)).toString());
        } catch (CharacterCodingException e) {
            throw new MalformedInputException("Log line is not valid UTF-8", e);
        }
    }

    /**
     * Builds a record from a {@code system.profile} document.
     */
    public ParsedRecord parse(JSONObject profileDocument) {
        return ProfileDocuments.toRecord(profileDocument, this);
    }

    /**
     * Lenient variant for stream scanning: blank lines yield null instead of an exception.
     */
    public ParsedRecord tryParse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return null;
        }
        return parse(rawText);
    }

    /**
     * @return the timestamp of the line, or null when it has none
     */
    public OffsetDateTime extractTimestamp(String rawText) {
        ParsedRecord record = tryParse(rawText);
        return record == null ? null : record.getTimestamp();
    }

    Optional<TimestampMatch> matchTimestamp(List<String> tokens) {
        int limit = Math.min(MAX_TIMESTAMP_OFFSET, tokens.size());
        for (int offset = 0; offset < limit; offset++) {
            for (TimestampMatcher matcher : matchers) {
                Optional<TimestampMatch> match = matcher.tryMatch(tokens, offset, config);
                if (match.isPresent()) {
                    if (logger.isTraceEnabled()) {
                        logger.trace("timestamp {} at offset {} ({})", match.get().getTimestamp(), offset,
                                match.get().getFormat().getLabel());
                    }
                    return match;
                }
            }
        }
        return Optional.empty();
    }

    public ParserConfig getConfig() {
        return config;
    }

    public PatternNormalizer getNormalizer() {
        return normalizer;
    }
}
