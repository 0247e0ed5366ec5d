package com.mongodb.log.analytics.record;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.mongodb.log.analytics.pattern.PatternNormalizer;

/**
 * One log line (or profile document) with its fields extracted on first access.
 * Every derived field is computed at most once from {@link #getRawText()}.
 */
public class ParsedRecord {

    private static final Set<String> LOG_LEVELS = Set.of("D", "F", "E", "W", "I", "U",
            "D1", "D2", "D3", "D4", "D5");

    private static final Pattern THREAD_PATTERN = Pattern.compile("^\\[([^\\]]*)\\]$");
    private static final Pattern DURATION_PATTERN = Pattern.compile("^(\\d[\\d,]*)ms$");
    private static final Pattern MMAPS_PATTERN = Pattern.compile("flushing mmaps took (\\d+)ms");
    private static final Pattern CHECKPOINT_PATTERN = Pattern.compile("Checkpoint took (\\d+) seconds to complete");

    private static final String OPLOG_QUERY_MARKER = "Scheduled new oplog query";
    private static final String TRUNCATED_MARKER = "warning: log line attempted";

    private final String rawText;
    private final RecordParser parser;
    private final boolean fromProfile;

    private List<String> tokens;
    private int[] tokenStarts;
    private int[] tokenEnds;

    private boolean timestampCalculated;
    private OffsetDateTime timestamp;
    private TimestampFormat timestampFormat = TimestampFormat.NONE;
    private int timestampOffset;
    private int consumedTokenCount;

    private boolean threadCalculated;
    private String level;
    private String component;
    private String thread;
    private int threadPosition = -1;

    private boolean connectionCalculated;
    private String connection;

    private boolean operationCalculated;
    private OpType operation;
    private String namespace;
    private int namespacePosition = -1;

    private boolean commandCalculated;
    private String command;

    private boolean durationCalculated;
    private Long durationMs;

    private boolean countersCalculated;
    private final Map<Counter, Long> counters = new EnumMap<>(Counter.class);

    private boolean planSummaryCalculated;
    private String planSummary;

    private boolean patternCalculated;
    private String pattern;

    private boolean sortPatternCalculated;
    private String sortPattern;

    ParsedRecord(String rawText, RecordParser parser) {
        this(rawText, parser, false);
    }

    private ParsedRecord(String rawText, RecordParser parser, boolean fromProfile) {
        this.rawText = rawText;
        this.parser = parser;
        this.fromProfile = fromProfile;
    }

    /**
     * A record whose fields are all set explicitly by the caller, nothing is derived
     * from the text.
     */
    static ParsedRecord eager(String rawText, RecordParser parser) {
        ParsedRecord record = new ParsedRecord(rawText, parser, true);
        record.timestampCalculated = true;
        record.threadCalculated = true;
        record.connectionCalculated = true;
        record.operationCalculated = true;
        record.commandCalculated = true;
        record.durationCalculated = true;
        record.countersCalculated = true;
        record.planSummaryCalculated = true;
        record.patternCalculated = true;
        record.sortPatternCalculated = true;
        return record;
    }

    public String getRawText() {
        return rawText;
    }

    public boolean isFromProfile() {
        return fromProfile;
    }

    public List<String> getTokens() {
        tokenize();
        return tokens;
    }

    public OffsetDateTime getTimestamp() {
        calculateTimestamp();
        return timestamp;
    }

    public TimestampFormat getTimestampFormat() {
        calculateTimestamp();
        return timestampFormat;
    }

    public int getConsumedTokenCount() {
        calculateTimestamp();
        return consumedTokenCount;
    }

    public String getLevel() {
        calculateThread();
        return level;
    }

    public String getComponent() {
        calculateThread();
        return component;
    }

    public String getThread() {
        calculateThread();
        return thread;
    }

    public String getConnection() {
        if (!connectionCalculated) {
            connectionCalculated = true;
            String t = getThread();
            if (t != null) {
                if (t.startsWith("conn")) {
                    connection = t;
                } else if (t.equals("initandlisten") || t.equals("mongosMain")) {
                    List<String> tk = getTokens();
                    if (tk.size() >= 5 && tk.get(tk.size() - 5).startsWith("#")) {
                        connection = "conn" + tk.get(tk.size() - 5).substring(1);
                    }
                }
            }
        }
        return connection;
    }

    public OpType getOperation() {
        calculateOperation();
        return operation;
    }

    public String getNamespace() {
        calculateOperation();
        return namespace;
    }

    public String getCommand() {
        if (!commandCalculated) {
            commandCalculated = true;
            if (getOperation() == OpType.COMMAND) {
                List<String> tk = getTokens();
                int idx = tk.indexOf("command:");
                if (idx >= 0 && idx + 1 < tk.size()) {
                    String value = tk.get(idx + 1);
                    if (value.equals("{") && idx + 2 < tk.size()) {
                        // 2.4 style: command: { replSetGetStatus: 1 }
                        value = tk.get(idx + 2);
                        value = value.substring(0, value.length() - 1);
                    }
                    command = value.toLowerCase();
                }
            }
        }
        return command;
    }

    public Long getDurationMs() {
        if (!durationCalculated) {
            durationCalculated = true;
            durationMs = calculateDuration();
        }
        return durationMs;
    }

    public Map<Counter, Long> getCounters() {
        calculateCounters();
        return Collections.unmodifiableMap(counters);
    }

    public Long getCounter(Counter counter) {
        calculateCounters();
        return counters.get(counter);
    }

    public String getPlanSummary() {
        if (!planSummaryCalculated) {
            planSummaryCalculated = true;
            List<String> tk = getTokens();
            int idx = tk.indexOf("planSummary:");
            if (idx >= 0 && idx + 1 < tk.size()) {
                planSummary = tk.get(idx + 1);
            }
        }
        return planSummary;
    }

    public String getPattern() {
        if (!patternCalculated) {
            patternCalculated = true;
            OpType op = getOperation();
            String cmd = getCommand();
            if ((op != null && op.hasQueryPattern()) || "count".equals(cmd) || "findandmodify".equals(cmd)) {
                String fragment = findFragment("query: ");
                if (fragment == null) {
                    fragment = findFragment("q: ");
                }
                pattern = normalize(fragment);
            } else if ("find".equals(cmd)) {
                pattern = normalize(findFragment("filter: "));
            }
        }
        return pattern;
    }

    public String getSortPattern() {
        if (!sortPatternCalculated) {
            sortPatternCalculated = true;
            OpType op = getOperation();
            if (op == OpType.QUERY || op == OpType.GETMORE) {
                sortPattern = normalize(findFragment("orderby: "));
            }
        }
        return sortPattern;
    }

    /**
     * Forces evaluation of every field.
     */
    public ParsedRecord parseAll() {
        getTimestamp();
        getThread();
        getConnection();
        getOperation();
        getCommand();
        getDurationMs();
        getCounters();
        getPlanSummary();
        getPattern();
        getSortPattern();
        return this;
    }

    /**
     * Returns the raw text with the timestamp replaced by {@code newTimestamp}, rendered in
     * this record's own format. Lines without a timestamp are returned unchanged.
     */
    public String withTimestamp(OffsetDateTime newTimestamp) {
        if (getTimestamp() == null || fromProfile) {
            return rawText;
        }
        tokenize();
        int begin = tokenStarts[timestampOffset];
        int end = tokenEnds[consumedTokenCount - 1];
        return rawText.substring(0, begin) + TimestampFormatter.format(newTimestamp, timestampFormat)
                + rawText.substring(end);
    }

    // values used by ProfileDocuments
    void setTimestamp(OffsetDateTime timestamp, TimestampFormat format) {
        this.timestamp = timestamp;
        this.timestampFormat = timestamp == null ? TimestampFormat.NONE : format;
    }

    void setThread(String thread) {
        this.thread = thread;
        this.connection = thread != null && thread.startsWith("conn") ? thread : null;
    }

    void setOperation(OpType operation, String namespace) {
        this.operation = operation;
        this.namespace = namespace;
    }

    void setCommand(String command) {
        this.command = command;
    }

    void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    void setCounter(Counter counter, Long value) {
        if (value != null) {
            counters.put(counter, value);
        }
    }

    void setPattern(String pattern) {
        this.pattern = pattern;
    }

    void setSortPattern(String sortPattern) {
        this.sortPattern = sortPattern;
    }

    void setPlanSummary(String planSummary) {
        this.planSummary = planSummary;
    }

    private void tokenize() {
        if (tokens != null) {
            return;
        }
        List<String> list = new ArrayList<>();
        List<int[]> spans = new ArrayList<>();
        int i = 0;
        int n = rawText.length();
        while (i < n) {
            while (i < n && Character.isWhitespace(rawText.charAt(i))) {
                i++;
            }
            if (i >= n) {
                break;
            }
            int start = i;
            while (i < n && !Character.isWhitespace(rawText.charAt(i))) {
                i++;
            }
            list.add(rawText.substring(start, i));
            spans.add(new int[] { start, i });
        }
        tokenStarts = new int[spans.size()];
        tokenEnds = new int[spans.size()];
        for (int j = 0; j < spans.size(); j++) {
            tokenStarts[j] = spans.get(j)[0];
            tokenEnds[j] = spans.get(j)[1];
        }
        tokens = Collections.unmodifiableList(list);
    }

    private void calculateTimestamp() {
        if (timestampCalculated) {
            return;
        }
        timestampCalculated = true;
        Optional<TimestampMatch> match = parser.matchTimestamp(getTokens());
        if (match.isPresent()) {
            TimestampMatch m = match.get();
            timestamp = m.getTimestamp();
            timestampFormat = m.getFormat();
            timestampOffset = m.getOffset();
            consumedTokenCount = m.getNextPosition();
        }
    }

    private void calculateThread() {
        if (threadCalculated) {
            return;
        }
        threadCalculated = true;
        if (getTimestamp() == null) {
            return;
        }
        List<String> tk = getTokens();
        int pos = consumedTokenCount;
        if (pos + 1 < tk.size() && LOG_LEVELS.contains(tk.get(pos))) {
            level = tk.get(pos);
            component = tk.get(pos + 1);
            pos += 2;
        }
        if (pos < tk.size()) {
            Matcher m = THREAD_PATTERN.matcher(tk.get(pos));
            if (m.matches()) {
                thread = m.group(1);
                threadPosition = pos;
            }
        }
    }

    private void calculateOperation() {
        if (operationCalculated) {
            return;
        }
        operationCalculated = true;
        getThread();
        if (threadPosition < 0) {
            return;
        }
        List<String> tk = getTokens();
        int pos = threadPosition;
        if (pos + 1 < tk.size() && tk.get(pos + 1).equals("warning:") && rawText.contains(TRUNCATED_MARKER)) {
            // truncated line, the operation follows the "..." token
            pos = tk.indexOf("...");
            if (pos < 0) {
                return;
            }
        }
        if (pos + 2 < tk.size()) {
            OpType op = OpType.findByType(tk.get(pos + 1));
            if (op != null) {
                operation = op;
                namespace = tk.get(pos + 2);
                namespacePosition = pos + 2;
            }
        }
    }

    private Long calculateDuration() {
        List<String> tk = getTokens();
        if (!tk.isEmpty() && !rawText.contains(OPLOG_QUERY_MARKER)) {
            Matcher m = DURATION_PATTERN.matcher(tk.get(tk.size() - 1));
            if (m.matches()) {
                return parseLong(m.group(1).replace(",", ""));
            }
        }
        Matcher mmaps = MMAPS_PATTERN.matcher(rawText);
        if (mmaps.find()) {
            return parseLong(mmaps.group(1));
        }
        Matcher checkpoint = CHECKPOINT_PATTERN.matcher(rawText);
        if (checkpoint.find()) {
            Long seconds = parseLong(checkpoint.group(1));
            return seconds == null ? null : seconds * 1000;
        }
        return null;
    }

    private void calculateCounters() {
        if (countersCalculated) {
            return;
        }
        countersCalculated = true;
        getOperation();
        if (namespacePosition < 0) {
            return;
        }
        List<String> tk = getTokens();
        for (int i = namespacePosition + 1; i < tk.size(); i++) {
            String token = tk.get(i);
            int colon = token.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            Counter counter = Counter.findByName(token.substring(0, colon));
            if (counter == null) {
                continue;
            }
            String value = token.substring(colon + 1);
            if (value.isEmpty() && counter == Counter.NUM_YIELDS && i + 1 < tk.size()) {
                // 2.4 writes "numYields: 2405"
                value = tk.get(i + 1);
            }
            Long parsed = parseLong(value.replace(",", ""));
            if (parsed != null) {
                counters.put(counter, parsed);
            }
        }
    }

    /**
     * Brace-balanced fragment following the last occurrence of {@code trigger}.
     */
    private String findFragment(String trigger) {
        int idx = rawText.lastIndexOf(trigger);
        if (idx < 0) {
            return null;
        }
        String rest = rawText.substring(idx + trigger.length());
        int depth = 0;
        int stop = -1;
        for (int i = 0; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                stop = i;
                if (depth <= 0) {
                    break;
                }
            }
        }
        if (stop < 0) {
            return null;
        }
        return rest.substring(0, stop + 1).trim();
    }

    private String normalize(String fragment) {
        if (fragment == null) {
            return null;
        }
        PatternNormalizer normalizer = parser.getNormalizer();
        return normalizer.normalize(fragment);
    }

    private static Long parseLong(String value) {
        try {
            return Long.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return rawText;
    }
}
