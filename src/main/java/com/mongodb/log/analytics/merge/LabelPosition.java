package com.mongodb.log.analytics.merge;

/**
 * Where a stream label goes in a merged line: in front, at the end, or before the
 * token with a given index.
 */
public final class LabelPosition {

    public static final LabelPosition FRONT = new LabelPosition(0, false);
    public static final LabelPosition END_OF_LINE = new LabelPosition(-1, true);

    private final int tokenIndex;
    private final boolean endOfLine;

    private LabelPosition(int tokenIndex, boolean endOfLine) {
        this.tokenIndex = tokenIndex;
        this.endOfLine = endOfLine;
    }

    public static LabelPosition atToken(int tokenIndex) {
        if (tokenIndex < 0) {
            throw new IllegalArgumentException("Label position must not be negative: " + tokenIndex);
        }
        return tokenIndex == 0 ? FRONT : new LabelPosition(tokenIndex, false);
    }

    /**
     * @param value {@code eol} or a token index
     */
    public static LabelPosition parse(String value) {
        if ("eol".equalsIgnoreCase(value)) {
            return END_OF_LINE;
        }
        try {
            return atToken(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid label position '" + value + "', use eol or a number", e);
        }
    }

    String apply(String line, String label) {
        if (endOfLine) {
            return line + " " + label;
        }
        if (tokenIndex == 0) {
            return label + " " + line;
        }
        String[] tokens = line.trim().split("\\s+");
        int split = Math.min(tokenIndex, tokens.length);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < split; i++) {
            sb.append(tokens[i]).append(' ');
        }
        sb.append(label);
        for (int i = split; i < tokens.length; i++) {
            sb.append(' ').append(tokens[i]);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return endOfLine ? "eol" : String.valueOf(tokenIndex);
    }
}
