package com.mongodb.log.analytics.record;

public enum OpType {
    QUERY("query", true),
    GETMORE("getmore", true),
    INSERT("insert", false),
    UPDATE("update", true),
    REMOVE("remove", true),
    COMMAND("command", false);

    OpType(final String pOpType, final boolean pHasQueryPattern) {
        this.type = pOpType;
        this.hasQueryPattern = pHasQueryPattern;
    }

    private final String type;
    private final boolean hasQueryPattern;

    public String getType() {
        return type;
    }

    /**
     * @return true when the pattern of this operation is taken from its {@code query:} fragment
     */
    public boolean hasQueryPattern() {
        return hasQueryPattern;
    }

    public static OpType findByType(final String pOpType) {
        if (pOpType == null) {
            return null;
        }
        final String lowerOpType = pOpType.toLowerCase();

        if (lowerOpType.equals("query")) {
            return OpType.QUERY;
        } else if (lowerOpType.equals("getmore")) {
            return OpType.GETMORE;
        } else if (lowerOpType.equals("insert")) {
            return OpType.INSERT;
        } else if (lowerOpType.equals("update")) {
            return OpType.UPDATE;
        } else if (lowerOpType.equals("remove")) {
            return OpType.REMOVE;
        } else if (lowerOpType.equals("command")) {
            return OpType.COMMAND;
        }

        return null;
    }
}
