package com.mongodb.log.analytics.grouping;

import com.mongodb.log.analytics.record.OpType;
import com.mongodb.log.analytics.record.ParsedRecord;

/**
 * Key class for aggregating by namespace, operation and query pattern
 */
public class QueryShapeKey {

    private final String namespace;
    private final OpType operation;
    private final String pattern;

    public QueryShapeKey(String namespace, OpType operation, String pattern) {
        this.namespace = namespace;
        this.operation = operation;
        this.pattern = pattern;
    }

    public static QueryShapeKey of(ParsedRecord record) {
        return new QueryShapeKey(record.getNamespace(), record.getOperation(), record.getPattern());
    }

    public String getNamespace() {
        return namespace;
    }

    public OpType getOperation() {
        return operation;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((namespace == null) ? 0 : namespace.hashCode());
        result = prime * result + ((operation == null) ? 0 : operation.hashCode());
        result = prime * result + ((pattern == null) ? 0 : pattern.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        QueryShapeKey other = (QueryShapeKey) obj;
        if (namespace == null) {
            if (other.namespace != null)
                return false;
        } else if (!namespace.equals(other.namespace))
            return false;
        if (operation != other.operation)
            return false;
        if (pattern == null) {
            if (other.pattern != null)
                return false;
        } else if (!pattern.equals(other.pattern))
            return false;
        return true;
    }

    @Override
    public String toString() {
        return String.format("%s %s %s",
            namespace != null ? namespace : "-",
            operation != null ? operation.getType() : "-",
            pattern != null ? pattern : "-");
    }
}
