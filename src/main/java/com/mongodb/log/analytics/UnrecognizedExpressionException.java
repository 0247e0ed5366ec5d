package com.mongodb.log.analytics;

/**
 * A date/time expression left text behind that no rule could consume.
 */
public class UnrecognizedExpressionException extends LogAnalyticsException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    public UnrecognizedExpressionException(String expression) {
        super("Can't parse datetime from '" + expression + "'");
        this.expression = expression;
    }

    public UnrecognizedExpressionException(String expression, Throwable cause) {
        super("Can't parse datetime from '" + expression + "'", cause);
        this.expression = expression;
    }

    /**
     * @return the unconsumed part of the expression
     */
    public String getExpression() {
        return expression;
    }
}
