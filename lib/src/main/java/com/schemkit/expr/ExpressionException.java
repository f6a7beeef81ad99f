package com.schemkit.expr;

/** An expression that does not parse or cannot be evaluated. */
public final class ExpressionException extends Exception {
    private final String expression;

    public ExpressionException(String message, String expression) {
        super(message);
        this.expression = expression;
    }

    public ExpressionException(String message, String expression, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
