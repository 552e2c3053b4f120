package net.cronhook.core.schedule;

public class MalformedExpressionException extends IllegalArgumentException {
    private final String expression;

    public MalformedExpressionException(String expression, String reason) {
        super("Invalid schedule expression [" + expression + "]: " + reason);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
