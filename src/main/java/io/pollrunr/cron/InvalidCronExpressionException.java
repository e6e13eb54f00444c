package io.pollrunr.cron;

import io.pollrunr.PollRunrException;

/**
 * Raised at registration time when a cron expression cannot be parsed.
 * A task whose expression fails to parse is never started.
 */
public class InvalidCronExpressionException extends PollRunrException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression '%s': %s".formatted(expression, reason));
        this.expression = expression;
    }

    public InvalidCronExpressionException(String expression, String reason, Throwable cause) {
        super("Invalid cron expression '%s': %s".formatted(expression, reason), cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
