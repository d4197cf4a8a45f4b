package com.hookrelay.common.resilience;

import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Retryability predicates for {@link RetryOptions}.
 */
public final class RetryPredicates {

    private static final Pattern TRANSIENT_MESSAGE = Pattern.compile(
            "(?i)(timeout|timed out|econnreset|connection reset|enotfound|\\b5\\d\\d\\b)");

    private RetryPredicates() {
    }

    /**
     * Network errors, timeouts and 5xx responses, matched by type or by message anywhere in the cause chain.
     */
    public static Predicate<Throwable> networkOrServerError() {
        return RetryPredicates::isTransient;
    }

    public static Predicate<Throwable> never() {
        return error -> false;
    }

    public static Predicate<Throwable> always() {
        return error -> true;
    }

    static boolean isTransient(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof ConnectException
                    || current instanceof SocketTimeoutException
                    || current instanceof UnknownHostException
                    || current instanceof TimeoutException
                    || current instanceof ResourceAccessException
                    || current instanceof HttpServerErrorException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && TRANSIENT_MESSAGE.matcher(message).find()) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
