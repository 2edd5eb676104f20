package com.deepansh.inbox.tool;

import com.deepansh.inbox.model.ErrorKind;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.util.Locale;

/**
 * Maps catalog failures onto {@link ErrorKind}.
 *
 * The catalog reports per-tool errors as free text, so classification of
 * those is keyword based. HTTP status codes and transport exceptions are
 * classified exactly.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static ErrorKind fromStatus(int status) {
        if (status == 408 || status == 504) {
            return ErrorKind.TIMEOUT;
        }
        if (status == 429 || status >= 500) {
            return ErrorKind.TRANSIENT;
        }
        if (status == 401 || status == 403) {
            return ErrorKind.PERMISSION_DENIED;
        }
        if (status == 404) {
            return ErrorKind.NOT_FOUND;
        }
        if (status >= 400) {
            return ErrorKind.INVALID_INPUT;
        }
        return ErrorKind.UNKNOWN;
    }

    public static ErrorKind fromTransport(ResourceAccessException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SocketTimeoutException) {
                return ErrorKind.TIMEOUT;
            }
            cause = cause.getCause();
        }
        return fromMessage(e.getMessage()) == ErrorKind.TIMEOUT ? ErrorKind.TIMEOUT : ErrorKind.TRANSIENT;
    }

    public static ErrorKind fromMessage(String message) {
        if (message == null || message.isBlank()) {
            return ErrorKind.UNKNOWN;
        }
        String m = message.toLowerCase(Locale.ROOT);

        if (m.contains("timed out") || m.contains("timeout")) {
            return ErrorKind.TIMEOUT;
        }
        if (m.contains("rate limit") || m.contains("too many requests") || m.contains("temporarily")
                || m.contains("unavailable") || m.contains("try again") || m.contains("internal server error")) {
            return ErrorKind.TRANSIENT;
        }
        if (m.contains("permission") || m.contains("forbidden") || m.contains("unauthorized")
                || m.contains("not connected") || m.contains("no active connection") || m.contains("access denied")) {
            return ErrorKind.PERMISSION_DENIED;
        }
        if (m.contains("not found") || m.contains("does not exist") || m.contains("unknown tool")) {
            return ErrorKind.NOT_FOUND;
        }
        if (m.contains("invalid") || m.contains("required") || m.contains("validation")
                || m.contains("missing") || m.contains("malformed")) {
            return ErrorKind.INVALID_INPUT;
        }
        return ErrorKind.UNKNOWN;
    }
}
