package com.plm.common.infra;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Error formatting utilities: safely extract messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Strip the wrappers added by {@code CompletableFuture} and executors.
     */
    public static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        Throwable root = unwrap(err);
        String msg = root.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return root.getClass().getSimpleName();
    }

    /**
     * Format any object as an error message (for non-Throwable cases).
     */
    public static String formatErrorMessage(Object err) {
        if (err == null)
            return "Error";
        if (err instanceof Throwable t)
            return formatErrorMessage(t);
        return err.toString();
    }
}
