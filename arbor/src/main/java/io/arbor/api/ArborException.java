package io.arbor.api;

/**
 * Common base of the compile-time failures reported by Arbor.
 *
 * <p>The message names the faulty part of the input, when known, and the error code, so that a
 * logged message alone is enough to locate the problem.
 */
public abstract class ArborException extends Exception {
    private final String context;
    private final String errorCode;

    protected ArborException(String message, Throwable cause, String context, String errorCode) {
        super(describe(message, context, errorCode), cause);
        this.context = context;
        this.errorCode = errorCode;
    }

    private static String describe(String message, String context, String errorCode) {
        String described = context == null ? message : message + " [Context: " + context + "]";
        return errorCode == null ? described : described + " [Error Code: " + errorCode + "]";
    }

    /** @return where in the input the failure was found, or {@code null} */
    public String getContext() {
        return context;
    }

    /** @return the error code, see the subclasses for the values they use */
    public String getErrorCode() {
        return errorCode;
    }
}
