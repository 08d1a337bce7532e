package io.arbor.api;

import java.util.regex.PatternSyntaxException;

/**
 * Exception thrown when a property sheet description cannot be compiled.
 * No partially compiled sheet is ever handed out.
 */
public class PropertySheetException extends ArborException {
    public static final String INVALID_JSON = "INVALID_JSON";
    public static final String INVALID_REGEX = "INVALID_REGEX";
    public static final String INVALID_SHEET = "INVALID_SHEET";

    private PropertySheetException(
            String message, Throwable cause, String context, String errorCode) {
        super(message, cause, context, errorCode);
    }

    /**
     * Creates an exception for input that is not JSON or does not have the property sheet shape.
     *
     * @param cause the underlying parse error
     * @return a new PropertySheetException instance
     */
    public static PropertySheetException invalidJson(Throwable cause) {
        return new PropertySheetException(
            "Invalid JSON: " + cause.getMessage(), cause, null, INVALID_JSON);
    }

    /**
     * Creates an exception for a required member that is absent.
     *
     * @param member the missing member
     * @param location where the member was expected, e.g. {@code states[2]}
     * @return a new PropertySheetException instance
     */
    public static PropertySheetException missingMember(String member, String location) {
        return new PropertySheetException(
            String.format("Invalid JSON: missing required member '%s'", member),
            null, location, INVALID_JSON);
    }

    /**
     * Creates an exception for a transition text pattern that does not compile.
     *
     * @param pattern the offending pattern
     * @param cause the compile error
     * @return a new PropertySheetException instance
     */
    public static PropertySheetException invalidRegex(
            String pattern, PatternSyntaxException cause) {
        return new PropertySheetException(
            "Invalid Regex: " + cause.getDescription(), cause, pattern, INVALID_REGEX);
    }

    /**
     * Creates an exception for well-formed input that refers to states or property sets that do not
     * exist.
     *
     * @param message what is wrong
     * @param location where, e.g. {@code states[0].transitions[3]}
     * @return a new PropertySheetException instance
     */
    public static PropertySheetException invalidSheet(String message, String location) {
        return new PropertySheetException(message, null, location, INVALID_SHEET);
    }
}
