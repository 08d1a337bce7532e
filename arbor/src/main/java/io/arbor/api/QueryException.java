package io.arbor.api;

/**
 * Exception thrown when a query cannot be compiled, either because the structural engine rejected
 * the pattern source or because a predicate clause is malformed.
 */
public class QueryException extends ArborException {

    public enum Kind {
        SYNTAX,
        NODE_TYPE,
        FIELD,
        CAPTURE,
        PREDICATE
    }

    private final Kind kind;
    private final int offset;
    private final String name;

    private QueryException(Kind kind, String message, Throwable cause, int offset, String name) {
        super(message, cause, null, kind.name());
        this.kind = kind;
        this.offset = offset;
        this.name = name;
    }

    public static QueryException syntax(int offset) {
        return new QueryException(
            Kind.SYNTAX, "Query syntax error at offset " + offset, null, offset, null);
    }

    public static QueryException nodeType(int offset, String name) {
        return new QueryException(Kind.NODE_TYPE, "Invalid node type " + name, null, offset, name);
    }

    public static QueryException field(int offset, String name) {
        return new QueryException(Kind.FIELD, "Invalid field name " + name, null, offset, name);
    }

    public static QueryException capture(int offset, String name) {
        return new QueryException(Kind.CAPTURE, "Invalid capture name " + name, null, offset, name);
    }

    public static QueryException predicate(String message) {
        return new QueryException(Kind.PREDICATE, message, null, -1, null);
    }

    public static QueryException predicate(String message, Throwable cause) {
        return new QueryException(Kind.PREDICATE, message, cause, -1, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the byte offset in the pattern source for engine errors, {@code -1} for predicate
     *     errors
     */
    public int getOffset() {
        return offset;
    }

    /** @return the offending node type, field or capture name, or {@code null} */
    public String getName() {
        return name;
    }
}
