package io.arbor.tree.query;

/** Raised by a {@link QueryEngine} when a pattern source cannot be compiled. */
public class QueryEngineException extends Exception {
  public enum ErrorType {
    SYNTAX,
    NODE_TYPE,
    FIELD,
    CAPTURE
  }

  private final ErrorType errorType;
  private final int offset;

  /**
   * @param errorType what went wrong
   * @param offset the UTF-8 byte offset in the pattern source where the error was detected
   */
  public QueryEngineException(ErrorType errorType, int offset) {
    super(errorType + " error at offset " + offset);
    this.errorType = errorType;
    this.offset = offset;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public int getOffset() {
    return offset;
  }
}
