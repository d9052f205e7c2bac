package truthtable.frontend;

/** Source text that is not valid Java. */
public class SourceParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String identifier;

  public SourceParseException(String identifier, String message) {
    super(identifier + ": " + message);
    this.identifier = identifier;
  }

  public String identifier() {
    return identifier;
  }
}
