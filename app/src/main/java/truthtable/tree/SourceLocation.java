package truthtable.tree;

/** 1-based line and column of a node's first token. */
public record SourceLocation(int line, int column) {

  public static final SourceLocation UNKNOWN = new SourceLocation(0, 0);

  public SourceLocation {
    if (line < 0 || column < 0) {
      throw new IllegalArgumentException("line and column must be non-negative");
    }
  }

  public boolean isKnown() {
    return line > 0;
  }

  @Override
  public String toString() {
    return isKnown() ? line + ":" + column : "?";
  }
}
