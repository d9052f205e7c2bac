package truthtable.tree;

/** Kinds of literal values. */
public enum LiteralKind {
  STRING(true),
  CHARACTER(true),
  NUMBER(true),
  ARRAY(true),
  BOOLEAN(false),
  NULL(false);

  private final boolean constantLike;

  LiteralKind(boolean constantLike) {
    this.constantLike = constantLike;
  }

  /**
   * Whether a boolean expression made only of literals of this kind is a compile-time constant
   * not worth tabulating. {@code true}, {@code false} and {@code null} are not.
   */
  public boolean isConstantLike() {
    return constantLike;
  }
}
