package truthtable.tree;

/** Operators of a {@link UnaryOp}. Only {@link #NOT} has a boolean meaning. */
public enum UnaryOperator {
  NOT,
  MINUS,
  PLUS,
  COMPLEMENT,
  PREFIX_INCREMENT,
  PREFIX_DECREMENT,
  POSTFIX_INCREMENT,
  POSTFIX_DECREMENT;

  public boolean isNegation() {
    return this == NOT;
  }
}
