package truthtable.tree;

/** Operators of a {@link BooleanOp}. */
public enum LogicalOperator {
  AND,
  OR
}
