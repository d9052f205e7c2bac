package truthtable.tree;

import java.util.List;
import truthtable.AnalysisException;

/** A logical AND/OR over an ordered list of operands. */
public record BooleanOp(
    LogicalOperator operator, List<SourceNode> operands, SourceLocation location)
    implements SourceNode {

  public BooleanOp {
    if (operator == null) {
      throw AnalysisException.missingField("BooleanOp", "operator");
    }
    if (operands == null) {
      throw AnalysisException.missingField("BooleanOp", "operands");
    }
    for (SourceNode operand : operands) {
      if (operand == null) {
        throw AnalysisException.missingField("BooleanOp", "operands[]");
      }
    }
    operands = List.copyOf(operands);
    location = location == null ? SourceLocation.UNKNOWN : location;
  }

  @Override
  public List<NodeField> fields() {
    return List.of(
        new NodeField.Scalar("operator", operator), new NodeField.Many("operands", operands));
  }

  // Occurrences are distinct even when structurally equal.
  @Override
  public boolean equals(Object obj) {
    return this == obj;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(this);
  }
}
