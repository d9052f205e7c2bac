package truthtable.tree;

import java.util.List;
import truthtable.AnalysisException;

/** A prefix or postfix unary operation. */
public record UnaryOp(UnaryOperator operator, SourceNode operand, SourceLocation location)
    implements SourceNode {

  public UnaryOp {
    if (operator == null) {
      throw AnalysisException.missingField("UnaryOp", "operator");
    }
    if (operand == null) {
      throw AnalysisException.missingField("UnaryOp", "operand");
    }
    location = location == null ? SourceLocation.UNKNOWN : location;
  }

  public boolean isNot() {
    return operator.isNegation();
  }

  @Override
  public List<NodeField> fields() {
    return List.of(
        new NodeField.Scalar("operator", operator), new NodeField.Single("operand", operand));
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(this);
  }
}
