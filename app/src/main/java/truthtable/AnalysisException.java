package truthtable;

import java.util.Objects;

/**
 * Fatal failure while analyzing one boolean expression.
 *
 * <p>None of these conditions is transient: each signals either an input the analysis does not
 * support or a broken invariant between operand extraction and evaluation.
 */
public class AnalysisException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Kind kind;

  public AnalysisException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }

  public static AnalysisException unsupportedOperator(String nodeKind, Object operator) {
    return new AnalysisException(
        Kind.UNSUPPORTED_OPERATOR, nodeKind + " operator " + operator + " not implemented");
  }

  public static AnalysisException operandNotRegistered(String description) {
    return new AnalysisException(
        Kind.OPERAND_LOOKUP_FAILURE, "No operand registered for " + description);
  }

  public static AnalysisException missingField(String nodeKind, String field) {
    return new AnalysisException(Kind.MALFORMED_TREE, nodeKind + " is missing its " + field);
  }

  public static AnalysisException unknownNodeKind(Object node) {
    return new AnalysisException(
        Kind.MALFORMED_TREE,
        "Unknown node kind: " + (node == null ? "null" : node.getClass().getName()));
  }

  public static AnalysisException tooManyOperands(int operandCount, int maxOperands) {
    return new AnalysisException(
        Kind.OPERAND_LIMIT_EXCEEDED,
        "Expression has " + operandCount + " operands, limit is " + maxOperands);
  }

  /** Error taxonomy of the analysis. */
  public enum Kind {
    UNSUPPORTED_OPERATOR,
    OPERAND_LOOKUP_FAILURE,
    MALFORMED_TREE,
    OPERAND_LIMIT_EXCEEDED
  }
}
