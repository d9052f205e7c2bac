package truthtable.core;

import com.google.common.base.Preconditions;
import java.util.Map;
import truthtable.AnalysisException;
import truthtable.tree.BooleanOp;
import truthtable.tree.Literal;
import truthtable.tree.OtherNode;
import truthtable.tree.SourceNode;
import truthtable.tree.UnaryOp;

/**
 * Computes the value of a boolean expression under one truth assignment.
 *
 * <p>Every operand of an AND/OR is evaluated; short-circuiting has no observable effect here
 * because operands are plain truth values.
 */
public final class Evaluator {

  /**
   * @param node expression to evaluate
   * @param operands operands extracted from {@code node}
   * @param assignment one truth value per operand, in operand order
   * @throws AnalysisException if an operator is not AND/OR/NOT or an atomic node has no operand
   */
  public boolean evaluate(SourceNode node, OperandSet operands, boolean[] assignment) {
    Preconditions.checkArgument(
        operands.size() == assignment.length,
        "Expected %s truth values but got %s",
        operands.size(),
        assignment.length);
    return evaluate(node, operands.positions(), assignment);
  }

  private boolean evaluate(
      SourceNode node, Map<SourceNode, Integer> positions, boolean[] assignment) {
    if (node instanceof BooleanOp op) {
      boolean all = true;
      boolean any = false;
      for (SourceNode operand : op.operands()) {
        Integer position = positions.get(operand);
        boolean value =
            position != null ? assignment[position] : evaluate(operand, positions, assignment);
        all &= value;
        any |= value;
      }
      return switch (op.operator()) {
        case AND -> all;
        case OR -> any;
      };
    }
    if (node instanceof UnaryOp unary) {
      if (!unary.isNot()) {
        throw AnalysisException.unsupportedOperator("UnaryOp", unary.operator());
      }
      return !evaluate(unary.operand(), positions, assignment);
    }
    if (node instanceof Literal || node instanceof OtherNode) {
      Integer position = positions.get(node);
      if (position == null) {
        throw AnalysisException.operandNotRegistered(describe(node));
      }
      return assignment[position];
    }
    throw AnalysisException.unknownNodeKind(node);
  }

  private static String describe(SourceNode node) {
    String kind =
        node instanceof OtherNode other ? other.kind() : node.getClass().getSimpleName();
    return kind + " at " + node.location();
  }
}
