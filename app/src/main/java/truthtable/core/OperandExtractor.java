package truthtable.core;

import java.util.Objects;
import truthtable.tree.BooleanOp;
import truthtable.tree.SourceNode;
import truthtable.tree.UnaryOp;
import truthtable.tree.Unparser;

/**
 * Flattens a boolean expression into its atomic operands.
 *
 * <p>Nested AND/OR operations and negations are walked through rather than becoming operands
 * themselves: {@code a && (b || !a)} yields {@code a, b}. Occurrences sharing a label collapse into
 * one operand.
 */
public final class OperandExtractor {
  private final Unparser unparser;

  public OperandExtractor(Unparser unparser) {
    this.unparser = Objects.requireNonNull(unparser, "unparser");
  }

  public OperandSet extract(SourceNode node) {
    if (node instanceof BooleanOp op) {
      OperandSet operands = new OperandSet();
      for (SourceNode operand : op.operands()) {
        if (operand instanceof BooleanOp || isNot(operand)) {
          operands.addAll(extract(operand));
        } else {
          operands.add(new Operand(label(operand), operand));
        }
      }
      return operands;
    }
    if (isNot(node)) {
      return extract(((UnaryOp) node).operand());
    }
    return OperandSet.of(new Operand(label(node), node));
  }

  /** Canonical text of {@code node}. */
  public String label(SourceNode node) {
    String text = unparser.unparse(node);
    if (text == null) {
      throw new IllegalStateException("Unparser returned no text for " + node.location());
    }
    return text.strip();
  }

  private static boolean isNot(SourceNode node) {
    return node instanceof UnaryOp unary && unary.isNot();
  }
}
