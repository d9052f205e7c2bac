package truthtable.core;

import java.util.function.Predicate;
import truthtable.tree.BooleanOp;
import truthtable.tree.Literal;
import truthtable.tree.SourceNode;

/**
 * Decides whether a boolean operation is worth tabulating.
 *
 * <p>Expressions whose operands are all constant-like literals ({@code "x" && "y"}) are skipped;
 * no constant folding is attempted beyond that. A negated literal is a unary operation, not a
 * literal, and therefore passes.
 */
public final class CandidateFilter implements Predicate<SourceNode> {

  public boolean isCandidate(SourceNode node) {
    if (!(node instanceof BooleanOp op)) {
      return false;
    }
    for (SourceNode operand : op.operands()) {
      if (operand instanceof BooleanOp) {
        if (!isCandidate(operand)) {
          return false;
        }
      } else if (operand instanceof Literal literal && literal.isConstantLike()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean test(SourceNode node) {
    return isCandidate(node);
  }
}
