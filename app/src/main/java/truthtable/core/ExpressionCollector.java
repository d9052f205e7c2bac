package truthtable.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import truthtable.tree.BooleanOp;
import truthtable.tree.NodeField;
import truthtable.tree.SourceNode;

/**
 * Finds every candidate boolean operation of a tree in document order.
 *
 * <p>The walk is a pre-order depth-first traversal over all node fields, so a candidate is
 * reported before the candidates nested inside it and nested ones are never suppressed.
 */
public final class ExpressionCollector {
  private final CandidateFilter filter;

  public ExpressionCollector() {
    this(new CandidateFilter());
  }

  public ExpressionCollector(CandidateFilter filter) {
    this.filter = Objects.requireNonNull(filter, "filter");
  }

  public List<BooleanOp> collect(SourceNode root) {
    List<BooleanOp> found = new ArrayList<>();
    Deque<SourceNode> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      SourceNode node = stack.pop();
      if (filter.isCandidate(node)) {
        found.add((BooleanOp) node);
      }
      List<SourceNode> children = children(node);
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return found;
  }

  private static List<SourceNode> children(SourceNode node) {
    List<SourceNode> children = new ArrayList<>();
    for (NodeField field : node.fields()) {
      if (field instanceof NodeField.Single single) {
        children.add(single.node());
      } else if (field instanceof NodeField.Many many) {
        children.addAll(many.nodes());
      }
      // scalars carry no nodes
    }
    return children;
  }
}
