package truthtable.tree;

import java.util.List;

/**
 * A node of an analyzed source tree.
 *
 * <p>The set of node kinds is closed: every walker dispatches over {@link BooleanOp}, {@link
 * UnaryOp}, {@link Literal} and {@link OtherNode} and fails loudly on anything else. Nodes are
 * compared by identity wherever an occurrence matters, never by {@code equals}.
 */
public sealed interface SourceNode permits BooleanOp, UnaryOp, Literal, OtherNode {

  /** Position of the node's first token. */
  SourceLocation location();

  /** Fields of this node in declaration order, as seen by generic tree walkers. */
  List<NodeField> fields();
}
