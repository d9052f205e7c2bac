package truthtable.tree;

/**
 * Renders a node back to source text. Used for labels only: two structurally equal nodes must
 * render to the same text so they are recognized as the same operand.
 */
@FunctionalInterface
public interface Unparser {

  String unparse(SourceNode node);
}
