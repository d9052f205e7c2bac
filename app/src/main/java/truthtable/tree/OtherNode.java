package truthtable.tree;

import java.util.List;

/**
 * Any construct that is neither a boolean operation, a unary operation nor a literal: names,
 * calls, comparisons, statements, declarations. Only its children matter to the analysis.
 */
public record OtherNode(String kind, List<SourceNode> children, SourceLocation location)
    implements SourceNode {

  public OtherNode {
    kind = kind == null ? "Other" : kind;
    children = children == null ? List.of() : List.copyOf(children);
    location = location == null ? SourceLocation.UNKNOWN : location;
  }

  @Override
  public List<NodeField> fields() {
    return List.of(new NodeField.Scalar("kind", kind), new NodeField.Many("children", children));
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
