package truthtable.tree;

import java.util.List;
import truthtable.AnalysisException;

/**
 * A literal value as written in the source. Array literals keep their elements, since those can
 * hold boolean expressions of their own.
 */
public record Literal(
    LiteralKind kind, String text, List<SourceNode> elements, SourceLocation location)
    implements SourceNode {

  public Literal(LiteralKind kind, String text, SourceLocation location) {
    this(kind, text, List.of(), location);
  }

  public Literal {
    if (kind == null) {
      throw AnalysisException.missingField("Literal", "kind");
    }
    text = text == null ? "" : text;
    elements = elements == null ? List.of() : List.copyOf(elements);
    location = location == null ? SourceLocation.UNKNOWN : location;
  }

  public boolean isConstantLike() {
    return kind.isConstantLike();
  }

  @Override
  public List<NodeField> fields() {
    return List.of(
        new NodeField.Scalar("kind", kind),
        new NodeField.Scalar("text", text),
        new NodeField.Many("elements", elements));
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
