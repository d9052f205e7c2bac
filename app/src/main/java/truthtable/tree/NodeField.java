package truthtable.tree;

import java.util.List;

/** A named field of a {@link SourceNode}: one child, a list of children, or a scalar value. */
public sealed interface NodeField {

  String name();

  record Single(String name, SourceNode node) implements NodeField {}

  record Many(String name, List<SourceNode> nodes) implements NodeField {
    public Many {
      nodes = List.copyOf(nodes);
    }
  }

  record Scalar(String name, Object value) implements NodeField {}
}
