package truthtable.frontend;

import java.util.Objects;
import truthtable.tree.SourceNode;
import truthtable.tree.Unparser;

/**
 * A parsed input: its name, the converted tree and the unparser that renders nodes of that tree.
 */
public record ParsedSource(String name, SourceNode root, Unparser unparser) {

  public ParsedSource {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(unparser, "unparser");
  }
}
