package truthtable.testing;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import truthtable.frontend.JavaSourceParser;
import truthtable.frontend.ParsedSource;
import truthtable.tree.OtherNode;
import truthtable.tree.SourceLocation;
import truthtable.tree.SourceNode;
import truthtable.tree.Unparser;

/** Shared fixtures: parsed expressions, bundled sample sources and hand-built nodes. */
public final class Sources {
  public static final String CONDITIONS = "samples/Conditions.java";

  /** Renders hand-built {@link OtherNode}s by their kind, anything else by its class name. */
  public static final Unparser BY_KIND =
      node ->
          node instanceof OtherNode other ? other.kind() : node.getClass().getSimpleName();

  private Sources() {}

  public static ParsedSource expression(String text) {
    return new JavaSourceParser().parseExpression(text);
  }

  public static ParsedSource resource(String path) {
    try (InputStream in = Sources.class.getClassLoader().getResourceAsStream(path)) {
      if (in == null) {
        throw new IllegalArgumentException("Missing test resource: " + path);
      }
      String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      return new JavaSourceParser().parse(text, path);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  public static OtherNode name(String identifier) {
    return new OtherNode(identifier, List.of(), new SourceLocation(1, 1));
  }

  public static SourceNode[] names(String... identifiers) {
    SourceNode[] nodes = new SourceNode[identifiers.length];
    for (int i = 0; i < identifiers.length; i++) {
      nodes[i] = name(identifiers[i]);
    }
    return nodes;
  }
}
