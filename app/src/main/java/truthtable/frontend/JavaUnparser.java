package truthtable.frontend;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.utils.StringEscapeUtils;
import java.util.Map;
import truthtable.tree.SourceNode;
import truthtable.tree.Unparser;

/** Renders converted nodes by pretty-printing the JavaParser nodes they came from. */
final class JavaUnparser implements Unparser {
  private final Map<SourceNode, Node> origins;

  JavaUnparser(Map<SourceNode, Node> origins) {
    this.origins = origins;
  }

  @Override
  public String unparse(SourceNode node) {
    Node origin = origins.get(node);
    if (origin == null) {
      throw new IllegalArgumentException("Node does not belong to this source: " + node);
    }
    // labels must fit on one table line; only printer layout may be collapsed
    return withoutTextBlocks(origin).toString().replaceAll("\\s*\\R\\s*", " ").strip();
  }

  /** Text blocks carry line breaks in their value, so they print as escaped string literals. */
  private static Node withoutTextBlocks(Node origin) {
    if (origin instanceof TextBlockLiteralExpr block) {
      return asStringLiteral(block);
    }
    if (origin.findFirst(TextBlockLiteralExpr.class).isEmpty()) {
      return origin;
    }
    Node copy = origin.clone();
    for (TextBlockLiteralExpr block : copy.findAll(TextBlockLiteralExpr.class)) {
      block.replace(asStringLiteral(block));
    }
    return copy;
  }

  private static StringLiteralExpr asStringLiteral(TextBlockLiteralExpr block) {
    return new StringLiteralExpr(StringEscapeUtils.escapeJava(block.asString()));
  }
}
