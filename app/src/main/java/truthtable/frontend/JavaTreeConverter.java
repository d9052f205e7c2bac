package truthtable.frontend;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import truthtable.tree.BooleanOp;
import truthtable.tree.Literal;
import truthtable.tree.LiteralKind;
import truthtable.tree.LogicalOperator;
import truthtable.tree.OtherNode;
import truthtable.tree.SourceLocation;
import truthtable.tree.SourceNode;
import truthtable.tree.UnaryOp;
import truthtable.tree.UnaryOperator;

/**
 * Converts a JavaParser tree into a {@link SourceNode} tree.
 *
 * <p>A left-nested chain of the same conditional operator becomes one n-ary {@link BooleanOp}, so
 * {@code a && b && c} has three operands while {@code a && (b && c)} keeps the parenthesized
 * operation as a nested one. Parentheses themselves leave no node behind. Every converted node
 * remembers the JavaParser node it came from so it can be printed back.
 */
final class JavaTreeConverter {
  private static final Comparator<Node> BY_BEGIN =
      Comparator.comparing(
          (Node node) -> node.getBegin().orElse(null),
          Comparator.nullsLast(Comparator.naturalOrder()));

  private final Map<SourceNode, Node> origins = new IdentityHashMap<>();

  Map<SourceNode, Node> origins() {
    return origins;
  }

  SourceNode convert(Node node) {
    if (node instanceof EnclosedExpr enclosed) {
      return convert(enclosed.getInner());
    }
    if (node instanceof BinaryExpr binary && logicalOperator(binary) != null) {
      List<SourceNode> operands = new ArrayList<>();
      flatten(binary, binary.getOperator(), operands);
      return register(new BooleanOp(logicalOperator(binary), operands, location(binary)), binary);
    }
    if (node instanceof UnaryExpr unary) {
      return register(
          new UnaryOp(
              unaryOperator(unary.getOperator()), convert(unary.getExpression()), location(unary)),
          unary);
    }
    LiteralKind literalKind = literalKind(node);
    if (literalKind != null) {
      List<SourceNode> elements =
          literalKind == LiteralKind.ARRAY ? convertChildren(node) : List.of();
      return register(new Literal(literalKind, node.toString(), elements, location(node)), node);
    }
    return register(
        new OtherNode(node.getClass().getSimpleName(), convertChildren(node), location(node)),
        node);
  }

  private void flatten(Expression expression, BinaryExpr.Operator operator, List<SourceNode> out) {
    if (expression instanceof BinaryExpr binary && binary.getOperator() == operator) {
      flatten(binary.getLeft(), operator, out);
      flatten(binary.getRight(), operator, out);
    } else {
      out.add(convert(expression));
    }
  }

  private List<SourceNode> convertChildren(Node node) {
    List<Node> children = new ArrayList<>();
    for (Node child : node.getChildNodes()) {
      if (!(child instanceof Comment)) {
        children.add(child);
      }
    }
    children.sort(BY_BEGIN);
    List<SourceNode> converted = new ArrayList<>(children.size());
    for (Node child : children) {
      converted.add(convert(child));
    }
    return converted;
  }

  private SourceNode register(SourceNode converted, Node origin) {
    origins.put(converted, origin);
    return converted;
  }

  private static LogicalOperator logicalOperator(BinaryExpr binary) {
    return switch (binary.getOperator()) {
      case AND -> LogicalOperator.AND;
      case OR -> LogicalOperator.OR;
      default -> null;
    };
  }

  private static UnaryOperator unaryOperator(UnaryExpr.Operator operator) {
    return switch (operator) {
      case LOGICAL_COMPLEMENT -> UnaryOperator.NOT;
      case MINUS -> UnaryOperator.MINUS;
      case PLUS -> UnaryOperator.PLUS;
      case BITWISE_COMPLEMENT -> UnaryOperator.COMPLEMENT;
      case PREFIX_INCREMENT -> UnaryOperator.PREFIX_INCREMENT;
      case PREFIX_DECREMENT -> UnaryOperator.PREFIX_DECREMENT;
      case POSTFIX_INCREMENT -> UnaryOperator.POSTFIX_INCREMENT;
      case POSTFIX_DECREMENT -> UnaryOperator.POSTFIX_DECREMENT;
    };
  }

  private static LiteralKind literalKind(Node node) {
    if (node instanceof StringLiteralExpr || node instanceof TextBlockLiteralExpr) {
      return LiteralKind.STRING;
    }
    if (node instanceof CharLiteralExpr) {
      return LiteralKind.CHARACTER;
    }
    if (node instanceof IntegerLiteralExpr
        || node instanceof LongLiteralExpr
        || node instanceof DoubleLiteralExpr) {
      return LiteralKind.NUMBER;
    }
    if (node instanceof BooleanLiteralExpr) {
      return LiteralKind.BOOLEAN;
    }
    if (node instanceof NullLiteralExpr) {
      return LiteralKind.NULL;
    }
    if (node instanceof ArrayInitializerExpr) {
      return LiteralKind.ARRAY;
    }
    if (node instanceof ArrayCreationExpr creation && creation.getInitializer().isPresent()) {
      return LiteralKind.ARRAY;
    }
    return null;
  }

  private static SourceLocation location(Node node) {
    return node.getBegin()
        .map((Position begin) -> new SourceLocation(begin.line, begin.column))
        .orElse(SourceLocation.UNKNOWN);
  }
}
