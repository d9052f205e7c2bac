package truthtable.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import truthtable.core.ExpressionCollector;
import truthtable.testing.Sources;
import truthtable.tree.BooleanOp;
import truthtable.tree.Literal;
import truthtable.tree.LiteralKind;
import truthtable.tree.LogicalOperator;
import truthtable.tree.OtherNode;
import truthtable.tree.UnaryOp;
import truthtable.tree.UnaryOperator;

final class JavaSourceParserTest {
  private final JavaSourceParser parser = new JavaSourceParser();

  @Test
  void sameOperatorChainBecomesOneOperation() {
    BooleanOp op = assertInstanceOf(BooleanOp.class, Sources.expression("a && b && c").root());
    assertEquals(LogicalOperator.AND, op.operator());
    assertEquals(3, op.operands().size());
  }

  @Test
  void parenthesizedOperandStaysNested() {
    BooleanOp op = assertInstanceOf(BooleanOp.class, Sources.expression("a && (b && c)").root());
    assertEquals(2, op.operands().size());
    assertInstanceOf(BooleanOp.class, op.operands().get(1));
  }

  @Test
  void mixedOperatorsNestByPrecedence() {
    BooleanOp or = assertInstanceOf(BooleanOp.class, Sources.expression("a || b && c").root());
    assertEquals(LogicalOperator.OR, or.operator());
    BooleanOp and = assertInstanceOf(BooleanOp.class, or.operands().get(1));
    assertEquals(LogicalOperator.AND, and.operator());
  }

  @Test
  void convertsUnaryOperationsAndLiterals() {
    BooleanOp op =
        assertInstanceOf(BooleanOp.class, Sources.expression("!a || \"s\" || 3 || null").root());
    UnaryOp not = assertInstanceOf(UnaryOp.class, op.operands().get(0));
    assertEquals(UnaryOperator.NOT, not.operator());
    assertInstanceOf(OtherNode.class, not.operand());
    assertEquals(LiteralKind.STRING, assertInstanceOf(Literal.class, op.operands().get(1)).kind());
    assertEquals(LiteralKind.NUMBER, assertInstanceOf(Literal.class, op.operands().get(2)).kind());
    assertEquals(LiteralKind.NULL, assertInstanceOf(Literal.class, op.operands().get(3)).kind());
  }

  @Test
  void recordsSourceLines() {
    String text =
        String.join(
            "\n",
            "class A {",
            "  boolean f(boolean a, boolean b) {",
            "    return a",
            "        && b;",
            "  }",
            "}");
    ParsedSource source = parser.parse(text, "A.java");
    List<BooleanOp> found = new ExpressionCollector().collect(source.root());

    assertEquals(1, found.size());
    assertEquals(3, found.get(0).location().line());
    assertEquals("a && b", source.unparser().unparse(found.get(0)));
    assertEquals("A.java", source.name());
  }

  @Test
  void labelsIgnoreComments() {
    ParsedSource source = Sources.expression("a /* first */ && b");
    assertEquals("a && b", source.unparser().unparse(source.root()));
  }

  @Test
  void invalidSourceNamesTheInput() {
    SourceParseException ex =
        assertThrows(SourceParseException.class, () -> parser.parse("class {", "Broken.java"));
    assertEquals("Broken.java", ex.identifier());
    assertTrue(ex.getMessage().startsWith("Broken.java: "));
  }

  @Test
  void unparserRejectsForeignNodes() {
    ParsedSource source = Sources.expression("a && b");
    assertThrows(
        IllegalArgumentException.class, () -> source.unparser().unparse(Sources.name("a")));
  }

  @Test
  void rejectsUnknownLanguageLevel() {
    assertThrows(IllegalArgumentException.class, () -> new JavaSourceParser(99));
  }

  @Test
  void readsFiles(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("B.java");
    Files.writeString(file, "class B { boolean x = p || q; }", StandardCharsets.UTF_8);

    ParsedSource source = parser.parse(file);

    assertEquals(file.toString(), source.name());
    assertEquals(1, new ExpressionCollector().collect(source.root()).size());
  }
}
