package truthtable.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import truthtable.frontend.ParsedSource;
import truthtable.testing.Sources;
import truthtable.tree.BooleanOp;

final class OperandExtractorTest {

  private static OperandSet extract(String expression) {
    ParsedSource source = Sources.expression(expression);
    return new OperandExtractor(source.unparser()).extract(source.root());
  }

  @Test
  void duplicateOperandsCollapse() {
    OperandSet operands = extract("a && b && a");
    assertEquals(List.of("a", "b"), operands.labels());
    assertEquals(2, operands.get("a").orElseThrow().nodes().size());
  }

  @Test
  void nestedOperationsAreFlattened() {
    assertEquals(List.of("a", "b", "c"), extract("a && (b || c)").labels());
    assertEquals(List.of("a", "b", "c", "d"), extract("a && b || c && d").labels());
  }

  @Test
  void negationIsTransparent() {
    OperandSet operands = extract("a && !a");
    assertEquals(List.of("a"), operands.labels());
    assertEquals(2, operands.get("a").orElseThrow().nodes().size());
    assertEquals(List.of("a", "b"), extract("!(a && b)").labels());
  }

  @Test
  void compoundAtomsKeepTheirText() {
    assertEquals(
        List.of("a.b()", "x > 1", "-y"), extract("a.b() && x > 1 || a.b() && -y").labels());
  }

  @Test
  void textBlocksWithDifferentLineBreaksStayDistinct() {
    ParsedSource source =
        Sources.expression(
            "s.equals(\"\"\"\n  a\n    b\"\"\") && !s.equals(\"\"\"\n  a\n  b\"\"\")");
    OperandSet operands = new OperandExtractor(source.unparser()).extract(source.root());

    assertEquals(2, operands.size(), "labels: " + operands.labels());
    for (String label : operands.labels()) {
      assertFalse(label.contains("\n"), label);
    }
    TruthTable table = new TruthTableBuilder(source.unparser()).build((BooleanOp) source.root());
    assertTrue(table.rows().get(2).result(), "a\\n  b matched, a\\nb did not");
  }

  @Test
  void extractionIsIdempotent() {
    ParsedSource source = Sources.expression("c || a && (b || !c)");
    OperandExtractor extractor = new OperandExtractor(source.unparser());
    assertEquals(
        extractor.extract(source.root()).labels(), extractor.extract(source.root()).labels());
    assertEquals(List.of("c", "a", "b"), extractor.extract(source.root()).labels());
  }

  @Test
  void atomicNodeIsItsOwnOperand() {
    OperandSet operands = new OperandExtractor(Sources.BY_KIND).extract(Sources.name("flag"));
    assertEquals(List.of("flag"), operands.labels());
  }
}
