package truthtable.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import truthtable.AnalysisException;
import truthtable.tree.SourceNode;
import truthtable.tree.Unparser;

/** Builds the full truth table of one boolean expression. */
public final class TruthTableBuilder {
  private final OperandExtractor extractor;
  private final Evaluator evaluator;
  private final int maxOperands;

  public TruthTableBuilder(Unparser unparser) {
    this(unparser, TruthTableOptions.DEFAULT_MAX_OPERANDS);
  }

  public TruthTableBuilder(Unparser unparser, int maxOperands) {
    this(new OperandExtractor(unparser), new Evaluator(), maxOperands);
  }

  public TruthTableBuilder(OperandExtractor extractor, Evaluator evaluator, int maxOperands) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    if (maxOperands < 0 || maxOperands > TruthTableOptions.HARD_MAX_OPERANDS) {
      throw new IllegalArgumentException("maxOperands out of range: " + maxOperands);
    }
    this.maxOperands = maxOperands;
  }

  /**
   * Tabulates {@code node} over all {@code 2^n} assignments of its {@code n} operands, first
   * operand most significant, {@code false} before {@code true}.
   *
   * @throws AnalysisException if the expression has more operands than allowed or cannot be
   *     evaluated
   */
  public TruthTable build(SourceNode node) {
    OperandSet operands = extractor.extract(node);
    int size = operands.size();
    if (size > maxOperands) {
      throw AnalysisException.tooManyOperands(size, maxOperands);
    }
    long count = Assignments.count(size);
    List<TruthTable.Row> rows = new ArrayList<>((int) count);
    for (long mask = 0; mask < count; mask++) {
      boolean[] assignment = Assignments.fromMask(mask, size);
      boolean result = evaluator.evaluate(node, operands, assignment);
      rows.add(new TruthTable.Row(Assignments.toList(assignment), result));
    }
    return new TruthTable(operands.labels(), extractor.label(node), rows);
  }
}
