package truthtable.pipeline;

import java.util.Objects;
import truthtable.core.TruthTable;

/** Truth table of one expression found in a source, with where it was found. */
public record ExpressionReport(String expression, int line, TruthTable table) {

  public ExpressionReport {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(table, "table");
  }
}
