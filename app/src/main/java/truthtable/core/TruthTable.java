package truthtable.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Every truth assignment of an expression's operands with the resulting value.
 *
 * @param operandLabels canonical labels of the operands, in extraction order
 * @param expression canonical text of the whole expression
 * @param rows one row per assignment, in binary counting order
 */
public record TruthTable(List<String> operandLabels, String expression, List<Row> rows) {

  public TruthTable {
    operandLabels = List.copyOf(operandLabels);
    Objects.requireNonNull(expression, "expression");
    rows = List.copyOf(rows);
    for (Row row : rows) {
      if (row.assignment().size() != operandLabels.size()) {
        throw new IllegalArgumentException(
            "Row has " + row.assignment().size() + " values for " + operandLabels.size()
                + " operands");
      }
    }
  }

  public int operandCount() {
    return operandLabels.size();
  }

  /** Operand labels followed by the expression. */
  public List<String> header() {
    List<String> header = new ArrayList<>(operandLabels);
    header.add(expression);
    return header;
  }

  /** Header followed by the data rows as text, every row of arity {@code operandCount() + 1}. */
  public List<List<String>> textRows(ValueStyle style) {
    List<List<String>> text = new ArrayList<>(rows.size() + 1);
    text.add(header());
    for (Row row : rows) {
      List<String> cells = new ArrayList<>(row.assignment().size() + 1);
      for (boolean value : row.assignment()) {
        cells.add(style.format(value));
      }
      cells.add(style.format(row.result()));
      text.add(cells);
    }
    return text;
  }

  /** One assignment and the value of the expression under it. */
  public record Row(List<Boolean> assignment, boolean result) {
    public Row {
      assignment = List.copyOf(assignment);
    }
  }
}
