package truthtable.render;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import truthtable.core.TruthTable;
import truthtable.core.TruthTableOptions;
import truthtable.core.ValueStyle;

/**
 * Formats rows as centered, fixed-width columns with a dashed line under the header.
 *
 * <p>Each column is as wide as its widest cell plus the padding; the padding is the only gap
 * between columns.
 */
public final class TableRenderer {
  private final int padding;

  public TableRenderer() {
    this(TruthTableOptions.DEFAULT_PADDING);
  }

  public TableRenderer(int padding) {
    Preconditions.checkArgument(padding >= 0, "padding must be non-negative: %s", padding);
    this.padding = padding;
  }

  public String render(TruthTable table, ValueStyle style) {
    return render(table.textRows(style));
  }

  public String render(List<? extends List<?>> rows) {
    Preconditions.checkArgument(!rows.isEmpty(), "at least one row is required");
    int[] widths = columnWidths(rows);

    List<String> lines = new ArrayList<>(rows.size() + 1);
    for (int i = 0; i < rows.size(); i++) {
      List<?> row = rows.get(i);
      StringBuilder line = new StringBuilder();
      for (int column = 0; column < widths.length; column++) {
        line.append(center(String.valueOf(row.get(column)), widths[column]));
      }
      lines.add(line.toString());
      if (i == 0) {
        lines.add(separator(widths));
      }
    }
    return String.join("\n", lines);
  }

  int[] columnWidths(List<? extends List<?>> rows) {
    int columns = rows.get(0).size();
    int[] widths = new int[columns];
    for (List<?> row : rows) {
      Preconditions.checkArgument(
          row.size() == columns, "row has %s columns, expected %s", row.size(), columns);
      for (int column = 0; column < columns; column++) {
        widths[column] = Math.max(widths[column], String.valueOf(row.get(column)).length());
      }
    }
    for (int column = 0; column < columns; column++) {
      widths[column] += padding;
    }
    return widths;
  }

  private String separator(int[] widths) {
    StringBuilder line = new StringBuilder();
    for (int width : widths) {
      line.append(center("-".repeat(width - padding), width));
    }
    return line.toString();
  }

  /** Centers {@code text} in {@code width}; odd slack puts the extra space on the right. */
  static String center(String text, int width) {
    int slack = width - text.length();
    if (slack <= 0) {
      return text;
    }
    int left = slack / 2;
    return Strings.padEnd(Strings.padStart(text, text.length() + left, ' '), width, ' ');
  }
}
