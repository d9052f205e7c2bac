package truthtable.cli;

import java.util.ArrayList;
import java.util.List;
import truthtable.core.ValueStyle;
import truthtable.pipeline.AnalysisResult;
import truthtable.pipeline.ExpressionReport;
import truthtable.render.TableRenderer;

/** Prints every table of a source under a label naming the expression and where it was found. */
final class TextReportFormatter {
  private final TableRenderer renderer;
  private final ValueStyle valueStyle;

  TextReportFormatter(int padding, ValueStyle valueStyle) {
    this.renderer = new TableRenderer(padding);
    this.valueStyle = valueStyle;
  }

  String format(AnalysisResult result) {
    List<String> blocks = new ArrayList<>(result.reports().size());
    for (ExpressionReport report : result.reports()) {
      blocks.add(format(report, result.sourceName()));
    }
    return String.join("\n\n", blocks);
  }

  String format(ExpressionReport report, String sourceName) {
    return "Expression: "
        + report.expression()
        + "\n    in "
        + sourceName
        + " line: "
        + report.line()
        + "\n\n"
        + renderer.render(report.table(), valueStyle)
        + "\n";
  }
}
