package truthtable.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import truthtable.core.TruthTable;
import truthtable.pipeline.AnalysisResult;
import truthtable.pipeline.ExpressionReport;
import truthtable.pipeline.TableDiagnostic;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  String build(List<AnalysisResult> results, List<SourceFailure> failures) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", VERSION);
    List<Map<String, Object>> sources = new ArrayList<>(results.size());
    for (AnalysisResult result : results) {
      sources.add(source(result));
    }
    root.put("sources", sources);
    if (!failures.isEmpty()) {
      root.put("failures", failureSummaries(failures));
    }
    return gson.toJson(root);
  }

  private Map<String, Object> source(AnalysisResult result) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", result.sourceName());
    map.put("time_ms", result.elapsedMillis());
    map.put("candidates", result.candidateCount());
    List<Map<String, Object>> expressions = new ArrayList<>(result.reports().size());
    for (ExpressionReport report : result.reports()) {
      expressions.add(expression(report));
    }
    map.put("expressions", expressions);
    if (result.hasDiagnostics()) {
      map.put("diagnostics", diagnosticSummaries(result.diagnostics()));
    }
    return map;
  }

  private Map<String, Object> expression(ExpressionReport report) {
    TruthTable table = report.table();
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("expression", report.expression());
    map.put("line", report.line());
    map.put("operands", table.operandLabels());
    List<Map<String, Object>> rows = new ArrayList<>(table.rows().size());
    for (TruthTable.Row row : table.rows()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("values", row.assignment());
      entry.put("result", row.result());
      rows.add(entry);
    }
    map.put("rows", rows);
    return map;
  }

  private List<Map<String, Object>> diagnosticSummaries(List<TableDiagnostic> diagnostics) {
    List<Map<String, Object>> summaries = new ArrayList<>();
    for (TableDiagnostic diagnostic : diagnostics) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("expression", diagnostic.expression());
      map.put("line", diagnostic.line());
      map.put("reason", diagnostic.reason().name());
      map.put("message", diagnostic.message());
      summaries.add(map);
    }
    return summaries;
  }

  private List<Map<String, Object>> failureSummaries(List<SourceFailure> failures) {
    List<Map<String, Object>> summaries = new ArrayList<>();
    for (SourceFailure failure : failures) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("source", failure.source());
      map.put("message", failure.message());
      summaries.add(map);
    }
    return summaries;
  }

  /** A source that could not be read or parsed. */
  record SourceFailure(String source, String message) {}
}
