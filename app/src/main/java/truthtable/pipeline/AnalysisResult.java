package truthtable.pipeline;

import java.util.List;
import java.util.Objects;

/** Aggregated outcome of analyzing one source. */
public record AnalysisResult(
    String sourceName,
    int candidateCount,
    List<ExpressionReport> reports,
    List<TableDiagnostic> diagnostics,
    long elapsedMillis) {

  public AnalysisResult {
    Objects.requireNonNull(sourceName, "sourceName");
    reports = List.copyOf(reports);
    diagnostics = List.copyOf(diagnostics);
  }

  public boolean hasDiagnostics() {
    return !diagnostics.isEmpty();
  }
}
