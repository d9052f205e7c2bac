package truthtable.pipeline;

import java.util.Objects;
import truthtable.AnalysisException;

/** Structured entry describing why an expression was skipped. */
public record TableDiagnostic(
    String expression, int line, AnalysisException.Kind reason, String message) {

  public TableDiagnostic {
    Objects.requireNonNull(reason, "reason");
    expression = expression == null ? "" : expression;
    message = message == null ? "" : message;
  }

  public static TableDiagnostic skipped(String expression, int line, AnalysisException error) {
    return new TableDiagnostic(expression, line, error.kind(), error.getMessage());
  }
}
