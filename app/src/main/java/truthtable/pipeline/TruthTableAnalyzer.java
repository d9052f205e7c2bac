package truthtable.pipeline;

import com.google.common.base.Stopwatch;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import truthtable.AnalysisException;
import truthtable.core.Evaluator;
import truthtable.core.ExpressionCollector;
import truthtable.core.OperandExtractor;
import truthtable.core.TruthTable;
import truthtable.core.TruthTableBuilder;
import truthtable.core.TruthTableOptions;
import truthtable.frontend.ParsedSource;
import truthtable.tree.BooleanOp;

/**
 * Runs the analysis over a parsed source: collect candidate expressions, then tabulate each one
 * in document order.
 *
 * <p>An expression that cannot be tabulated is skipped with a diagnostic unless {@link
 * TruthTableOptions#failFast()} is set, in which case the error propagates.
 */
public final class TruthTableAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(TruthTableAnalyzer.class);

  private final ExpressionCollector collector;

  public TruthTableAnalyzer() {
    this(new ExpressionCollector());
  }

  public TruthTableAnalyzer(ExpressionCollector collector) {
    this.collector = collector;
  }

  public AnalysisResult analyze(ParsedSource source, TruthTableOptions options) {
    TruthTableOptions effective = TruthTableOptions.normalize(options);
    Stopwatch stopwatch = Stopwatch.createStarted();

    List<BooleanOp> candidates = collector.collect(source.root());
    LOG.debug("{}: {} candidate expression(s)", source.name(), candidates.size());

    OperandExtractor extractor = new OperandExtractor(source.unparser());
    TruthTableBuilder builder =
        new TruthTableBuilder(extractor, new Evaluator(), effective.maxOperands());
    List<ExpressionReport> reports = new ArrayList<>(candidates.size());
    List<TableDiagnostic> diagnostics = new ArrayList<>();

    for (BooleanOp candidate : candidates) {
      int line = candidate.location().line();
      try {
        TruthTable table = builder.build(candidate);
        reports.add(new ExpressionReport(table.expression(), line, table));
      } catch (AnalysisException ex) {
        if (effective.failFast()) {
          throw ex;
        }
        String label = extractor.label(candidate);
        LOG.warn("Skipping {} at {} line {}: {}", label, source.name(), line, ex.getMessage());
        diagnostics.add(TableDiagnostic.skipped(label, line, ex));
      }
    }

    long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
    LOG.info(
        "Analyzed {}: {} table(s), {} skipped in {} ms",
        source.name(),
        reports.size(),
        diagnostics.size(),
        elapsed);
    return new AnalysisResult(source.name(), candidates.size(), reports, diagnostics, elapsed);
  }
}
