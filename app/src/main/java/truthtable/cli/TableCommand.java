package truthtable.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import truthtable.AnalysisException;
import truthtable.cli.JsonReportBuilder.SourceFailure;
import truthtable.core.TruthTableOptions;
import truthtable.frontend.JavaSourceParser;
import truthtable.frontend.ParsedSource;
import truthtable.frontend.SourceParseException;
import truthtable.pipeline.AnalysisResult;
import truthtable.pipeline.TruthTableAnalyzer;

/** Parses arguments, analyzes every requested source and prints the tables. */
final class TableCommand {
  private static final Logger LOG = LoggerFactory.getLogger(TableCommand.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;
  static final int EXIT_SKIPPED = 3;

  static final String USAGE =
      String.join(
          "\n",
          "Usage: truthtable [options] <file.java>...",
          "       truthtable [options] --expression \"<java expression>\"",
          "",
          "Options:",
          "  --expression <expr>   tabulate a single expression",
          "  --format text|json    output format (default text)",
          "  --padding <n>         spaces added to every column (default 4)",
          "  --max-operands <n>    skip expressions with more operands (default 16, max 30)",
          "  --values words|bits   print false/true or 0/1 (default words)",
          "  --language-level <n>  Java language level of the sources (default 17)",
          "  --fail-fast           stop at the first expression that cannot be tabulated",
          "  --help                print this help");

  private final PrintStream out;

  TableCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) {
    CliOptions options;
    JavaSourceParser parser;
    try {
      options = parseArgs(args);
      parser = new JavaSourceParser(options.languageLevel());
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      out.println(USAGE);
      return EXIT_USAGE;
    }
    if (options.help()) {
      out.println(USAGE);
      return EXIT_OK;
    }

    TruthTableAnalyzer analyzer = new TruthTableAnalyzer();
    TruthTableOptions tableOptions = options.tableOptions();
    List<AnalysisResult> results = new ArrayList<>();
    List<SourceFailure> failures = new ArrayList<>();

    try {
      if (options.hasExpression()) {
        results.add(analyzer.analyze(parser.parseExpression(options.expression()), tableOptions));
      } else {
        for (Path file : options.files()) {
          ParsedSource source = load(parser, file, failures);
          if (source != null) {
            results.add(analyzer.analyze(source, tableOptions));
          }
        }
      }
    } catch (SourceParseException ex) {
      LOG.error("Cannot parse {}", ex.getMessage());
      return EXIT_FAILURE;
    } catch (AnalysisException ex) {
      LOG.error("Analysis failed ({}): {}", ex.kind(), ex.getMessage());
      // sources finished before the failure are still reported
      print(results, failures, options);
      return EXIT_FAILURE;
    }

    print(results, failures, options);

    if (!failures.isEmpty()) {
      return EXIT_FAILURE;
    }
    for (AnalysisResult result : results) {
      if (result.hasDiagnostics()) {
        return EXIT_SKIPPED;
      }
    }
    return EXIT_OK;
  }

  private ParsedSource load(JavaSourceParser parser, Path file, List<SourceFailure> failures) {
    try {
      return parser.parse(file);
    } catch (IOException ex) {
      LOG.error("Cannot read {}: {}", file, ex.getMessage());
      failures.add(new SourceFailure(file.toString(), "read failed: " + ex.getMessage()));
    } catch (SourceParseException ex) {
      LOG.error("Cannot parse {}", ex.getMessage());
      failures.add(new SourceFailure(file.toString(), ex.getMessage()));
    }
    return null;
  }

  private void print(
      List<AnalysisResult> results, List<SourceFailure> failures, CliOptions options) {
    if (options.format() == OutputFormat.JSON) {
      out.println(new JsonReportBuilder().build(results, failures));
      return;
    }
    TextReportFormatter formatter =
        new TextReportFormatter(options.padding(), options.valueStyle());
    for (AnalysisResult result : results) {
      if (result.reports().isEmpty()) {
        LOG.info("No boolean expressions to tabulate in {}", result.sourceName());
        continue;
      }
      out.println(formatter.format(result));
    }
  }

  CliOptions parseArgs(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      if (!parsed.option().startsWith("--")) {
        builder.addFile(Path.of(parsed.option()));
        continue;
      }
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    TruthTableOptions defaults = TruthTableOptions.defaults();
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--expression", OptionSpec.withValue((b, raw) -> b.expression(raw)));
    specs.put(
        "--format", OptionSpec.withValue((b, raw) -> b.format(CliParsers.parseFormat(raw))));
    specs.put(
        "--padding",
        OptionSpec.withValue(
            (b, raw) -> b.padding(CliParsers.parseInt(raw, defaults.padding(), "--padding"))));
    specs.put(
        "--max-operands",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxOperands(
                    CliParsers.parseInt(raw, defaults.maxOperands(), "--max-operands"))));
    specs.put(
        "--values",
        OptionSpec.withValue((b, raw) -> b.valueStyle(CliParsers.parseValueStyle(raw))));
    specs.put(
        "--language-level",
        OptionSpec.withValue(
            (b, raw) ->
                b.languageLevel(
                    CliParsers.parseInt(
                        raw, JavaSourceParser.DEFAULT_LANGUAGE_LEVEL, "--language-level"))));
    specs.put("--fail-fast", OptionSpec.flag(b -> b.failFast(true)));
    specs.put("--help", OptionSpec.flag(b -> b.help(true)));
    return specs;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Empty argument");
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
