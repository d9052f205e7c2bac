package truthtable.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import truthtable.core.TruthTableOptions;
import truthtable.core.ValueStyle;
import truthtable.frontend.JavaSourceParser;

record CliOptions(
    List<Path> files,
    String expression,
    OutputFormat format,
    int padding,
    int maxOperands,
    ValueStyle valueStyle,
    int languageLevel,
    boolean failFast,
    boolean help) {

  CliOptions {
    files = files == null ? List.of() : List.copyOf(files);
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(valueStyle, "valueStyle");
  }

  boolean hasExpression() {
    return expression != null && !expression.isBlank();
  }

  TruthTableOptions tableOptions() {
    return new TruthTableOptions(padding, maxOperands, valueStyle, failFast);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private final List<Path> files = new ArrayList<>();
    private String expression;
    private OutputFormat format = OutputFormat.TEXT;
    private int padding = TruthTableOptions.defaults().padding();
    private int maxOperands = TruthTableOptions.defaults().maxOperands();
    private ValueStyle valueStyle = TruthTableOptions.defaults().valueStyle();
    private int languageLevel = JavaSourceParser.DEFAULT_LANGUAGE_LEVEL;
    private boolean failFast;
    private boolean help;

    Builder addFile(Path file) {
      files.add(file);
      return this;
    }

    Builder expression(String expression) {
      this.expression = expression;
      return this;
    }

    Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    Builder padding(int padding) {
      this.padding = padding;
      return this;
    }

    Builder maxOperands(int maxOperands) {
      this.maxOperands = maxOperands;
      return this;
    }

    Builder valueStyle(ValueStyle valueStyle) {
      this.valueStyle = valueStyle;
      return this;
    }

    Builder languageLevel(int languageLevel) {
      this.languageLevel = languageLevel;
      return this;
    }

    Builder failFast(boolean failFast) {
      this.failFast = failFast;
      return this;
    }

    Builder help(boolean help) {
      this.help = help;
      return this;
    }

    CliOptions build() {
      if (!help) {
        boolean hasExpression = expression != null && !expression.isBlank();
        if (hasExpression && !files.isEmpty()) {
          throw new IllegalArgumentException(
              "Provide either --expression or source files, not both");
        }
        if (!hasExpression && files.isEmpty()) {
          throw new IllegalArgumentException("Provide at least one source file or --expression");
        }
      }
      if (padding < 0) {
        throw new IllegalArgumentException("--padding must be non-negative");
      }
      if (maxOperands < 0 || maxOperands > TruthTableOptions.HARD_MAX_OPERANDS) {
        throw new IllegalArgumentException(
            "--max-operands must be between 0 and " + TruthTableOptions.HARD_MAX_OPERANDS);
      }
      return new CliOptions(
          files,
          expression,
          format,
          padding,
          maxOperands,
          valueStyle,
          languageLevel,
          failFast,
          help);
    }
  }
}
