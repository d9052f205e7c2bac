package truthtable.cli;

import java.util.Locale;
import truthtable.core.ValueStyle;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static OutputFormat parseFormat(String raw) {
    if (raw == null || raw.isBlank()) {
      return OutputFormat.TEXT;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "text", "table" -> OutputFormat.TEXT;
      case "json" -> OutputFormat.JSON;
      default -> throw new IllegalArgumentException("Invalid format: " + raw);
    };
  }

  static ValueStyle parseValueStyle(String raw) {
    if (raw == null || raw.isBlank()) {
      return ValueStyle.WORDS;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "words", "boolean", "bool" -> ValueStyle.WORDS;
      case "bits", "binary", "01" -> ValueStyle.BITS;
      default -> throw new IllegalArgumentException("Invalid value style: " + raw);
    };
  }
}
