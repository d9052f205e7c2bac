package truthtable.core;

/** Configuration for building and printing truth tables. */
public record TruthTableOptions(
    int padding, int maxOperands, ValueStyle valueStyle, boolean failFast) {

  public static final int DEFAULT_PADDING = 4;
  public static final int DEFAULT_MAX_OPERANDS = 16;
  public static final int HARD_MAX_OPERANDS = 30;

  public TruthTableOptions {
    if (padding < 0) {
      throw new IllegalArgumentException("padding must be non-negative");
    }
    if (maxOperands < 0 || maxOperands > HARD_MAX_OPERANDS) {
      throw new IllegalArgumentException(
          "maxOperands must be between 0 and " + HARD_MAX_OPERANDS + ": " + maxOperands);
    }
  }

  public static TruthTableOptions defaults() {
    return new TruthTableOptions(DEFAULT_PADDING, DEFAULT_MAX_OPERANDS, ValueStyle.WORDS, false);
  }

  public static TruthTableOptions normalize(TruthTableOptions options) {
    if (options == null) {
      return defaults();
    }
    ValueStyle style = options.valueStyle() != null ? options.valueStyle() : ValueStyle.WORDS;
    return new TruthTableOptions(
        options.padding(), options.maxOperands(), style, options.failFast());
  }

  public TruthTableOptions withMaxOperands(int maxOperands) {
    return new TruthTableOptions(padding, maxOperands, valueStyle, failFast);
  }
}
