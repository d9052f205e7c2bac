package truthtable.core;

/** How truth values are printed in table cells. */
public enum ValueStyle {
  WORDS("false", "true"),
  BITS("0", "1");

  private final String falseText;
  private final String trueText;

  ValueStyle(String falseText, String trueText) {
    this.falseText = falseText;
    this.trueText = trueText;
  }

  public String format(boolean value) {
    return value ? trueText : falseText;
  }
}
