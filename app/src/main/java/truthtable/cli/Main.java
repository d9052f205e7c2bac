package truthtable.cli;

/**
 * Command line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main Foo.java Bar.java} prints a truth table for every boolean expression found
 *   <li>{@code Main --expression "a && (b || c)"} prints the table of one expression
 *   <li>{@code Main --format json Foo.java} prints a JSON report instead
 * </ul>
 */
public final class Main {

  private Main() {}

  public static void main(String[] args) {
    int exitCode = new TableCommand(System.out).execute(args == null ? new String[0] : args);
    if (exitCode != TableCommand.EXIT_OK) {
      System.exit(exitCode);
    }
  }
}
