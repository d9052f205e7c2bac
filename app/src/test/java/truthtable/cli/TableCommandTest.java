package truthtable.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import truthtable.core.ValueStyle;

final class TableCommandTest {
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final TableCommand command =
      new TableCommand(new PrintStream(buffer, true, StandardCharsets.UTF_8));

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  void printsLabelledTableForExpression() {
    int exit = command.execute(new String[] {"--expression", "a && b"});

    assertEquals(TableCommand.EXIT_OK, exit);
    String expected =
        String.join(
            "\n",
            "Expression: a && b",
            "    in <expression> line: 1",
            "",
            "    a        b      a && b  ",
            "  -----    -----    ------  ",
            "  false    false    false   ",
            "  false    true     false   ",
            "  true     false    false   ",
            "  true     true      true   ",
            "");
    assertEquals(expected + System.lineSeparator(), output());
  }

  @Test
  void bitsStyleAndPadding() {
    int exit =
        command.execute(new String[] {"--expression=a || b", "--values=bits", "--padding=0"});

    assertEquals(TableCommand.EXIT_OK, exit);
    assertTrue(output().contains("aba || b\n--------\n00  0   \n"), output());
  }

  @Test
  void jsonReportListsRows() {
    int exit = command.execute(new String[] {"--format", "json", "--expression", "x && !y"});

    assertEquals(TableCommand.EXIT_OK, exit);
    JsonObject root = JsonParser.parseString(output()).getAsJsonObject();
    JsonObject source = root.getAsJsonArray("sources").get(0).getAsJsonObject();
    JsonObject expression = source.getAsJsonArray("expressions").get(0).getAsJsonObject();
    assertEquals("x && !y", expression.get("expression").getAsString());
    assertEquals(2, expression.getAsJsonArray("operands").size());
    JsonArray rows = expression.getAsJsonArray("rows");
    assertEquals(4, rows.size());
    assertTrue(rows.get(2).getAsJsonObject().get("result").getAsBoolean());
  }

  @Test
  void analyzesFiles(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("C.java");
    Files.writeString(file, "class C {\n  boolean ok = p && q;\n}\n", StandardCharsets.UTF_8);

    int exit = command.execute(new String[] {file.toString()});

    assertEquals(TableCommand.EXIT_OK, exit);
    assertTrue(output().startsWith("Expression: p && q\n    in " + file + " line: 2\n"));
  }

  @Test
  void unreadableOrInvalidSourcesFail(@TempDir Path dir) throws IOException {
    Path broken = dir.resolve("Broken.java");
    Files.writeString(broken, "class {", StandardCharsets.UTF_8);

    assertEquals(TableCommand.EXIT_FAILURE, command.execute(new String[] {broken.toString()}));
    assertEquals(
        TableCommand.EXIT_FAILURE,
        command.execute(new String[] {dir.resolve("Missing.java").toString()}));
  }

  @Test
  void skippedExpressionsSetExitCode() {
    int exit = command.execute(new String[] {"--max-operands", "1", "--expression", "a && b"});
    assertEquals(TableCommand.EXIT_SKIPPED, exit);
  }

  @Test
  void failFastStopsAtFirstError() {
    int exit =
        command.execute(
            new String[] {"--fail-fast", "--max-operands", "1", "--expression", "a && b"});
    assertEquals(TableCommand.EXIT_FAILURE, exit);
  }

  @Test
  void failFastKeepsTablesOfEarlierFiles(@TempDir Path dir) throws IOException {
    Path first = dir.resolve("A.java");
    Path second = dir.resolve("B.java");
    Files.writeString(first, "class A {\n  boolean ok = p && q;\n}\n", StandardCharsets.UTF_8);
    Files.writeString(
        second, "class B {\n  boolean ok = a && b && c;\n}\n", StandardCharsets.UTF_8);

    int exit =
        command.execute(
            new String[] {
              "--fail-fast", "--max-operands", "2", first.toString(), second.toString()
            });

    assertEquals(TableCommand.EXIT_FAILURE, exit);
    assertTrue(
        output().startsWith("Expression: p && q\n    in " + first + " line: 2\n"), output());
    assertFalse(output().contains("a && b && c"), output());
  }

  @Test
  void usageErrors() {
    assertEquals(TableCommand.EXIT_USAGE, command.execute(new String[0]));
    assertEquals(TableCommand.EXIT_USAGE, command.execute(new String[] {"--bogus", "A.java"}));
    assertEquals(TableCommand.EXIT_USAGE, command.execute(new String[] {"--expression"}));
    assertEquals(
        TableCommand.EXIT_USAGE,
        command.execute(new String[] {"--max-operands", "99", "--expression", "a && b"}));
    assertEquals(
        TableCommand.EXIT_USAGE,
        command.execute(new String[] {"--language-level", "4", "--expression", "a && b"}));
    assertEquals(TableCommand.EXIT_OK, command.execute(new String[] {"--help"}));
  }

  @Test
  void parsesOptions() {
    CliOptions options =
        command.parseArgs(new String[] {"--values", "bits", "--padding=2", "A.java", "B.java"});

    assertEquals(List.of(Path.of("A.java"), Path.of("B.java")), options.files());
    assertEquals(ValueStyle.BITS, options.valueStyle());
    assertEquals(2, options.padding());
    assertEquals(OutputFormat.TEXT, options.format());
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseArgs(new String[] {"--expression", "a", "A.java"}));
  }
}
