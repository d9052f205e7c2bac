package truthtable.frontend;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import truthtable.tree.SourceNode;

/** Parses Java source text into analyzable trees. */
public final class JavaSourceParser {
  private static final Logger LOG = LoggerFactory.getLogger(JavaSourceParser.class);
  public static final int DEFAULT_LANGUAGE_LEVEL = 17;

  private final LanguageLevel languageLevel;

  public JavaSourceParser() {
    this(DEFAULT_LANGUAGE_LEVEL);
  }

  public JavaSourceParser(int languageLevel) {
    this.languageLevel = languageLevel(languageLevel);
  }

  /**
   * Parses a compilation unit.
   *
   * @param text Java source
   * @param identifier name reported for this source, usually its path
   * @throws SourceParseException if {@code text} is not valid Java
   */
  public ParsedSource parse(String text, String identifier) {
    ParseResult<? extends Node> result = newParser().parse(text);
    return convert(result, identifier);
  }

  public ParsedSource parse(Path path) throws IOException {
    String text = Files.readString(path, StandardCharsets.UTF_8);
    return parse(text, path.toString());
  }

  /** Parses a single expression such as {@code a && !b}. */
  public ParsedSource parseExpression(String text) {
    ParseResult<Expression> result = newParser().parseExpression(text);
    return convert(result, "<expression>");
  }

  private ParsedSource convert(ParseResult<? extends Node> result, String identifier) {
    if (!result.isSuccessful() || result.getResult().isEmpty()) {
      throw new SourceParseException(identifier, firstProblem(result.getProblems()));
    }
    JavaTreeConverter converter = new JavaTreeConverter();
    SourceNode root = converter.convert(result.getResult().get());
    LOG.debug("Converted {} ({} nodes)", identifier, converter.origins().size());
    return new ParsedSource(identifier, root, new JavaUnparser(converter.origins()));
  }

  private JavaParser newParser() {
    ParserConfiguration configuration =
        new ParserConfiguration().setLanguageLevel(languageLevel).setAttributeComments(false);
    return new JavaParser(configuration);
  }

  private static String firstProblem(List<Problem> problems) {
    if (problems.isEmpty()) {
      return "unparseable source";
    }
    return problems.get(0).getVerboseMessage();
  }

  private static LanguageLevel languageLevel(int level) {
    try {
      return LanguageLevel.valueOf("JAVA_" + level);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          String.format(Locale.ROOT, "Unsupported Java language level: %d", level), ex);
    }
  }
}
