package dev.slox.parsing;

import static dev.slox.parsing.TokenType.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.slox.errors.Diagnostic;
import dev.slox.errors.ErrorState;
import dev.slox.errors.SloxException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ScannerTest {
  private static List<Token> scan(String source) {
    return Scanner.scan(source, /* startingLine: */ 0);
  }

  @Test
  void canTokenizeSingleCharacterTokens() {
    List<Token> tokens = scan("( { } )\n, . - + ; / *");

    assertThat(
        types(tokens),
        contains(
            LEFT_PAREN, LEFT_BRACE, RIGHT_BRACE, RIGHT_PAREN, COMMA, DOT, MINUS,
            PLUS, SEMICOLON, SLASH, STAR, EOF
        )
    );
    assertThat(lines(tokens), contains(0, 0, 0, 0, 1, 1, 1, 1, 1, 1, 1, 1));
  }

  @Test
  void canTokenizeOneOrTwoCharacterOperators() {
    List<Token> tokens = scan("! !=\n= ==\n> >=\n< <=");

    assertThat(
        types(tokens),
        contains(
            BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL, GREATER, GREATER_EQUAL, LESS,
            LESS_EQUAL, EOF
        )
    );
    assertThat(lines(tokens), contains(0, 0, 1, 1, 2, 2, 3, 3, 3));
  }

  @Test
  void operatorsNeedNoSurroundingSpaces() {
    assertThat(
        types(scan("a!=b==c<=d")),
        contains(
            IDENTIFIER, BANG_EQUAL, IDENTIFIER, EQUAL_EQUAL, IDENTIFIER,
            LESS_EQUAL, IDENTIFIER, EOF
        )
    );
  }

  @Test
  void canTokenizeLiterals() {
    List<Token> tokens = scan("id\n\"literal\"\n123\n4.5");

    assertEquals(new Token(IDENTIFIER, "id", "id", 0), tokens.get(0));
    assertEquals(
        new Token(STRING, "\"literal\"", "literal", 1), tokens.get(1)
    );
    assertEquals(new Token(NUMBER, "123", 123.0f, 2), tokens.get(2));
    assertEquals(new Token(NUMBER, "4.5", 4.5f, 3), tokens.get(3));
    assertEquals(new Token(EOF, "", 3), tokens.get(4));
  }

  @Test
  void canTokenizeKeywords() {
    List<Token> tokens = scan(
        "if else for while true false class this super and or print fun return var nil"
    );

    assertThat(
        types(tokens),
        contains(
            IF, ELSE, FOR, WHILE, TRUE, FALSE, CLASS, THIS, SUPER, AND, OR,
            PRINT, FUN, RETURN, VAR, NIL, EOF
        )
    );
  }

  @Test
  void keywordsAreOnlyMatchedAsWholeWords() {
    List<Token> tokens = scan("variable _print");

    assertThat(types(tokens), contains(IDENTIFIER, IDENTIFIER, EOF));
    assertEquals("variable", tokens.get(0).value);
    assertEquals("_print", tokens.get(1).value);
  }

  @Test
  void digitsEndAWord() {
    assertThat(types(scan("x1")), contains(IDENTIFIER, NUMBER, EOF));
  }

  @Test
  void shouldIgnoreSinglelineComments() {
    List<Token> tokens = scan("/\n// ignored");

    assertThat(types(tokens), contains(SLASH, EOF));
    assertThat(lines(tokens), contains(0, 1));
  }

  @Test
  void shouldIgnoreTrailingComments() {
    List<String> expectedLexemes = Arrays.asList("var", "line", "=", "10", ";", "");

    List<Token> tokens =
        scan("var line = 10; // this is a comment that will be ignored!");

    assertThat(lexemes(tokens), is(expectedLexemes));
  }

  @Test
  void stringsKeepTheLineTheyStartOn() {
    List<Token> tokens = scan("\"two\nlines\" x");

    assertEquals("two\nlines", tokens.get(0).value);
    assertEquals(0, tokens.get(0).line);
    assertEquals(1, tokens.get(1).line);
  }

  @Test
  void defaultStartingLineIsOne() {
    List<Token> tokens = new Scanner("a\nb").scanTokens();
    assertThat(lines(tokens), contains(1, 2, 2));
  }

  @Test
  void shouldReportUnterminatedStrings() {
    Scanner scanner = new Scanner("var s = \"never closed;");
    List<Token> tokens = scanner.scanTokens();

    assertThat(types(tokens), contains(VAR, IDENTIFIER, EQUAL, EOF));
    assertThat(
        scanner.errors().diagnostics(),
        contains(new Diagnostic("unterminated string", 1))
    );
  }

  @Test
  void shouldKeepScanningAfterAnInvalidNumber() {
    Scanner scanner = new Scanner("1.2.3 + 4");
    List<Token> tokens = scanner.scanTokens();

    assertThat(types(tokens), contains(PLUS, NUMBER, EOF));
    assertEquals(1, scanner.errors().diagnostics().size());
    assertThat(
        scanner.errors().diagnostics().get(0).message,
        startsWith("invalid number literal: 1.2.3")
    );
  }

  @Test
  void shouldKeepScanningAfterAnUnexpectedCharacter() {
    Scanner scanner = new Scanner("1 @ 2\n# 3");
    List<Token> tokens = scanner.scanTokens();

    assertThat(types(tokens), contains(NUMBER, NUMBER, NUMBER, EOF));
    assertThat(
        scanner.errors().diagnostics(),
        contains(
            new Diagnostic("unexpected character: @", 1),
            new Diagnostic("unexpected character: #", 2)
        )
    );
  }

  @Test
  void charactersOutsideTheBmpAreReportedOnce() {
    String emoji = "\uD83D\uDE00";
    Scanner scanner = new Scanner("1 " + emoji + " 2");
    List<Token> tokens = scanner.scanTokens();

    assertThat(types(tokens), contains(NUMBER, NUMBER, EOF));
    assertThat(
        scanner.errors().diagnostics(),
        contains(new Diagnostic("unexpected character: " + emoji, 1))
    );
  }

  @Test
  void scanThrowsWithEveryErrorFound() {
    SloxException error =
        assertThrows(SloxException.class, () -> Scanner.scan("@ 1.2.3 $", 1));

    assertEquals(ErrorState.Kind.SCAN, error.state.kind());
    assertEquals(3, error.state.diagnostics().size());
  }

  private static List<TokenType> types(List<Token> tokens) {
    return tokens.stream().map(token -> token.type).collect(Collectors.toList());
  }

  private static List<Integer> lines(List<Token> tokens) {
    return tokens.stream().map(token -> token.line).collect(Collectors.toList());
  }

  private static List<String> lexemes(List<Token> tokens) {
    return tokens.stream().map(token -> token.lexeme).collect(Collectors.toList());
  }
}
