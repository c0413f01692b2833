package dev.slox.parsing;

import static dev.slox.parsing.TokenType.*;

import dev.slox.errors.ErrorState;
import dev.slox.errors.SloxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Scanner {
  private static final Logger logger = LoggerFactory.getLogger(Scanner.class);

  public static final Map<String, TokenType> keywords;
  static {
    Map<String, TokenType> table = new HashMap<>();
    table.put("and", AND);
    table.put("class", CLASS);
    table.put("else", ELSE);
    table.put("false", FALSE);
    table.put("for", FOR);
    table.put("fun", FUN);
    table.put("if", IF);
    table.put("nil", NIL);
    table.put("or", OR);
    table.put("print", PRINT);
    table.put("return", RETURN);
    table.put("super", SUPER);
    table.put("this", THIS);
    table.put("true", TRUE);
    table.put("var", VAR);
    table.put("while", WHILE);
    keywords = Collections.unmodifiableMap(table);
  }

  private final String sourceCode;
  private final List<Token> tokens = new ArrayList<>();
  private final ErrorState errors = ErrorState.scanErrors();
  // `start` & `current` are meant to index `sourceCode` and they
  // represent the bounds of the token currently under examination.
  private int start = 0;
  private int current = 0;
  private int line;

  // `line` starts at 1 (and not 0) to be user friendly
  public Scanner(String sourceCode) { this(sourceCode, /* startingLine: */ 1); }

  // the REPL scans one line at a time, so it tells us where we are
  public Scanner(String sourceCode, int startingLine) {
    this.sourceCode = sourceCode;
    this.line = startingLine;
  }

  // Scans `sourceCode` and returns its tokens, or throws if anything in it
  // couldn't be scanned.
  public static List<Token> scan(String sourceCode, int startingLine) {
    Scanner scanner = new Scanner(sourceCode, startingLine);
    List<Token> tokens = scanner.scanTokens();
    if (!scanner.errors().isEmpty())
      throw new SloxException(scanner.errors());
    return tokens;
  }

  // post-condition: the last token is always EOF, even if errors were found
  public List<Token> scanTokens() {
    while (!isAtEnd()) {
      start = current;
      scanToken();
    }
    tokens.add(new Token(EOF, /* lexeme: */ "", line));

    logger.debug(
        "scanned {} tokens with {} errors", tokens.size(),
        errors.diagnostics().size()
    );
    return tokens;
  }

  public ErrorState errors() { return errors; }

  private void scanToken() {
    char c = advance();
    switch (c) {
    case '(':
      addToken(LEFT_PAREN);
      break;
    case ')':
      addToken(RIGHT_PAREN);
      break;
    case '{':
      addToken(LEFT_BRACE);
      break;
    case '}':
      addToken(RIGHT_BRACE);
      break;
    case ',':
      addToken(COMMA);
      break;
    case '.':
      addToken(DOT);
      break;
    case '-':
      addToken(MINUS);
      break;
    case '+':
      addToken(PLUS);
      break;
    case ';':
      addToken(SEMICOLON);
      break;
    case '*':
      addToken(STAR);
      break;

    case '!':
      addToken(match('=') ? BANG_EQUAL : BANG);
      break;
    case '=':
      addToken(match('=') ? EQUAL_EQUAL : EQUAL);
      break;
    case '<':
      addToken(match('=') ? LESS_EQUAL : LESS);
      break;
    case '>':
      addToken(match('=') ? GREATER_EQUAL : GREATER);
      break;
    case '/':
      if (match('/')) {
        singleLineComment();
      } else {
        addToken(SLASH);
      }
      break;

    case ' ':
    case '\r':
    case '\t':
      // ignore whitespace;
      break;

    case '\n':
      line++;
      break;

    case '"':
      string();
      break;

    default:
      if (isDigit(c)) {
        number();
      } else if (isAlpha(c)) {
        word();
      } else {
        // characters outside the BMP arrive as a surrogate pair
        if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek()))
          advance();
        // only this character is lost; keep going to find more errors
        errors.add(
            String.format(
                "unexpected character: %s", sourceCode.substring(start, current)
            ),
            line
        );
      }
    }
  }

  // Scan (and ignore the contents of) a single-line comment.
  //
  // pre-condition: the opening delimiter (//) has just been consumed
  // post-condition: all characters up to a newline (or EOF) have been consumed.
  private void singleLineComment() {
    while (peek() != '\n' && !isAtEnd())
      advance();
  }

  // keywords and identifiers; digits can't be part of a word
  private void word() {
    while (isAlpha(peek()))
      advance();

    String text = sourceCode.substring(start, current);
    TokenType type = keywords.get(text);
    if (type == null) {
      addToken(IDENTIFIER, text);
    } else {
      addToken(type);
    }
  }

  // pre-condition: the opening " has just been consumed
  private void string() {
    int startLine = line;
    while (peek() != '"' && !isAtEnd()) {
      if (peek() == '\n')
        line++;
      advance();
    }
    if (isAtEnd()) {
      errors.add("unterminated string", startLine);
      return;
    }
    // the closing "
    advance();

    // trim the surrounding quotes
    String value = sourceCode.substring(start + 1, current - 1);
    tokens.add(new Token(
        STRING, sourceCode.substring(start, current), value, startLine
    ));
  }

  // Digits and dots are taken greedily, so `1.2.3` ends up as one (invalid)
  // numeral rather than as a number followed by a dot.
  private void number() {
    while (isDigit(peek()) || peek() == '.')
      advance();

    String text = sourceCode.substring(start, current);
    try {
      addToken(NUMBER, Float.parseFloat(text));
    } catch (NumberFormatException e) {
      errors.add(
          String.format("invalid number literal: %s, %s", text, e.getMessage()),
          line
      );
    }
  }

  private boolean match(char expected) {
    if (isAtEnd())
      return false;
    if (sourceCode.charAt(current) != expected)
      return false;
    current++;
    return true;
  }

  // returns the next character to be consumed
  private char peek() {
    if (isAtEnd())
      return '\0';
    return sourceCode.charAt(current);
  }

  private boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

  private boolean isAtEnd() { return current >= sourceCode.length(); }

  // returns the previously current character and advances one char forward
  private char advance() { return sourceCode.charAt(current++); }

  private void addToken(TokenType type) { addToken(type, /* value: */ null); }

  private void addToken(TokenType type, Object value) {
    String text = sourceCode.substring(start, current);
    tokens.add(new Token(type, text, value, line));
  }
}
