package dev.slox.parsing;

import java.util.Objects;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final TokenType type;
  public final String lexeme;
  // the name for IDENTIFIER, the contents for STRING, a `Float` for NUMBER
  public final Object value;
  public final int line;

  public Token(TokenType type, String lexeme, Object value, int line) {
    this.type = type;
    this.lexeme = lexeme;
    this.value = value;
    this.line = line;
  }

  public Token(TokenType type, String lexeme, int line) {
    this(type, lexeme, /* value: */ null, line);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Token))
      return false;
    Token that = (Token)other;
    return type == that.type && line == that.line &&
        lexeme.equals(that.lexeme) && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, lexeme, value, line);
  }

  @Override
  public String toString() {
    if (value == null)
      return String.format("%s '%s' @%d", type, lexeme, line);
    return String.format("%s '%s' %s @%d", type, lexeme, value, line);
  }
}
