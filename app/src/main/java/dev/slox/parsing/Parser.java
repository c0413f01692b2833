package dev.slox.parsing;

import static dev.slox.parsing.TokenType.*;

import dev.slox.errors.ErrorState;
import dev.slox.errors.SloxException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Parser {
  private static class ParseError extends RuntimeException {}

  private static final Logger logger = LoggerFactory.getLogger(Parser.class);

  private static final Map<TokenType, Expr.BinaryOperator> binaryOperators;
  static {
    binaryOperators = new EnumMap<>(TokenType.class);
    binaryOperators.put(EQUAL_EQUAL, Expr.BinaryOperator.EQ);
    binaryOperators.put(BANG_EQUAL, Expr.BinaryOperator.NEQ);
    binaryOperators.put(GREATER, Expr.BinaryOperator.GT);
    binaryOperators.put(GREATER_EQUAL, Expr.BinaryOperator.GT_EQ);
    binaryOperators.put(LESS, Expr.BinaryOperator.LT);
    binaryOperators.put(LESS_EQUAL, Expr.BinaryOperator.LT_EQ);
    binaryOperators.put(PLUS, Expr.BinaryOperator.ADD);
    binaryOperators.put(MINUS, Expr.BinaryOperator.SUB);
    binaryOperators.put(SLASH, Expr.BinaryOperator.DIV);
    binaryOperators.put(STAR, Expr.BinaryOperator.MULT);
  }

  private final List<Token> tokens;
  private final ErrorState errors = ErrorState.parseErrors();
  // indexes the token currently being looked at; it never moves backwards
  private int current = 0;

  // pre-condition: `tokens` ends with an EOF token
  public Parser(List<Token> tokens) { this.tokens = tokens; }

  // program -> declaration* EOF
  //
  // Returns the parsed statements only when every declaration parsed
  // cleanly; otherwise throws with all the errors found along the way.
  public List<Stmt> parse() {
    List<Stmt> statements = new ArrayList<>();
    while (!isAtEnd()) {
      Stmt statement = declaration();
      if (statement != null) {
        statements.add(statement);
      }
    }
    logger.debug(
        "parsed {} statements with {} errors", statements.size(),
        errors.diagnostics().size()
    );

    if (!errors.isEmpty())
      throw new SloxException(errors);
    return statements;
  }

  // expression -> equality
  private Expr expression() { return equality(); }

  // declaration -> varDeclaration
  //              | statement
  private Stmt declaration() {
    try {
      if (match(VAR))
        return varDeclaration();
      return statement();
    } catch (ParseError error) {
      synchronize();
      return null;
    } catch (StackOverflowError error) {
      errors.add("expression nested too deeply", peek().line);
      synchronize();
      return null;
    }
  }

  // varDeclaration -> "var" IDENTIFIER "=" expression ";"
  private Stmt varDeclaration() {
    Expr.Identifier name = identifier();
    consume(EQUAL, "expected '=' after variable name");
    Expr initializer = expression();
    consume(SEMICOLON, "expected ';' after variable declaration");
    return new Stmt.Var(name, initializer);
  }

  // Variable names are not expressions, so they don't go through `primary`.
  private Expr.Identifier identifier() {
    Token name = consume(IDENTIFIER, "expected variable name");
    return new Expr.Identifier((String)name.value, name.line);
  }

  // statement -> printStatement
  //            | expressionStatement
  private Stmt statement() {
    if (match(PRINT))
      return printStatement();

    return expressionStatement();
  }

  // printStatement -> "print" expression ";"
  private Stmt printStatement() {
    Expr value = expression();
    consume(SEMICOLON, "expected ';' after value");
    return new Stmt.Print(value);
  }

  // expressionStatement -> expression ";"
  private Stmt expressionStatement() {
    Expr value = expression();
    consume(SEMICOLON, "expected ';' after expression");
    return new Stmt.Expression(value);
  }

  // equality -> equality ( "!=" | "==" ) comparison
  //           | comparison
  private Expr equality() {
    return binary(() -> comparison(), BANG_EQUAL, EQUAL_EQUAL);
  }

  // comparison -> comparison ( ">" | ">=" | "<" | "<=" ) term
  //             | term
  private Expr comparison() {
    return binary(() -> term(), GREATER, GREATER_EQUAL, LESS, LESS_EQUAL);
  }

  // term -> term ( "-" | "+" ) factor
  //       | factor
  private Expr term() { return binary(() -> factor(), MINUS, PLUS); }

  // factor -> factor ( "/" | "*" ) unary
  //         | unary
  private Expr factor() { return binary(() -> unary(), SLASH, STAR); }

  // unary -> ( "!" | "-" ) unary
  //        | primary
  private Expr unary() {
    if (match(BANG, MINUS)) {
      Token operator = previous();
      Expr operand = unary();
      Expr.UnaryOperator op = operator.type == BANG
                                  ? Expr.UnaryOperator.INVERSE
                                  : Expr.UnaryOperator.NEGATIVE;
      return new Expr.Unary(op, operand, operator.line);
    }
    return primary();
  }

  // primary -> IDENTIFIER | NUMBER | STRING | "true" | "false" | "nil"
  //          | "(" expression ")"
  private Expr primary() {
    if (match(FALSE)) {
      return new Expr.False(previous().line);
    }
    if (match(TRUE)) {
      return new Expr.True(previous().line);
    }
    if (match(NIL)) {
      return new Expr.Nil(previous().line);
    }
    if (match(NUMBER)) {
      return new Expr.NumberLiteral((Float)previous().value, previous().line);
    }
    if (match(STRING)) {
      return new Expr.StringLiteral((String)previous().value, previous().line);
    }
    if (match(IDENTIFIER)) {
      return new Expr.Identifier((String)previous().value, previous().line);
    }
    if (match(LEFT_PAREN)) {
      Expr expr = expression();
      consume(RIGHT_PAREN, "expected ')' after expression");
      // parentheses only shape the tree; they don't get a node of their own
      return expr;
    }
    throw error(peek(), "expected expression");
  }

  // binary -> binary ONE_OF<tokenTypes> subunit
  //         | subunit
  //
  // The loop makes the operator left-associative: `1 - 2 - 3` is
  // `(1 - 2) - 3`.
  private Expr binary(Supplier<Expr> subunitParser, TokenType... tokenTypes) {
    Expr expr = subunitParser.get();
    while (match(tokenTypes)) {
      Expr.BinaryOperator operator = binaryOperators.get(previous().type);
      Expr right = subunitParser.get();
      expr = new Expr.Binary(operator, expr, right);
    }
    return expr;
  }

  // returns true if it was able to consume the next token
  // consumes the next token if it matches one of `expectedTypes`
  private boolean match(TokenType... expectedTypes) {
    for (TokenType type : expectedTypes) {
      if (check(type)) {
        advance();
        return true;
      }
    }
    return false;
  }

  private Token consume(TokenType type, String message) {
    if (check(type))
      return advance();
    throw error(peek(), message);
  }

  private boolean check(TokenType expectedType) {
    if (isAtEnd())
      return false;
    return peek().type == expectedType;
  }

  private Token advance() {
    if (!isAtEnd())
      current++;
    return previous();
  }

  private boolean isAtEnd() { return peek().type == EOF; }

  private Token peek() { return tokens.get(current); }

  private Token previous() { return tokens.get(current - 1); }

  private ParseError error(Token token, String message) {
    String found = token.type == EOF
                       ? "end of input"
                       : String.format("'%s'", token.lexeme);
    errors.add(String.format("%s, found %s", message, found), token.line);
    return new ParseError();
  }

  // skips as many tokens as necessary to get out of the current
  // state of confusion (i.e., we've failed to parse a rule but
  // we want to tolerate errors, so we try to move past to the
  // begining of the next statement.)
  //
  // post-condition: every token up to and including the next ';' has been
  // discarded, or the current token is EOF
  private void synchronize() {
    while (!isAtEnd()) {
      if (advance().type == SEMICOLON)
        return;
    }
  }
}
