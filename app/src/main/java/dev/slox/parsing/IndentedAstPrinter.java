package dev.slox.parsing;

import dev.slox.runtime.Value;

/**
 * Renders statements as an indented tree, one node per line, for the
 * `--debug-ast` option. A binary operator sits between its two operands,
 * which are indented one level deeper:
 *
 * <pre>
 *     1
 * +
 *         2
 *     *
 *         3
 * </pre>
 *
 * Literals are shown the way `print` would show them. Line numbers are not
 * part of the output.
 */
public class IndentedAstPrinter
    implements Expr.Visitor<Void>, Stmt.Visitor<Void> {
  private static final int INDENT_SIZE = 4;

  private final StringBuilder builder = new StringBuilder();
  private int indentation = 0;

  public String print(Stmt stmt) {
    builder.setLength(0);
    indentation = 0;
    stmt.accept(this);
    return builder.toString();
  }

  public String print(Expr expr) {
    builder.setLength(0);
    indentation = 0;
    expr.accept(this);
    return builder.toString();
  }

  @Override
  public Void visitVarStmt(Stmt.Var stmt) {
    line(String.format("var %s =", stmt.name.name));
    nested(stmt.initializer);
    return null;
  }

  @Override
  public Void visitExpressionStmt(Stmt.Expression stmt) {
    stmt.expression.accept(this);
    return null;
  }

  @Override
  public Void visitPrintStmt(Stmt.Print stmt) {
    line("print");
    nested(stmt.expression);
    return null;
  }

  @Override
  public Void visitBinaryExpr(Expr.Binary expr) {
    nested(expr.left);
    line(expr.operator.symbol);
    nested(expr.right);
    return null;
  }

  @Override
  public Void visitUnaryExpr(Expr.Unary expr) {
    line(expr.operator.symbol);
    nested(expr.operand);
    return null;
  }

  @Override
  public Void visitNumberLiteralExpr(Expr.NumberLiteral expr) {
    line(Value.of(expr.value).stringify());
    return null;
  }

  @Override
  public Void visitStringLiteralExpr(Expr.StringLiteral expr) {
    line(expr.value);
    return null;
  }

  @Override
  public Void visitIdentifierExpr(Expr.Identifier expr) {
    line(expr.name);
    return null;
  }

  @Override
  public Void visitTrueExpr(Expr.True expr) {
    line("true");
    return null;
  }

  @Override
  public Void visitFalseExpr(Expr.False expr) {
    line("false");
    return null;
  }

  @Override
  public Void visitNilExpr(Expr.Nil expr) {
    line("nil");
    return null;
  }

  private void nested(Expr expr) {
    indentation += INDENT_SIZE;
    expr.accept(this);
    indentation -= INDENT_SIZE;
  }

  private void line(String text) {
    builder.append(" ".repeat(indentation)).append(text).append("\n");
  }
}
