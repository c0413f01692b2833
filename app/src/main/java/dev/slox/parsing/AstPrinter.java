package dev.slox.parsing;

// Renders an expression as a one-line s-expression, e.g. `(* (- 1.0) 2.0)`.
public class AstPrinter implements Expr.Visitor<String> {
  public String print(Expr expr) { return expr.accept(this); }

  @Override
  public String visitBinaryExpr(Expr.Binary expr) {
    return parenthesize(expr.operator.symbol, expr.left, expr.right);
  }

  @Override
  public String visitUnaryExpr(Expr.Unary expr) {
    return parenthesize(expr.operator.symbol, expr.operand);
  }

  @Override
  public String visitNumberLiteralExpr(Expr.NumberLiteral expr) {
    return Float.toString(expr.value);
  }

  @Override
  public String visitStringLiteralExpr(Expr.StringLiteral expr) {
    return String.format("\"%s\"", expr.value);
  }

  @Override
  public String visitIdentifierExpr(Expr.Identifier expr) {
    return expr.name;
  }

  @Override
  public String visitTrueExpr(Expr.True expr) {
    return "true";
  }

  @Override
  public String visitFalseExpr(Expr.False expr) {
    return "false";
  }

  @Override
  public String visitNilExpr(Expr.Nil expr) {
    return "nil";
  }

  private String parenthesize(String name, Expr... exprs) {
    StringBuilder builder = new StringBuilder();

    builder.append("(").append(name);
    for (Expr expr : exprs) {
      builder.append(" ");
      builder.append(expr.accept(this));
    }
    builder.append(")");

    return builder.toString();
  }
}
