package dev.slox.parsing;

// A program is a list of these, run top to bottom. `Var` is the only
// declaration; `Expression` and `Print` are the statements proper.
public abstract class Stmt {
  public interface Visitor<R> {
    public R visitVarStmt(Var stmt);
    public R visitExpressionStmt(Expression stmt);
    public R visitPrintStmt(Print stmt);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public static class Var extends Stmt {
    public Var(Expr.Identifier name, Expr initializer) {
      this.name = name;
      this.initializer = initializer;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVarStmt(this);
    }

    public final Expr.Identifier name;
    public final Expr initializer;
  }

  public static class Expression extends Stmt {
    public Expression(Expr expression) { this.expression = expression; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitExpressionStmt(this);
    }

    public final Expr expression;
  }

  public static class Print extends Stmt {
    public Print(Expr expression) { this.expression = expression; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPrintStmt(this);
    }

    public final Expr expression;
  }
}
