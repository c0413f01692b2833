package dev.slox.parsing;

// All AST classes (`Expr` and `Stmt` classes) are simple data structures
// with no real behavior so it's okay for them (and their fields) to be
// public. Every node remembers the line of its leftmost token.
public abstract class Expr {
  public interface Visitor<R> {
    public R visitBinaryExpr(Binary expr);
    public R visitUnaryExpr(Unary expr);
    public R visitNumberLiteralExpr(NumberLiteral expr);
    public R visitStringLiteralExpr(StringLiteral expr);
    public R visitIdentifierExpr(Identifier expr);
    public R visitTrueExpr(True expr);
    public R visitFalseExpr(False expr);
    public R visitNilExpr(Nil expr);
  }

  public final int line;

  Expr(int line) { this.line = line; }

  public abstract <R> R accept(Visitor<R> visitor);

  public enum BinaryOperator {
    EQ("=="),
    NEQ("!="),
    GT(">"),
    GT_EQ(">="),
    LT("<"),
    LT_EQ("<="),
    ADD("+"),
    SUB("-"),
    DIV("/"),
    MULT("*");

    public final String symbol;

    BinaryOperator(String symbol) { this.symbol = symbol; }
  }

  public enum UnaryOperator {
    NEGATIVE("-"),
    INVERSE("!");

    public final String symbol;

    UnaryOperator(String symbol) { this.symbol = symbol; }
  }

  public static class Binary extends Expr {
    public Binary(BinaryOperator operator, Expr left, Expr right) {
      super(left.line);
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinaryExpr(this);
    }

    public final BinaryOperator operator;
    public final Expr left;
    public final Expr right;
  }

  public static class Unary extends Expr {
    public Unary(UnaryOperator operator, Expr operand, int line) {
      super(line);
      this.operator = operator;
      this.operand = operand;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnaryExpr(this);
    }

    public final UnaryOperator operator;
    public final Expr operand;
  }

  public static class NumberLiteral extends Expr {
    public NumberLiteral(float value, int line) {
      super(line);
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumberLiteralExpr(this);
    }

    public final float value;
  }

  public static class StringLiteral extends Expr {
    public StringLiteral(String value, int line) {
      super(line);
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStringLiteralExpr(this);
    }

    public final String value;
  }

  public static class Identifier extends Expr {
    public Identifier(String name, int line) {
      super(line);
      this.name = name;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIdentifierExpr(this);
    }

    public final String name;
  }

  public static class True extends Expr {
    public True(int line) { super(line); }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTrueExpr(this);
    }
  }

  public static class False extends Expr {
    public False(int line) { super(line); }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFalseExpr(this);
    }
  }

  public static class Nil extends Expr {
    public Nil(int line) { super(line); }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNilExpr(this);
    }
  }
}
