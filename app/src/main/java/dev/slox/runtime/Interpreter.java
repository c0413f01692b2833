package dev.slox.runtime;

import dev.slox.errors.Diagnostic;
import dev.slox.errors.ErrorState;
import dev.slox.errors.SloxException;
import dev.slox.parsing.Expr;
import dev.slox.parsing.Stmt;
import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Interpreter implements Expr.Visitor<Value>, Stmt.Visitor<Void> {
  private static final Logger logger =
      LoggerFactory.getLogger(Interpreter.class);

  // bindings outlive a single call to `interpret` so a REPL session can
  // build on earlier lines
  private final Environment environment = new Environment();
  private final PrintStream out;

  public Interpreter() { this(System.out); }

  public Interpreter(PrintStream out) { this.out = out; }

  // Runs `statements` in order. The first runtime error stops the whole
  // program: nothing after the failing statement is executed.
  public void interpret(List<Stmt> statements) {
    for (Stmt statement : statements) {
      try {
        execute(statement);
      } catch (RuntimeError error) {
        logger.debug("runtime error on line {}", error.line);
        throw new SloxException(ErrorState.runtimeError(
            new Diagnostic(error.getMessage(), error.line)
        ));
      } catch (StackOverflowError error) {
        throw new SloxException(ErrorState.runtimeError(
            new Diagnostic("expression nested too deeply", lineOf(statement))
        ));
      }
    }
  }

  public Value evaluate(Expr expression) { return expression.accept(this); }

  public Environment environment() { return environment; }

  void execute(Stmt stmt) { stmt.accept(this); }

  @Override
  public Void visitVarStmt(Stmt.Var stmt) {
    Value value = evaluate(stmt.initializer);
    environment.define(stmt.name.name, value);
    return null;
  }

  @Override
  public Void visitExpressionStmt(Stmt.Expression stmt) {
    evaluate(stmt.expression);
    return null;
  }

  @Override
  public Void visitPrintStmt(Stmt.Print stmt) {
    Value value = evaluate(stmt.expression);
    out.println(value.stringify());
    out.flush();
    return null;
  }

  @Override
  public Value visitNumberLiteralExpr(Expr.NumberLiteral expr) {
    return Value.of(expr.value);
  }

  @Override
  public Value visitStringLiteralExpr(Expr.StringLiteral expr) {
    return Value.of(expr.value);
  }

  @Override
  public Value visitTrueExpr(Expr.True expr) {
    return Value.TRUE;
  }

  @Override
  public Value visitFalseExpr(Expr.False expr) {
    return Value.FALSE;
  }

  @Override
  public Value visitNilExpr(Expr.Nil expr) {
    return Value.NIL;
  }

  @Override
  public Value visitIdentifierExpr(Expr.Identifier expr) {
    return environment.get(expr.name, expr.line);
  }

  @Override
  public Value visitUnaryExpr(Expr.Unary expr) {
    Value operand = evaluate(expr.operand);
    switch (expr.operator) {
    case NEGATIVE:
      if (operand instanceof Value.Number)
        return Value.of(-((Value.Number)operand).value);
      throw new RuntimeError(expr.line, "- can only be applied to numbers");
    case INVERSE:
      if (operand instanceof Value.Bool)
        return Value.of(!((Value.Bool)operand).value);
      throw new RuntimeError(expr.line, "! can only be applied to booleans");
    }
    // unreachable
    throw new IllegalStateException("unknown operator " + expr.operator);
  }

  @Override
  public Value visitBinaryExpr(Expr.Binary expr) {
    Value left = evaluate(expr.left);
    Value right = evaluate(expr.right);

    switch (expr.operator) {
    case EQ:
      return Value.of(isEqual(left, right));
    case NEQ:
      return Value.of(!isEqual(left, right));
    case GT:
      checkNumberOperands(expr, left, right, "can only compare numbers");
      return Value.of(number(left) > number(right));
    case GT_EQ:
      checkNumberOperands(expr, left, right, "can only compare numbers");
      return Value.of(number(left) >= number(right));
    case LT:
      checkNumberOperands(expr, left, right, "can only compare numbers");
      return Value.of(number(left) < number(right));
    case LT_EQ:
      checkNumberOperands(expr, left, right, "can only compare numbers");
      return Value.of(number(left) <= number(right));
    case ADD:
      if (left instanceof Value.Number && right instanceof Value.Number) {
        return Value.of(number(left) + number(right));
      }
      if (left instanceof Value.Text && right instanceof Value.Text) {
        return ((Value.Text)left).concatenate((Value.Text)right);
      }
      throw new RuntimeError(expr.line, "can only add numbers or strings");
    case SUB:
      checkNumberOperands(expr, left, right, "can only subtract numbers");
      return Value.of(number(left) - number(right));
    case DIV:
      // division by zero yields inf or NaN, as floats do
      checkNumberOperands(expr, left, right, "can only divide numbers");
      return Value.of(number(left) / number(right));
    case MULT:
      checkNumberOperands(expr, left, right, "can only multiply numbers");
      return Value.of(number(left) * number(right));
    }
    // unreachable
    throw new IllegalStateException("unknown operator " + expr.operator);
  }

  private void
  checkNumberOperands(Expr expr, Value left, Value right, String message) {
    if (left instanceof Value.Number && right instanceof Value.Number)
      return;
    throw new RuntimeError(expr.line, message);
  }

  private static int lineOf(Stmt statement) {
    if (statement instanceof Stmt.Var)
      return ((Stmt.Var)statement).name.line;
    if (statement instanceof Stmt.Print)
      return ((Stmt.Print)statement).expression.line;
    return ((Stmt.Expression)statement).expression.line;
  }

  private static float number(Value value) { return ((Value.Number)value).value; }

  // Numbers follow IEEE rules (`NaN` is not equal to itself); everything else
  // is structural. Values of different kinds are simply unequal.
  static boolean isEqual(Value a, Value b) {
    if (a instanceof Value.Number && b instanceof Value.Number)
      return number(a) == number(b);
    return a.equals(b);
  }
}
