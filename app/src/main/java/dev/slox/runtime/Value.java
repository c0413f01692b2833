package dev.slox.runtime;

import java.math.BigDecimal;

/**
 * A runtime value. The set of kinds is closed: numbers, strings, booleans
 * and nil. Values are immutable and compare structurally within a kind;
 * values of different kinds are never equal.
 */
public abstract class Value {
  public static final Nil NIL = new Nil();
  public static final Bool TRUE = new Bool(true);
  public static final Bool FALSE = new Bool(false);

  private Value() {}

  public static Number of(float value) { return new Number(value); }

  public static Text of(String value) { return new Text(value); }

  public static Bool of(boolean value) { return value ? TRUE : FALSE; }

  // How `print` shows the value.
  public abstract String stringify();

  @Override
  public String toString() {
    return stringify();
  }

  public static final class Number extends Value {
    public final float value;

    private Number(float value) { this.value = value; }

    // `2` rather than `2.0`, and never in exponent form
    @Override
    public String stringify() {
      if (Float.isNaN(value))
        return "NaN";
      if (Float.isInfinite(value))
        return value > 0 ? "inf" : "-inf";
      if (value == 0.0f)
        return (1.0f / value) < 0 ? "-0" : "0";
      return new BigDecimal(Float.toString(value))
          .stripTrailingZeros()
          .toPlainString();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Number &&
          Float.compare(value, ((Number)other).value) == 0;
    }

    @Override
    public int hashCode() {
      return Float.hashCode(value);
    }
  }

  public static final class Text extends Value {
    public final String value;

    private Text(String value) { this.value = value; }

    public Text concatenate(Text other) {
      return new Text(value + other.value);
    }

    @Override
    public String stringify() {
      return value;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Text && value.equals(((Text)other).value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }
  }

  public static final class Bool extends Value {
    public final boolean value;

    private Bool(boolean value) { this.value = value; }

    @Override
    public String stringify() {
      return Boolean.toString(value);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Bool && value == ((Bool)other).value;
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(value);
    }
  }

  public static final class Nil extends Value {
    private Nil() {}

    @Override
    public String stringify() {
      return "nil";
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Nil;
    }

    @Override
    public int hashCode() {
      return 0;
    }
  }
}
