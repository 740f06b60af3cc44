package stela.backend.sv;

import stela.backend.ExprOp;
import stela.backend.Statement;
import stela.backend.VarException;
import stela.backend.Variable;

/**
 * A SystemVerilog signal or expression, identified by its rendered text.
 * Width checks are strict: non-constant operands of arithmetic, equality and assignment must have equal widths.
 */
public class SVVariable implements Variable {
  private final String name;
  private final int width;
  private final boolean signed;
  /** Number of array elements, 0 for a plain vector. */
  private final int size;
  private final boolean assignable;
  /** Value of a constant, else null. */
  private final Long constantValue;

  SVVariable(String name, int width, boolean signed, int size, boolean assignable, Long constantValue) {
    if (width <= 0)
      throw new VarException("Width of " + name + " must be positive, got " + width);
    this.name = name;
    this.width = width;
    this.signed = signed;
    this.size = size;
    this.assignable = assignable;
    this.constantValue = constantValue;
  }

  static SVVariable constant(long value, int width, boolean signed) {
    if (!fits(value, width, signed))
      throw new VarException(String.format("Constant %d does not fit into %d bit %s", value, width, signed ? "signed" : "unsigned"));
    String text = width + (signed ? "'sd" : "'d") + Math.abs(value);
    if (value < 0)
      text = "-" + text;
    return new SVVariable(text, width, signed, 0, false, value);
  }

  static boolean fits(long value, int width, boolean signed) {
    if (width >= 63)
      return signed || value >= 0;
    if (signed)
      return value >= -(1L << (width - 1)) && value < (1L << (width - 1));
    return value >= 0 && value < (1L << width);
  }

  @Override
  public String getName() { return name; }
  @Override
  public int getWidth() { return width; }
  @Override
  public boolean isSigned() { return signed; }
  public int getSize() { return size; }
  public boolean isConstant() { return constantValue != null; }

  private static SVVariable cast(Variable var) {
    if (!(var instanceof SVVariable))
      throw new IllegalArgumentException("Foreign variable " + var.getName() + " in SystemVerilog expression");
    return (SVVariable)var;
  }

  private void checkSameWidth(SVVariable other, String what) {
    if (size != other.size)
      throw new VarException(String.format("%s: array size mismatch between %s (%d) and %s (%d)", what, name, size, other.name, other.size));
    if (isConstant() || other.isConstant())
      return;
    if (width != other.width)
      throw new VarException(String.format("%s: width mismatch between %s (%d) and %s (%d)", what, name, width, other.name, other.width));
  }

  @Override
  public Statement assign(Variable value) {
    SVVariable source = cast(value);
    if (!assignable)
      throw new VarException("Cannot assign to " + name);
    checkSameWidth(source, "Assignment");
    if (source.isConstant() && !fits(source.constantValue, width, signed))
      throw new VarException(String.format("Constant %s does not fit into %s (%d bit)", source.name, name, width));
    return new SVStatement.Assign(this, source);
  }

  private SVVariable bit(String text) { return new SVVariable(text, 1, false, 0, false, null); }

  @Override
  public Variable eq(Variable other) {
    SVVariable rhs = cast(other);
    checkSameWidth(rhs, "Equality");
    return bit("(" + name + " == " + rhs.name + ")");
  }

  @Override
  public Variable and(Variable other) {
    return bit("(" + name + " && " + cast(other).name + ")");
  }

  @Override
  public Variable or(Variable other) {
    return bit("(" + name + " || " + cast(other).name + ")");
  }

  @Override
  public Variable rNot() {
    return bit("!" + name);
  }

  @Override
  public Variable binary(ExprOp op, Variable other) {
    SVVariable rhs = cast(other);
    if (op == ExprOp.Negate || op == ExprOp.Invert)
      throw new IllegalArgumentException(op + " is not a binary operator");
    String text = "(" + name + " " + op.symbol + " " + rhs.name + ")";
    if (op.relational) {
      checkSameWidth(rhs, "Comparison");
      return bit(text);
    }
    if (op != ExprOp.ShiftLeft && op != ExprOp.ShiftRight)
      checkSameWidth(rhs, "Operator " + op.symbol);
    return new SVVariable(text, width, signed, 0, false, null);
  }

  @Override
  public Variable unary(ExprOp op) {
    if (op != ExprOp.Negate && op != ExprOp.Invert)
      throw new IllegalArgumentException(op + " is not a unary operator");
    return new SVVariable(op.symbol + name, width, signed, 0, false, null);
  }

  @Override
  public Variable index(long index) {
    if (size > 0) {
      if (index < 0 || index >= size)
        throw new VarException(String.format("Index %d out of range for %s with %d elements", index, name, size));
      return new SVVariable(name + "[" + index + "]", width, signed, 0, assignable, null);
    }
    if (index < 0 || index >= width)
      throw new VarException(String.format("Bit %d out of range for %s (%d bit)", index, name, width));
    return new SVVariable(name + "[" + index + "]", 1, false, 0, assignable, null);
  }

  @Override
  public Variable slice(long upper, long lower) {
    if (size > 0)
      throw new VarException("Cannot slice array " + name);
    if (lower < 0 || upper < lower || upper >= width)
      throw new VarException(String.format("Slice [%d:%d] out of range for %s (%d bit)", upper, lower, name, width));
    return new SVVariable(name + "[" + upper + ":" + lower + "]", (int)(upper - lower + 1), false, 0, assignable, null);
  }

  @Override
  public String toString() {
    return name;
  }
}
