package stela.backend;

/**
 * Backend handle of a hardware signal or signal-valued expression.
 * All operations may throw {@link VarException} on width or type mismatches.
 */
public interface Variable {
  /** Signal name, or the rendered expression for anonymous expressions. */
  String getName();
  int getWidth();
  boolean isSigned();

  /** Builds the statement {@code this = value}. */
  Statement assign(Variable value);

  /** Equality reduction, single bit. */
  Variable eq(Variable other);
  /** Logical and reduction, single bit. */
  Variable and(Variable other);
  /** Logical or reduction, single bit. */
  Variable or(Variable other);
  /** Logical negation reduction, single bit. */
  Variable rNot();

  Variable binary(ExprOp op, Variable other);
  /** @param op {@link ExprOp#Negate} or {@link ExprOp#Invert} */
  Variable unary(ExprOp op);

  /** Element of an array signal, or a single bit of a vector signal. */
  Variable index(long index);
  /** Bit range [upper:lower] of a vector signal. */
  Variable slice(long upper, long lower);
}
