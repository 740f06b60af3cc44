package stela.eval;

import stela.backend.ExprOp;

/**
 * Signal operations used by {@link ExpressionEvaluator}. At least one operand of each call is signal-valued;
 * the other may be an integer or boolean that the implementation converts.
 */
public interface SignalOps {
  Value eq(Value lhs, Value rhs);
  Value and(Value lhs, Value rhs);
  Value or(Value lhs, Value rhs);
  Value not(Value operand);
  Value binary(ExprOp op, Value lhs, Value rhs);
  Value unary(ExprOp op, Value operand);
  Value index(Value signal, long index);
  Value slice(Value signal, long upper, long lower);

  /** Operations for classification: performs no backend call and yields {@link Value.Symbolic}. */
  static SignalOps symbolic() { return SymbolicSignalOps.INSTANCE; }
}
