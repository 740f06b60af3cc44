package stela.eval;

import stela.backend.ExprOp;

final class SymbolicSignalOps implements SignalOps {
  static final SymbolicSignalOps INSTANCE = new SymbolicSignalOps();

  private SymbolicSignalOps() {}

  @Override
  public Value eq(Value lhs, Value rhs) { return Value.Symbolic.INSTANCE; }
  @Override
  public Value and(Value lhs, Value rhs) { return Value.Symbolic.INSTANCE; }
  @Override
  public Value or(Value lhs, Value rhs) { return Value.Symbolic.INSTANCE; }
  @Override
  public Value not(Value operand) { return Value.Symbolic.INSTANCE; }
  @Override
  public Value binary(ExprOp op, Value lhs, Value rhs) { return Value.Symbolic.INSTANCE; }
  @Override
  public Value unary(ExprOp op, Value operand) { return Value.Symbolic.INSTANCE; }
  @Override
  public Value index(Value signal, long index) { return Value.Symbolic.INSTANCE; }
  @Override
  public Value slice(Value signal, long upper, long lower) { return Value.Symbolic.INSTANCE; }
}
