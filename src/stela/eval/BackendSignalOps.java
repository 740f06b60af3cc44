package stela.eval;

import stela.backend.ExprOp;
import stela.backend.Generator;
import stela.backend.Variable;

/**
 * Signal operations delegated to a backend generator.
 * Integer and boolean operands are converted to constants with the width and signedness of the signal operand.
 */
public class BackendSignalOps implements SignalOps {
  private final Generator generator;

  public BackendSignalOps(Generator generator) { this.generator = generator; }

  /**
   * Converts a value to a backend variable.
   * @param value the value to convert
   * @param sizedLike signal whose width and signedness a constant gets, or null for a single bit
   */
  public Variable toVariable(Value value, Variable sizedLike) {
    if (value instanceof Value.Signal)
      return ((Value.Signal)value).variable();
    int width = sizedLike == null ? 1 : sizedLike.getWidth();
    boolean signed = sizedLike != null && sizedLike.isSigned();
    if (value instanceof Value.Int)
      return generator.constant(((Value.Int)value).value(), width, signed);
    if (value instanceof Value.Bool)
      return generator.constant(((Value.Bool)value).value() ? 1 : 0, width, signed);
    throw new EvaluationFailure("Cannot use " + value.describe() + " as a signal operand", null);
  }

  private Variable signalOf(Value value) {
    if (value instanceof Value.Signal)
      return ((Value.Signal)value).variable();
    throw new EvaluationFailure(value.describe() + " is not a signal", null);
  }

  /** Converts both operands; the signal operand decides the width of a constant operand. */
  private Variable[] pair(Value lhs, Value rhs) {
    Variable left = lhs instanceof Value.Signal ? signalOf(lhs) : null;
    Variable right = rhs instanceof Value.Signal ? signalOf(rhs) : null;
    if (left == null && right == null)
      throw new EvaluationFailure("Signal operation without signal operand", null);
    if (left == null)
      left = toVariable(lhs, right);
    if (right == null)
      right = toVariable(rhs, left);
    return new Variable[] {left, right};
  }

  @Override
  public Value eq(Value lhs, Value rhs) {
    Variable[] operands = pair(lhs, rhs);
    return new Value.Signal(operands[0].eq(operands[1]));
  }

  @Override
  public Value and(Value lhs, Value rhs) {
    return new Value.Signal(signalOf(lhs).and(signalOf(rhs)));
  }

  @Override
  public Value or(Value lhs, Value rhs) {
    return new Value.Signal(signalOf(lhs).or(signalOf(rhs)));
  }

  @Override
  public Value not(Value operand) {
    return new Value.Signal(signalOf(operand).rNot());
  }

  @Override
  public Value binary(ExprOp op, Value lhs, Value rhs) {
    Variable[] operands = pair(lhs, rhs);
    return new Value.Signal(operands[0].binary(op, operands[1]));
  }

  @Override
  public Value unary(ExprOp op, Value operand) {
    return new Value.Signal(signalOf(operand).unary(op));
  }

  @Override
  public Value index(Value signal, long index) {
    return new Value.Signal(signalOf(signal).index(index));
  }

  @Override
  public Value slice(Value signal, long upper, long lower) {
    return new Value.Signal(signalOf(signal).slice(upper, lower));
  }
}
