package stela.backend;

import java.util.Optional;

/** Arithmetic, bitwise and relational operators a backend {@link Variable} implements. */
public enum ExprOp {
  Add("+", false),
  Subtract("-", false),
  Multiply("*", false),
  Divide("/", false),
  Mod("%", false),
  Power("**", false),
  ShiftLeft("<<", false),
  ShiftRight(">>", false),
  BitAnd("&", false),
  BitOr("|", false),
  BitXor("^", false),
  LessThan("<", true),
  LessEqual("<=", true),
  GreaterThan(">", true),
  GreaterEqual(">=", true),
  NotEqual("!=", true),
  Negate("-", false),
  Invert("~", false);

  public final String symbol;
  /** Relational operators produce a single-bit result. */
  public final boolean relational;

  private ExprOp(String symbol, boolean relational) {
    this.symbol = symbol;
    this.relational = relational;
  }

  /**
   * Maps a host binary operator token to the backend operator.
   * The host floor division {@code //} maps to {@link #Divide}.
   */
  public static Optional<ExprOp> fromBinaryToken(String token) {
    switch (token) {
    case "+":
      return Optional.of(Add);
    case "-":
      return Optional.of(Subtract);
    case "*":
      return Optional.of(Multiply);
    case "//":
      return Optional.of(Divide);
    case "%":
      return Optional.of(Mod);
    case "**":
      return Optional.of(Power);
    case "<<":
      return Optional.of(ShiftLeft);
    case ">>":
      return Optional.of(ShiftRight);
    case "&":
      return Optional.of(BitAnd);
    case "|":
      return Optional.of(BitOr);
    case "^":
      return Optional.of(BitXor);
    case "<":
      return Optional.of(LessThan);
    case "<=":
      return Optional.of(LessEqual);
    case ">":
      return Optional.of(GreaterThan);
    case ">=":
      return Optional.of(GreaterEqual);
    case "!=":
      return Optional.of(NotEqual);
    default:
      return Optional.empty();
    }
  }
}
