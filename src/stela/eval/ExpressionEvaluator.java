package stela.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stela.backend.ExprOp;
import stela.frontend.NodeKind;
import stela.frontend.SyntaxNode;

/**
 * Interpreter of the restricted compile-time expression grammar.
 *
 * Host operands are computed with host semantics (floor division, sequence indexing with negative indices, ...).
 * As soon as an operand is signal-valued, the operation is handed to a {@link SignalOps} instance:
 * {@link SignalOps#symbolic()} during classification, a {@link BackendSignalOps} when statements are executed.
 * Anything outside the grammar raises {@link EvaluationFailure}; there is no fallback to a general host evaluation.
 */
public class ExpressionEvaluator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Reduction methods that may be called on a signal. */
  public static final List<String> REDUCTION_METHODS = List.of("eq", "and_", "or_", "r_not");

  /**
   * Classifies an expression without calling the backend.
   * @param expr the expression
   * @param env the compile-time environment
   * @return Literal for host values, SignalValued if any operand is a signal, Failure otherwise
   */
  public EvalResult classify(SyntaxNode expr, Environment env) {
    try {
      Value value = evaluate(expr, env, SignalOps.symbolic());
      if (value.isSignal())
        return new EvalResult.SignalValued(value);
      return new EvalResult.Literal(value);
    } catch (EvaluationFailure failure) {
      logger.trace("Classification of {} failed: {}", expr, failure.getMessage());
      return new EvalResult.Failure(failure.getMessage(), failure.getNode() != null ? failure.getNode() : expr);
    }
  }

  /** Shorthand for {@code classify(expr, env) instanceof SignalValued}. */
  public boolean isSignalValued(SyntaxNode expr, Environment env) {
    return classify(expr, env) instanceof EvalResult.SignalValued;
  }

  /**
   * Evaluates an expression.
   * @throws EvaluationFailure if expr is outside the compile-time grammar
   */
  public Value evaluate(SyntaxNode expr, Environment env, SignalOps ops) {
    switch (expr.getKind()) {
    case INT:
      return new Value.Int((Long)expr.getLiteral());
    case STR:
      return new Value.Str((String)expr.getLiteral());
    case BOOL:
      return Value.Bool.of((Boolean)expr.getLiteral());
    case NAME:
      return env.lookup(expr.getToken()).orElseThrow(() -> new EvaluationFailure("name '" + expr.getToken() + "' is not defined", expr));
    case ATTRIBUTE:
      return attribute(expr, evaluate(expr.child(0), env, ops));
    case SUBSCRIPT:
      return subscript(expr, evaluate(expr.child(0), env, ops), evaluate(expr.child(1), env, ops), ops);
    case SLICE: {
      Value base = evaluate(expr.child(0), env, ops);
      if (!base.isSignal())
        throw new EvaluationFailure("Bit slices are only supported on signals, got " + base.describe(), expr);
      long upper = asLong(evaluate(expr.child(1), env, ops), expr);
      long lower = asLong(evaluate(expr.child(2), env, ops), expr);
      return signalOp(expr, () -> ops.slice(base, upper, lower));
    }
    case TUPLE:
    case LIST: {
      List<Value> elements = new ArrayList<>();
      for (SyntaxNode element : expr.getChildren())
        elements.add(evaluate(element, env, ops));
      return new Value.Seq(elements);
    }
    case BIN_OP:
      return binary(expr, evaluate(expr.child(0), env, ops), evaluate(expr.child(1), env, ops), ops);
    case UNARY_OP:
      return unary(expr, evaluate(expr.child(0), env, ops), ops);
    case BOOL_OP:
      return boolOp(expr, env, ops);
    case COMPARE:
      return compare(expr, evaluate(expr.child(0), env, ops), evaluate(expr.child(1), env, ops), ops);
    case CALL:
      return call(expr, env, ops);
    case REDUCE:
      return reduce(expr, expr.getToken(), expr.getChildren(), env, ops);
    default:
      throw new EvaluationFailure(expr.getKind().getSerialName() + " is not a compile-time expression", expr);
    }
  }

  private static Value signalOp(SyntaxNode expr, Supplier<Value> op) {
    try {
      return op.get();
    } catch (EvaluationFailure failure) {
      if (failure.getNode() != null)
        throw failure;
      throw new EvaluationFailure(failure.getMessage(), expr);
    }
  }

  private static Value attribute(SyntaxNode expr, Value base) {
    if (base instanceof Value.Namespace) {
      Value member = ((Value.Namespace)base).members().get(expr.getToken());
      if (member == null)
        throw new EvaluationFailure("'" + base + "' has no attribute '" + expr.getToken() + "'", expr);
      return member;
    }
    throw new EvaluationFailure("Attribute '" + expr.getToken() + "' of " + base.describe() + " is not supported", expr);
  }

  private static Value subscript(SyntaxNode expr, Value base, Value index, SignalOps ops) {
    if (index.isSignal())
      throw new EvaluationFailure("Index must be known at compile time, got " + index.describe(), expr);
    long i = asLong(index, expr);
    if (base.isSignal())
      return signalOp(expr, () -> ops.index(base, i));
    if (base instanceof Value.Seq) {
      List<Value> elements = ((Value.Seq)base).elements();
      return elements.get(hostIndex(expr, i, elements.size()));
    }
    if (base instanceof Value.Str) {
      String str = ((Value.Str)base).value();
      int at = hostIndex(expr, i, str.length());
      return new Value.Str(str.substring(at, at + 1));
    }
    throw new EvaluationFailure(base.describe() + " is not subscriptable", expr);
  }

  private static int hostIndex(SyntaxNode expr, long i, int size) {
    long at = i < 0 ? i + size : i;
    if (at < 0 || at >= size)
      throw new EvaluationFailure("Index " + i + " out of range for " + size + " elements", expr);
    return (int)at;
  }

  /** Integer view of an integer or boolean. */
  static long asLong(Value value, SyntaxNode expr) {
    if (value instanceof Value.Int)
      return ((Value.Int)value).value();
    if (value instanceof Value.Bool)
      return ((Value.Bool)value).value() ? 1 : 0;
    throw new EvaluationFailure("Expected an integer, got " + value.describe(), expr);
  }

  private static boolean isNumeric(Value value) { return value instanceof Value.Int || value instanceof Value.Bool; }

  private static void checkSignalOperand(SyntaxNode expr, Value operand) {
    if (!operand.isSignal() && !isNumeric(operand))
      throw new EvaluationFailure("Cannot combine a signal with " + operand.describe(), expr);
  }

  private static Value binary(SyntaxNode expr, Value lhs, Value rhs, SignalOps ops) {
    String token = expr.getToken();
    if (token.equals("/"))
      throw new EvaluationFailure("True division is not supported, use //", expr);
    if (lhs.isSignal() || rhs.isSignal()) {
      checkSignalOperand(expr, lhs);
      checkSignalOperand(expr, rhs);
      ExprOp op = ExprOp.fromBinaryToken(token).orElseThrow(() -> new EvaluationFailure("Unknown operator " + token, expr));
      if (op.relational)
        throw new EvaluationFailure("Unknown operator " + token, expr);
      return signalOp(expr, () -> ops.binary(op, lhs, rhs));
    }
    if (isNumeric(lhs) && isNumeric(rhs))
      return new Value.Int(arithmetic(expr, token, asLong(lhs, expr), asLong(rhs, expr)));
    if (token.equals("+") && lhs instanceof Value.Str && rhs instanceof Value.Str)
      return new Value.Str(((Value.Str)lhs).value() + ((Value.Str)rhs).value());
    if (token.equals("+") && lhs instanceof Value.Seq && rhs instanceof Value.Seq) {
      List<Value> elements = new ArrayList<>(((Value.Seq)lhs).elements());
      elements.addAll(((Value.Seq)rhs).elements());
      return new Value.Seq(elements);
    }
    if (token.equals("*") && (isNumeric(lhs) || isNumeric(rhs)))
      return repeat(expr, isNumeric(lhs) ? rhs : lhs, asLong(isNumeric(lhs) ? lhs : rhs, expr));
    throw new EvaluationFailure("Unsupported operand types for " + token + ": " + lhs.describe() + " and " + rhs.describe(), expr);
  }

  private static Value repeat(SyntaxNode expr, Value base, long times) {
    if (!(base instanceof Value.Str) && !(base instanceof Value.Seq))
      throw new EvaluationFailure("Cannot repeat " + base.describe(), expr);
    long count = Math.max(0, times);
    long length = base instanceof Value.Str ? ((Value.Str)base).value().length() : ((Value.Seq)base).elements().size();
    if (length == 0)
      count = 0;
    else if (count > Builtins.MAX_RANGE_LENGTH / length)
      throw new EvaluationFailure("Repetition longer than " + Builtins.MAX_RANGE_LENGTH + " elements", expr);
    if (base instanceof Value.Str)
      return new Value.Str(((Value.Str)base).value().repeat((int)count));
    List<Value> elements = new ArrayList<>();
    for (long i = 0; i < count; ++i)
      elements.addAll(((Value.Seq)base).elements());
    return new Value.Seq(elements);
  }

  private static long arithmetic(SyntaxNode expr, String token, long a, long b) {
    try {
      switch (token) {
      case "+":
        return Math.addExact(a, b);
      case "-":
        return Math.subtractExact(a, b);
      case "*":
        return Math.multiplyExact(a, b);
      case "//":
        if (b == 0)
          throw new EvaluationFailure("Integer division by zero", expr);
        return Math.floorDiv(a, b);
      case "%":
        if (b == 0)
          throw new EvaluationFailure("Integer modulo by zero", expr);
        return Math.floorMod(a, b);
      case "**": {
        if (b < 0)
          throw new EvaluationFailure("Negative exponent " + b, expr);
        long result = 1;
        for (long i = 0; i < b; ++i)
          result = Math.multiplyExact(result, a);
        return result;
      }
      case "<<":
        if (b < 0 || b >= 63)
          throw new EvaluationFailure("Shift count " + b + " out of range", expr);
        if (Long.numberOfLeadingZeros(Math.abs(a)) <= b)
          throw new ArithmeticException("overflow");
        return a << b;
      case ">>":
        if (b < 0)
          throw new EvaluationFailure("Negative shift count " + b, expr);
        return a >> Math.min(b, 63);
      case "&":
        return a & b;
      case "|":
        return a | b;
      case "^":
        return a ^ b;
      default:
        throw new EvaluationFailure("Unknown operator " + token, expr);
      }
    } catch (ArithmeticException e) {
      throw new EvaluationFailure("Integer overflow in " + a + " " + token + " " + b, expr);
    }
  }

  private static Value unary(SyntaxNode expr, Value operand, SignalOps ops) {
    String token = expr.getToken();
    if (token.equals("not")) {
      if (operand.isSignal())
        return signalOp(expr, () -> ops.not(operand));
      return Value.Bool.of(!truthy(operand, expr));
    }
    if (!operand.isSignal() && !isNumeric(operand))
      throw new EvaluationFailure("Bad operand for unary " + token + ": " + operand.describe(), expr);
    switch (token) {
    case "+":
      return operand.isSignal() ? operand : new Value.Int(asLong(operand, expr));
    case "-":
      if (operand.isSignal())
        return signalOp(expr, () -> ops.unary(ExprOp.Negate, operand));
      return new Value.Int(-asLong(operand, expr));
    case "~":
      if (operand.isSignal())
        return signalOp(expr, () -> ops.unary(ExprOp.Invert, operand));
      return new Value.Int(~asLong(operand, expr));
    default:
      throw new EvaluationFailure("Unknown unary operator " + token, expr);
    }
  }

  /** Host truth value. */
  static boolean truthy(Value value, SyntaxNode expr) {
    if (value instanceof Value.Bool)
      return ((Value.Bool)value).value();
    if (value instanceof Value.Int)
      return ((Value.Int)value).value() != 0;
    if (value instanceof Value.Str)
      return !((Value.Str)value).value().isEmpty();
    if (value instanceof Value.Seq)
      return !((Value.Seq)value).elements().isEmpty();
    if (value instanceof Value.Namespace)
      return true;
    throw new EvaluationFailure("The truth value of " + value.describe() + " is not known at compile time", expr);
  }

  /**
   * Operands are all evaluated. A chain of signals folds left-associatively; a host chain returns the deciding operand.
   */
  private Value boolOp(SyntaxNode expr, Environment env, SignalOps ops) {
    boolean isAnd = expr.getToken().equals("and");
    if (!isAnd && !expr.getToken().equals("or"))
      throw new EvaluationFailure("Invalid logical operator " + expr.getToken(), expr);
    List<Value> operands = new ArrayList<>();
    for (SyntaxNode operand : expr.getChildren())
      operands.add(evaluate(operand, env, ops));
    long signalCount = operands.stream().filter(Value::isSignal).count();
    if (signalCount > 0) {
      if (signalCount != operands.size())
        throw new EvaluationFailure("Cannot mix signals with host values in logical operators", expr);
      Value result = operands.get(0);
      for (int i = 1; i < operands.size(); ++i) {
        Value lhs = result;
        Value rhs = operands.get(i);
        result = signalOp(expr, () -> isAnd ? ops.and(lhs, rhs) : ops.or(lhs, rhs));
      }
      return result;
    }
    for (Value operand : operands.subList(0, operands.size() - 1)) {
      if (truthy(operand, expr) != isAnd)
        return operand;
    }
    return operands.get(operands.size() - 1);
  }

  private static Value compare(SyntaxNode expr, Value lhs, Value rhs, SignalOps ops) {
    String token = expr.getToken();
    if (lhs.isSignal() || rhs.isSignal()) {
      checkSignalOperand(expr, lhs);
      checkSignalOperand(expr, rhs);
      if (token.equals("=="))
        return signalOp(expr, () -> ops.eq(lhs, rhs));
      ExprOp op = ExprOp.fromBinaryToken(token).filter(candidate -> candidate.relational)
                      .orElseThrow(() -> new EvaluationFailure("Operator " + token + " is not supported on signals", expr));
      return signalOp(expr, () -> ops.binary(op, lhs, rhs));
    }
    switch (token) {
    case "==":
      return Value.Bool.of(hostEquals(lhs, rhs));
    case "!=":
      return Value.Bool.of(!hostEquals(lhs, rhs));
    case "in":
      return Value.Bool.of(contains(expr, rhs, lhs));
    case "not in":
      return Value.Bool.of(!contains(expr, rhs, lhs));
    default:
      break;
    }
    int order;
    if (isNumeric(lhs) && isNumeric(rhs))
      order = Long.compare(asLong(lhs, expr), asLong(rhs, expr));
    else if (lhs instanceof Value.Str && rhs instanceof Value.Str)
      order = ((Value.Str)lhs).value().compareTo(((Value.Str)rhs).value());
    else
      throw new EvaluationFailure("Cannot order " + lhs.describe() + " and " + rhs.describe(), expr);
    switch (token) {
    case "<":
      return Value.Bool.of(order < 0);
    case "<=":
      return Value.Bool.of(order <= 0);
    case ">":
      return Value.Bool.of(order > 0);
    case ">=":
      return Value.Bool.of(order >= 0);
    default:
      throw new EvaluationFailure("Unknown comparison " + token, expr);
    }
  }

  static boolean hostEquals(Value lhs, Value rhs) {
    if (isNumeric(lhs) && isNumeric(rhs))
      return asLong(lhs, null) == asLong(rhs, null);
    if (lhs instanceof Value.Seq && rhs instanceof Value.Seq) {
      List<Value> a = ((Value.Seq)lhs).elements();
      List<Value> b = ((Value.Seq)rhs).elements();
      if (a.size() != b.size())
        return false;
      for (int i = 0; i < a.size(); ++i) {
        if (!hostEquals(a.get(i), b.get(i)))
          return false;
      }
      return true;
    }
    if (lhs instanceof Value.Namespace || rhs instanceof Value.Namespace)
      return lhs == rhs;
    return lhs.equals(rhs);
  }

  private static boolean contains(SyntaxNode expr, Value container, Value element) {
    if (container instanceof Value.Seq)
      return ((Value.Seq)container).elements().stream().anyMatch(candidate -> hostEquals(candidate, element));
    if (container instanceof Value.Str && element instanceof Value.Str)
      return ((Value.Str)container).value().contains(((Value.Str)element).value());
    if (container instanceof Value.Namespace && element instanceof Value.Str)
      return ((Value.Namespace)container).members().containsKey(((Value.Str)element).value());
    throw new EvaluationFailure("Cannot test membership of " + element.describe() + " in " + container.describe(), expr);
  }

  private Value call(SyntaxNode expr, Environment env, SignalOps ops) {
    SyntaxNode function = expr.child(0);
    List<SyntaxNode> argNodes = expr.getChildren().subList(1, expr.size());
    if (function.is(NodeKind.ATTRIBUTE) && REDUCTION_METHODS.contains(function.getToken())) {
      Value receiver = evaluate(function.child(0), env, ops);
      if (receiver.isSignal()) {
        List<SyntaxNode> operands = new ArrayList<>();
        operands.add(function.child(0));
        operands.addAll(argNodes);
        return reduce(expr, function.getToken(), operands, env, ops);
      }
    }
    if (!function.is(NodeKind.NAME))
      throw new EvaluationFailure("Call to " + function + " is not supported in compile-time expressions", expr);
    List<Value> args = new ArrayList<>();
    for (SyntaxNode arg : argNodes)
      args.add(evaluate(arg, env, ops));
    return Builtins.lookup(function.getToken())
        .orElseThrow(() -> new EvaluationFailure("Call to " + function + " is not supported in compile-time expressions", expr))
        .apply(expr, args);
  }

  /**
   * Evaluates a reduction call.
   * @param operands receiver followed by the argument, if any
   */
  private Value reduce(SyntaxNode expr, String method, List<SyntaxNode> operands, Environment env, SignalOps ops) {
    Value receiver = evaluate(operands.get(0), env, ops);
    if (!receiver.isSignal())
      throw new EvaluationFailure("Reduction " + method + " needs a signal receiver, got " + receiver.describe(), expr);
    int expectedArgs = method.equals("r_not") ? 0 : 1;
    if (operands.size() - 1 != expectedArgs)
      throw new EvaluationFailure("Reduction " + method + " takes " + expectedArgs + " argument(s)", expr);
    if (expectedArgs == 0)
      return signalOp(expr, () -> ops.not(receiver));
    Value arg = evaluate(operands.get(1), env, ops);
    switch (method) {
    case "eq":
      checkSignalOperand(expr, arg);
      return signalOp(expr, () -> ops.eq(receiver, arg));
    case "and_":
    case "or_":
      if (!arg.isSignal())
        throw new EvaluationFailure("Cannot mix signals with host values in logical operators", expr);
      return signalOp(expr, () -> method.equals("and_") ? ops.and(receiver, arg) : ops.or(receiver, arg));
    default:
      throw new EvaluationFailure("Unknown reduction " + method, expr);
    }
  }

  /** Helper for callers that only need a host integer. */
  public Optional<Long> evaluateInt(SyntaxNode expr, Environment env) {
    EvalResult result = classify(expr, env);
    if (result instanceof EvalResult.Literal) {
      Value value = ((EvalResult.Literal)result).value();
      if (isNumeric(value))
        return Optional.of(asLong(value, expr));
    }
    return Optional.empty();
  }
}
