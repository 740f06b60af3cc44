package stela.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import stela.frontend.SyntaxNode;

/** Host functions callable from compile-time expressions. */
final class Builtins {
  private Builtins() {}

  /** Upper bound on the length of a range, so a typo in a loop bound cannot exhaust memory. */
  static final long MAX_RANGE_LENGTH = 1L << 20;

  @FunctionalInterface
  interface Builtin {
    Value apply(SyntaxNode call, List<Value> args);
  }

  private static final Map<String, Builtin> BUILTINS =
      Map.of("range", Builtins::range, "len", Builtins::len, "min", (call, args) -> extreme(call, args, true), "max",
             (call, args) -> extreme(call, args, false), "abs", Builtins::abs);

  static Optional<Builtin> lookup(String name) { return Optional.ofNullable(BUILTINS.get(name)); }

  private static void checkHost(SyntaxNode call, List<Value> args) {
    for (Value arg : args) {
      if (arg.isSignal())
        throw new EvaluationFailure("Builtin " + call.child(0) + " cannot take signal arguments", call);
    }
  }

  private static Value range(SyntaxNode call, List<Value> args) {
    checkHost(call, args);
    long start = 0, stop, step = 1;
    switch (args.size()) {
    case 1:
      stop = ExpressionEvaluator.asLong(args.get(0), call);
      break;
    case 2:
      start = ExpressionEvaluator.asLong(args.get(0), call);
      stop = ExpressionEvaluator.asLong(args.get(1), call);
      break;
    case 3:
      start = ExpressionEvaluator.asLong(args.get(0), call);
      stop = ExpressionEvaluator.asLong(args.get(1), call);
      step = ExpressionEvaluator.asLong(args.get(2), call);
      break;
    default:
      throw new EvaluationFailure("range expects 1 to 3 arguments, got " + args.size(), call);
    }
    if (step == 0)
      throw new EvaluationFailure("range step must not be zero", call);
    List<Value> elements = new ArrayList<>();
    for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
      if (elements.size() >= MAX_RANGE_LENGTH)
        throw new EvaluationFailure("range longer than " + MAX_RANGE_LENGTH + " elements", call);
      elements.add(new Value.Int(i));
    }
    return new Value.Seq(elements);
  }

  private static Value len(SyntaxNode call, List<Value> args) {
    checkHost(call, args);
    if (args.size() != 1)
      throw new EvaluationFailure("len expects 1 argument, got " + args.size(), call);
    Value arg = args.get(0);
    if (arg instanceof Value.Seq)
      return new Value.Int(((Value.Seq)arg).elements().size());
    if (arg instanceof Value.Str)
      return new Value.Int(((Value.Str)arg).value().length());
    throw new EvaluationFailure("len of " + arg.describe() + " is not supported", call);
  }

  /** min / max over either the arguments or a single sequence argument. */
  private static Value extreme(SyntaxNode call, List<Value> args, boolean min) {
    checkHost(call, args);
    List<Value> candidates = args;
    if (args.size() == 1 && args.get(0) instanceof Value.Seq)
      candidates = ((Value.Seq)args.get(0)).elements();
    if (candidates.isEmpty())
      throw new EvaluationFailure((min ? "min" : "max") + " of an empty sequence", call);
    Value best = candidates.get(0);
    for (Value candidate : candidates.subList(1, candidates.size())) {
      long a = ExpressionEvaluator.asLong(candidate, call);
      long b = ExpressionEvaluator.asLong(best, call);
      if (min ? a < b : a > b)
        best = candidate;
    }
    ExpressionEvaluator.asLong(best, call);
    return best;
  }

  private static Value abs(SyntaxNode call, List<Value> args) {
    checkHost(call, args);
    if (args.size() != 1)
      throw new EvaluationFailure("abs expects 1 argument, got " + args.size(), call);
    return new Value.Int(Math.abs(ExpressionEvaluator.asLong(args.get(0), call)));
  }
}
