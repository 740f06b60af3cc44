package stela.eval;

import stela.frontend.SyntaxNode;

/** Outcome of classifying an expression at compile time. */
public interface EvalResult {
  /** The expression resolved to a host value. */
  record Literal(Value value) implements EvalResult {}
  /** The expression depends on a signal; value is a {@link Value.Signal} for plain references, else {@link Value.Symbolic}. */
  record SignalValued(Value value) implements EvalResult {}
  /** The expression is outside the compile-time grammar or refers to something undefined. */
  record Failure(String message, SyntaxNode node) implements EvalResult {}
}
