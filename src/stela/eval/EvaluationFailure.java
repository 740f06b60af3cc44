package stela.eval;

import stela.frontend.SyntaxNode;

/** Raised while evaluating an expression that is not a valid compile-time expression. */
public class EvaluationFailure extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient SyntaxNode node;

  public EvaluationFailure(String message, SyntaxNode node) {
    super(message);
    this.node = node;
  }

  /** The offending sub-expression. */
  public SyntaxNode getNode() { return node; }
}
