package stela.elab;

/** A value that must be known during elaboration could not be resolved to a suitable host value. */
public class CompileTimeEvalException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    UnresolvableIterable,
    NonLiteralLoopValue,
    NonBooleanPredicate,
    UndefinedSignal,
    UnresolvableExpression,
    /** a host value where a signal is required (assignment target, assertion, runtime predicate) */
    NonSignalValue
  }

  private final Kind kind;

  public CompileTimeEvalException(Kind kind, String message, String filename, int line) {
    super(kind + ": " + message, filename, line);
    this.kind = kind;
  }

  public Kind getKind() { return kind; }
}
