package stela.backend;

/**
 * Semantic failure raised by a backend while constructing an expression or statement, e.g. a width or type mismatch.
 * The elaborator reports the offending source line and lets it propagate unchanged.
 */
public class VarException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public VarException(String message) { super(message); }
}
