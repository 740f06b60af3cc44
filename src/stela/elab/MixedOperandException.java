package stela.elab;

/** Signal and host operands mixed in one logical operator chain. */
public class MixedOperandException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public MixedOperandException(String message, String filename, int line) {
    super(message, filename, line);
  }
}
