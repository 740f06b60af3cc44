package stela.elab;

/**
 * Base of all errors raised while elaborating a block.
 * Carries the source file and absolute line of the offending construct when they are known.
 */
public class ElaborationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String filename;
  private final int line;
  private final String detail;

  public ElaborationException(String message) { this(message, null, -1); }

  public ElaborationException(String message, String filename, int line) {
    super(formatMessage(message, filename, line));
    this.detail = message;
    this.filename = filename;
    this.line = line;
  }

  private static String formatMessage(String message, String filename, int line) {
    if (line < 0)
      return message;
    return String.format("%s (%s:%d)", message, filename == null ? "<unknown>" : filename, line);
  }

  /** Source file, or null if unknown. */
  public String getFilename() { return filename; }
  /** Absolute source line, or -1 if unknown. */
  public int getLine() { return line; }
  /** The message without location. */
  public String getDetail() { return detail; }
}
