package stela.elab;

/** A construct of the block body that cannot be elaborated. */
public class SyntaxRestrictionException extends ElaborationException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** for/else */
    IllegalSyntax,
    /** loop target that is not a single name */
    UnsupportedTarget,
    UnsupportedSyntax,
    /** raise of anything but {@code Exception(...)} */
    UnsupportedRaise,
    MultipleDecorations,
    UnknownDecoration,
    MalformedSensitivity,
    /** missing decoration while decorations are required */
    UndecoratedBlock
  }

  private final Kind kind;

  public SyntaxRestrictionException(Kind kind, String message, String filename, int line) {
    super(kind + ": " + message, filename, line);
    this.kind = kind;
  }

  public Kind getKind() { return kind; }
}
