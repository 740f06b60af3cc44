package stela.backend;

/** Backend object of a function-style block. */
public interface FunctionBuilder {
  String getName();
  /** Declares the next function argument. */
  Variable input(String name, int width, boolean signed);
  Statement returnStmt(Variable value);
}
