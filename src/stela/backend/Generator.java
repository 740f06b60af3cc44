package stela.backend;

/**
 * The hardware generator statements are elaborated for.
 * Statement construction is assumed single-writer per generator.
 */
public interface Generator {
  String getName();

  /** If set, elaborated statements carry source lines and loop bindings as debug metadata. */
  boolean isDebug();

  /** Sized constant. Throws {@link VarException} if value does not fit. */
  Variable constant(long value, int width, boolean signed);

  IfStatement ifStmt(Variable predicate);
  Statement assertStmt(Variable value);

  /** Creates the backend object of a function-style block. */
  FunctionBuilder function(String name);
}
