package stela.elab;

import java.util.Optional;
import stela.backend.FunctionBuilder;
import stela.backend.Generator;
import stela.backend.Statement;
import stela.backend.VarException;
import stela.backend.Variable;
import stela.eval.Value;
import stela.util.SourceLines;

/** Scope of a function-style block, which declares inputs and returns a value. */
public class FuncScope extends Scope {
  private final FunctionBuilder function;

  public FuncScope(Generator generator, String functionName, SourceInfo source, boolean debug) {
    super(generator, source, debug, null);
    this.function = generator.function(functionName);
  }

  public FunctionBuilder getFunction() { return function; }

  /** Declares the next function argument. */
  public Variable input(String varName, int width, boolean signed) { return function.input(varName, width, signed); }

  /**
   * Builds {@code return value}.
   * @param value a signal, or an integer or boolean that becomes a single bit constant
   */
  public Statement return_(Value value, Optional<Integer> line) {
    Statement stmt;
    try {
      stmt = function.returnStmt(ops.toVariable(value, null));
    } catch (VarException ex) {
      if (line.isPresent())
        SourceLines.logSource(filename, absoluteLine(line.get()));
      throw ex;
    }
    if (line.isPresent() && debug)
      stmt.addFileLine(filename, absoluteLine(line.get()));
    return stmt;
  }
}
