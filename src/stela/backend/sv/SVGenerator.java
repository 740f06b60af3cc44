package stela.backend.sv;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import stela.backend.FunctionBuilder;
import stela.backend.Generator;
import stela.backend.IfStatement;
import stela.backend.Statement;
import stela.backend.VarException;
import stela.backend.Variable;

/**
 * Reference backend that renders statements as SystemVerilog text.
 * It declares no modules or ports; signals are created with {@link #var(String, int, boolean, int)}.
 */
public class SVGenerator implements Generator {
  private final String name;
  private final Map<String, SVVariable> vars = new LinkedHashMap<>();
  private final Map<String, SVFunction> functions = new LinkedHashMap<>();
  private boolean debug = false;

  public SVGenerator(String name) { this.name = name; }

  @Override
  public String getName() { return name; }

  @Override
  public boolean isDebug() { return debug; }
  public void setDebug(boolean debug) { this.debug = debug; }

  public SVVariable var(String varName, int width) { return var(varName, width, false, 0); }

  /**
   * Declares a signal.
   * @param varName unique signal name
   * @param width bit width (of each element for arrays)
   * @param signed signedness
   * @param size number of array elements, 0 for a plain vector
   */
  public SVVariable var(String varName, int width, boolean signed, int size) {
    if (vars.containsKey(varName))
      throw new VarException("Signal " + varName + " already exists in " + name);
    SVVariable var = new SVVariable(varName, width, signed, size, true, null);
    vars.put(varName, var);
    return var;
  }

  public Map<String, SVVariable> getVars() { return Collections.unmodifiableMap(vars); }

  @Override
  public Variable constant(long value, int width, boolean signed) {
    return SVVariable.constant(value, width, signed);
  }

  @Override
  public IfStatement ifStmt(Variable predicate) {
    return new SVIfStatement(cast(predicate));
  }

  @Override
  public Statement assertStmt(Variable value) {
    return new SVStatement.Assert(cast(value));
  }

  @Override
  public FunctionBuilder function(String functionName) {
    if (functions.containsKey(functionName))
      throw new VarException("Function " + functionName + " already exists in " + name);
    SVFunction function = new SVFunction(functionName);
    functions.put(functionName, function);
    return function;
  }

  private static SVVariable cast(Variable var) {
    if (!(var instanceof SVVariable))
      throw new IllegalArgumentException("Foreign variable " + var.getName() + " passed to SystemVerilog generator");
    return (SVVariable)var;
  }
}
