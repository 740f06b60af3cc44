package stela.backend.sv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import stela.backend.FunctionBuilder;
import stela.backend.Statement;
import stela.backend.Variable;

/** A SystemVerilog function; collects its declared inputs in order. */
public class SVFunction implements FunctionBuilder {
  private final String name;
  private final List<SVVariable> inputs = new ArrayList<>();

  SVFunction(String name) { this.name = name; }

  @Override
  public String getName() { return name; }

  public List<SVVariable> getInputs() { return Collections.unmodifiableList(inputs); }

  @Override
  public Variable input(String inputName, int width, boolean signed) {
    SVVariable input = new SVVariable(inputName, width, signed, 0, false, null);
    inputs.add(input);
    return input;
  }

  @Override
  public Statement returnStmt(Variable value) {
    if (!(value instanceof SVVariable))
      throw new IllegalArgumentException("Foreign variable " + value.getName() + " returned from " + name);
    return new SVStatement.Return((SVVariable)value);
  }
}
