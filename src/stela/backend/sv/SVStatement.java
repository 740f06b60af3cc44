package stela.backend.sv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import stela.backend.ScopeVariable;
import stela.backend.SourceLocation;
import stela.backend.Statement;

/**
 * SystemVerilog rendering of a statement, with its debug metadata.
 */
public abstract class SVStatement implements Statement {
  public static String tab = "  ";

  private final List<SourceLocation> fileLines = new ArrayList<>();
  private final Map<String, ScopeVariable> scopeVariables = new LinkedHashMap<>();

  @Override
  public void addFileLine(String filename, int line) {
    fileLines.add(new SourceLocation(filename, line));
  }
  @Override
  public List<SourceLocation> getFileLines() {
    return Collections.unmodifiableList(fileLines);
  }

  @Override
  public void addScopeVariable(String name, String value, boolean isVar) {
    scopeVariables.put(name, new ScopeVariable(value, isVar));
  }
  @Override
  public Map<String, ScopeVariable> getScopeVariables() {
    return Collections.unmodifiableMap(scopeVariables);
  }

  /**
   * Appends the statement text, one line per statement line, each line terminated by a newline.
   * @param out the target
   * @param indent the current indent level
   */
  public abstract void render(StringBuilder out, int indent);

  protected static void indent(StringBuilder out, int indent) {
    for (int i = 0; i < indent; ++i)
      out.append(tab);
  }

  /** Rendered text without the trailing newline. */
  @Override
  public String toString() {
    StringBuilder out = new StringBuilder();
    render(out, 0);
    int end = out.length();
    while (end > 0 && out.charAt(end - 1) == '\n')
      --end;
    return out.substring(0, end);
  }

  /** {@code target = value;} */
  public static class Assign extends SVStatement {
    private final SVVariable target;
    private final SVVariable value;

    Assign(SVVariable target, SVVariable value) {
      this.target = target;
      this.value = value;
    }
    public SVVariable getTarget() { return target; }
    public SVVariable getValue() { return value; }

    @Override
    public void render(StringBuilder out, int indent) {
      indent(out, indent);
      out.append(target.getName()).append(" = ").append(value.getName()).append(";\n");
    }
  }

  /** {@code assert (value);} */
  public static class Assert extends SVStatement {
    private final SVVariable value;

    Assert(SVVariable value) { this.value = value; }
    public SVVariable getValue() { return value; }

    @Override
    public void render(StringBuilder out, int indent) {
      indent(out, indent);
      out.append("assert (").append(value.getName()).append(");\n");
    }
  }

  /** {@code return value;} */
  public static class Return extends SVStatement {
    private final SVVariable value;

    Return(SVVariable value) { this.value = value; }
    public SVVariable getValue() { return value; }

    @Override
    public void render(StringBuilder out, int indent) {
      indent(out, indent);
      out.append("return ").append(value.getName()).append(";\n");
    }
  }
}
