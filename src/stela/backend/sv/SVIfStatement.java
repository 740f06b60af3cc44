package stela.backend.sv;

import stela.backend.IfStatement;
import stela.backend.StatementBlock;
import stela.backend.Variable;

/** {@code if (predicate) begin ... end else begin ... end} */
public class SVIfStatement extends SVStatement implements IfStatement {
  private final SVVariable predicate;
  private final SVBlock thenBody = new SVBlock();
  private final SVBlock elseBody = new SVBlock();

  SVIfStatement(SVVariable predicate) { this.predicate = predicate; }

  @Override
  public Variable predicate() { return predicate; }
  @Override
  public StatementBlock thenBody() { return thenBody; }
  @Override
  public StatementBlock elseBody() { return elseBody; }

  @Override
  public void render(StringBuilder out, int indent) {
    indent(out, indent);
    out.append("if (").append(predicate.getName()).append(") begin\n");
    thenBody.render(out, indent + 1);
    indent(out, indent);
    out.append("end\n");
    if (!elseBody.isEmpty()) {
      indent(out, indent);
      out.append("else begin\n");
      elseBody.render(out, indent + 1);
      indent(out, indent);
      out.append("end\n");
    }
  }
}
