package stela.backend.sv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import stela.backend.Statement;
import stela.backend.StatementBlock;

/** A begin/end sequence of statements. */
public class SVBlock extends SVStatement implements StatementBlock {
  private final List<Statement> stmts = new ArrayList<>();

  @Override
  public void add(Statement stmt) {
    if (!(stmt instanceof SVStatement))
      throw new IllegalArgumentException("Foreign statement " + stmt.getClass().getName() + " in SystemVerilog block");
    stmts.add(stmt);
  }

  @Override
  public List<Statement> statements() {
    return Collections.unmodifiableList(stmts);
  }

  public boolean isEmpty() { return stmts.isEmpty(); }

  /** Renders only the contained statements; the enclosing statement writes begin/end. */
  @Override
  public void render(StringBuilder out, int indent) {
    for (Statement stmt : stmts)
      ((SVStatement)stmt).render(out, indent);
  }
}
