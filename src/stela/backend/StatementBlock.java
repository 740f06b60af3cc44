package stela.backend;

import java.util.List;

/** Ordered container of statements, such as the branches of an {@link IfStatement}. */
public interface StatementBlock extends Statement {
  void add(Statement stmt);
  List<Statement> statements();
}
