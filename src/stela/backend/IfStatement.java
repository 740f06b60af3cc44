package stela.backend;

/** Runtime conditional on a signal-valued predicate. */
public interface IfStatement extends Statement {
  Variable predicate();
  StatementBlock thenBody();
  StatementBlock elseBody();
}
