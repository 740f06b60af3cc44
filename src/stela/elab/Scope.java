package stela.elab;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stela.backend.Generator;
import stela.backend.IfStatement;
import stela.backend.Statement;
import stela.backend.VarException;
import stela.backend.Variable;
import stela.eval.BackendSignalOps;
import stela.eval.Environment;
import stela.eval.Value;
import stela.frontend.LoopBinding;
import stela.util.SourceLines;

/**
 * Collects the backend statements of one elaborated block in program order.
 *
 * Lines passed to the builder methods are relative to the function definition.
 * If diagnostics are enabled and a line is given, statements get the absolute source line and the loop bindings as metadata.
 */
public class Scope {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final List<Statement> stmtList = new ArrayList<>();
  protected final Generator generator;
  protected final String filename;
  /** Absolute line of the function definition. */
  protected final int ln;
  protected final boolean debug;
  /** Environment recorded on statements when capturing locals, or null. */
  private Environment capturedLocals;
  protected final BackendSignalOps ops;

  /**
   * @param generator the backend generator
   * @param source file and start line of the block
   * @param debug attach debug metadata
   * @param capturedLocals if non-null, its literal and signal bindings are attached to assignments and assertions
   */
  public Scope(Generator generator, SourceInfo source, boolean debug, Environment capturedLocals) {
    this.generator = generator;
    this.filename = source.filename();
    this.ln = source.startLine();
    this.debug = debug;
    this.capturedLocals = capturedLocals;
    this.ops = new BackendSignalOps(generator);
  }

  public Generator getGenerator() { return generator; }
  /** Signal operations on this scope's generator. */
  public BackendSignalOps getSignalOps() { return ops; }
  public String getFilename() { return filename; }
  public boolean isDebug() { return debug; }

  /** Sets the environment recorded on statements, null to disable capturing. */
  public void setCapturedLocals(Environment capturedLocals) { this.capturedLocals = capturedLocals; }

  protected int absoluteLine(int relativeLine) { return relativeLine + ln - 1; }

  /** Handle of a conditional under construction, returned by {@link Scope#if_}. */
  public class IfHandle {
    private final IfStatement ifStmt;

    private IfHandle(IfStatement ifStmt) { this.ifStmt = ifStmt; }

    /**
     * Appends statements to the else branch.
     * @param stmts statements or nested handles
     * @param line relative line of the else branch
     * @return this handle
     */
    public IfHandle else_(List<?> stmts, Optional<Integer> line) {
      for (Object stmt : stmts)
        ifStmt.elseBody().add(unwrap(stmt));
      if (line.isPresent() && debug)
        ifStmt.elseBody().addFileLine(filename, absoluteLine(line.get()));
      return this;
    }

    public IfStatement stmt() { return ifStmt; }
  }

  private static Statement unwrap(Object stmt) {
    if (stmt instanceof IfHandle)
      return ((IfHandle)stmt).stmt();
    if (stmt instanceof Statement)
      return (Statement)stmt;
    throw new IllegalArgumentException("Not a statement: " + stmt);
  }

  /**
   * Builds a runtime conditional.
   * @param test the signal-valued predicate
   * @param thenStmts statements or nested handles of the then branch
   * @param line relative line of the if statement
   * @param loopVars enclosing loop bindings
   */
  public IfHandle if_(Variable test, List<?> thenStmts, Optional<Integer> line, List<LoopBinding> loopVars) {
    IfHandle handle = new IfHandle(generator.ifStmt(test));
    if (line.isPresent() && debug) {
      int absLine = absoluteLine(line.get());
      handle.ifStmt.addFileLine(filename, absLine);
      handle.ifStmt.thenBody().addFileLine(filename, absLine);
      addLoopVars(handle.ifStmt, loopVars);
    }
    for (Object stmt : thenStmts)
      handle.ifStmt.thenBody().add(unwrap(stmt));
    return handle;
  }

  /**
   * Builds {@code target = value}. Integer and boolean values become constants of the target's width.
   * A backend failure is reported with the source line and rethrown.
   */
  public Statement assign(Variable target, Value value, Optional<Integer> line, List<LoopBinding> loopVars) {
    Statement stmt;
    try {
      stmt = target.assign(ops.toVariable(value, target));
    } catch (VarException ex) {
      if (line.isPresent())
        SourceLines.logSource(filename, absoluteLine(line.get()));
      throw ex;
    }
    addMetadata(stmt, line, loopVars);
    return stmt;
  }

  /**
   * Builds an assertion.
   * @param value a signal, or the integer 0 for an assertion that always fails
   */
  public Statement assert_(Value value, Optional<Integer> line, List<LoopBinding> loopVars) {
    Variable var;
    if (value instanceof Value.Signal)
      var = ((Value.Signal)value).variable();
    else if (value instanceof Value.Int && ((Value.Int)value).value() == 0)
      var = generator.constant(0, 1, false);
    else
      throw new IllegalArgumentException("assert_ needs a signal or 0, got " + value.describe());
    Statement stmt;
    try {
      stmt = generator.assertStmt(var);
    } catch (VarException ex) {
      if (line.isPresent())
        SourceLines.logSource(filename, absoluteLine(line.get()));
      throw ex;
    }
    addMetadata(stmt, line, loopVars);
    return stmt;
  }

  private void addMetadata(Statement stmt, Optional<Integer> line, List<LoopBinding> loopVars) {
    if (!debug || line.isEmpty())
      return;
    stmt.addFileLine(filename, absoluteLine(line.get()));
    if (capturedLocals != null)
      addScopeContext(stmt, capturedLocals.visibleBindings());
    addLoopVars(stmt, loopVars);
  }

  /** Attaches literal bindings as values and named signals as variables. */
  static void addScopeContext(Statement stmt, Map<String, Value> locals) {
    locals.forEach((name, value) -> {
      if (value.isLiteral())
        stmt.addScopeVariable(name, value.toString(), false);
      else if (value instanceof Value.Signal && !((Value.Signal)value).variable().getName().isEmpty())
        stmt.addScopeVariable(name, ((Value.Signal)value).variable().getName(), true);
    });
  }

  static void addLoopVars(Statement stmt, List<LoopBinding> loopVars) {
    for (LoopBinding binding : loopVars)
      stmt.addScopeVariable(binding.name(), binding.valueString(), false);
  }

  /** Unconditionally appends a statement. */
  public void addStmt(Statement stmt) {
    logger.trace("Adding statement {}", stmt);
    stmtList.add(stmt);
  }

  /** Read-only view of the statements in insertion order. */
  public List<Statement> statements() { return Collections.unmodifiableList(stmtList); }
}
