package stela.elab;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stela.backend.Statement;
import stela.backend.VarException;
import stela.elab.CompileTimeEvalException.Kind;
import stela.eval.BackendSignalOps;
import stela.eval.EvaluationFailure;
import stela.eval.Value;
import stela.frontend.SyntaxNode;
import stela.util.SourceLines;

/**
 * Runs lowered calls against a {@link Scope}. Expressions are evaluated with backend signal operations here, so this is the
 * only place where backend variables are created.
 */
public class ScopeExecutor {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Scope scope;
  private final ElaborationContext ctx;
  private final BackendSignalOps ops;

  ScopeExecutor(Scope scope, ElaborationContext ctx) {
    this.scope = scope;
    this.ctx = ctx;
    this.ops = scope.getSignalOps();
  }

  /** Executes the top-level calls, appending each result to the scope. */
  public void execute(List<ScopeCall> calls) {
    for (ScopeCall call : calls)
      scope.addStmt(build(call));
  }

  private Statement build(ScopeCall call) {
    if (call instanceof ScopeCall.AssignCall) {
      ScopeCall.AssignCall assign = (ScopeCall.AssignCall)call;
      Value target = evaluate(assign.target(), assign.sourceLine());
      if (!(target instanceof Value.Signal))
        throw ctx.evalError(Kind.NonSignalValue, "Assignment target " + assign.target() + " is " + target.describe() + ", not a signal",
                            assign.sourceLine());
      Value value = requireSignalOperand(assign.value(), evaluate(assign.value(), assign.sourceLine()), assign.sourceLine());
      try {
        return scope.assign(((Value.Signal)target).variable(), value, assign.line(), assign.loopVars());
      } catch (VarException ex) {
        logUnlocated(assign.line(), assign.sourceLine());
        throw ex;
      }
    }
    if (call instanceof ScopeCall.AssertCall) {
      ScopeCall.AssertCall assertCall = (ScopeCall.AssertCall)call;
      Value value = evaluate(assertCall.value(), assertCall.sourceLine());
      boolean isZero = value instanceof Value.Int && ((Value.Int)value).value() == 0;
      if (!(value instanceof Value.Signal) && !isZero)
        throw ctx.evalError(Kind.NonSignalValue, "Assertion " + assertCall.value() + " is " + value.describe() + ", not a signal",
                            assertCall.sourceLine());
      try {
        return scope.assert_(value, assertCall.line(), assertCall.loopVars());
      } catch (VarException ex) {
        logUnlocated(assertCall.line(), assertCall.sourceLine());
        throw ex;
      }
    }
    if (call instanceof ScopeCall.ReturnCall) {
      ScopeCall.ReturnCall ret = (ScopeCall.ReturnCall)call;
      if (!(scope instanceof FuncScope))
        throw new IllegalStateException("return lowered outside of a function block");
      Value value = requireSignalOperand(ret.value(), evaluate(ret.value(), ret.sourceLine()), ret.sourceLine());
      try {
        return ((FuncScope)scope).return_(value, ret.line());
      } catch (VarException ex) {
        logUnlocated(ret.line(), ret.sourceLine());
        throw ex;
      }
    }
    ScopeCall.IfCall ifCall = (ScopeCall.IfCall)call;
    Value test = evaluate(ifCall.test(), ifCall.sourceLine());
    if (!(test instanceof Value.Signal))
      throw ctx.evalError(Kind.NonSignalValue, "Predicate " + ifCall.test() + " is " + test.describe() + ", not a signal",
                          ifCall.sourceLine());
    List<Statement> thenStmts = new ArrayList<>();
    for (ScopeCall nested : ifCall.thenCalls())
      thenStmts.add(build(nested));
    List<Statement> elseStmts = new ArrayList<>();
    for (ScopeCall nested : ifCall.elseCalls())
      elseStmts.add(build(nested));
    return scope.if_(((Value.Signal)test).variable(), thenStmts, ifCall.line(), ifCall.loopVars()).else_(elseStmts, ifCall.elseLine()).stmt();
  }

  /** The scope logs failures of calls that carry a line; without diagnostics the line is logged here. */
  private void logUnlocated(Optional<Integer> line, int sourceLine) {
    if (line.isEmpty())
      SourceLines.logSource(ctx.source.filename(), ctx.absoluteLine(sourceLine));
  }

  private Value requireSignalOperand(SyntaxNode expr, Value value, int line) {
    if (value.isSignal() || value instanceof Value.Int || value instanceof Value.Bool)
      return value;
    throw ctx.evalError(Kind.NonSignalValue, expr + " is " + value.describe() + ", expected a signal or an integer", line);
  }

  private Value evaluate(SyntaxNode expr, int line) {
    try {
      return ctx.evaluator.evaluate(expr, ctx.env, ops);
    } catch (EvaluationFailure failure) {
      int failureLine = failure.getNode() != null ? ElaborationContext.lineOf(failure.getNode(), line) : line;
      throw ctx.evalError(Kind.UnresolvableExpression, failure.getMessage(), failureLine);
    } catch (VarException ex) {
      SourceLines.logSource(ctx.source.filename(), ctx.absoluteLine(line));
      throw ex;
    }
  }
}
