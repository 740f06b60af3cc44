package stela.elab;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stela.eval.EvalResult;
import stela.frontend.LoopBinding;
import stela.frontend.Syntax;
import stela.frontend.SyntaxNode;

/**
 * Rewrites signal-valued logic into reduction calls and lowers runtime conditionals into {@link ScopeCall.IfCall}s.
 *
 * <ul>
 * <li>{@code sig == x} becomes {@code sig.eq(x)}</li>
 * <li>{@code not sig} becomes {@code sig.r_not()}</li>
 * <li>{@code a and b and c} on signals becomes {@code a.and_(b).and_(c)}; mixing signals with host values is an error</li>
 * </ul>
 * Host sub-expressions are left unchanged.
 */
public class ControlFlowRewriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ElaborationContext ctx;

  ControlFlowRewriter(ElaborationContext ctx) { this.ctx = ctx; }

  /** Normalizes an if predicate. */
  public SyntaxNode normalizePredicate(SyntaxNode test, int line) { return normalizeLogic(test, line); }

  /**
   * Applies the reduction rewrites bottom-up.
   * @param expr the expression
   * @param contextLine relative line of the enclosing statement, for diagnostics
   */
  public SyntaxNode normalizeLogic(SyntaxNode expr, int contextLine) {
    if (expr.getChildren().isEmpty())
      return expr;
    List<SyntaxNode> children = new ArrayList<>(expr.size());
    boolean changed = false;
    for (SyntaxNode child : expr.getChildren()) {
      SyntaxNode newChild = normalizeLogic(child, contextLine);
      changed |= newChild != child;
      children.add(newChild);
    }
    SyntaxNode node = changed ? expr.withChildren(children) : expr;
    int line = ElaborationContext.lineOf(node, contextLine);

    switch (node.getKind()) {
    case COMPARE:
      if (node.getToken().equals("==") && isSignal(node.child(0), line))
        return Syntax.reduce("eq", node.getLine(), node.child(0), node.child(1));
      return node;
    case UNARY_OP:
      if (node.getToken().equals("not") && isSignal(node.child(0), line))
        return Syntax.reduce("r_not", node.getLine(), node.child(0));
      return node;
    case BOOL_OP:
      return foldBoolOp(node, line);
    default:
      return node;
    }
  }

  private SyntaxNode foldBoolOp(SyntaxNode node, int line) {
    String method;
    if (node.getToken().equals("and"))
      method = "and_";
    else if (node.getToken().equals("or"))
      method = "or_";
    else
      throw ctx.syntaxError(SyntaxRestrictionException.Kind.UnsupportedSyntax, "Invalid logical operator " + node.getToken(), line);
    boolean anySignal = false;
    SyntaxNode hostOperand = null;
    for (SyntaxNode operand : node.getChildren()) {
      if (isSignal(operand, line))
        anySignal = true;
      else if (hostOperand == null)
        hostOperand = operand;
    }
    if (!anySignal)
      return node;
    if (hostOperand != null)
      throw new MixedOperandException("Cannot mix signals with host values in logical operators: " + hostOperand + " in " + node,
                                      ctx.source.filename(), ctx.absoluteLine(line));
    SyntaxNode result = node.child(0);
    for (SyntaxNode operand : node.getChildren().subList(1, node.size()))
      result = Syntax.reduce(method, node.getLine(), result, operand);
    return result;
  }

  private boolean isSignal(SyntaxNode expr, int line) {
    EvalResult result = ctx.classify(expr);
    if (result instanceof EvalResult.Failure)
      throw ctx.evalError(CompileTimeEvalException.Kind.UnresolvableExpression, ((EvalResult.Failure)result).message(),
                          ElaborationContext.lineOf(((EvalResult.Failure)result).node(), line));
    return result instanceof EvalResult.SignalValued;
  }

  /**
   * Lowers a conditional with a signal-valued predicate.
   * @param ifNode the IF statement
   * @param test the normalized predicate
   * @param thenCalls the lowered then-branch
   * @param elseCalls the lowered else-branch, possibly empty
   * @param loopVars the active provenance
   */
  public ScopeCall.IfCall lowerConditional(SyntaxNode ifNode, SyntaxNode test, List<ScopeCall> thenCalls, List<ScopeCall> elseCalls,
                                           List<LoopBinding> loopVars) {
    SyntaxNode orelse = ifNode.child(2);
    Optional<Integer> elseLine = orelse.size() > 0 ? ctx.lineArg(orelse.getLine()) : Optional.empty();
    logger.trace("Lowering runtime conditional on {} at line {}", test, ctx.absoluteLine(ifNode.getLine()));
    return new ScopeCall.IfCall(test, thenCalls, elseCalls, ifNode.getLine(), ctx.lineArg(ifNode.getLine()), elseLine, loopVars);
  }
}
