package stela.elab;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stela.elab.CompileTimeEvalException.Kind;
import stela.eval.EvalResult;
import stela.eval.Value;
import stela.frontend.LoopBinding;
import stela.frontend.NodeKind;
import stela.frontend.SyntaxNode;

/**
 * Resolves compile-time control flow: unrolls loops over literal sequences and prunes conditionals with host predicates.
 * Conditionals on signals are handed to the {@link ControlFlowRewriter}, all other statements to the {@link StatementNormalizer}.
 *
 * The pass is a single depth-first walk; each emitted call carries the provenance of the loop iterations it came from.
 */
public class StaticElaborator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ElaborationContext ctx;
  private final ControlFlowRewriter rewriter;
  private final StatementNormalizer normalizer;
  private final ProvenanceStack provenance = new ProvenanceStack();

  StaticElaborator(ElaborationContext ctx) {
    this.ctx = ctx;
    this.rewriter = new ControlFlowRewriter(ctx);
    this.normalizer = new StatementNormalizer(ctx, rewriter);
  }

  /**
   * Elaborates a block body.
   * @param block a BLOCK node
   * @return the lowered calls in program order
   */
  public List<ScopeCall> elaborate(SyntaxNode block) { return elaborateStatements(block.getChildren()); }

  List<ScopeCall> elaborateStatements(List<SyntaxNode> stmts) {
    List<ScopeCall> result = new ArrayList<>();
    for (SyntaxNode stmt : stmts) {
      if (stmt.is(NodeKind.FOR))
        result.addAll(unroll(stmt));
      else if (stmt.is(NodeKind.IF))
        result.addAll(elaborateIf(stmt));
      else
        normalizer.normalize(stmt.withProvenance(provenance.snapshot())).ifPresent(result::add);
    }
    return result;
  }

  private List<ScopeCall> unroll(SyntaxNode forNode) {
    int line = forNode.getLine();
    SyntaxNode target = forNode.child(0);
    SyntaxNode iterable = forNode.child(1);
    SyntaxNode body = forNode.child(2);
    SyntaxNode orelse = forNode.child(3);
    if (orelse.size() > 0)
      throw ctx.syntaxError(SyntaxRestrictionException.Kind.IllegalSyntax, "for/else is not allowed in blocks", orelse.getLine());

    // resolve and check the whole iterable before the first iteration
    EvalResult iterResult = ctx.classify(iterable);
    if (iterResult instanceof EvalResult.Failure)
      throw ctx.evalError(Kind.UnresolvableIterable, "Unable to statically evaluate loop iterable " + iterable + ": " +
                                                         ((EvalResult.Failure)iterResult).message(), line);
    if (!(iterResult instanceof EvalResult.Literal) || !(((EvalResult.Literal)iterResult).value() instanceof Value.Seq))
      throw ctx.evalError(Kind.UnresolvableIterable, "Loop iterable " + iterable + " is not a finite sequence", line);
    List<Value> values = ((Value.Seq)((EvalResult.Literal)iterResult).value()).elements();
    for (Value value : values) {
      if (!value.isLiteral())
        throw ctx.evalError(Kind.NonLiteralLoopValue, "Loop values have to be integers, strings or booleans, got " + value.describe(), line);
    }
    if (!target.is(NodeKind.NAME))
      throw ctx.syntaxError(SyntaxRestrictionException.Kind.UnsupportedTarget, "Unable to use loop target " + target, line);

    String name = target.getToken();
    logger.debug("Unrolling loop over {} at {}:{} with {} iterations", name, ctx.source.filename(), ctx.absoluteLine(line), values.size());
    List<ScopeCall> result = new ArrayList<>();
    for (Value value : values) {
      Object literal = Value.toLiteral(value);
      SyntaxNode iterationBody = body.substitute(name, literal);
      provenance.push(new LoopBinding(name, literal));
      try {
        result.addAll(elaborateStatements(iterationBody.getChildren()));
      } finally {
        provenance.pop();
      }
    }
    return result;
  }

  private List<ScopeCall> elaborateIf(SyntaxNode ifNode) {
    int line = ifNode.getLine();
    SyntaxNode test = rewriter.normalizePredicate(ifNode.child(0), line);
    EvalResult result = ctx.classify(test);
    if (result instanceof EvalResult.Literal) {
      Value value = ((EvalResult.Literal)result).value();
      if (!(value instanceof Value.Bool))
        throw ctx.evalError(Kind.NonBooleanPredicate, "Cannot statically evaluate if predicate " + test + " to a boolean, got " +
                                                          value.describe(), line);
      boolean taken = ((Value.Bool)value).value();
      logger.debug("Pruning if at {}:{}, keeping the {} branch", ctx.source.filename(), ctx.absoluteLine(line), taken ? "then" : "else");
      return elaborateStatements(ifNode.child(taken ? 1 : 2).getChildren());
    }
    if (result instanceof EvalResult.Failure)
      throw ctx.evalError(Kind.UnresolvableExpression, "Unable to evaluate if predicate " + test + ": " + ((EvalResult.Failure)result).message(),
                          line);
    List<LoopBinding> loopVars = provenance.snapshot();
    List<ScopeCall> thenCalls = elaborateStatements(ifNode.child(1).getChildren());
    List<ScopeCall> elseCalls = elaborateStatements(ifNode.child(2).getChildren());
    return List.of(rewriter.lowerConditional(ifNode, test, thenCalls, elseCalls, loopVars));
  }
}
