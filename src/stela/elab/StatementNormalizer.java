package stela.elab;

import java.util.List;
import java.util.Optional;
import stela.elab.SyntaxRestrictionException.Kind;
import stela.frontend.LoopBinding;
import stela.frontend.NodeKind;
import stela.frontend.Syntax;
import stela.frontend.SyntaxNode;

/**
 * Lowers leaf statements (everything but for and if) into scope calls.
 */
public class StatementNormalizer {
  private final ElaborationContext ctx;
  private final ControlFlowRewriter rewriter;

  StatementNormalizer(ElaborationContext ctx, ControlFlowRewriter rewriter) {
    this.ctx = ctx;
    this.rewriter = rewriter;
  }

  /**
   * Lowers one statement. The loop bindings are taken from the statement's provenance.
   * @return the lowered call, or empty for statements without effect ({@code pass})
   */
  public Optional<ScopeCall> normalize(SyntaxNode stmt) {
    int line = stmt.getLine();
    List<LoopBinding> loopVars = stmt.getProvenance();
    switch (stmt.getKind()) {
    case AUG_ASSIGN: {
      SyntaxNode target = stmt.child(0);
      return normalize(
          Syntax.assign(line, target, new SyntaxNode(NodeKind.BIN_OP, stmt.getToken(), null, List.of(target, stmt.child(1)), line, 0))
              .withProvenance(loopVars));
    }
    case ASSIGN: {
      if (stmt.size() != 2)
        throw ctx.syntaxError(Kind.UnsupportedSyntax, "Chained assignment is not allowed: " + stmt, line);
      SyntaxNode target = stmt.child(0);
      if (target.is(NodeKind.TUPLE) || target.is(NodeKind.LIST))
        throw ctx.syntaxError(Kind.UnsupportedSyntax, "Tuple unpacking is not allowed: " + stmt, line);
      SyntaxNode value = rewriter.normalizeLogic(stmt.child(1), line);
      return Optional.of(new ScopeCall.AssignCall(target, value, line, ctx.lineArg(line), loopVars));
    }
    case EXPR_STMT: {
      SyntaxNode expr = stmt.child(0);
      if (expr.is(NodeKind.CALL) && expr.child(0).is(NodeKind.NAME) && expr.child(0).getToken().equals("assert_")) {
        if (expr.size() != 2)
          throw ctx.syntaxError(Kind.UnsupportedSyntax, "assert_ takes exactly one argument: " + stmt, line);
        return Optional.of(assertCall(expr.child(1), line, loopVars));
      }
      throw ctx.syntaxError(Kind.UnsupportedSyntax, "Expression statement " + stmt + " has no effect", line);
    }
    case ASSERT:
      return Optional.of(assertCall(stmt.child(0), line, loopVars));
    case RAISE: {
      SyntaxNode exception = stmt.size() > 0 ? stmt.child(0) : null;
      if (exception == null || !exception.is(NodeKind.CALL) || !exception.child(0).is(NodeKind.NAME) ||
          !exception.child(0).getToken().equals("Exception"))
        throw ctx.syntaxError(Kind.UnsupportedRaise, stmt + " not supported, only raise Exception(...)", line);
      return Optional.of(new ScopeCall.AssertCall(Syntax.literal(0L, line, 0), line, ctx.lineArg(line), loopVars));
    }
    case RETURN:
      if (!ctx.allowReturn)
        throw ctx.syntaxError(Kind.UnsupportedSyntax, "return is only allowed in function blocks", line);
      if (stmt.size() == 0)
        throw ctx.syntaxError(Kind.UnsupportedSyntax, "return needs a value", line);
      return Optional.of(new ScopeCall.ReturnCall(rewriter.normalizeLogic(stmt.child(0), line), line, ctx.lineArg(line)));
    case PASS:
      return Optional.empty();
    default:
      throw ctx.syntaxError(Kind.UnsupportedSyntax, stmt.getKind().getSerialName() + " statement is not supported in blocks", line);
    }
  }

  private ScopeCall.AssertCall assertCall(SyntaxNode value, int line, List<LoopBinding> loopVars) {
    return new ScopeCall.AssertCall(rewriter.normalizeLogic(value, line), line, ctx.lineArg(line), loopVars);
  }
}
