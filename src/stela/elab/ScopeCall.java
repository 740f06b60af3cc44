package stela.elab;

import java.util.List;
import java.util.Optional;
import stela.frontend.LoopBinding;
import stela.frontend.SyntaxNode;

/**
 * Lowered form of a block statement: one call against the {@link Scope}.
 * Expressions are already normalized but not yet evaluated; lines are relative to the function definition
 * and only present when diagnostics are enabled.
 */
public interface ScopeCall {
  /** Relative source line of the statement the call was lowered from. */
  int sourceLine();

  /** {@code scope.if_(test, then...).else_(else...)} */
  record IfCall(SyntaxNode test, List<ScopeCall> thenCalls, List<ScopeCall> elseCalls, int sourceLine, Optional<Integer> line,
                Optional<Integer> elseLine, List<LoopBinding> loopVars) implements ScopeCall {
    public IfCall {
      thenCalls = List.copyOf(thenCalls);
      elseCalls = List.copyOf(elseCalls);
      loopVars = List.copyOf(loopVars);
    }
  }

  /** {@code scope.assign(target, value)} */
  record AssignCall(SyntaxNode target, SyntaxNode value, int sourceLine, Optional<Integer> line, List<LoopBinding> loopVars)
      implements ScopeCall {
    public AssignCall {
      loopVars = List.copyOf(loopVars);
    }
  }

  /** {@code scope.assert_(value)}; raised exceptions lower to an assertion of the literal 0. */
  record AssertCall(SyntaxNode value, int sourceLine, Optional<Integer> line, List<LoopBinding> loopVars) implements ScopeCall {
    public AssertCall {
      loopVars = List.copyOf(loopVars);
    }
  }

  /** {@code scope.return_(value)}, function blocks only. */
  record ReturnCall(SyntaxNode value, int sourceLine, Optional<Integer> line) implements ScopeCall {}
}
