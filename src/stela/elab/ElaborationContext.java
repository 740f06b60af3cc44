package stela.elab;

import java.util.Optional;
import stela.eval.EvalResult;
import stela.eval.Environment;
import stela.eval.ExpressionEvaluator;
import stela.frontend.SyntaxNode;

/**
 * State shared by the passes of one elaboration run: the environment, the source location and the diagnostics flag.
 */
class ElaborationContext {
  final Environment env;
  final SourceInfo source;
  /** Attach source lines and loop bindings to generated statements. */
  final boolean debug;
  /** {@code return} is only lowered inside function blocks. */
  final boolean allowReturn;
  final ExpressionEvaluator evaluator = new ExpressionEvaluator();

  ElaborationContext(Environment env, SourceInfo source, boolean debug, boolean allowReturn) {
    this.env = env;
    this.source = source;
    this.debug = debug;
    this.allowReturn = allowReturn;
  }

  ElaborationContext withEnvironment(Environment newEnv) { return new ElaborationContext(newEnv, source, debug, allowReturn); }

  /** Line argument of a lowered call: the relative line if diagnostics are enabled. */
  Optional<Integer> lineArg(int relativeLine) { return debug ? Optional.of(relativeLine) : Optional.empty(); }

  int absoluteLine(int relativeLine) { return source.absoluteLine(relativeLine); }

  EvalResult classify(SyntaxNode expr) { return evaluator.classify(expr, env); }

  SyntaxRestrictionException syntaxError(SyntaxRestrictionException.Kind kind, String message, int relativeLine) {
    return new SyntaxRestrictionException(kind, message, source.filename(), absoluteLine(relativeLine));
  }

  CompileTimeEvalException evalError(CompileTimeEvalException.Kind kind, String message, int relativeLine) {
    return new CompileTimeEvalException(kind, message, source.filename(), absoluteLine(relativeLine));
  }

  /** Line of a node, falling back to the enclosing statement for expressions built without position. */
  static int lineOf(SyntaxNode node, int fallback) { return node.getLine() > 0 ? node.getLine() : fallback; }
}
