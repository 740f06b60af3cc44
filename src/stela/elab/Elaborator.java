package stela.elab;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stela.backend.Generator;
import stela.backend.Variable;
import stela.eval.Environment;
import stela.eval.Value;
import stela.frontend.NodeKind;
import stela.frontend.SyntaxNode;
import stela.ui.StelaConfig;
import stela.util.SourceLines;

/**
 * Elaborates statement blocks and function blocks into backend statements.
 *
 * A run classifies the block, resolves compile-time control flow, lowers the remaining statements to scope calls
 * and finally executes them once against a fresh {@link Scope}. On failure nothing is returned;
 * the source location is logged and the exception propagates.
 */
public class Elaborator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Generator generator;
  private final StelaConfig cfg;

  public Elaborator(Generator generator, StelaConfig cfg) {
    this.generator = generator;
    this.cfg = cfg;
  }

  public Generator getGenerator() { return generator; }

  private boolean isDebug() { return cfg.debug || generator.isDebug(); }

  /**
   * Elaborates a statement block.
   * @param functionDef the FUNCTION_DEF node of the block
   * @param env compile-time environment, including the binding of {@code self}
   * @param source file and start line of the definition
   */
  public ElaboratedBlock elaborateBlock(SyntaxNode functionDef, Environment env, SourceInfo source) {
    checkFunctionDef(functionDef);
    boolean debug = isDebug();
    ElaborationContext ctx = new ElaborationContext(env, source, debug, false);
    try {
      BlockClassifier.Classification classification = new BlockClassifier(cfg.require_decoration).classify(functionDef, ctx);
      List<SyntaxNode> params = functionDef.child(1).getChildren();
      if (params.size() > 1)
        throw ctx.syntaxError(SyntaxRestrictionException.Kind.UnsupportedSyntax,
                              String.format("Statement block %s has to be defined as def %s(self) or %s()", functionDef.getToken(),
                                            functionDef.getToken(), functionDef.getToken()),
                              functionDef.getLine());
      if (params.size() == 1 && env.lookup(params.get(0).getToken()).isEmpty())
        logger.debug("Parameter {} of block {} is not bound in the environment", params.get(0).getToken(), functionDef.getToken());

      logger.debug("Elaborating {} block {} ({}:{})", classification.blockType(), functionDef.getToken(), source.filename(),
                   source.startLine());
      List<ScopeCall> calls = new StaticElaborator(ctx).elaborate(functionDef.child(2));
      Scope scope = new Scope(generator, source, debug, debug && cfg.capture_locals ? env : null);
      new ScopeExecutor(scope, ctx).execute(calls);
      logger.debug("Block {} produced {} statement(s)", functionDef.getToken(), scope.statements().size());
      return new ElaboratedBlock(classification.blockType(), classification.sensitivity(), scope.statements());
    } catch (ElaborationException e) {
      reportFailure(functionDef, e);
      throw e;
    }
  }

  /**
   * Elaborates a function block. All parameters except {@code self} are declared as inputs in order.
   * @param functionDef the FUNCTION_DEF node
   * @param argTypes one entry per non-self parameter
   * @param env compile-time environment
   * @param source file and start line of the definition
   */
  public ElaboratedFunction elaborateFunction(SyntaxNode functionDef, List<PortType> argTypes, Environment env, SourceInfo source) {
    checkFunctionDef(functionDef);
    boolean debug = isDebug();
    ElaborationContext ctx = new ElaborationContext(env, source, debug, true);
    try {
      List<String> argNames = new ArrayList<>();
      for (SyntaxNode param : functionDef.child(1).getChildren()) {
        if (!param.getToken().equals("self"))
          argNames.add(param.getToken());
      }
      if (argTypes.size() != argNames.size())
        throw ctx.syntaxError(SyntaxRestrictionException.Kind.UnsupportedSyntax,
                              String.format("Function %s has %d argument(s) %s but %d argument type(s) were given", functionDef.getToken(),
                                            argNames.size(), argNames, argTypes.size()),
                              functionDef.getLine());

      FuncScope scope = new FuncScope(generator, functionDef.getToken(), source, debug);
      Environment.Builder argEnv = env.extend();
      for (int i = 0; i < argNames.size(); ++i) {
        PortType type = argTypes.get(i);
        Variable input = scope.input(argNames.get(i), type.width(), type.signed());
        argEnv.bind(argNames.get(i), new Value.Signal(input));
      }
      ElaborationContext funcCtx = ctx.withEnvironment(argEnv.build());
      if (debug && cfg.capture_locals)
        scope.setCapturedLocals(funcCtx.env);

      logger.debug("Elaborating function {} ({}:{}) with arguments {}", functionDef.getToken(), source.filename(), source.startLine(),
                   argNames);
      List<ScopeCall> calls = new StaticElaborator(funcCtx).elaborate(functionDef.child(2));
      new ScopeExecutor(scope, funcCtx).execute(calls);
      return new ElaboratedFunction(scope.getFunction(), argNames, scope.statements());
    } catch (ElaborationException e) {
      reportFailure(functionDef, e);
      throw e;
    }
  }

  private static void checkFunctionDef(SyntaxNode functionDef) {
    if (!functionDef.is(NodeKind.FUNCTION_DEF))
      throw new IllegalArgumentException("Expected a function definition, got " + functionDef.getKind().getSerialName());
  }

  private static void reportFailure(SyntaxNode functionDef, ElaborationException e) {
    logger.error("Elaboration of {} failed: {}", functionDef.getToken(), e.getDetail());
    SourceLines.logSource(e.getFilename(), e.getLine());
  }
}
