package stela.elab;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import stela.elab.SyntaxRestrictionException.Kind;
import stela.eval.EvalResult;
import stela.eval.Value;
import stela.frontend.NodeKind;
import stela.frontend.SyntaxNode;

/**
 * Derives the block type and the sensitivity list of a statement block from its decoration.
 */
public class BlockClassifier {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Result of {@link #classify}. */
  public record Classification(BlockType blockType, List<SensitivityEntry> sensitivity) {
    public Classification {
      sensitivity = List.copyOf(sensitivity);
    }
  }

  private final boolean requireDecoration;

  /** @param requireDecoration if set, an undecorated block is rejected instead of treated as combinational */
  public BlockClassifier(boolean requireDecoration) { this.requireDecoration = requireDecoration; }

  /**
   * Classifies a block.
   * @param functionDef the FUNCTION_DEF node
   * @param ctx context to resolve sensitivity signals against
   */
  Classification classify(SyntaxNode functionDef, ElaborationContext ctx) {
    List<SyntaxNode> decorations = functionDef.child(0).getChildren();
    int defLine = functionDef.getLine();
    if (decorations.isEmpty()) {
      if (requireDecoration)
        throw ctx.syntaxError(Kind.UndecoratedBlock, "Block " + functionDef.getToken() + " needs one of @always_comb, @always_ff(...), @initial",
                              defLine);
      logger.warn("Undecorated block {} ({}:{}) is treated as combinational. Bare blocks are deprecated, use @always_comb or @always_ff",
                  functionDef.getToken(), ctx.source.filename(), ctx.absoluteLine(defLine));
      return new Classification(BlockType.Combinational, List.of());
    }
    if (decorations.size() > 1)
      throw ctx.syntaxError(Kind.MultipleDecorations, "Block " + functionDef.getToken() + " has " + decorations.size() + " decorations",
                            defLine);

    SyntaxNode decoration = decorations.get(0);
    int line = ElaborationContext.lineOf(decoration, defLine);
    SyntaxNode nameNode = decoration.is(NodeKind.CALL) ? decoration.child(0) : decoration;
    if (!nameNode.is(NodeKind.NAME))
      throw ctx.syntaxError(Kind.UnknownDecoration, "Unrecognized decoration " + decoration, line);
    BlockDecoration blockDecoration = BlockDecoration.fromSerialName(nameNode.getToken())
                                          .orElseThrow(() -> ctx.syntaxError(Kind.UnknownDecoration, "Unrecognized decoration " + nameNode, line));
    if (blockDecoration.blockType != BlockType.Sequential)
      return new Classification(blockDecoration.blockType, List.of());

    if (!decoration.is(NodeKind.CALL))
      throw ctx.syntaxError(Kind.MalformedSensitivity, "@" + nameNode + " needs a sensitivity list", line);
    List<SensitivityEntry> sensitivity = new ArrayList<>();
    for (SyntaxNode entry : decoration.getChildren().subList(1, decoration.size()))
      sensitivity.add(parseEntry(entry, ctx, line));
    logger.debug("Block {} is sequential with sensitivity {}", functionDef.getToken(), sensitivity);
    return new Classification(BlockType.Sequential, sensitivity);
  }

  private SensitivityEntry parseEntry(SyntaxNode entry, ElaborationContext ctx, int line) {
    if (!(entry.is(NodeKind.TUPLE) || entry.is(NodeKind.LIST)) || entry.size() != 2)
      throw ctx.syntaxError(Kind.MalformedSensitivity, "Sensitivity entry " + entry + " must be an (edge, signal) pair", line);
    SyntaxNode edgeNode = entry.child(0);
    SyntaxNode signalNode = entry.child(1);

    if (!edgeNode.is(NodeKind.NAME) && !edgeNode.is(NodeKind.ATTRIBUTE))
      throw ctx.syntaxError(Kind.MalformedSensitivity, "Invalid edge " + edgeNode, line);
    EdgeKind edge = EdgeKind.fromToken(edgeNode.getToken())
                        .orElseThrow(() -> ctx.syntaxError(Kind.MalformedSensitivity, "Unknown edge " + edgeNode.getToken(), line));

    if (signalNode.is(NodeKind.STR))
      return new SensitivityEntry(edge, (String)signalNode.getLiteral());
    if (!signalNode.is(NodeKind.NAME) && !signalNode.is(NodeKind.ATTRIBUTE))
      throw ctx.syntaxError(Kind.MalformedSensitivity, "Invalid sensitivity signal " + signalNode, line);
    EvalResult resolved = ctx.classify(signalNode);
    if (resolved instanceof EvalResult.SignalValued && ((EvalResult.SignalValued)resolved).value() instanceof Value.Signal)
      return new SensitivityEntry(edge, ((Value.Signal)((EvalResult.SignalValued)resolved).value()).variable().getName());
    String reason = resolved instanceof EvalResult.Failure ? ((EvalResult.Failure)resolved).message() : signalNode + " is not a signal";
    throw ctx.evalError(CompileTimeEvalException.Kind.UndefinedSignal, reason, line);
  }
}
