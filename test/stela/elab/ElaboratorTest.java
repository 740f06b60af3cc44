package stela.elab;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.WriterAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import stela.backend.ScopeVariable;
import stela.backend.SourceLocation;
import stela.backend.Statement;
import stela.backend.VarException;
import stela.backend.sv.SVGenerator;
import stela.backend.sv.SVIfStatement;
import stela.eval.Environment;
import stela.eval.Value;
import stela.frontend.Syntax;
import stela.frontend.SyntaxNode;
import stela.ui.StelaConfig;

class ElaboratorTest {
  static final SourceInfo SOURCE = new SourceInfo("blocks.py", 10);

  SVGenerator generator;
  Environment env;
  StelaConfig cfg;

  @BeforeEach
  void setUp() {
    generator = new SVGenerator("top");
    env = newEnvironment(generator);
    cfg = new StelaConfig();
  }

  static Environment newEnvironment(SVGenerator generator) {
    Value.Namespace self = new Value.Namespace("self", Map.of("clk", new Value.Signal(generator.var("clk", 1)), "rst",
                                                              new Value.Signal(generator.var("rst", 1))));
    return Environment.builder()
        .bind("self", self)
        .bind("a", generator.var("a", 4))
        .bind("s", generator.var("s", 4))
        .bind("wide", generator.var("wide", 8))
        .bind("x", generator.var("x", 4, false, 3))
        .bind("y", generator.var("y", 4))
        .bind("p", generator.var("p", 1))
        .bind("q", generator.var("q", 1))
        .bind("r", generator.var("r", 1))
        .bind("out", generator.var("out", 1))
        .bind("n", 3)
        .build();
  }

  static SyntaxNode comb(SyntaxNode... body) {
    return Syntax.functionDef(1, "blk", List.of(Syntax.name("always_comb")), List.of("self"), List.of(body));
  }

  ElaboratedBlock elaborate(SyntaxNode functionDef) { return new Elaborator(generator, cfg).elaborateBlock(functionDef, env, SOURCE); }

  static List<String> render(List<Statement> stmts) { return stmts.stream().map(Statement::toString).collect(Collectors.toList()); }

  <T extends ElaborationException> T assertFails(Class<T> type, SyntaxNode functionDef) {
    return Assertions.assertThrows(type, () -> elaborate(functionDef));
  }

  @Test
  void testUnrollsLoopInOrder() {
    ElaboratedBlock block = elaborate(comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.call("range", Syntax.intLit(3)),
                                                          Syntax.assign(3, Syntax.subscript(Syntax.name("x"), Syntax.name("i")), Syntax.name("y")))));
    Assertions.assertEquals(BlockType.Combinational, block.blockType());
    Assertions.assertEquals(List.of(), block.sensitivity());
    Assertions.assertEquals(List.of("x[0] = y;", "x[1] = y;", "x[2] = y;"), render(block.statements()));
  }

  @Test
  void testPrunesStaticConditional() {
    ElaboratedBlock block = elaborate(comb(Syntax.ifElse(2, Syntax.bool(true), List.of(Syntax.assign(3, Syntax.name("a"), Syntax.intLit(1))),
                                                         List.of(Syntax.assign(5, Syntax.name("a"), Syntax.intLit(2))))));
    Assertions.assertEquals(List.of("a = 4'd1;"), render(block.statements()));
  }

  @Test
  void testPrunesOnLoopVariable() {
    ElaboratedBlock block = elaborate(comb(Syntax.forLoop(
        2, Syntax.name("i"), Syntax.call("range", Syntax.name("n")),
        Syntax.ifStmt(3, Syntax.eq(Syntax.name("i"), Syntax.intLit(1)), Syntax.assign(4, Syntax.name("a"), Syntax.name("i"))))));
    Assertions.assertEquals(List.of("a = 4'd1;"), render(block.statements()));
  }

  @Test
  void testRuntimeConditional() {
    ElaboratedBlock block = elaborate(comb(Syntax.ifElse(2, Syntax.eq(Syntax.name("s"), Syntax.intLit(3)),
                                                         List.of(Syntax.assign(3, Syntax.name("out"), Syntax.intLit(1))),
                                                         List.of(Syntax.assign(5, Syntax.name("out"), Syntax.intLit(0))))));
    Assertions.assertEquals(1, block.statements().size());
    Assertions.assertInstanceOf(SVIfStatement.class, block.statements().get(0));
    Assertions.assertEquals("if ((s == 4'd3)) begin\n  out = 1'd1;\nend\nelse begin\n  out = 1'd0;\nend", block.statements().get(0).toString());
  }

  @Test
  void testSensitivityList() {
    SyntaxNode decoration = Syntax.call("always_ff", Syntax.tuple(Syntax.name("posedge"), Syntax.path("self.clk")),
                                        Syntax.tuple(Syntax.name("negedge"), Syntax.path("self.rst")));
    ElaboratedBlock block = elaborate(Syntax.functionDef(1, "seq", List.of(decoration), List.of("self"),
                                                         List.of(Syntax.assign(2, Syntax.name("a"), Syntax.name("y")))));
    Assertions.assertEquals(BlockType.Sequential, block.blockType());
    Assertions.assertEquals("[(Posedge, clk), (Negedge, rst)]", block.sensitivity().toString());
    Assertions.assertEquals(List.of("a = y;"), render(block.statements()));
  }

  @Test
  void testLogicalOperatorsOnSignals() {
    ElaboratedBlock block = elaborate(comb(Syntax.assign(2, Syntax.name("out"), Syntax.and(Syntax.name("p"), Syntax.name("q"), Syntax.name("r"))),
                                           Syntax.assign(3, Syntax.name("out"), Syntax.not(Syntax.or(Syntax.name("p"), Syntax.name("q")))),
                                           Syntax.assertCall(4, Syntax.name("p")),
                                           Syntax.assertStmt(5, Syntax.eq(Syntax.name("s"), Syntax.intLit(3)))));
    Assertions.assertEquals(List.of("out = ((p && q) && r);", "out = !(p || q);", "assert (p);", "assert ((s == 4'd3));"),
                            render(block.statements()));
  }

  @Test
  void testAugmentedAssignmentAndRaise() {
    ElaboratedBlock block = elaborate(comb(Syntax.augAssign(2, "+", Syntax.name("a"), Syntax.intLit(1)),
                                           Syntax.raise(3, Syntax.call("Exception", Syntax.str("unreachable"))), Syntax.pass(4)));
    Assertions.assertEquals(List.of("a = (a + 4'd1);", "assert (1'd0);"), render(block.statements()));
  }

  @Test
  void testMixedOperandsAreRejected() {
    MixedOperandException ex = assertFails(MixedOperandException.class,
                                           comb(Syntax.ifStmt(2, Syntax.and(Syntax.name("p"), Syntax.intLit(1)),
                                                              Syntax.assign(3, Syntax.name("out"), Syntax.intLit(1)))));
    Assertions.assertEquals("blocks.py", ex.getFilename());
    Assertions.assertEquals(11, ex.getLine());
  }

  @Test
  void testLoopErrors() {
    var forElse = assertFails(SyntaxRestrictionException.class,
                              comb(Syntax.forElse(2, Syntax.name("i"), Syntax.call("range", Syntax.intLit(2)), List.of(Syntax.pass(3)),
                                                  List.of(Syntax.pass(5)))));
    Assertions.assertEquals(SyntaxRestrictionException.Kind.IllegalSyntax, forElse.getKind());
    Assertions.assertEquals(14, forElse.getLine());

    var overSignal = assertFails(CompileTimeEvalException.class, comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.name("a"), Syntax.pass(3))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.UnresolvableIterable, overSignal.getKind());
    Assertions.assertEquals(11, overSignal.getLine());

    var undefined = assertFails(CompileTimeEvalException.class, comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.name("nope"), Syntax.pass(3))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.UnresolvableIterable, undefined.getKind());

    var signalElements = assertFails(CompileTimeEvalException.class,
                                     comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.list(Syntax.name("a")), Syntax.pass(3))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.NonLiteralLoopValue, signalElements.getKind());

    // the second value is rejected before the body is elaborated for the first one
    var lateSignal = assertFails(CompileTimeEvalException.class,
                                 comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.list(Syntax.intLit(0), Syntax.name("a")),
                                                     Syntax.assign(3, Syntax.name("out"), Syntax.name("nope")))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.NonLiteralLoopValue, lateSignal.getKind());
    Assertions.assertEquals(11, lateSignal.getLine());

    var tupleTarget = assertFails(SyntaxRestrictionException.class,
                                  comb(Syntax.forLoop(2, Syntax.tuple(Syntax.name("i"), Syntax.name("j")), Syntax.call("range", Syntax.intLit(2)),
                                                      Syntax.pass(3))));
    Assertions.assertEquals(SyntaxRestrictionException.Kind.UnsupportedTarget, tupleTarget.getKind());
  }

  @Test
  void testPredicateErrors() {
    var nonBool = assertFails(CompileTimeEvalException.class,
                              comb(Syntax.ifStmt(2, Syntax.intLit(1), Syntax.assign(3, Syntax.name("a"), Syntax.intLit(1)))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.NonBooleanPredicate, nonBool.getKind());

    var undefined = assertFails(CompileTimeEvalException.class,
                                comb(Syntax.ifStmt(2, Syntax.name("nope"), Syntax.assign(3, Syntax.name("a"), Syntax.intLit(1)))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.UnresolvableExpression, undefined.getKind());
    Assertions.assertEquals(11, undefined.getLine());
  }

  @Test
  void testStatementRestrictions() {
    SyntaxNode[] rejected = {
        Syntax.assign(2, Syntax.tuple(Syntax.name("a"), Syntax.name("y")), Syntax.tuple(Syntax.intLit(1), Syntax.intLit(2))),
        Syntax.assignMulti(2, Syntax.intLit(1), Syntax.name("a"), Syntax.name("y")),
        Syntax.ret(2, Syntax.name("a")),
        Syntax.exprStmt(2, Syntax.call("print", Syntax.name("a"))),
        Syntax.exprStmt(2, Syntax.call("assert_", Syntax.name("p"), Syntax.name("q"))),
    };
    for (SyntaxNode stmt : rejected) {
      var ex = assertFails(SyntaxRestrictionException.class, comb(stmt));
      Assertions.assertEquals(SyntaxRestrictionException.Kind.UnsupportedSyntax, ex.getKind(), stmt::toString);
      Assertions.assertEquals(11, ex.getLine());
    }
    var raise = assertFails(SyntaxRestrictionException.class, comb(Syntax.raise(2, Syntax.call("ValueError"))));
    Assertions.assertEquals(SyntaxRestrictionException.Kind.UnsupportedRaise, raise.getKind());
  }

  @Test
  void testNonSignalOperands() {
    var hostTarget = assertFails(CompileTimeEvalException.class, comb(Syntax.assign(2, Syntax.name("n"), Syntax.intLit(1))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.NonSignalValue, hostTarget.getKind());
    var stringValue = assertFails(CompileTimeEvalException.class, comb(Syntax.assign(2, Syntax.name("a"), Syntax.str("x"))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.NonSignalValue, stringValue.getKind());
    var hostAssert = assertFails(CompileTimeEvalException.class, comb(Syntax.assertCall(2, Syntax.intLit(1))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.NonSignalValue, hostAssert.getKind());
  }

  @Test
  void testDecorationErrors() {
    var multiple = assertFails(SyntaxRestrictionException.class,
                               Syntax.functionDef(1, "blk", List.of(Syntax.name("always_comb"), Syntax.name("initial")), List.of("self"),
                                                  List.of(Syntax.pass(2))));
    Assertions.assertEquals(SyntaxRestrictionException.Kind.MultipleDecorations, multiple.getKind());
    Assertions.assertEquals(10, multiple.getLine());

    var unknown = assertFails(SyntaxRestrictionException.class, Syntax.functionDef(1, "blk", List.of(Syntax.name("always_latch")),
                                                                                   List.of("self"), List.of(Syntax.pass(2))));
    Assertions.assertEquals(SyntaxRestrictionException.Kind.UnknownDecoration, unknown.getKind());

    var bare = assertFails(SyntaxRestrictionException.class, Syntax.functionDef(1, "blk", List.of(Syntax.name("always_ff")), List.of("self"),
                                                                                List.of(Syntax.pass(2))));
    Assertions.assertEquals(SyntaxRestrictionException.Kind.MalformedSensitivity, bare.getKind());

    var shortEntry = assertFails(SyntaxRestrictionException.class,
                                 Syntax.functionDef(1, "blk", List.of(Syntax.call("always_ff", Syntax.tuple(Syntax.name("posedge")))),
                                                    List.of("self"), List.of(Syntax.pass(2))));
    Assertions.assertEquals(SyntaxRestrictionException.Kind.MalformedSensitivity, shortEntry.getKind());

    var missing = assertFails(CompileTimeEvalException.class,
                              Syntax.functionDef(1, "blk",
                                                 List.of(Syntax.call("always_ff", Syntax.tuple(Syntax.name("posedge"), Syntax.path("self.missing")))),
                                                 List.of("self"), List.of(Syntax.pass(2))));
    Assertions.assertEquals(CompileTimeEvalException.Kind.UndefinedSignal, missing.getKind());

    var params = assertFails(SyntaxRestrictionException.class, Syntax.functionDef(1, "blk", List.of(Syntax.name("always_comb")),
                                                                                  List.of("self", "extra"), List.of(Syntax.pass(2))));
    Assertions.assertEquals(SyntaxRestrictionException.Kind.UnsupportedSyntax, params.getKind());
  }

  @Test
  void testUndecoratedBlock() {
    SyntaxNode undecorated = Syntax.functionDef(1, "blk", List.of(), List.of("self"), List.of(Syntax.assign(2, Syntax.name("a"), Syntax.name("y"))));
    Assertions.assertEquals(BlockType.Combinational, elaborate(undecorated).blockType());

    cfg.require_decoration = true;
    var ex = assertFails(SyntaxRestrictionException.class, undecorated);
    Assertions.assertEquals(SyntaxRestrictionException.Kind.UndecoratedBlock, ex.getKind());
  }

  @Test
  void testInitialBlock() {
    ElaboratedBlock block = elaborate(Syntax.functionDef(1, "init", List.of(Syntax.name("initial")), List.of(),
                                                         List.of(Syntax.assign(2, Syntax.name("a"), Syntax.intLit(0)))));
    Assertions.assertEquals(BlockType.Initial, block.blockType());
    Assertions.assertEquals(List.of("a = 4'd0;"), render(block.statements()));
  }

  @Test
  void testWidthMismatchPropagates() {
    Assertions.assertThrows(VarException.class, () -> elaborate(comb(Syntax.assign(2, Syntax.name("a"), Syntax.name("wide")))));
    Assertions.assertThrows(VarException.class, () -> elaborate(comb(Syntax.assign(2, Syntax.name("a"), Syntax.intLit(16)))));
    Assertions.assertThrows(VarException.class,
                            () -> elaborate(comb(Syntax.assign(2, Syntax.subscript(Syntax.name("x"), Syntax.intLit(3)), Syntax.name("y")))));
  }

  /** Runs an action while collecting the messages of error events. */
  static List<String> captureErrors(Runnable action) {
    StringWriter log = new StringWriter();
    LoggerContext context = (LoggerContext)LogManager.getContext(false);
    Configuration config = context.getConfiguration();
    LoggerConfig root = config.getRootLogger();
    Level previousLevel = root.getLevel();
    WriterAppender appender = WriterAppender.newBuilder()
                                  .setName("capture")
                                  .setTarget(log)
                                  .setLayout(PatternLayout.newBuilder().withPattern("%msg%n").build())
                                  .build();
    appender.start();
    root.addAppender(appender, Level.ERROR, null);
    root.setLevel(Level.ERROR);
    context.updateLoggers();
    try {
      action.run();
    } finally {
      root.removeAppender("capture");
      root.setLevel(previousLevel);
      context.updateLoggers();
      appender.stop();
    }
    return log.toString().lines().collect(Collectors.toList());
  }

  @Test
  void testWidthMismatchLogsSourceLine() {
    List<String> errors = captureErrors(() -> Assertions.assertThrows(
                                            VarException.class, () -> elaborate(comb(Syntax.assign(2, Syntax.name("a"), Syntax.name("wide"))))));
    Assertions.assertEquals(List.of("blocks.py:11"), errors);

    cfg.debug = true;
    errors = captureErrors(() -> Assertions.assertThrows(
                               VarException.class, () -> elaborate(comb(Syntax.ifStmt(2, Syntax.name("p"), Syntax.assign(3, Syntax.name("a"), Syntax.name("wide")))))));
    Assertions.assertEquals(List.of("blocks.py:12"), errors);
  }

  @Test
  void testNoMetadataWithoutDebug() {
    ElaboratedBlock block = elaborate(comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.call("range", Syntax.intLit(2)),
                                                          Syntax.assign(3, Syntax.subscript(Syntax.name("x"), Syntax.name("i")), Syntax.name("y")))));
    for (Statement stmt : block.statements()) {
      Assertions.assertTrue(stmt.getFileLines().isEmpty());
      Assertions.assertTrue(stmt.getScopeVariables().isEmpty());
    }
  }

  @Test
  void testDebugMetadata() {
    cfg.debug = true;
    ElaboratedBlock block = elaborate(comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.call("range", Syntax.intLit(2)),
                                                          Syntax.assign(3, Syntax.subscript(Syntax.name("x"), Syntax.name("i")), Syntax.name("y")))));
    Statement second = block.statements().get(1);
    Assertions.assertEquals(List.of(new SourceLocation("blocks.py", 12)), second.getFileLines());
    Map<String, ScopeVariable> vars = second.getScopeVariables();
    Assertions.assertEquals(new ScopeVariable("1", false), vars.get("i"));
    Assertions.assertEquals(new ScopeVariable("y", true), vars.get("y"));
    Assertions.assertEquals(new ScopeVariable("3", false), vars.get("n"));
    Assertions.assertFalse(vars.containsKey("self"));
  }

  @Test
  void testDebugWithoutCapturedLocals() {
    cfg.capture_locals = false;
    generator.setDebug(true);
    ElaboratedBlock block = elaborate(comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.list(Syntax.str("lo"), Syntax.str("hi")),
                                                          Syntax.assign(3, Syntax.name("a"), Syntax.intLit(1)))));
    Assertions.assertEquals(Map.of("i", new ScopeVariable("hi", false)), block.statements().get(1).getScopeVariables());
  }

  @Test
  void testDebugMetadataOfConditional() {
    cfg.debug = true;
    ElaboratedBlock block = elaborate(comb(Syntax.ifElse(2, Syntax.name("p"), List.of(Syntax.assign(3, Syntax.name("out"), Syntax.intLit(1))),
                                                         List.of(Syntax.assign(5, Syntax.name("out"), Syntax.intLit(0))))));
    SVIfStatement ifStmt = (SVIfStatement)block.statements().get(0);
    Assertions.assertEquals(List.of(new SourceLocation("blocks.py", 11)), ifStmt.getFileLines());
    Assertions.assertEquals(List.of(new SourceLocation("blocks.py", 11)), ifStmt.thenBody().getFileLines());
    Assertions.assertEquals(List.of(new SourceLocation("blocks.py", 14)), ifStmt.elseBody().getFileLines());
    Assertions.assertEquals(List.of(new SourceLocation("blocks.py", 12)), ifStmt.thenBody().statements().get(0).getFileLines());
  }

  @Test
  void testNestedLoopProvenance() {
    cfg.debug = true;
    cfg.capture_locals = false;
    SyntaxNode inner = Syntax.forLoop(3, Syntax.name("j"), Syntax.call("range", Syntax.name("i")),
                                      Syntax.assign(4, Syntax.subscript(Syntax.name("x"), Syntax.name("j")), Syntax.name("y")));
    ElaboratedBlock block = elaborate(comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.call("range", Syntax.intLit(3)), inner)));
    Assertions.assertEquals(List.of("x[0] = y;", "x[0] = y;", "x[1] = y;"), render(block.statements()));
    Assertions.assertEquals(Map.of("i", new ScopeVariable("2", false), "j", new ScopeVariable("1", false)),
                            block.statements().get(2).getScopeVariables());
  }

  @Test
  void testElaborationIsDeterministic() {
    SyntaxNode functionDef = comb(Syntax.forLoop(2, Syntax.name("i"), Syntax.call("range", Syntax.intLit(3)),
                                                 Syntax.ifStmt(3, Syntax.eq(Syntax.name("s"), Syntax.name("i")),
                                                               Syntax.assign(4, Syntax.subscript(Syntax.name("x"), Syntax.name("i")), Syntax.name("y")))));
    List<String> first = render(elaborate(functionDef).statements());
    SVGenerator otherGenerator = new SVGenerator("other");
    List<String> second =
        render(new Elaborator(otherGenerator, cfg).elaborateBlock(functionDef, newEnvironment(otherGenerator), SOURCE).statements());
    Assertions.assertEquals(first, second);
    Assertions.assertEquals(3, first.size());
  }

  @Test
  void testFunctionBlock() {
    SyntaxNode add = Syntax.functionDef(1, "add", List.of(), List.of("self", "u", "v"),
                                        List.of(Syntax.ret(2, Syntax.binOp("+", Syntax.name("u"), Syntax.name("v")))));
    ElaboratedFunction function =
        new Elaborator(generator, cfg).elaborateFunction(add, List.of(new PortType(4, false), new PortType(4, false)), env, SOURCE);
    Assertions.assertEquals(List.of("u", "v"), function.argNames());
    Assertions.assertEquals("add", function.function().getName());
    Assertions.assertEquals(List.of("return (u + v);"), render(function.statements()));
  }

  @Test
  void testFunctionBlockWithConditionalReturn() {
    SyntaxNode isZero = Syntax.functionDef(1, "is_zero", List.of(), List.of("u"),
                                           List.of(Syntax.ifStmt(2, Syntax.eq(Syntax.name("u"), Syntax.intLit(0)), Syntax.ret(3, Syntax.bool(true))),
                                                   Syntax.ret(4, Syntax.intLit(0))));
    ElaboratedFunction function = new Elaborator(generator, cfg).elaborateFunction(isZero, List.of(new PortType(2, false)), env, SOURCE);
    Assertions.assertEquals(List.of("if ((u == 2'd0)) begin\n  return 1'd1;\nend", "return 1'd0;"), render(function.statements()));
  }

  @Test
  void testFunctionArgumentCountMismatch() {
    SyntaxNode add = Syntax.functionDef(1, "add", List.of(), List.of("self", "u", "v"), List.of(Syntax.ret(2, Syntax.name("u"))));
    var ex = Assertions.assertThrows(SyntaxRestrictionException.class,
                                     () -> new Elaborator(generator, cfg).elaborateFunction(add, List.of(new PortType(4, false)), env, SOURCE));
    Assertions.assertEquals(SyntaxRestrictionException.Kind.UnsupportedSyntax, ex.getKind());
  }

  @Test
  void testRejectsNonFunctionNode() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> elaborate(Syntax.pass(1)));
  }
}
