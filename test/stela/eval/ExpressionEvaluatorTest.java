package stela.eval;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import stela.backend.sv.SVGenerator;
import stela.frontend.Syntax;
import stela.frontend.SyntaxNode;

class ExpressionEvaluatorTest {
  ExpressionEvaluator evaluator = new ExpressionEvaluator();
  SVGenerator generator;
  Environment env;

  @BeforeEach
  void setUp() {
    generator = new SVGenerator("g");
    env = Environment.builder()
              .bind("a", generator.var("a", 4))
              .bind("b", generator.var("b", 4))
              .bind("mem", generator.var("mem", 8, false, 4))
              .bind("n", 3)
              .bind("names", List.of("x", "y", "z"))
              .bind("self", Map.of("width", 8, "clk", generator.var("clk", 1)))
              .build();
  }

  private Value literal(SyntaxNode expr) {
    EvalResult result = evaluator.classify(expr, env);
    Assertions.assertInstanceOf(EvalResult.Literal.class, result, () -> expr + " gave " + result);
    return ((EvalResult.Literal)result).value();
  }

  private EvalResult.Failure failure(SyntaxNode expr) {
    EvalResult result = evaluator.classify(expr, env);
    Assertions.assertInstanceOf(EvalResult.Failure.class, result, () -> expr + " gave " + result);
    return (EvalResult.Failure)result;
  }

  @Test
  void testHostArithmetic() {
    Assertions.assertEquals(new Value.Int(7), literal(Syntax.binOp("+", Syntax.name("n"), Syntax.intLit(4))));
    Assertions.assertEquals(new Value.Int(-4), literal(Syntax.binOp("//", Syntax.intLit(7), Syntax.intLit(-2))));
    Assertions.assertEquals(new Value.Int(2), literal(Syntax.binOp("%", Syntax.intLit(-7), Syntax.intLit(3))));
    Assertions.assertEquals(new Value.Int(1024), literal(Syntax.binOp("**", Syntax.intLit(2), Syntax.intLit(10))));
    Assertions.assertEquals(new Value.Int(12), literal(Syntax.binOp("<<", Syntax.name("n"), Syntax.intLit(2))));
    Assertions.assertEquals(new Value.Int(2), literal(Syntax.binOp("+", Syntax.bool(true), Syntax.intLit(1))));
    Assertions.assertEquals(new Value.Int(-3), literal(Syntax.unary("-", Syntax.name("n"))));
  }

  @Test
  void testHostStringsAndSequences() {
    Assertions.assertEquals(new Value.Str("abc"), literal(Syntax.binOp("+", Syntax.str("ab"), Syntax.str("c"))));
    Assertions.assertEquals(new Value.Str("aaa"), literal(Syntax.binOp("*", Syntax.str("a"), Syntax.intLit(3))));
    Assertions.assertEquals(new Value.Str("z"), literal(Syntax.subscript(Syntax.name("names"), Syntax.intLit(-1))));
    Assertions.assertEquals(Value.Bool.TRUE, literal(Syntax.compare("in", Syntax.str("y"), Syntax.name("names"))));
    Assertions.assertEquals(Value.Bool.FALSE, literal(Syntax.compare("not in", Syntax.intLit(3), Syntax.list(Syntax.intLit(3)))));
    Assertions.assertEquals(new Value.Int(8), literal(Syntax.path("self.width")));
  }

  @Test
  void testBuiltins() {
    Value range = literal(Syntax.call("range", Syntax.intLit(1), Syntax.intLit(7), Syntax.intLit(3)));
    Assertions.assertEquals(new Value.Seq(List.of(new Value.Int(1), new Value.Int(4))), range);
    Assertions.assertEquals(new Value.Int(4), literal(Syntax.call("len", Syntax.call("range", Syntax.intLit(4)))));
    Assertions.assertEquals(new Value.Int(1), literal(Syntax.call("min", Syntax.intLit(3), Syntax.intLit(1), Syntax.intLit(2))));
    Assertions.assertEquals(new Value.Int(4), literal(Syntax.call("max", Syntax.call("range", Syntax.intLit(5)))));
    Assertions.assertEquals(new Value.Int(3), literal(Syntax.call("abs", Syntax.intLit(-3))));
    Assertions.assertEquals(new Value.Seq(List.of()), literal(Syntax.call("range", Syntax.intLit(0))));
  }

  @Test
  void testLogicalOperatorsReturnDecidingOperand() {
    Assertions.assertEquals(new Value.Int(0), literal(Syntax.and(Syntax.intLit(3), Syntax.intLit(0))));
    Assertions.assertEquals(new Value.Str("x"), literal(Syntax.or(Syntax.intLit(0), Syntax.str("x"))));
    Assertions.assertEquals(Value.Bool.TRUE, literal(Syntax.not(Syntax.list())));
  }

  @Test
  void testSignalClassification() {
    Assertions.assertEquals(new EvalResult.SignalValued(env.lookup("a").orElseThrow()), evaluator.classify(Syntax.name("a"), env));
    Assertions.assertTrue(evaluator.isSignalValued(Syntax.binOp("+", Syntax.name("a"), Syntax.intLit(1)), env));
    Assertions.assertTrue(evaluator.isSignalValued(Syntax.eq(Syntax.name("a"), Syntax.name("b")), env));
    Assertions.assertTrue(evaluator.isSignalValued(Syntax.not(Syntax.name("a")), env));
    Assertions.assertTrue(evaluator.isSignalValued(Syntax.slice(Syntax.name("a"), Syntax.intLit(1), Syntax.intLit(0)), env));
    Assertions.assertTrue(evaluator.isSignalValued(Syntax.subscript(Syntax.name("mem"), Syntax.name("n")), env));
    Assertions.assertTrue(evaluator.isSignalValued(Syntax.path("self.clk"), env));
    Assertions.assertFalse(evaluator.isSignalValued(Syntax.name("n"), env));
  }

  @Test
  void testBackendEvaluation() {
    BackendSignalOps ops = new BackendSignalOps(generator);
    Value sum = evaluator.evaluate(Syntax.binOp("+", Syntax.name("a"), Syntax.intLit(1)), env, ops);
    Assertions.assertEquals("(a + 4'd1)", sum.toString());
    Value element = evaluator.evaluate(Syntax.subscript(Syntax.name("mem"), Syntax.binOp("-", Syntax.name("n"), Syntax.intLit(1))), env, ops);
    Assertions.assertEquals("mem[2]", element.toString());
    Value reduced = evaluator.evaluate(Syntax.reduce("and_", 0, Syntax.name("a"), Syntax.name("b")), env, ops);
    Assertions.assertEquals("(a && b)", reduced.toString());
  }

  @Test
  void testFailures() {
    Assertions.assertTrue(failure(Syntax.name("undefined")).message().contains("not defined"));
    Assertions.assertTrue(failure(Syntax.binOp("/", Syntax.intLit(1), Syntax.intLit(2))).message().contains("division"));
    Assertions.assertTrue(failure(Syntax.call("print", Syntax.intLit(1))).message().contains("not supported"));
    failure(Syntax.binOp("//", Syntax.intLit(1), Syntax.intLit(0)));
    failure(Syntax.subscript(Syntax.name("names"), Syntax.intLit(3)));
    failure(Syntax.path("self.missing"));
    failure(Syntax.call("len", Syntax.name("a")));
    failure(Syntax.call("range", Syntax.intLit(1), Syntax.intLit(2), Syntax.intLit(0)));
  }

  @Test
  void testRepetitionIsBounded() {
    Assertions.assertTrue(failure(Syntax.binOp("*", Syntax.str("ab"), Syntax.intLit(4294967297L))).message().contains("Repetition"));
    Assertions.assertTrue(failure(Syntax.binOp("*", Syntax.list(Syntax.intLit(0)), Syntax.intLit(1_000_000_000L))).message().contains("Repetition"));
    Assertions.assertEquals(new Value.Str(""), literal(Syntax.binOp("*", Syntax.str(""), Syntax.intLit(4294967297L))));
    Assertions.assertEquals(new Value.Seq(List.of()), literal(Syntax.binOp("*", Syntax.intLit(-2), Syntax.list(Syntax.intLit(0)))));
    Assertions.assertEquals(new Value.Int(6), literal(Syntax.call("len", Syntax.binOp("*", Syntax.tuple(Syntax.intLit(1), Syntax.intLit(2)), Syntax.intLit(3)))));
  }

  @Test
  void testMixingSignalAndHostFails() {
    SyntaxNode mixed = Syntax.and(Syntax.name("a"), Syntax.intLit(1));
    Assertions.assertSame(mixed, failure(mixed).node());
    failure(Syntax.binOp("+", Syntax.name("a"), Syntax.str("x")));
    failure(Syntax.subscript(Syntax.name("mem"), Syntax.name("a")));
    failure(Syntax.reduce("or_", 0, Syntax.name("a"), Syntax.intLit(1)));
  }

  @ParameterizedTest
  @ValueSource(longs = {Long.MAX_VALUE, Long.MIN_VALUE, 1L << 62})
  void testOverflowIsReported(long value) {
    Assertions.assertTrue(failure(Syntax.binOp("*", Syntax.intLit(value), Syntax.intLit(4))).message().contains("overflow"));
  }

  @Test
  void testEvaluateInt() {
    Assertions.assertEquals(9L, evaluator.evaluateInt(Syntax.binOp("*", Syntax.name("n"), Syntax.name("n")), env).orElseThrow());
    Assertions.assertTrue(evaluator.evaluateInt(Syntax.name("a"), env).isEmpty());
    Assertions.assertTrue(evaluator.evaluateInt(Syntax.str("x"), env).isEmpty());
  }
}
