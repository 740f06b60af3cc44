package stela.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for {@link SyntaxNode} trees.
 * Expressions built without a line get line 0 and report the line of their enclosing statement.
 */
public final class Syntax {
  private Syntax() {}

  private static SyntaxNode node(NodeKind kind, String token, Object literal, int line, SyntaxNode... children) {
    return new SyntaxNode(kind, token, literal, Arrays.asList(children), line, 0);
  }

  //// expressions

  public static SyntaxNode name(String id) { return name(id, 0); }
  public static SyntaxNode name(String id, int line) { return node(NodeKind.NAME, id, null, line); }

  public static SyntaxNode intLit(long value) { return node(NodeKind.INT, null, value, 0); }
  public static SyntaxNode str(String value) { return node(NodeKind.STR, null, value, 0); }
  public static SyntaxNode bool(boolean value) { return node(NodeKind.BOOL, null, value, 0); }

  /**
   * Creates the literal node matching a Java value.
   * @param literal Long, Integer, String or Boolean
   */
  public static SyntaxNode literal(Object literal, int line, int column) {
    if (literal instanceof Integer)
      literal = Long.valueOf((Integer)literal);
    NodeKind kind;
    if (literal instanceof Long)
      kind = NodeKind.INT;
    else if (literal instanceof String)
      kind = NodeKind.STR;
    else if (literal instanceof Boolean)
      kind = NodeKind.BOOL;
    else
      throw new IllegalArgumentException("Not a literal: " + literal);
    return new SyntaxNode(kind, null, literal, List.of(), line, column);
  }

  public static SyntaxNode attr(SyntaxNode value, String attribute) { return node(NodeKind.ATTRIBUTE, attribute, null, 0, value); }

  /** Dotted path such as {@code self.clk}. */
  public static SyntaxNode path(String dotted) {
    String[] parts = dotted.split("\\.");
    SyntaxNode result = name(parts[0]);
    for (int i = 1; i < parts.length; ++i)
      result = attr(result, parts[i]);
    return result;
  }

  public static SyntaxNode subscript(SyntaxNode value, SyntaxNode index) { return node(NodeKind.SUBSCRIPT, null, null, 0, value, index); }
  public static SyntaxNode slice(SyntaxNode value, SyntaxNode upper, SyntaxNode lower) {
    return node(NodeKind.SLICE, null, null, 0, value, upper, lower);
  }

  public static SyntaxNode call(SyntaxNode function, SyntaxNode... args) {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(function);
    children.addAll(Arrays.asList(args));
    return new SyntaxNode(NodeKind.CALL, null, null, children, 0, 0);
  }
  public static SyntaxNode call(String function, SyntaxNode... args) { return call(name(function), args); }

  public static SyntaxNode binOp(String op, SyntaxNode left, SyntaxNode right) { return node(NodeKind.BIN_OP, op, null, 0, left, right); }
  public static SyntaxNode unary(String op, SyntaxNode operand) { return node(NodeKind.UNARY_OP, op, null, 0, operand); }
  public static SyntaxNode not(SyntaxNode operand) { return unary("not", operand); }
  public static SyntaxNode and(SyntaxNode... operands) { return boolOp("and", 0, operands); }
  public static SyntaxNode or(SyntaxNode... operands) { return boolOp("or", 0, operands); }
  public static SyntaxNode boolOp(String op, int line, SyntaxNode... operands) {
    if (operands.length < 2)
      throw new IllegalArgumentException("A boolean operator needs at least two operands");
    return node(NodeKind.BOOL_OP, op, null, line, operands);
  }
  public static SyntaxNode compare(String op, SyntaxNode left, SyntaxNode right) { return node(NodeKind.COMPARE, op, null, 0, left, right); }
  public static SyntaxNode eq(SyntaxNode left, SyntaxNode right) { return compare("==", left, right); }

  public static SyntaxNode tuple(SyntaxNode... elements) { return node(NodeKind.TUPLE, null, null, 0, elements); }
  public static SyntaxNode list(SyntaxNode... elements) { return node(NodeKind.LIST, null, null, 0, elements); }

  /**
   * Reduction call on a signal-valued receiver.
   * @param method one of eq, and_, or_, r_not
   */
  public static SyntaxNode reduce(String method, int line, SyntaxNode receiver, SyntaxNode... args) {
    List<SyntaxNode> children = new ArrayList<>();
    children.add(receiver);
    children.addAll(Arrays.asList(args));
    return new SyntaxNode(NodeKind.REDUCE, method, null, children, line, 0);
  }

  //// statements

  public static SyntaxNode block(int line, SyntaxNode... statements) { return block(line, Arrays.asList(statements)); }
  public static SyntaxNode block(int line, List<SyntaxNode> statements) {
    return new SyntaxNode(NodeKind.BLOCK, null, null, statements, line, 0);
  }

  public static SyntaxNode assign(int line, SyntaxNode target, SyntaxNode value) { return node(NodeKind.ASSIGN, null, null, line, target, value); }
  /** Chained assignment {@code a = b = value}. */
  public static SyntaxNode assignMulti(int line, SyntaxNode value, SyntaxNode... targets) {
    List<SyntaxNode> children = new ArrayList<>(Arrays.asList(targets));
    children.add(value);
    return new SyntaxNode(NodeKind.ASSIGN, null, null, children, line, 0);
  }
  public static SyntaxNode augAssign(int line, String op, SyntaxNode target, SyntaxNode value) {
    return node(NodeKind.AUG_ASSIGN, op, null, line, target, value);
  }

  public static SyntaxNode forLoop(int line, SyntaxNode target, SyntaxNode iterable, SyntaxNode... body) {
    return forElse(line, target, iterable, Arrays.asList(body), List.of());
  }
  public static SyntaxNode forElse(int line, SyntaxNode target, SyntaxNode iterable, List<SyntaxNode> body, List<SyntaxNode> orelse) {
    int elseLine = orelse.isEmpty() ? line : orelse.get(0).getLine();
    return node(NodeKind.FOR, null, null, line, target, iterable, block(line + 1, body), block(elseLine, orelse));
  }

  public static SyntaxNode ifStmt(int line, SyntaxNode test, SyntaxNode... body) { return ifElse(line, test, Arrays.asList(body), List.of()); }
  public static SyntaxNode ifElse(int line, SyntaxNode test, List<SyntaxNode> body, List<SyntaxNode> orelse) {
    int elseLine = orelse.isEmpty() ? line : orelse.get(0).getLine();
    return node(NodeKind.IF, null, null, line, test, block(line + 1, body), block(elseLine, orelse));
  }

  public static SyntaxNode exprStmt(int line, SyntaxNode expr) { return node(NodeKind.EXPR_STMT, null, null, line, expr); }
  /** The {@code assert_(value)} call statement. */
  public static SyntaxNode assertCall(int line, SyntaxNode value) { return exprStmt(line, call("assert_", value)); }
  public static SyntaxNode assertStmt(int line, SyntaxNode value) { return node(NodeKind.ASSERT, null, null, line, value); }
  public static SyntaxNode raise(int line, SyntaxNode exception) { return node(NodeKind.RAISE, null, null, line, exception); }
  public static SyntaxNode ret(int line, SyntaxNode value) { return node(NodeKind.RETURN, null, null, line, value); }
  public static SyntaxNode pass(int line) { return node(NodeKind.PASS, null, null, line); }

  public static SyntaxNode functionDef(int line, String name, List<SyntaxNode> decorators, List<String> parameters,
                                       List<SyntaxNode> body) {
    List<SyntaxNode> params = new ArrayList<>();
    for (String parameter : parameters)
      params.add(name(parameter, line));
    return node(NodeKind.FUNCTION_DEF, name, null, line, new SyntaxNode(NodeKind.DECORATORS, null, null, decorators, line, 0),
                new SyntaxNode(NodeKind.PARAMETERS, null, null, params, line, 0), block(line + 1, body));
  }
}
