package stela.frontend;

import java.util.Optional;

/**
 * Kind tag of a {@link SyntaxNode}.
 * The child layout of each kind is fixed; the comment of each constant lists it.
 */
public enum NodeKind {
  // statements
  /** token: function name; children: DECORATORS, PARAMETERS, BLOCK body */
  FUNCTION_DEF("function_def", true),
  /** children: decoration expressions */
  DECORATORS("decorators", false),
  /** children: NAME per parameter */
  PARAMETERS("parameters", false),
  /** children: statements */
  BLOCK("block", true),
  /** children: target..., value (last) */
  ASSIGN("assign", true),
  /** token: binary operator; children: target, value */
  AUG_ASSIGN("aug_assign", true),
  /** children: target, iterable, BLOCK body, BLOCK orelse */
  FOR("for", true),
  /** children: test, BLOCK body, BLOCK orelse */
  IF("if", true),
  /** children: expression */
  EXPR_STMT("expr", true),
  /** children: expression */
  ASSERT("assert", true),
  /** children: exception expression, or none */
  RAISE("raise", true),
  /** children: value, or none */
  RETURN("return", true),
  /** no children */
  PASS("pass", true),

  // expressions
  /** token: identifier */
  NAME("name", false),
  /** literal: Long */
  INT("int", false),
  /** literal: String */
  STR("str", false),
  /** literal: Boolean */
  BOOL("bool", false),
  /** token: attribute name; children: value */
  ATTRIBUTE("attribute", false),
  /** children: value, index */
  SUBSCRIPT("subscript", false),
  /** children: value, upper, lower */
  SLICE("slice", false),
  /** children: function, arguments... */
  CALL("call", false),
  /** token: operator; children: left, right */
  BIN_OP("bin_op", false),
  /** token: operator (not, -, +, ~); children: operand */
  UNARY_OP("unary_op", false),
  /** token: and / or; children: operands (two or more) */
  BOOL_OP("bool_op", false),
  /** token: comparison operator; children: left, right */
  COMPARE("compare", false),
  /** children: elements */
  TUPLE("tuple", false),
  /** children: elements */
  LIST("list", false),
  /** token: reduction method (eq, and_, or_, r_not); children: receiver, argument (none for r_not) */
  REDUCE("reduce", false);

  private final String serialName;
  private final boolean statement;

  private NodeKind(String serialName, boolean statement) {
    this.serialName = serialName;
    this.statement = statement;
  }

  public String getSerialName() { return serialName; }
  public boolean isStatement() { return statement; }

  public static Optional<NodeKind> fromSerialName(String serialName) {
    for (NodeKind kind : values()) {
      if (kind.serialName.equals(serialName))
        return Optional.of(kind);
    }
    return Optional.empty();
  }
}
