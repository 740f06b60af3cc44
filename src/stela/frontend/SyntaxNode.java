package stela.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable node of an already-parsed block body.
 * Lines are relative to the enclosing function definition, whose own line is 1.
 *
 * All rewrites create new nodes. Sub-trees that a rewrite does not touch are shared between the old and the new tree,
 * so per-iteration substitution during loop unrolling never deep-copies invariant parts of the body.
 */
public final class SyntaxNode {
  private final NodeKind kind;
  private final String token;
  private final Object literal;
  private final List<SyntaxNode> children;
  private final int line;
  private final int column;
  /** Loop bindings active when this statement was produced by unrolling. Empty for source nodes. */
  private final List<LoopBinding> provenance;

  public SyntaxNode(NodeKind kind, String token, Object literal, List<SyntaxNode> children, int line, int column) {
    this(kind, token, literal, children, line, column, List.of());
  }

  private SyntaxNode(NodeKind kind, String token, Object literal, List<SyntaxNode> children, int line, int column,
                     List<LoopBinding> provenance) {
    this.kind = Objects.requireNonNull(kind);
    this.token = token;
    this.literal = literal;
    this.children = List.copyOf(children);
    this.line = line;
    this.column = column;
    this.provenance = List.copyOf(provenance);
  }

  public NodeKind getKind() { return kind; }
  public boolean is(NodeKind kind) { return this.kind == kind; }
  /** Identifier, attribute name or operator, depending on the kind. May be null. */
  public String getToken() { return token; }
  /** Long, String or Boolean for literal kinds, else null. */
  public Object getLiteral() { return literal; }
  public List<SyntaxNode> getChildren() { return children; }
  public SyntaxNode child(int i) { return children.get(i); }
  public int size() { return children.size(); }
  public int getLine() { return line; }
  public int getColumn() { return column; }
  public List<LoopBinding> getProvenance() { return provenance; }

  public SyntaxNode withChildren(List<SyntaxNode> newChildren) {
    return new SyntaxNode(kind, token, literal, newChildren, line, column, provenance);
  }
  public SyntaxNode withChild(int i, SyntaxNode newChild) {
    if (children.get(i) == newChild)
      return this;
    List<SyntaxNode> newChildren = new ArrayList<>(children);
    newChildren.set(i, newChild);
    return withChildren(newChildren);
  }
  public SyntaxNode withProvenance(List<LoopBinding> newProvenance) {
    return new SyntaxNode(kind, token, literal, children, line, column, newProvenance);
  }

  /**
   * Replaces every free occurrence of a name by a literal node positioned at the replaced occurrence.
   * A nested FOR that binds the same name shadows it: only its iterable is rewritten.
   * @param name the name to replace
   * @param literal Long, String or Boolean
   * @return this node if nothing was replaced, else the rewritten copy
   */
  public SyntaxNode substitute(String name, Object literal) {
    if (kind == NodeKind.NAME)
      return name.equals(token) ? Syntax.literal(literal, line, column) : this;
    if (children.isEmpty())
      return this;
    if (kind == NodeKind.FOR && child(0).is(NodeKind.NAME) && name.equals(child(0).getToken()))
      return withChild(1, child(1).substitute(name, literal));
    List<SyntaxNode> newChildren = null;
    for (int i = 0; i < children.size(); ++i) {
      SyntaxNode oldChild = children.get(i);
      SyntaxNode newChild = oldChild.substitute(name, literal);
      if (newChild != oldChild) {
        if (newChildren == null)
          newChildren = new ArrayList<>(children);
        newChildren.set(i, newChild);
      }
    }
    return newChildren == null ? this : withChildren(newChildren);
  }

  /** Structural equality, ignoring source positions and provenance. */
  public boolean sameShape(SyntaxNode other) {
    if (other == null || kind != other.kind || !Objects.equals(token, other.token) || !Objects.equals(literal, other.literal) ||
        children.size() != other.children.size())
      return false;
    for (int i = 0; i < children.size(); ++i) {
      if (!children.get(i).sameShape(other.children.get(i)))
        return false;
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, token, literal, children, line, column, provenance);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    SyntaxNode other = (SyntaxNode)obj;
    return kind == other.kind && Objects.equals(token, other.token) && Objects.equals(literal, other.literal) && line == other.line &&
        column == other.column && children.equals(other.children) && provenance.equals(other.provenance);
  }

  /** Source-like rendering, used in diagnostics. Statements render on a single line. */
  @Override
  public String toString() {
    switch (kind) {
    case NAME:
      return token;
    case INT:
      return String.valueOf(literal);
    case STR:
      return "\"" + literal + "\"";
    case BOOL:
      return ((Boolean)literal) ? "True" : "False";
    case ATTRIBUTE:
      return child(0) + "." + token;
    case SUBSCRIPT:
      return child(0) + "[" + child(1) + "]";
    case SLICE:
      return child(0) + "[" + child(1) + ":" + child(2) + "]";
    case CALL:
      return child(0) + "(" + join(children.subList(1, children.size()), ", ") + ")";
    case REDUCE:
      return child(0) + "." + token + "(" + join(children.subList(1, children.size()), ", ") + ")";
    case BIN_OP:
    case COMPARE:
      return "(" + child(0) + " " + token + " " + child(1) + ")";
    case UNARY_OP:
      return token.equals("not") ? "(not " + child(0) + ")" : "(" + token + child(0) + ")";
    case BOOL_OP:
      return "(" + join(children, " " + token + " ") + ")";
    case TUPLE:
      return "(" + join(children, ", ") + (children.size() == 1 ? ",)" : ")");
    case LIST:
      return "[" + join(children, ", ") + "]";
    case ASSIGN:
      return join(children.subList(0, children.size() - 1), " = ") + " = " + child(children.size() - 1);
    case AUG_ASSIGN:
      return child(0) + " " + token + "= " + child(1);
    case FOR:
      return "for " + child(0) + " in " + child(1) + ": ...";
    case IF:
      return "if " + child(0) + ": ...";
    case EXPR_STMT:
      return child(0).toString();
    case ASSERT:
      return "assert " + child(0);
    case RAISE:
      return children.isEmpty() ? "raise" : "raise " + child(0);
    case RETURN:
      return children.isEmpty() ? "return" : "return " + child(0);
    case PASS:
      return "pass";
    case FUNCTION_DEF:
      return "def " + token + "(" + join(child(1).children, ", ") + "): ...";
    default:
      return kind.getSerialName() + "[" + join(children, ", ") + "]";
    }
  }

  private static String join(List<SyntaxNode> nodes, String separator) {
    return nodes.stream().map(SyntaxNode::toString).collect(Collectors.joining(separator));
  }

  /** Empty statement list with the BLOCK kind. */
  public static SyntaxNode emptyBlock(int line) {
    return new SyntaxNode(NodeKind.BLOCK, null, null, Collections.emptyList(), line, 0);
  }
}
