package stela.ui;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import stela.backend.sv.SVGenerator;
import stela.elab.PortType;
import stela.elab.SourceInfo;
import stela.eval.Environment;
import stela.eval.Value;
import stela.frontend.NodeKind;
import stela.frontend.SyntaxNode;

/**
 * Reads a block description from YAML.
 *
 * <pre>
 * filename: blocks.py        # optional, used in diagnostics
 * start_line: 12             # absolute line of the definition, default 1
 * function:                  # the parsed definition, see below
 *   kind: function_def
 *   token: code
 *   line: 1
 *   children: [...]
 * env:                       # compile-time environment
 *   n: 4
 *   self:
 *     namespace:
 *       a: {signal: a, width: 4}
 *       mem: {signal: mem, width: 8, size: 4}
 * args:                      # argument types of function blocks
 *   - {width: 4, signed: false}
 * </pre>
 *
 * A syntax node is a map with the keys kind (serial name of {@link NodeKind}), token, value (literal kinds),
 * line, column and children. Signals are declared on the given generator.
 */
public class YamlBlockReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Content of a block description. */
  public record BlockDescription(SyntaxNode function, Environment env, SourceInfo source, List<PortType> args) {}

  private final SVGenerator generator;

  public YamlBlockReader(SVGenerator generator) { this.generator = generator; }

  /**
   * Reads a description.
   * @throws IllegalArgumentException on malformed content
   */
  public BlockDescription read(InputStream yamlStream) {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    Object root = yaml.load(yamlStream);
    if (!(root instanceof Map))
      throw new IllegalArgumentException("Block description must be a map");
    Map<?, ?> rootMap = (Map<?, ?>)root;

    String filename = rootMap.containsKey("filename") ? String.valueOf(rootMap.get("filename")) : null;
    int startLine = rootMap.containsKey("start_line") ? toInt(rootMap.get("start_line"), "start_line") : 1;
    if (!rootMap.containsKey("function"))
      throw new IllegalArgumentException("Block description has no function");
    SyntaxNode function = readNode(rootMap.get("function"));

    Environment.Builder env = Environment.builder();
    Object envData = rootMap.get("env");
    if (envData != null) {
      if (!(envData instanceof Map))
        throw new IllegalArgumentException("env must be a map");
      for (Map.Entry<?, ?> entry : ((Map<?, ?>)envData).entrySet()) {
        String name = String.valueOf(entry.getKey());
        env.bind(name, readValue(name, entry.getValue()));
      }
    }

    List<PortType> args = new ArrayList<>();
    Object argsData = rootMap.get("args");
    if (argsData != null) {
      if (!(argsData instanceof List))
        throw new IllegalArgumentException("args must be a list");
      for (Object arg : (List<?>)argsData) {
        if (!(arg instanceof Map))
          throw new IllegalArgumentException("Argument type must be a map with width and signed, got " + arg);
        Map<?, ?> argMap = (Map<?, ?>)arg;
        args.add(new PortType(toInt(argMap.get("width"), "width"), Boolean.TRUE.equals(argMap.get("signed"))));
      }
    }
    logger.debug("Read block {} from {} (start line {}) with {} environment entries", function.getToken(), filename, startLine,
                 envData == null ? 0 : ((Map<?, ?>)envData).size());
    return new BlockDescription(function, env.build(), new SourceInfo(filename, startLine), args);
  }

  /** Converts one generic YAML node into a syntax node. */
  public static SyntaxNode readNode(Object data) {
    if (!(data instanceof Map))
      throw new IllegalArgumentException("Syntax node must be a map, got " + data);
    Map<?, ?> map = (Map<?, ?>)data;
    String kindName = String.valueOf(map.get("kind"));
    NodeKind kind = NodeKind.fromSerialName(kindName).orElseThrow(() -> new IllegalArgumentException("Unknown node kind " + kindName));
    String token = map.containsKey("token") ? String.valueOf(map.get("token")) : null;
    int line = map.containsKey("line") ? toInt(map.get("line"), "line") : 0;
    int column = map.containsKey("column") ? toInt(map.get("column"), "column") : 0;

    Object literal = null;
    switch (kind) {
    case INT:
      if (!(map.get("value") instanceof Integer || map.get("value") instanceof Long))
        throw new IllegalArgumentException("int node needs an integer value, got " + map.get("value"));
      literal = ((Number)map.get("value")).longValue();
      break;
    case STR:
      literal = String.valueOf(map.get("value"));
      break;
    case BOOL:
      if (!(map.get("value") instanceof Boolean))
        throw new IllegalArgumentException("bool node needs a boolean value, got " + map.get("value"));
      literal = map.get("value");
      break;
    default:
      break;
    }

    List<SyntaxNode> children = new ArrayList<>();
    Object childData = map.get("children");
    if (childData != null) {
      if (!(childData instanceof List))
        throw new IllegalArgumentException("children of " + kindName + " must be a list");
      for (Object child : (List<?>)childData)
        children.add(readNode(child));
    }
    // the else block of for and if may be left out
    if ((kind == NodeKind.FOR && children.size() == 3) || (kind == NodeKind.IF && children.size() == 2))
      children.add(SyntaxNode.emptyBlock(line));
    checkShape(kind, token, children);
    return new SyntaxNode(kind, token, literal, children, line, column);
  }

  private static void checkShape(NodeKind kind, String token, List<SyntaxNode> children) {
    int min = 0;
    int max = Integer.MAX_VALUE;
    boolean needsToken = false;
    switch (kind) {
    case FUNCTION_DEF:
      min = max = 3;
      needsToken = true;
      requireKind(kind, children, 0, NodeKind.DECORATORS);
      requireKind(kind, children, 1, NodeKind.PARAMETERS);
      requireKind(kind, children, 2, NodeKind.BLOCK);
      break;
    case ASSIGN:
    case CALL:
      min = kind == NodeKind.ASSIGN ? 2 : 1;
      break;
    case AUG_ASSIGN:
    case BIN_OP:
    case COMPARE:
      min = max = 2;
      needsToken = true;
      break;
    case SUBSCRIPT:
      min = max = 2;
      break;
    case SLICE:
      min = max = 3;
      break;
    case FOR:
      min = max = 4;
      requireKind(kind, children, 2, NodeKind.BLOCK);
      requireKind(kind, children, 3, NodeKind.BLOCK);
      break;
    case IF:
      min = max = 3;
      requireKind(kind, children, 1, NodeKind.BLOCK);
      requireKind(kind, children, 2, NodeKind.BLOCK);
      break;
    case EXPR_STMT:
    case ASSERT:
      min = max = 1;
      break;
    case RAISE:
    case RETURN:
      max = 1;
      break;
    case PASS:
    case INT:
    case STR:
    case BOOL:
      max = 0;
      break;
    case NAME:
      max = 0;
      needsToken = true;
      break;
    case ATTRIBUTE:
    case UNARY_OP:
      min = max = 1;
      needsToken = true;
      break;
    case BOOL_OP:
      min = 2;
      needsToken = true;
      break;
    case REDUCE:
      min = 1;
      max = 2;
      needsToken = true;
      break;
    default:
      break;
    }
    String kindName = kind.getSerialName();
    if (children.size() < min || children.size() > max)
      throw new IllegalArgumentException(String.format("%s node has %d children, expected %s", kindName, children.size(),
                                                       min == max ? String.valueOf(min) : max == Integer.MAX_VALUE ? "at least " + min : min + " to " + max));
    if (needsToken && token == null)
      throw new IllegalArgumentException(kindName + " node needs a token");
  }

  private static void requireKind(NodeKind parent, List<SyntaxNode> children, int i, NodeKind expected) {
    if (i < children.size() && !children.get(i).is(expected))
      throw new IllegalArgumentException(String.format("Child %d of %s must be a %s node, got %s", i, parent.getSerialName(),
                                                       expected.getSerialName(), children.get(i).getKind().getSerialName()));
  }

  private Value readValue(String name, Object data) {
    if (data instanceof List) {
      List<Value> elements = new ArrayList<>();
      for (Object element : (List<?>)data)
        elements.add(readValue(name, element));
      return new Value.Seq(elements);
    }
    if (data instanceof Map) {
      Map<?, ?> map = (Map<?, ?>)data;
      if (map.containsKey("signal")) {
        String signalName = String.valueOf(map.get("signal"));
        int width = toInt(map.get("width"), "width of " + signalName);
        boolean signed = Boolean.TRUE.equals(map.get("signed"));
        int size = map.containsKey("size") ? toInt(map.get("size"), "size of " + signalName) : 0;
        return new Value.Signal(generator.var(signalName, width, signed, size));
      }
      if (map.containsKey("namespace")) {
        Object members = map.get("namespace");
        if (!(members instanceof Map))
          throw new IllegalArgumentException("namespace " + name + " must contain a map");
        Map<String, Value> values = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>)members).entrySet()) {
          String member = String.valueOf(entry.getKey());
          values.put(member, readValue(name + "." + member, entry.getValue()));
        }
        return new Value.Namespace(name, values);
      }
      throw new IllegalArgumentException("Environment entry " + name + " must be a signal or a namespace");
    }
    if (data instanceof Integer || data instanceof Long || data instanceof String || data instanceof Boolean)
      return Value.of(data);
    throw new IllegalArgumentException("Unsupported value for environment entry " + name + ": " + data);
  }

  private static int toInt(Object data, String what) {
    if (data instanceof Integer)
      return (Integer)data;
    if (data instanceof Long && (Long)data == ((Long)data).intValue())
      return ((Long)data).intValue();
    throw new IllegalArgumentException(what + " must be an integer, got " + data);
  }
}
