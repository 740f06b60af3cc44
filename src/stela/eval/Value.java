package stela.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import stela.backend.Variable;

/**
 * Tagged value of the compile-time environment and of evaluated expressions.
 * Host values (integer, string, boolean, sequence, namespace) are fully known at elaboration time;
 * signal values depend on hardware and only exist as backend handles.
 */
public interface Value {

  /** True for {@link Signal} and {@link Symbolic}. */
  default boolean isSignal() { return false; }
  /** True for integer, string and boolean values. */
  default boolean isLiteral() { return false; }
  /** Short type description for diagnostics. */
  String describe();

  record Int(long value) implements Value {
    @Override
    public boolean isLiteral() { return true; }
    @Override
    public String describe() { return "integer " + value; }
    @Override
    public String toString() { return Long.toString(value); }
  }

  record Str(String value) implements Value {
    public Str {
      Objects.requireNonNull(value);
    }
    @Override
    public boolean isLiteral() { return true; }
    @Override
    public String describe() { return "string \"" + value + "\""; }
    @Override
    public String toString() { return value; }
  }

  record Bool(boolean value) implements Value {
    public static final Bool TRUE = new Bool(true);
    public static final Bool FALSE = new Bool(false);
    public static Bool of(boolean value) { return value ? TRUE : FALSE; }
    @Override
    public boolean isLiteral() { return true; }
    @Override
    public String describe() { return "boolean " + toString(); }
    @Override
    public String toString() { return value ? "True" : "False"; }
  }

  /** Finite ordered sequence: tuple, list or range result. */
  record Seq(List<Value> elements) implements Value {
    public Seq {
      elements = List.copyOf(elements);
    }
    @Override
    public String describe() { return "sequence of " + elements.size() + " elements"; }
    @Override
    public String toString() { return elements.toString(); }
  }

  /** Container reachable through dotted paths, such as the generator bound to {@code self}. */
  record Namespace(String name, Map<String, Value> members) implements Value {
    public Namespace {
      members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
    }
    @Override
    public String describe() { return "namespace " + name; }
    @Override
    public String toString() { return name; }
  }

  /** Backend signal handle. */
  record Signal(Variable variable) implements Value {
    public Signal {
      Objects.requireNonNull(variable);
    }
    @Override
    public boolean isSignal() { return true; }
    @Override
    public String describe() { return "signal " + variable.getName(); }
    @Override
    public String toString() { return variable.getName(); }
  }

  /**
   * Result of a signal operation during classification, where no backend call is made.
   * Never part of an environment.
   */
  record Symbolic() implements Value {
    public static final Symbolic INSTANCE = new Symbolic();
    @Override
    public boolean isSignal() { return true; }
    @Override
    public String describe() { return "signal expression"; }
  }

  /**
   * Converts a Java object into a value.
   * Accepts Integer/Long, String, Boolean, Variable, Value, Lists of those (as sequences)
   * and String-keyed Maps (as namespaces named "namespace").
   */
  static Value of(Object obj) {
    if (obj instanceof Value)
      return (Value)obj;
    if (obj instanceof Integer || obj instanceof Long || obj instanceof Short || obj instanceof Byte)
      return new Int(((Number)obj).longValue());
    if (obj instanceof String)
      return new Str((String)obj);
    if (obj instanceof Boolean)
      return Bool.of((Boolean)obj);
    if (obj instanceof Variable)
      return new Signal((Variable)obj);
    if (obj instanceof List) {
      List<Value> elements = new ArrayList<>();
      for (Object element : (List<?>)obj)
        elements.add(of(element));
      return new Seq(elements);
    }
    if (obj instanceof Map) {
      Map<String, Value> members = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>)obj).entrySet())
        members.put(String.valueOf(entry.getKey()), of(entry.getValue()));
      return new Namespace("namespace", members);
    }
    throw new IllegalArgumentException("No compile-time value for " + (obj == null ? "null" : obj.getClass().getName()));
  }

  /** The Java literal of an integer, string or boolean value. */
  static Object toLiteral(Value value) {
    if (value instanceof Int)
      return ((Int)value).value();
    if (value instanceof Str)
      return ((Str)value).value();
    if (value instanceof Bool)
      return ((Bool)value).value();
    throw new IllegalArgumentException(value.describe() + " is not a literal");
  }
}
