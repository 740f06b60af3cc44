package stela.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable compile-time environment mapping names to values.
 * Child environments overlay bindings of their parent.
 */
public final class Environment {
  private static final Environment EMPTY = new Environment(null, Map.of());

  private final Environment parent;
  private final Map<String, Value> bindings;

  private Environment(Environment parent, Map<String, Value> bindings) {
    this.parent = parent;
    this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
  }

  public static Environment empty() { return EMPTY; }

  /**
   * Creates an environment from Java objects, converted with {@link Value#of(Object)}.
   * Iteration order of the map is kept.
   */
  public static Environment of(Map<String, ?> objects) {
    Map<String, Value> values = new LinkedHashMap<>();
    objects.forEach((name, obj) -> values.put(name, Value.of(obj)));
    return new Environment(null, values);
  }

  public static Builder builder() { return new Builder(null); }

  public Optional<Value> lookup(String name) {
    for (Environment env = this; env != null; env = env.parent) {
      Value value = env.bindings.get(name);
      if (value != null)
        return Optional.of(value);
    }
    return Optional.empty();
  }

  /** Child environment overlaying the builder's bindings. */
  public Builder extend() { return new Builder(this); }

  /** All visible bindings, outermost first; inner bindings replace outer ones. */
  public Map<String, Value> visibleBindings() {
    LinkedHashMap<String, Value> result = new LinkedHashMap<>();
    if (parent != null)
      result.putAll(parent.visibleBindings());
    result.putAll(bindings);
    return result;
  }

  @Override
  public String toString() {
    return visibleBindings().keySet().toString();
  }

  public static class Builder {
    private final Environment parent;
    private final Map<String, Value> bindings = new LinkedHashMap<>();

    private Builder(Environment parent) { this.parent = parent; }

    public Builder bind(String name, Value value) {
      bindings.put(name, value);
      return this;
    }
    /** Binds a Java object converted with {@link Value#of(Object)}. */
    public Builder bind(String name, Object obj) {
      return bind(name, Value.of(obj));
    }
    public Environment build() { return new Environment(parent, bindings); }
  }
}
