package stela.elab;

import java.util.ArrayList;
import java.util.List;
import stela.frontend.LoopBinding;

/** Loop bindings of the unrolled loop iterations enclosing the statement being elaborated, outermost first. */
public class ProvenanceStack {
  private final List<LoopBinding> bindings = new ArrayList<>();

  public void push(LoopBinding binding) { bindings.add(binding); }

  public LoopBinding pop() {
    if (bindings.isEmpty())
      throw new IllegalStateException("pop on empty provenance stack");
    return bindings.remove(bindings.size() - 1);
  }

  public boolean isEmpty() { return bindings.isEmpty(); }
  public int depth() { return bindings.size(); }

  /** Immutable copy of the current bindings. */
  public List<LoopBinding> snapshot() { return List.copyOf(bindings); }

  @Override
  public String toString() {
    return bindings.toString();
  }
}
