package stela.elab;

import java.util.Locale;
import java.util.Optional;

/** Clock/reset edge of a sensitivity entry. */
public enum EdgeKind {
  Posedge,
  Negedge;

  /**
   * Maps an edge token to the edge kind after capitalizing it, so {@code posedge} and {@code Posedge} are both accepted.
   */
  public static Optional<EdgeKind> fromToken(String token) {
    if (token == null || token.isEmpty())
      return Optional.empty();
    String capitalized = token.substring(0, 1).toUpperCase(Locale.ROOT) + token.substring(1).toLowerCase(Locale.ROOT);
    for (EdgeKind kind : values()) {
      if (kind.name().equals(capitalized))
        return Optional.of(kind);
    }
    return Optional.empty();
  }
}
