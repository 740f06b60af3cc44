package stela.frontend;

import java.util.Objects;

/**
 * One entry of the provenance stack: the loop variable of an unrolled loop and the literal it was bound to in the current iteration.
 * @param name the loop variable
 * @param literal a Long, String or Boolean
 */
public record LoopBinding(String name, Object literal) {
  public LoopBinding {
    Objects.requireNonNull(name);
    if (!(literal instanceof Long || literal instanceof String || literal instanceof Boolean))
      throw new IllegalArgumentException("Loop binding of " + name + " must be a literal, got " + literal);
  }

  /** The literal as attached to statement metadata. Booleans render as True/False. */
  public String valueString() {
    if (literal instanceof Boolean)
      return ((Boolean)literal) ? "True" : "False";
    return String.valueOf(literal);
  }

  @Override
  public String toString() {
    return name + "=" + valueString();
  }
}
