package stela.elab;

/**
 * One entry of the sensitivity list of a sequential block.
 * @param edge the edge kind
 * @param signal the signal name
 */
public record SensitivityEntry(EdgeKind edge, String signal) {
  @Override
  public String toString() {
    return "(" + edge + ", " + signal + ")";
  }
}
