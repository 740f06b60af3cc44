package stela.backend;

/** File and absolute line attached to a statement for debugging. */
public record SourceLocation(String filename, int line) {
  @Override
  public String toString() {
    return filename + ":" + line;
  }
}
