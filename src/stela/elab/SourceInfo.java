package stela.elab;

/**
 * Location of the function definition being elaborated.
 * @param filename source file, may be null
 * @param startLine absolute line of the definition
 */
public record SourceInfo(String filename, int startLine) {
  /** Converts a line relative to the definition (definition line = 1) into an absolute line. */
  public int absoluteLine(int relativeLine) { return relativeLine + startLine - 1; }
}
