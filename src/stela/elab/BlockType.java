package stela.elab;

/** Kind of an elaborated statement block. */
public enum BlockType {
  Combinational,
  Sequential,
  Initial
}
