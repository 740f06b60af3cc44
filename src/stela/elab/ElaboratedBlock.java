package stela.elab;

import java.util.List;
import stela.backend.Statement;

/**
 * Result of elaborating a statement block.
 * @param blockType the block type
 * @param sensitivity the sensitivity list, empty unless sequential
 * @param statements the top-level statements in program order
 */
public record ElaboratedBlock(BlockType blockType, List<SensitivityEntry> sensitivity, List<Statement> statements) {
  public ElaboratedBlock {
    sensitivity = List.copyOf(sensitivity);
    statements = List.copyOf(statements);
  }
}
