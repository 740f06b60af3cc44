package stela.elab;

import java.util.Optional;

/** Decorations of a statement block function. */
public enum BlockDecoration {
  AlwaysComb(BlockType.Combinational, "always_comb", "combinational"),
  AlwaysFF(BlockType.Sequential, "always_ff", "sequential"),
  Initial(BlockType.Initial, "initial");

  public final BlockType blockType;
  private final String[] serialNames;

  private BlockDecoration(BlockType blockType, String... serialNames) {
    this.blockType = blockType;
    this.serialNames = serialNames;
  }

  public String getSerialName() { return serialNames[0]; }

  public static Optional<BlockDecoration> fromSerialName(String serialName) {
    for (BlockDecoration decoration : values()) {
      for (String name : decoration.serialNames) {
        if (name.equals(serialName))
          return Optional.of(decoration);
      }
    }
    return Optional.empty();
  }
}
