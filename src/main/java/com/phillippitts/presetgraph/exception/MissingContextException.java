package com.phillippitts.presetgraph.exception;

/**
 * Thrown when a block needs captured bytes the run does not carry, e.g. an image block
 * reached without an image payload. This is a preset configuration error: the branch is
 * aborted and nothing is shown to the user.
 */
public class MissingContextException extends PresetGraphException {

    private final String blockId;
    private final int blockIndex;

    public MissingContextException(String blockId, int blockIndex, String reason) {
        super("Missing context for block " + blockIndex + " (" + blockId + "): " + reason);
        this.blockId = blockId;
        this.blockIndex = blockIndex;
    }

    public String getBlockId() {
        return blockId;
    }

    public int getBlockIndex() {
        return blockIndex;
    }
}
