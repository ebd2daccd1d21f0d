package com.phillippitts.presetgraph.exception;

/**
 * Thrown when a preset's block graph fails structural validation before a run starts.
 */
public class InvalidPipelineException extends PresetGraphException {

    private final String presetId;
    private final String reason;

    public InvalidPipelineException(String presetId, String reason) {
        super("Invalid pipeline '" + presetId + "': " + reason);
        this.presetId = presetId;
        this.reason = reason;
    }

    public String getPresetId() {
        return presetId;
    }

    public String getReason() {
        return reason;
    }
}
