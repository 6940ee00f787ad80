package io.horizen.rawtx.combine;

import io.horizen.rawtx.entity.McInput;
import io.horizen.rawtx.utils.BytesUtils;

import java.util.Arrays;

/**
 * Failure of a single input during signature combination.
 * Carries the input as it was left in the merged entity.
 */
public final class InputError {
    public static final String INPUT_NOT_FOUND = "Input not found or already spent";

    private final int inputIndex;
    private final byte[] priorId;
    private final long outputIndex;
    private final byte[] unlockingScript;
    private final long sequence;
    private final String error;

    public InputError(int inputIndex, McInput input, String error) {
        this.inputIndex = inputIndex;
        this.priorId = input.prevOut().entityId();
        this.outputIndex = input.prevOut().index();
        this.unlockingScript = input.unlockingScript();
        this.sequence = input.sequence();
        this.error = error;
    }

    // Position of the input in the entity.
    public int inputIndex() {
        return inputIndex;
    }

    public byte[] priorId() {
        return Arrays.copyOf(priorId, priorId.length);
    }

    public String priorIdHex() {
        return BytesUtils.toHexString(priorId);
    }

    public long outputIndex() {
        return outputIndex;
    }

    public byte[] unlockingScript() {
        return Arrays.copyOf(unlockingScript, unlockingScript.length);
    }

    public long sequence() {
        return sequence;
    }

    public String error() {
        return error;
    }

    @Override
    public String toString() {
        return String.format("InputError{input=%d, prevOut=%s:%d, error='%s'}", inputIndex, priorIdHex(), outputIndex, error);
    }
}
