package io.horizen.rawtx.proof;

public class TargetsNotInBlockException extends InclusionProofException {
    public static final String MESSAGE = "not all transactions found in specified block";

    public TargetsNotInBlockException() {
        super(MESSAGE);
    }
}
