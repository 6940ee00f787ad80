package io.horizen.rawtx.proof;

// Terminal failure of an inclusion proof operation.
public class InclusionProofException extends Exception {

    public InclusionProofException(String message) {
        super(message);
    }

    public InclusionProofException(String message, Throwable cause) {
        super(message, cause);
    }
}
