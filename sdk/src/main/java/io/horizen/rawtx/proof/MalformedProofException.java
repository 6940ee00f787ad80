package io.horizen.rawtx.proof;

public class MalformedProofException extends InclusionProofException {

    public MalformedProofException(String message) {
        super(message);
    }

    public MalformedProofException(String message, Throwable cause) {
        super(message, cause);
    }
}
