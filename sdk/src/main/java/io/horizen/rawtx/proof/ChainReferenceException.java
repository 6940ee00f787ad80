package io.horizen.rawtx.proof;

/**
 * The block a proof refers to is unknown, can not be inferred, or is not part of the best chain.
 */
public class ChainReferenceException extends InclusionProofException {

    public ChainReferenceException(String message) {
        super(message);
    }
}
