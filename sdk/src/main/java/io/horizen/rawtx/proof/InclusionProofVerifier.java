package io.horizen.rawtx.proof;

import io.horizen.rawtx.chain.ChainStateView;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Checks an inclusion proof and returns the entity ids it commits to.
 * <p>
 * A structurally valid proof whose root differs from the header's yields an empty list.
 * A proof that authenticates against a block outside the best chain is rejected with
 * {@link ChainReferenceException}.
 */
public class InclusionProofVerifier {
    private static final Logger logger = LogManager.getLogger();

    public static final String BLOCK_NOT_IN_CHAIN = "block not found in chain";

    public List<byte[]> verify(ChainStateView chainState, byte[] proofBytes) throws InclusionProofException {
        InclusionProof proof;
        try {
            proof = InclusionProofSerializer.getSerializer().parseBytes(proofBytes);
        } catch (MalformedProofException e) {
            logger.warn("Rejected malformed proof: {}", e.getMessage());
            throw e;
        }
        return verify(chainState, proof);
    }

    public List<byte[]> verify(ChainStateView chainState, InclusionProof proof) throws InclusionProofException {
        List<byte[]> matched = new ArrayList<>();
        byte[] root;
        try {
            root = proof.tree().extractMatches(matched);
        } catch (MalformedProofException e) {
            logger.warn("Rejected malformed proof: {}", e.getMessage());
            throw e;
        }

        if (!Arrays.equals(root, proof.header().hashMerkleRoot())) {
            logger.debug("Proof root does not match block {}", proof.header().hashHex());
            return Collections.emptyList();
        }

        if (!chainState.isOnBestChain(proof.header().hash())) {
            logger.warn("Proof refers to block {} outside the best chain", proof.header().hashHex());
            throw new ChainReferenceException(BLOCK_NOT_IN_CHAIN);
        }
        return matched;
    }
}
