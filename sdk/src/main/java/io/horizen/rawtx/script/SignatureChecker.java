package io.horizen.rawtx.script;

/**
 * Checks a signature found while evaluating a script against the entity being spent.
 */
public interface SignatureChecker {

    /**
     * @param signature  DER signature followed by the sighash type byte
     * @param pubKey     serialized public key
     * @param scriptCode script the signature commits to, with the signature itself removed
     * @return true if the signature is valid for the entity digest
     */
    boolean checkSignature(byte[] signature, byte[] pubKey, byte[] scriptCode);
}
