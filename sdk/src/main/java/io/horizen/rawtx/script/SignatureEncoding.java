package io.horizen.rawtx.script;

import io.horizen.rawtx.sign.SigHashType;
import io.horizen.rawtx.utils.BytesUtils;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Set;

// Encoding rules for signatures and public keys found on the script stack.
public final class SignatureEncoding {
    private SignatureEncoding() {}

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    public static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    /*
     * Strict DER with the sighash byte appended:
     * 0x30 [total-length] 0x02 [R-length] [R] 0x02 [S-length] [S] [sighash]
     */
    public static boolean isValidSignatureEncoding(byte[] sig) {
        if (sig.length < 9 || sig.length > 73) return false;
        if ((sig[0] & 0xff) != 0x30) return false;
        if ((sig[1] & 0xff) != sig.length - 3) return false;

        int lenR = sig[3] & 0xff;
        if (5 + lenR >= sig.length) return false;
        int lenS = sig[5 + lenR] & 0xff;
        if (lenR + lenS + 7 != sig.length) return false;

        if (sig[2] != 0x02) return false;
        if (lenR == 0) return false;
        if ((sig[4] & 0x80) != 0) return false;
        if (lenR > 1 && sig[4] == 0x00 && (sig[5] & 0x80) == 0) return false;

        if (sig[lenR + 4] != 0x02) return false;
        if (lenS == 0) return false;
        if ((sig[lenR + 6] & 0x80) != 0) return false;
        if (lenS > 1 && sig[lenR + 6] == 0x00 && (sig[lenR + 7] & 0x80) == 0) return false;

        return true;
    }

    public static boolean isLowDerSignature(byte[] sig) {
        if (!isValidSignatureEncoding(sig))
            return false;
        int lenR = sig[3] & 0xff;
        int lenS = sig[5 + lenR] & 0xff;
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(sig, 6 + lenR, 6 + lenR + lenS));
        return s.compareTo(HALF_CURVE_ORDER) <= 0;
    }

    public static boolean isDefinedHashTypeSignature(byte[] sig) {
        if (sig.length == 0)
            return false;
        int hashType = (sig[sig.length - 1] & 0xff) & ~SigHashType.ANYONECANPAY_FLAG;
        return hashType >= SigHashType.ALL_FLAG && hashType <= SigHashType.SINGLE_FLAG;
    }

    public static boolean isCompressedOrUncompressedPubKey(byte[] pubKey) {
        if (pubKey.length == BytesUtils.UNCOMPRESSED_PUBLIC_KEY_LENGTH)
            return pubKey[0] == 0x04;
        if (pubKey.length == BytesUtils.COMPRESSED_PUBLIC_KEY_LENGTH)
            return pubKey[0] == 0x02 || pubKey[0] == 0x03;
        return false;
    }

    // Empty signatures are allowed: they make CHECKSIG fail without an error.
    static ScriptError checkSignatureEncoding(byte[] sig, Set<ScriptVerifyFlag> flags) {
        if (sig.length == 0)
            return ScriptError.OK;
        boolean strict = flags.contains(ScriptVerifyFlag.DERSIG) || flags.contains(ScriptVerifyFlag.LOW_S)
                || flags.contains(ScriptVerifyFlag.STRICTENC);
        if (strict && !isValidSignatureEncoding(sig))
            return ScriptError.SIG_DER;
        if (flags.contains(ScriptVerifyFlag.LOW_S) && !isLowDerSignature(sig))
            return ScriptError.SIG_HIGH_S;
        if (flags.contains(ScriptVerifyFlag.STRICTENC) && !isDefinedHashTypeSignature(sig))
            return ScriptError.SIG_HASHTYPE;
        return ScriptError.OK;
    }

    static ScriptError checkPubKeyEncoding(byte[] pubKey, Set<ScriptVerifyFlag> flags) {
        if (flags.contains(ScriptVerifyFlag.STRICTENC) && !isCompressedOrUncompressedPubKey(pubKey))
            return ScriptError.PUBKEYTYPE;
        return ScriptError.OK;
    }
}
