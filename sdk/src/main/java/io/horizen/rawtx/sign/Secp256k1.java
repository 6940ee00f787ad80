package io.horizen.rawtx.sign;

import org.apache.logging.log4j.LogManager;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.math.ec.ECPoint;
import org.web3j.crypto.ECDSASignature;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;

public final class Secp256k1 {
    public static final int PRIVATE_KEY_SIZE = 32;

    private static final ECDomainParameters CURVE = new ECDomainParameters(
            Sign.CURVE_PARAMS.getCurve(), Sign.CURVE_PARAMS.getG(), Sign.CURVE_PARAMS.getN(), Sign.CURVE_PARAMS.getH());

    private Secp256k1() {
        // prevent instantiation
    }

    public static boolean isValidPrivateKey(byte[] privateKey) {
        if (privateKey.length != PRIVATE_KEY_SIZE)
            return false;
        BigInteger value = Numeric.toBigInt(privateKey);
        return value.signum() > 0 && value.compareTo(CURVE.getN()) < 0;
    }

    public static byte[] getCompressedPublicKey(byte[] privateKey) {
        ECPoint point = Sign.publicPointFromPrivate(Numeric.toBigInt(privateKey));
        return point.getEncoded(true);
    }

    // Deterministic (RFC 6979) signature with low S, DER encoded.
    public static byte[] sign(byte[] privateKey, byte[] messageHash) {
        ECKeyPair keyPair = ECKeyPair.create(privateKey);
        ECDSASignature signature = keyPair.sign(messageHash);
        try {
            return new DERSequence(new ASN1Integer[]{new ASN1Integer(signature.r), new ASN1Integer(signature.s)})
                    .getEncoded("DER");
        } catch (IOException e) {
            LogManager.getLogger().error("Unexpected exception: ", e);
            throw new IllegalStateException("Unable to DER encode signature", e);
        }
    }

    public static boolean verify(byte[] messageHash, byte[] derSignature, byte[] publicKey) {
        try {
            ASN1Sequence sequence = ASN1Sequence.getInstance(derSignature);
            if (sequence.size() != 2)
                return false;
            BigInteger r = ASN1Integer.getInstance(sequence.getObjectAt(0)).getPositiveValue();
            BigInteger s = ASN1Integer.getInstance(sequence.getObjectAt(1)).getPositiveValue();

            ECPoint point = CURVE.getCurve().decodePoint(publicKey);
            ECDSASigner signer = new ECDSASigner();
            signer.init(false, new ECPublicKeyParameters(point, CURVE));
            return signer.verifySignature(messageHash, r, s);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // malformed signature or public key
            return false;
        }
    }
}
