package io.horizen.rawtx.api.rpc.service;

import io.horizen.rawtx.api.rpc.handler.RpcException;
import io.horizen.rawtx.api.rpc.types.CertificateView;
import io.horizen.rawtx.api.rpc.types.PrevTxArgs;
import io.horizen.rawtx.api.rpc.types.RawCertificateView;
import io.horizen.rawtx.api.rpc.types.RawTransactionView;
import io.horizen.rawtx.api.rpc.types.ScriptView;
import io.horizen.rawtx.api.rpc.types.SignRawResultView;
import io.horizen.rawtx.api.rpc.types.TransactionView;
import io.horizen.rawtx.api.rpc.utils.RpcCode;
import io.horizen.rawtx.chain.ChainStateProvider;
import io.horizen.rawtx.chain.ChainStateSnapshot;
import io.horizen.rawtx.chain.PrevOutput;
import io.horizen.rawtx.chain.PrevOutputsOverlay;
import io.horizen.rawtx.combine.CombinationResult;
import io.horizen.rawtx.combine.SignatureCombinationEngine;
import io.horizen.rawtx.entity.McCertificate;
import io.horizen.rawtx.entity.McCertificateSerializer;
import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.entity.McEntityType;
import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.entity.McTransactionSerializer;
import io.horizen.rawtx.entity.OutPoint;
import io.horizen.rawtx.proof.ChainReferenceException;
import io.horizen.rawtx.proof.InclusionProof;
import io.horizen.rawtx.proof.InclusionProofBuilder;
import io.horizen.rawtx.proof.InclusionProofException;
import io.horizen.rawtx.proof.InclusionProofVerifier;
import io.horizen.rawtx.proof.MalformedProofException;
import io.horizen.rawtx.proof.TargetsNotInBlockException;
import io.horizen.rawtx.script.StandardScripts;
import io.horizen.rawtx.settings.RawTxSettings;
import io.horizen.rawtx.sign.BasicKeyStore;
import io.horizen.rawtx.sign.KeyStore;
import io.horizen.rawtx.sign.McPrivateKey;
import io.horizen.rawtx.sign.SigHashType;
import io.horizen.rawtx.utils.BytesUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Raw transaction calls of the mainchain node: signing and decoding of transactions and certificates,
 * inclusion proofs. Every call reads chain state through a snapshot held for the whole call.
 */
public class RawTransactionRpcService extends RpcService {
    private final ChainStateProvider chainState;
    private final KeyStore walletKeys;
    private final RawTxSettings settings;
    private final SignatureCombinationEngine combinationEngine;
    private final InclusionProofBuilder proofBuilder;
    private final InclusionProofVerifier proofVerifier;

    public RawTransactionRpcService(ChainStateProvider chainState,
                                    KeyStore walletKeys,
                                    RawTxSettings settings,
                                    SignatureCombinationEngine combinationEngine,
                                    InclusionProofBuilder proofBuilder,
                                    InclusionProofVerifier proofVerifier) {
        this.chainState = chainState;
        this.walletKeys = walletKeys;
        this.settings = settings;
        this.combinationEngine = combinationEngine;
        this.proofBuilder = proofBuilder;
        this.proofVerifier = proofVerifier;
    }

    public RawTransactionRpcService(ChainStateProvider chainState, KeyStore walletKeys, RawTxSettings settings) {
        this(chainState, walletKeys, settings, SignatureCombinationEngine.createDefault(),
                new InclusionProofBuilder(), new InclusionProofVerifier());
    }

    @RpcMethod(value = "signrawtransaction", optionalParameters = 3)
    public SignRawResultView signRawTransaction(String hexString, PrevTxArgs[] prevTxs, String[] privateKeys, String sigHashType)
            throws RpcException {
        byte[] bytes = parseHex(hexString, "argument 1");
        List<McTransaction> transactions;
        try {
            transactions = McTransactionSerializer.getSerializer().parseAll(bytes);
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.DeserializationError, "TX decode failed");
        }
        if (transactions.isEmpty())
            throw new RpcException(RpcCode.DeserializationError, "Missing transaction");
        if (transactions.size() > settings.maxSigningVariants())
            throw new RpcException(RpcCode.InvalidParameter,
                    String.format("Too many transaction variants, at most %d allowed", settings.maxSigningVariants()));

        SigHashType hashType;
        try {
            hashType = sigHashType == null ? SigHashType.ALL : SigHashType.fromString(sigHashType);
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.InvalidParameter, e.getMessage());
        }

        List<PrevOutput> prevOutputs = parsePrevTxs(prevTxs);
        KeyStore keys = selectKeys(privateKeys, prevOutputs);

        try (ChainStateSnapshot snapshot = chainState.openSnapshot()) {
            PrevOutputsOverlay view = createOverlay(snapshot, prevOutputs);
            CombinationResult result = combinationEngine.combine(view, transactions.get(0),
                    transactions.subList(1, transactions.size()), keys, hashType);
            return new SignRawResultView(result);
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.InvalidParameter, e.getMessage());
        }
    }

    @RpcMethod(value = "signrawcertificate", optionalParameters = 1)
    public SignRawResultView signRawCertificate(String hexString, String[] privateKeys) throws RpcException {
        McCertificate certificate = decodeCertificate(parseHex(hexString, "argument 1"));
        KeyStore keys = selectKeys(privateKeys, Collections.emptyList());

        try (ChainStateSnapshot snapshot = chainState.openSnapshot()) {
            CombinationResult result = combinationEngine.combine(snapshot, certificate, Collections.emptyList(), keys, SigHashType.ALL);
            return new SignRawResultView(result);
        }
    }

    @RpcMethod("decoderawtransaction")
    public TransactionView decodeRawTransaction(String hexString) throws RpcException {
        byte[] bytes = parseHex(hexString, "argument 1");
        try {
            return new TransactionView(McTransactionSerializer.getSerializer().parseBytes(bytes));
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.DeserializationError, "TX decode failed");
        }
    }

    @RpcMethod("decoderawcertificate")
    public CertificateView decodeRawCertificate(String hexString) throws RpcException {
        return new CertificateView(decodeCertificate(parseHex(hexString, "argument 1")));
    }

    // Script of any kind; an empty string is the empty script.
    @RpcMethod("decodescript")
    public ScriptView decodeScript(String hexString) throws RpcException {
        return ScriptView.decoded(parseHex(hexString, "argument"));
    }

    /**
     * Serialized transaction from the mempool or the best chain.
     * A non-zero verbose returns the decoded transaction together with its hex and block hash.
     */
    @RpcMethod(value = "getrawtransaction", optionalParameters = 1)
    public Object getRawTransaction(String txid, Integer verbose) throws RpcException {
        byte[] id = parseId(txid);
        try (ChainStateSnapshot snapshot = chainState.openSnapshot()) {
            McEntity entity = loadEntity(snapshot, id, McEntityType.TRANSACTION)
                    .orElseThrow(() -> new RpcException(RpcCode.InvalidAddressOrKey, "No information available about transaction"));
            if (verbose == null || verbose == 0)
                return BytesUtils.toHexString(entity.bytes());
            return new RawTransactionView((McTransaction) entity, blockHashHex(snapshot, id));
        }
    }

    @RpcMethod(value = "getrawcertificate", optionalParameters = 1)
    public Object getRawCertificate(String certid, Integer verbose) throws RpcException {
        byte[] id = parseId(certid);
        try (ChainStateSnapshot snapshot = chainState.openSnapshot()) {
            McEntity entity = loadEntity(snapshot, id, McEntityType.CERTIFICATE)
                    .orElseThrow(() -> new RpcException(RpcCode.InvalidAddressOrKey, "No information available about certificate"));
            if (verbose == null || verbose == 0)
                return BytesUtils.toHexString(entity.bytes());
            return new RawCertificateView((McCertificate) entity, blockHashHex(snapshot, id));
        }
    }

    @RpcMethod(value = "gettxoutproof", optionalParameters = 1)
    public String getTxOutProof(String[] txids, String blockHash) throws RpcException {
        if (txids == null || txids.length == 0)
            throw new RpcException(RpcCode.InvalidParameter, "txids must not be empty");
        if (txids.length > settings.maxProofTargets())
            throw new RpcException(RpcCode.InvalidParameter,
                    String.format("Too many txids, at most %d allowed", settings.maxProofTargets()));

        List<byte[]> targets = new ArrayList<>(txids.length);
        Optional<byte[]> block;
        try {
            for (String txid : txids)
                targets.add(BytesUtils.fromHashHexString(txid, "txid"));
            block = blockHash == null
                    ? Optional.empty()
                    : Optional.of(BytesUtils.fromHashHexString(blockHash, "blockhash"));
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.InvalidParameter, e.getMessage());
        }

        try (ChainStateSnapshot snapshot = chainState.openSnapshot()) {
            InclusionProof proof = proofBuilder.build(snapshot, targets, block);
            return BytesUtils.toHexString(proof.bytes());
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.InvalidParameter, e.getMessage());
        } catch (ChainReferenceException | TargetsNotInBlockException e) {
            throw new RpcException(RpcCode.InvalidAddressOrKey, e.getMessage());
        } catch (InclusionProofException e) {
            throw new RpcException(RpcCode.InternalError, e.getMessage());
        }
    }

    @RpcMethod("verifytxoutproof")
    public List<String> verifyTxOutProof(String proof) throws RpcException {
        byte[] bytes = parseHex(proof, "proof");
        try (ChainStateSnapshot snapshot = chainState.openSnapshot()) {
            return proofVerifier.verify(snapshot, bytes).stream()
                    .map(BytesUtils::toHexString)
                    .collect(Collectors.toList());
        } catch (MalformedProofException e) {
            throw new RpcException(RpcCode.DeserializationError, e.getMessage());
        } catch (ChainReferenceException e) {
            throw new RpcException(RpcCode.InvalidAddressOrKey, e.getMessage());
        } catch (InclusionProofException e) {
            throw new RpcException(RpcCode.InternalError, e.getMessage());
        }
    }

    private static byte[] parseHex(String hex, String name) throws RpcException {
        if (hex == null)
            throw new RpcException(RpcCode.InvalidParams, name + " is missing");
        try {
            return BytesUtils.fromHexString(hex);
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.InvalidParameter,
                    String.format("%s must be hexadecimal string (not '%s')", name, hex));
        }
    }

    private static byte[] parseId(String id) throws RpcException {
        try {
            return BytesUtils.fromHashHexString(id, "parameter 1");
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.InvalidParameter, e.getMessage());
        }
    }

    private static Optional<McEntity> loadEntity(ChainStateSnapshot snapshot, byte[] id, McEntityType type) {
        return snapshot.loadEntity(id).filter(entity -> entity.type() == type);
    }

    private static String blockHashHex(ChainStateSnapshot snapshot, byte[] id) {
        return snapshot.blockContaining(id).map(BytesUtils::toHexString).orElse(null);
    }

    private static McCertificate decodeCertificate(byte[] bytes) throws RpcException {
        try {
            return McCertificateSerializer.getSerializer().parseBytes(bytes);
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.DeserializationError, e.getMessage());
        }
    }

    private static List<PrevOutput> parsePrevTxs(PrevTxArgs[] prevTxs) throws RpcException {
        if (prevTxs == null)
            return Collections.emptyList();
        List<PrevOutput> prevOutputs = new ArrayList<>(prevTxs.length);
        for (PrevTxArgs prevTx : prevTxs) {
            try {
                byte[] txid = BytesUtils.fromHashHexString(prevTx.txid, "txid");
                byte[] lockingScript = BytesUtils.fromHexString(prevTx.scriptPubKey);
                byte[] redeemScript = prevTx.redeemScript == null ? null : BytesUtils.fromHexString(prevTx.redeemScript);
                prevOutputs.add(new PrevOutput(new OutPoint(txid, prevTx.vout), lockingScript, redeemScript));
            } catch (IllegalArgumentException e) {
                throw new RpcException(RpcCode.InvalidParameter, e.getMessage());
            }
        }
        return prevOutputs;
    }

    // Keys given with the call replace the wallet. Their redeem scripts come from the previous outputs.
    private KeyStore selectKeys(String[] privateKeys, List<PrevOutput> prevOutputs) throws RpcException {
        if (privateKeys == null)
            return walletKeys;

        BasicKeyStore keys = new BasicKeyStore();
        for (String privateKey : privateKeys) {
            try {
                keys.addKey(McPrivateKey.fromHex(privateKey));
            } catch (IllegalArgumentException e) {
                throw new RpcException(RpcCode.InvalidAddressOrKey, "Invalid private key");
            }
        }
        for (PrevOutput prevOutput : prevOutputs) {
            if (StandardScripts.solve(prevOutput.lockingScript()).type().isPayToScriptHash())
                prevOutput.redeemScript().ifPresent(keys::addRedeemScript);
        }
        return keys;
    }

    private static PrevOutputsOverlay createOverlay(ChainStateSnapshot snapshot, List<PrevOutput> prevOutputs) throws RpcException {
        try {
            return new PrevOutputsOverlay(snapshot, prevOutputs);
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcCode.DeserializationError, e.getMessage());
        }
    }
}
