package io.horizen.rawtx.signingtool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.horizen.rawtx.api.rpc.types.CertificateView;
import io.horizen.rawtx.api.rpc.types.SignRawResultView;
import io.horizen.rawtx.chain.ChainStateSnapshot;
import io.horizen.rawtx.chain.InMemoryChainState;
import io.horizen.rawtx.chain.PrevOutput;
import io.horizen.rawtx.chain.PrevOutputsOverlay;
import io.horizen.rawtx.combine.CombinationResult;
import io.horizen.rawtx.combine.SignatureCombinationEngine;
import io.horizen.rawtx.entity.McCertificateSerializer;
import io.horizen.rawtx.entity.McEntity;
import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.entity.McTransactionSerializer;
import io.horizen.rawtx.entity.OutPoint;
import io.horizen.rawtx.script.StandardScripts;
import io.horizen.rawtx.settings.RawTxSettings;
import io.horizen.rawtx.sign.BasicKeyStore;
import io.horizen.rawtx.sign.McPrivateKey;
import io.horizen.rawtx.sign.SigHashType;
import io.horizen.rawtx.tools.utils.Command;
import io.horizen.rawtx.tools.utils.CommandProcessor;
import io.horizen.rawtx.tools.utils.MessagePrinter;
import io.horizen.rawtx.utils.BytesUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Offline signing: entities are signed against the previous outputs given on the command line only.
 */
public class SigningToolCommandProcessor extends CommandProcessor {
    private static final ObjectMapper mapper = new ObjectMapper();

    private final SignatureCombinationEngine engine = SignatureCombinationEngine.createDefault();
    private final RawTxSettings settings;

    public SigningToolCommandProcessor(MessagePrinter printer, RawTxSettings settings) {
        super(printer);
        this.settings = settings;
    }

    @Override
    public void processCommand(String input) throws Exception {
        Command command = parseCommand(input);
        try {
            switch (command.name()) {
                case "help":
                    printUsageMsg();
                    break;
                case "signRawTransaction":
                    signRawTransaction(command);
                    break;
                case "signRawCertificate":
                    signRawCertificate(command);
                    break;
                case "decodeRawCertificate":
                    decodeRawCertificate(command);
                    break;
                case "privKeyToPubKey":
                    privKeyToPubKey(command);
                    break;
                default:
                    printUnsupportedCommandMsg(command.name());
            }
        } catch (Exception e) {
            ObjectNode resJson = mapper.createObjectNode();
            resJson.put("error", e.getMessage());

            printer.print(resJson.toString());
        }
    }

    @Override
    protected void printUsageMsg() {
        ObjectNode resJson = mapper.createObjectNode();

        resJson.putIfAbsent("Usage", mapper.createArrayNode()
                .add("From command line: <program name> [--settings <config file>] <command name> [<json data>]"));
        resJson.putIfAbsent("Supported commands", mapper.createArrayNode()
                .add("help")
                .add("signRawTransaction <arguments>")
                .add("signRawCertificate <arguments>")
                .add("decodeRawCertificate <arguments>")
                .add("privKeyToPubKey <arguments>")
        );

        printer.print(resJson.toString());
    }

    private void printUsageMsg(String error, String usage) {
        ObjectNode resJson = mapper.createObjectNode();

        resJson.put("error", error);
        resJson.put("Usage", usage);

        printer.print(resJson.toString());
    }

    private static final String SIGN_RAW_TRANSACTION_USAGE = "signRawTransaction { \"hex\": hex_string, "
            + "\"prevTxs\": [{\"txid\": id, \"vout\": n, \"scriptPubKey\": hex, \"redeemScript\": hex}], "
            + "\"privateKeys\": [private_key], \"sighashType\": \"ALL\" }";

    private void signRawTransaction(Command command) throws Exception {
        String error = checkSignArguments(command);
        if (error != null) {
            printUsageMsg(error, SIGN_RAW_TRANSACTION_USAGE);
            return;
        }
        if (command.data().has("sighashType") && !command.hasText("sighashType")) {
            printUsageMsg("sighashType has invalid format.", SIGN_RAW_TRANSACTION_USAGE);
            return;
        }
        SigHashType sigHashType = command.hasText("sighashType")
                ? SigHashType.fromString(command.text("sighashType"))
                : SigHashType.ALL;

        List<McTransaction> transactions = McTransactionSerializer.getSerializer()
                .parseAll(BytesUtils.fromHexString(command.text("hex")));
        if (transactions.size() > settings.maxSigningVariants())
            throw new IllegalArgumentException(String.format("Too many transaction variants, at most %d allowed",
                    settings.maxSigningVariants()));

        List<PrevOutput> prevOutputs = parsePrevTxs(command.data().get("prevTxs"));
        sign(transactions.get(0), transactions.subList(1, transactions.size()), prevOutputs,
                parseKeys(command.data().get("privateKeys"), prevOutputs), sigHashType);
    }

    private static final String SIGN_RAW_CERTIFICATE_USAGE = "signRawCertificate { \"hex\": hex_string, "
            + "\"prevTxs\": [{\"txid\": id, \"vout\": n, \"scriptPubKey\": hex}], \"privateKeys\": [private_key] }";

    private void signRawCertificate(Command command) throws Exception {
        String error = checkSignArguments(command);
        if (error != null) {
            printUsageMsg(error, SIGN_RAW_CERTIFICATE_USAGE);
            return;
        }
        McEntity certificate = McCertificateSerializer.getSerializer()
                .parseBytes(BytesUtils.fromHexString(command.text("hex")));
        List<PrevOutput> prevOutputs = parsePrevTxs(command.data().get("prevTxs"));
        sign(certificate, Collections.emptyList(), prevOutputs,
                parseKeys(command.data().get("privateKeys"), prevOutputs), SigHashType.ALL);
    }

    private void decodeRawCertificate(Command command) throws Exception {
        if (!command.hasText("hex")) {
            printUsageMsg("hex is not specified or has invalid format.", "decodeRawCertificate { \"hex\": hex_string }");
            return;
        }
        CertificateView view = new CertificateView(McCertificateSerializer.getSerializer()
                .parseBytes(BytesUtils.fromHexString(command.text("hex"))));
        printer.print(mapper.writeValueAsString(view));
    }

    private void privKeyToPubKey(Command command) {
        if (!command.hasText("privateKey")) {
            printUsageMsg("privateKey is not specified or has invalid format.", "privKeyToPubKey { \"privateKey\": private_key }");
            return;
        }
        McPrivateKey key = McPrivateKey.fromHex(command.text("privateKey"));

        ObjectNode resJson = mapper.createObjectNode();
        resJson.put("publicKey", BytesUtils.toHexString(key.publicKey()));
        printer.print(resJson.toString());
    }

    private static String checkSignArguments(Command command) {
        if (!command.hasText("hex"))
            return "hex is not specified or has invalid format.";
        if (!command.hasArray("prevTxs"))
            return "prevTxs is not specified or has invalid format.";
        if (!command.hasArray("privateKeys"))
            return "privateKeys is not specified or has invalid format.";
        return null;
    }

    private void sign(McEntity base, List<? extends McEntity> variants, List<PrevOutput> prevOutputs,
                      BasicKeyStore keys, SigHashType sigHashType) throws Exception {
        InMemoryChainState emptyChain = new InMemoryChainState();
        try (ChainStateSnapshot snapshot = emptyChain.openSnapshot()) {
            CombinationResult result = engine.combine(new PrevOutputsOverlay(snapshot, prevOutputs), base, variants, keys, sigHashType);
            printer.print(mapper.writeValueAsString(new SignRawResultView(result)));
        }
    }

    private static List<PrevOutput> parsePrevTxs(JsonNode prevTxs) {
        List<PrevOutput> prevOutputs = new ArrayList<>();
        for (JsonNode prevTx : prevTxs) {
            if (!prevTx.has("txid") || !prevTx.has("vout") || !prevTx.has("scriptPubKey"))
                throw new IllegalArgumentException("prevTxs entries must contain txid, vout and scriptPubKey");
            byte[] txid = BytesUtils.fromHashHexString(prevTx.get("txid").asText(), "txid");
            byte[] lockingScript = BytesUtils.fromHexString(prevTx.get("scriptPubKey").asText());
            byte[] redeemScript = prevTx.has("redeemScript") ? BytesUtils.fromHexString(prevTx.get("redeemScript").asText()) : null;
            prevOutputs.add(new PrevOutput(new OutPoint(txid, prevTx.get("vout").asLong()), lockingScript, redeemScript));
        }
        return prevOutputs;
    }

    private static BasicKeyStore parseKeys(JsonNode privateKeys, List<PrevOutput> prevOutputs) {
        BasicKeyStore keys = new BasicKeyStore();
        for (JsonNode privateKey : privateKeys) {
            try {
                keys.addKey(McPrivateKey.fromHex(privateKey.asText()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unable to parse privateKey bytes: " + e.getMessage());
            }
        }
        for (PrevOutput prevOutput : prevOutputs) {
            if (StandardScripts.solve(prevOutput.lockingScript()).type().isPayToScriptHash())
                prevOutput.redeemScript().ifPresent(keys::addRedeemScript);
        }
        return keys;
    }
}
