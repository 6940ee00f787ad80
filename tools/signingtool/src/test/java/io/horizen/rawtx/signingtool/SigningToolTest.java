package io.horizen.rawtx.signingtool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.horizen.rawtx.entity.McCertificate;
import io.horizen.rawtx.entity.McCertificateSerializer;
import io.horizen.rawtx.entity.McInput;
import io.horizen.rawtx.entity.McOutput;
import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.entity.OutPoint;
import io.horizen.rawtx.script.StandardScripts;
import io.horizen.rawtx.sign.McPrivateKey;
import io.horizen.rawtx.utils.BytesUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import static junit.framework.TestCase.*;

public class SigningToolTest {
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final String PREV_TXID = "0b8aab5b1fa3e8f9e6a8d1e37f09c0e4c3d0a2b1f1e1d1c1b1a1918171615141";

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private ByteArrayOutputStream byteArrayOutputStream;
    private PrintStream console;

    @Before
    public void setup() {
        byteArrayOutputStream = new ByteArrayOutputStream();
        console = System.out;
    }

    private String runTest(final String[] args) {
        try {
            System.setOut(new PrintStream(byteArrayOutputStream));
            SigningTool.main(args);
            return byteArrayOutputStream.toString();
        } catch (Exception e) {
            fail("Unexpected error in tests: " + e.getMessage());
        } finally {
            System.setOut(console);
            byteArrayOutputStream.reset();
        }
        return null;
    }

    private static McPrivateKey key(int seed) {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, (byte) seed);
        return new McPrivateKey(bytes);
    }

    private static McTransaction spendingTx() {
        McInput input = new McInput(new OutPoint(BytesUtils.fromHexString(PREV_TXID), 0), new byte[0], McInput.SEQUENCE_FINAL);
        McOutput output = new McOutput(50000, StandardScripts.payToPubKeyHash(key(2).keyId()));
        return new McTransaction(Collections.singletonList(input), Collections.singletonList(output), 0);
    }

    private static ObjectNode signArgs(String hex, McPrivateKey prevOwner, McPrivateKey signer) {
        ObjectNode argsJson = mapper.createObjectNode();
        argsJson.put("hex", hex);
        ObjectNode prevTx = mapper.createObjectNode();
        prevTx.put("txid", PREV_TXID);
        prevTx.put("vout", 0);
        prevTx.put("scriptPubKey", BytesUtils.toHexString(StandardScripts.payToPubKeyHash(prevOwner.keyId())));
        argsJson.putArray("prevTxs").add(prevTx);
        argsJson.putArray("privateKeys").add(BytesUtils.toHexString(signer.privateKeyBytes()));
        return argsJson;
    }

    @Test
    public void testUsage() {
        String result = runTest(new String[]{"help"});
        assertTrue(result != null && result.contains("Usage") && result.contains("Supported commands"));

        result = runTest(new String[]{});
        assertTrue(result != null && result.contains("Supported commands"));
    }

    @Test
    public void testUnsupportedCommand() {
        String result = runTest(new String[]{"createSignature", "{}"});
        assertTrue(result != null && result.contains("unsupported command 'createSignature'"));
    }

    @Test
    public void testInvalidJson() {
        String result = runTest(new String[]{"signRawTransaction", "{not json"});
        assertTrue(result != null && result.contains("error") && result.contains("Json expected"));
    }

    @Test
    public void testSignRawTransaction() throws Exception {
        McPrivateKey owner = key(1);
        String hex = BytesUtils.toHexString(spendingTx().bytes());

        String result = runTest(new String[]{"signRawTransaction", signArgs(hex, owner, owner).toString()});
        assertNotNull(result);

        JsonNode json = mapper.readTree(result);
        assertTrue("Signing with the owner key must complete the transaction", json.get("complete").asBoolean());
        assertFalse(json.has("errors"));
        assertFalse("Signed hex must differ from the unsigned one", hex.equals(json.get("hex").asText()));
    }

    @Test
    public void testSignRawTransactionWithWrongKey() throws Exception {
        String hex = BytesUtils.toHexString(spendingTx().bytes());

        String result = runTest(new String[]{"signRawTransaction", signArgs(hex, key(1), key(3)).toString()});
        JsonNode json = mapper.readTree(result);

        assertFalse(json.get("complete").asBoolean());
        assertEquals(1, json.get("errors").size());
        assertEquals(PREV_TXID, json.get("errors").get(0).get("txid").asText());
        assertEquals(hex, json.get("hex").asText());
    }

    @Test
    public void testSignRawTransactionMissingArguments() {
        ObjectNode argsJson = mapper.createObjectNode();
        argsJson.put("hex", BytesUtils.toHexString(spendingTx().bytes()));

        String result = runTest(new String[]{"signRawTransaction", argsJson.toString()});
        assertTrue(result != null && result.contains("prevTxs is not specified") && result.contains("Usage"));
    }

    @Test
    public void testSignRawTransactionInvalidSighash() {
        McPrivateKey owner = key(1);
        ObjectNode argsJson = signArgs(BytesUtils.toHexString(spendingTx().bytes()), owner, owner);
        argsJson.put("sighashType", "EVERYTHING");

        String result = runTest(new String[]{"signRawTransaction", argsJson.toString()});
        assertTrue(result != null && result.contains("Invalid sighash param"));
    }

    @Test
    public void testDecodeRawCertificate() throws Exception {
        byte[] scId = new byte[32];
        scId[0] = 7;
        McCertificate cert = new McCertificate(scId, 3, 10, new byte[32], new byte[McCertificate.SC_PROOF_SIZE],
                Collections.emptyList(),
                Collections.emptyList(),
                Collections.singletonList(new McOutput(1000, StandardScripts.payToPubKeyHash(key(1).keyId()))));
        ObjectNode argsJson = mapper.createObjectNode();
        argsJson.put("hex", BytesUtils.toHexString(McCertificateSerializer.getSerializer().toBytes(cert)));

        String result = runTest(new String[]{"decodeRawCertificate", argsJson.toString()});
        JsonNode json = mapper.readTree(result);

        assertEquals(cert.idHex(), json.get("certid").asText());
        assertEquals(3, json.get("cert").get("epochNumber").asInt());
        assertEquals(1, json.get("vout").size());
    }

    @Test
    public void testPrivKeyToPubKey() throws Exception {
        McPrivateKey key = key(5);
        ObjectNode argsJson = mapper.createObjectNode();
        argsJson.put("privateKey", BytesUtils.toHexString(key.privateKeyBytes()));

        String result = runTest(new String[]{"privKeyToPubKey", argsJson.toString()});
        assertEquals(BytesUtils.toHexString(key.publicKey()), mapper.readTree(result).get("publicKey").asText());

        argsJson.put("privateKey", "00");
        result = runTest(new String[]{"privKeyToPubKey", argsJson.toString()});
        assertTrue(result != null && result.contains("error") && result.contains("Invalid private key"));
    }

    @Test
    public void testSettingsOverride() throws Exception {
        File config = temporaryFolder.newFile("signing.conf");
        Files.write(config.toPath(), "rawtx.limits.maxSigningVariants = 1".getBytes(StandardCharsets.UTF_8));

        McPrivateKey owner = key(1);
        String hex = BytesUtils.toHexString(spendingTx().bytes());
        String twoVariants = signArgs(hex + hex, owner, owner).toString();

        String result = runTest(new String[]{"--settings", config.getPath(), "signRawTransaction", twoVariants});
        assertEquals("Too many transaction variants, at most 1 allowed", mapper.readTree(result).get("error").asText());

        // bundled configuration allows it
        result = runTest(new String[]{"signRawTransaction", twoVariants});
        assertTrue(mapper.readTree(result).get("complete").asBoolean());
    }

    @Test
    public void testMissingSettingsFile() throws Exception {
        String result = runTest(new String[]{"--settings", new File(temporaryFolder.getRoot(), "missing.conf").getPath(), "help"});
        assertTrue(mapper.readTree(result).get("error").asText().startsWith("Config file not found"));

        result = runTest(new String[]{"--settings"});
        assertTrue(result.contains("requires a config file path"));
    }
}
