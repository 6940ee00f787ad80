package io.horizen.rawtx.fixtures;

import io.horizen.rawtx.entity.McCertificate;
import io.horizen.rawtx.entity.McInput;
import io.horizen.rawtx.entity.McOutput;
import io.horizen.rawtx.entity.McTransaction;
import io.horizen.rawtx.entity.OutPoint;
import io.horizen.rawtx.script.StandardScripts;
import io.horizen.rawtx.sign.McPrivateKey;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class McEntityFixture {
    static public byte[] generateNextBytes(int size, int seed) {
        byte[] bytes = new byte[size];
        new Random(seed).nextBytes(bytes);
        return bytes;
    }

    static public byte[] generateHash(int seed) {
        return generateNextBytes(32, seed);
    }

    static public McPrivateKey generateKey(int seed) {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, (byte) seed);
        bytes[0] = 0x11;
        return new McPrivateKey(bytes);
    }

    static public McOutput payToKeyOutput(McPrivateKey key, long value) {
        return new McOutput(value, StandardScripts.payToPubKeyHash(key.keyId()));
    }

    // Transaction spending the given outpoints without any unlocking script.
    static public McTransaction unsignedTransaction(List<OutPoint> spent, List<McOutput> outputs) {
        List<McInput> inputs = new ArrayList<>();
        for (OutPoint outPoint : spent)
            inputs.add(new McInput(outPoint, new byte[0], McInput.SEQUENCE_FINAL));
        return new McTransaction(inputs, outputs, 0);
    }

    // Transaction with an input from nowhere, used to fund keys in a test chain.
    static public McTransaction fundingTransaction(int seed, List<McOutput> outputs) {
        return unsignedTransaction(Collections.singletonList(new OutPoint(generateHash(seed), 0)), outputs);
    }

    static public McCertificate certificate(int seed, List<McInput> inputs, List<McOutput> regularOutputs, List<McOutput> backwardTransfers) {
        Random rnd = new Random(seed);
        return new McCertificate(generateHash(rnd.nextInt()), rnd.nextInt(100), rnd.nextInt(1000),
                generateHash(rnd.nextInt()), generateNextBytes(McCertificate.SC_PROOF_SIZE, rnd.nextInt()),
                inputs, regularOutputs, backwardTransfers);
    }
}
