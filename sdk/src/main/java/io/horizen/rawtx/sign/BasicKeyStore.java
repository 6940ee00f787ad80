package io.horizen.rawtx.sign;

import io.horizen.rawtx.utils.ByteArrayWrapper;
import io.horizen.rawtx.utils.Utils;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class BasicKeyStore implements KeyStore {
    private final Map<ByteArrayWrapper, McPrivateKey> keys = new HashMap<>();
    private final Map<ByteArrayWrapper, byte[]> redeemScripts = new HashMap<>();

    public BasicKeyStore addKey(McPrivateKey key) {
        keys.put(new ByteArrayWrapper(key.keyId()), key);
        return this;
    }

    public BasicKeyStore addRedeemScript(byte[] redeemScript) {
        byte[] copy = Arrays.copyOf(redeemScript, redeemScript.length);
        redeemScripts.put(new ByteArrayWrapper(Utils.Ripemd160Sha256Hash(copy)), copy);
        return this;
    }

    @Override
    public Optional<McPrivateKey> getKey(byte[] keyId) {
        return Optional.ofNullable(keys.get(new ByteArrayWrapper(keyId)));
    }

    @Override
    public Optional<byte[]> getRedeemScript(byte[] scriptHash) {
        return Optional.ofNullable(redeemScripts.get(new ByteArrayWrapper(scriptHash)))
                .map(script -> Arrays.copyOf(script, script.length));
    }

    @Override
    public boolean isEmpty() {
        return keys.isEmpty() && redeemScripts.isEmpty();
    }

    public int keysCount() {
        return keys.size();
    }
}
