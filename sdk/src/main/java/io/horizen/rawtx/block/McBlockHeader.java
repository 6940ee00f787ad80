package io.horizen.rawtx.block;

import io.horizen.rawtx.utils.BytesReader;
import io.horizen.rawtx.utils.BytesUtils;
import io.horizen.rawtx.utils.Utils;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Mainchain block header. Hashes are held in display order and reversed on the wire.
 */
public final class McBlockHeader {
    public static final int NONCE_LENGTH = 32;

    private final int version;
    private final byte[] hashPrevBlock;
    private final byte[] hashMerkleRoot;
    private final byte[] hashScTxsCommitment;
    private final long time;
    private final long bits;
    private final byte[] nonce;
    private final byte[] solution;

    public McBlockHeader(int version,
                         byte[] hashPrevBlock,
                         byte[] hashMerkleRoot,
                         byte[] hashScTxsCommitment,
                         long time,
                         long bits,
                         byte[] nonce,
                         byte[] solution) {
        if (hashPrevBlock.length != BytesUtils.HASH_LENGTH || hashMerkleRoot.length != BytesUtils.HASH_LENGTH
                || hashScTxsCommitment.length != BytesUtils.HASH_LENGTH)
            throw new IllegalArgumentException("Block header hashes must be 32 bytes long");
        if (nonce.length != NONCE_LENGTH)
            throw new IllegalArgumentException(String.format("Incorrect nonce length, %d expected, %d found", NONCE_LENGTH, nonce.length));
        this.version = version;
        this.hashPrevBlock = Arrays.copyOf(hashPrevBlock, hashPrevBlock.length);
        this.hashMerkleRoot = Arrays.copyOf(hashMerkleRoot, hashMerkleRoot.length);
        this.hashScTxsCommitment = Arrays.copyOf(hashScTxsCommitment, hashScTxsCommitment.length);
        this.time = time;
        this.bits = bits;
        this.nonce = Arrays.copyOf(nonce, nonce.length);
        this.solution = Arrays.copyOf(solution, solution.length);
    }

    public int version() {
        return version;
    }

    public byte[] hashPrevBlock() {
        return Arrays.copyOf(hashPrevBlock, hashPrevBlock.length);
    }

    public byte[] hashMerkleRoot() {
        return Arrays.copyOf(hashMerkleRoot, hashMerkleRoot.length);
    }

    public byte[] hashScTxsCommitment() {
        return Arrays.copyOf(hashScTxsCommitment, hashScTxsCommitment.length);
    }

    public long time() {
        return time;
    }

    public long bits() {
        return bits;
    }

    public byte[] nonce() {
        return Arrays.copyOf(nonce, nonce.length);
    }

    public byte[] solution() {
        return Arrays.copyOf(solution, solution.length);
    }

    public byte[] bytes() {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        stream.writeBytes(BytesUtils.reversedIntBytes(version));
        stream.writeBytes(BytesUtils.reverseBytes(hashPrevBlock));
        stream.writeBytes(BytesUtils.reverseBytes(hashMerkleRoot));
        stream.writeBytes(BytesUtils.reverseBytes(hashScTxsCommitment));
        stream.writeBytes(BytesUtils.reversedIntBytes((int) time));
        stream.writeBytes(BytesUtils.reversedIntBytes((int) bits));
        stream.writeBytes(BytesUtils.reverseBytes(nonce));
        BytesUtils.writeVarBytes(stream, solution);
        return stream.toByteArray();
    }

    public byte[] hash() {
        return BytesUtils.reverseBytes(Utils.doubleSHA256Hash(bytes()));
    }

    public String hashHex() {
        return BytesUtils.toHexString(hash());
    }

    public static McBlockHeader parse(BytesReader reader) {
        int version = reader.readInt();
        byte[] prev = reader.readHash();
        byte[] merkleRoot = reader.readHash();
        byte[] scTxsCommitment = reader.readHash();
        long time = reader.readUnsignedInt();
        long bits = reader.readUnsignedInt();
        byte[] nonce = BytesUtils.reverseBytes(reader.readBytes(NONCE_LENGTH));
        byte[] solution = reader.readVarBytes();
        return new McBlockHeader(version, prev, merkleRoot, scTxsCommitment, time, bits, nonce, solution);
    }

    public static McBlockHeader parseBytes(byte[] bytes) {
        BytesReader reader = new BytesReader(bytes);
        McBlockHeader header = parse(reader);
        if (reader.hasRemaining())
            throw new IllegalArgumentException(String.format("Found %d extra byte(s) after block header", reader.remaining()));
        return header;
    }
}
