package io.horizen.rawtx.sign;

/**
 * Signature hash types accepted by the signing calls.
 */
public enum SigHashType {
    ALL("ALL", SigHashType.ALL_FLAG),
    NONE("NONE", SigHashType.NONE_FLAG),
    SINGLE("SINGLE", SigHashType.SINGLE_FLAG),
    ALL_ANYONECANPAY("ALL|ANYONECANPAY", SigHashType.ALL_FLAG | SigHashType.ANYONECANPAY_FLAG),
    NONE_ANYONECANPAY("NONE|ANYONECANPAY", SigHashType.NONE_FLAG | SigHashType.ANYONECANPAY_FLAG),
    SINGLE_ANYONECANPAY("SINGLE|ANYONECANPAY", SigHashType.SINGLE_FLAG | SigHashType.ANYONECANPAY_FLAG);

    public static final int ALL_FLAG = 0x01;
    public static final int NONE_FLAG = 0x02;
    public static final int SINGLE_FLAG = 0x03;
    public static final int ANYONECANPAY_FLAG = 0x80;
    // bits of the sighash byte selecting the output commitment mode
    public static final int BASE_TYPE_MASK = 0x1f;

    private final String name;
    private final int value;

    SigHashType(String name, int value) {
        this.name = name;
        this.value = value;
    }

    public static SigHashType fromString(String name) {
        for (SigHashType type : values()) {
            if (type.name.equals(name))
                return type;
        }
        throw new IllegalArgumentException("Invalid sighash param");
    }

    public String typeName() {
        return name;
    }

    // Byte appended to every signature.
    public int value() {
        return value;
    }

    public boolean isSingle() {
        return (value & BASE_TYPE_MASK) == SINGLE_FLAG;
    }

    public boolean isAnyoneCanPay() {
        return (value & ANYONECANPAY_FLAG) != 0;
    }
}
