package io.horizen.rawtx.api.rpc.types;

import java.math.BigDecimal;

public final class ValueConverter {
    // zatoshis per coin
    public static final int COIN_DECIMALS = 8;

    private ValueConverter() {}

    public static BigDecimal toCoins(long zatoshis) {
        return BigDecimal.valueOf(zatoshis, COIN_DECIMALS);
    }
}
