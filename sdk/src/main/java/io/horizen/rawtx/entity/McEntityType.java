package io.horizen.rawtx.entity;

public enum McEntityType {
    TRANSACTION,
    CERTIFICATE
}
