package io.horizen.rawtx.tools.utils;

public interface MessagePrinter {
    void print(String message);
}
