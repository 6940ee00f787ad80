package io.horizen.rawtx.entity;

import java.util.List;

/**
 * Spend-authorizing mainchain entity: a transaction or a sidechain withdrawal certificate.
 * Shared capability is structural access to inputs and outputs. Variant data is reached by
 * checking {@link #type()} and using the concrete class.
 */
public interface McEntity {

    McEntityType type();

    int version();

    List<McInput> inputs();

    List<McOutput> outputs();

    byte[] bytes();

    // Double SHA256 of the serialization in display order.
    byte[] id();

    String idHex();

    // Deep copy, whose inputs may be modified without affecting this entity.
    McEntity copy();
}
