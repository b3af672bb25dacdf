package com.p14n.fanout.broker;

import java.util.UUID;

/**
 * Source of message identifiers. Identifiers must be unique for the lifetime
 * of the process; the broker treats them as opaque strings.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();

    static IdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }
}
