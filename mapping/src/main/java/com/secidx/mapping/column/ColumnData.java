package com.secidx.mapping.column;

import java.io.Serializable;
import java.util.Objects;

/**
 * Stored (serializable) part of a column mapping: one token slot per
 * generalization plus the column salt used by runtime derivation.
 *
 * Instances are immutable once built; views over them are stateless.
 */
public abstract class ColumnData implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TokenSlot[] slots;
    private final boolean runtime;
    private final byte[] salt;

    protected ColumnData(TokenSlot[] slots, boolean runtime, byte[] salt) {
        this.slots = Objects.requireNonNull(slots, "slots").clone();
        this.runtime = runtime;
        this.salt = Objects.requireNonNull(salt, "salt").clone();
        for (TokenSlot s : this.slots) {
            Objects.requireNonNull(s, "slot");
            if (s.isRuntime() != runtime) {
                throw new IllegalArgumentException("Slot " + s + " does not match runtime=" + runtime);
            }
        }
    }

    public int size() {
        return slots.length;
    }

    public TokenSlot slot(int i) {
        return slots[i];
    }

    public boolean isRuntime() {
        return runtime;
    }

    public byte[] getSalt() {
        return salt.clone();
    }
}
