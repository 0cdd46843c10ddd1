package com.syncline.core.model;

import java.io.Serializable;

/**
 * Marks an entity as created locally before server confirmation.
 *
 * @param source         what produced the optimistic write
 * @param correlationKey informational key describing the entity for diagnostics
 * @param timestamp      epoch millis at which the entity was created locally
 */
public record OptimisticMetadata(
    OptimisticSource source,
    String correlationKey,
    long timestamp
) implements Serializable {

    /** Always {@code true}; present so serialized entities carry the flag explicitly. */
    public boolean optimistic() {
        return true;
    }
}
