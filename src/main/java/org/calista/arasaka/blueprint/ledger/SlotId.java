package org.calista.arasaka.blueprint.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Named facts tracked by the {@link CertaintyLedger}, each with the value types it accepts.
 */
public enum SlotId {
    INDUSTRY("industry", String.class),
    SUB_VERTICAL("subVertical", String.class),
    PRIMARY_ENTITIES("primaryEntities", List.class),
    WORKFLOWS("workflows", List.class),
    INTEGRATIONS("integrations", List.class),
    /** Either a labelled count ("12 properties") or a bare number. */
    SCALE("scale", String.class, Integer.class),
    TEAM_SIZE("teamSize", TeamSize.class),
    CUSTOMER_FACING("customerFacing", Boolean.class),
    COMPLEXITY("complexity", Complexity.class);

    private final String key;
    private final Class<?>[] types;

    SlotId(String key, Class<?>... types) {
        this.key = key;
        this.types = types;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean isList() {
        return types[0] == List.class;
    }

    /**
     * {@code null} clears a slot and is always accepted; list slots take lists of strings only.
     */
    public boolean accepts(Object value) {
        if (value == null) return true;
        for (Class<?> t : types) {
            if (!t.isInstance(value)) continue;
            if (value instanceof List<?> list) {
                for (Object o : list) {
                    if (!(o instanceof String)) return false;
                }
            }
            return true;
        }
        return false;
    }

    public static SlotId fromKey(String key) {
        for (SlotId id : values()) {
            if (id.key.equals(key)) return id;
        }
        throw new IllegalArgumentException("unknown slot: " + key);
    }
}
