package org.calista.arasaka.blueprint.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SlotValueTest {

    private static SlotValue<Object> of(Object value) {
        return new SlotValue<>(value, 0.9, SlotSource.INFERRED, List.of());
    }

    @Test
    void absentValues() {
        assertFalse(of(null).isPresent());
        assertFalse(of("").isPresent());
        assertFalse(of("   ").isPresent());
        assertFalse(of(List.of()).isPresent());
        assertFalse(of(0).isPresent());
    }

    @Test
    void presentValues() {
        assertTrue(of("plumber").isPresent());
        assertTrue(of(List.of("job")).isPresent());
        assertTrue(of(5).isPresent());
        assertTrue(of(Boolean.FALSE).isPresent());
    }
}
