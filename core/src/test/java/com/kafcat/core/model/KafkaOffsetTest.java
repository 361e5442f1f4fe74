package com.kafcat.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KafkaOffsetTest {

    @Test
    void testRawOffsetSignSelectsType() {
        assertEquals(KafkaOffset.Type.ABSOLUTE, KafkaOffset.offset(0).getType());
        assertEquals(KafkaOffset.Type.ABSOLUTE, KafkaOffset.offset(12).getType());
        assertEquals(KafkaOffset.Type.FROM_TAIL, KafkaOffset.offset(-1).getType());
        assertEquals(-1, KafkaOffset.offset(-1).getBegin());
    }

    @Test
    void testInvalidOffsetsRejected() {
        assertThrows(IllegalArgumentException.class, () -> KafkaOffset.absolute(-1));
        assertThrows(IllegalArgumentException.class, () -> KafkaOffset.fromTail(0));
        assertThrows(IllegalArgumentException.class, () -> KafkaOffset.offsetInterval(10, 5));
        assertThrows(IllegalArgumentException.class, () -> KafkaOffset.timeInterval(-5, 5));
    }

    @Test
    void testEndBound() {
        assertTrue(KafkaOffset.offsetInterval(1, 10).hasEndBound());
        assertTrue(KafkaOffset.timeInterval(1, 10).hasEndBound());
        assertFalse(KafkaOffset.timeInterval(1, KafkaOffset.OPEN_END).hasEndBound());
        assertFalse(KafkaOffset.absolute(10).hasEndBound());
        assertFalse(KafkaOffset.beginning().hasEndBound());
    }

    @Test
    void testValueEquality() {
        assertEquals(KafkaOffset.absolute(4), KafkaOffset.offset(4));
        assertEquals(KafkaOffset.timeInterval(1, 2), KafkaOffset.timeInterval(1, 2));
    }
}
