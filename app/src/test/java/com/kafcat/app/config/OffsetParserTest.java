package com.kafcat.app.config;

import com.kafcat.core.error.ConfigurationException;
import com.kafcat.core.model.KafkaOffset;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OffsetParserTest {

    @Test
    void testSymbolicOffsets() {
        assertEquals(KafkaOffset.beginning(), OffsetParser.parse("beginning"));
        assertEquals(KafkaOffset.end(), OffsetParser.parse(" END "));
        assertEquals(KafkaOffset.stored(), OffsetParser.parse("stored"));
    }

    @Test
    void testNumericOffsets() {
        assertEquals(KafkaOffset.absolute(42), OffsetParser.parse("42"));
        assertEquals(KafkaOffset.absolute(0), OffsetParser.parse("0"));
        assertEquals(KafkaOffset.fromTail(-1), OffsetParser.parse("-1"));
        assertEquals(KafkaOffset.fromTail(-10), OffsetParser.parse("-10"));
    }

    @Test
    void testOffsetIntervals() {
        assertEquals(KafkaOffset.offsetInterval(10, 20), OffsetParser.parse("10..20"));
        assertEquals(KafkaOffset.offsetInterval(10, KafkaOffset.OPEN_END), OffsetParser.parse("10.."));
    }

    @Test
    void testTimeIntervals() {
        assertEquals(KafkaOffset.timeInterval(1_700_000_000_000L, KafkaOffset.OPEN_END),
            OffsetParser.parse("s@1700000000000"));
        assertEquals(KafkaOffset.timeInterval(1_700_000_000_000L, 1_700_000_060_000L),
            OffsetParser.parse("s@1700000000000..1700000060000"));
        assertEquals(KafkaOffset.timeInterval(1_700_000_000_000L, KafkaOffset.OPEN_END),
            OffsetParser.parse("s@1700000000000.."));
    }

    @Test
    void testInvalidOffsetsRejected() {
        assertThrows(ConfigurationException.class, () -> OffsetParser.parse("latest"));
        assertThrows(ConfigurationException.class, () -> OffsetParser.parse("20..10"));
        assertThrows(ConfigurationException.class, () -> OffsetParser.parse("-5..10"));
        assertThrows(ConfigurationException.class, () -> OffsetParser.parse("s@yesterday"));
    }
}
