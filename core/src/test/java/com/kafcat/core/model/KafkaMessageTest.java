package com.kafcat.core.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KafkaMessageTest {

    @Test
    void testNullKeyAndPayloadBecomeEmpty() {
        KafkaMessage message = new KafkaMessage(null, null, 5L);

        assertArrayEquals(new byte[0], message.getKey());
        assertArrayEquals(new byte[0], message.getPayload());
        assertFalse(message.hasKey());
        assertFalse(message.hasPayload());
        assertTrue(message.getHeaders().isEmpty());
    }

    @Test
    void testStructuralEquality() {
        Map<String, byte[]> headers = new LinkedHashMap<>();
        headers.put("trace", "abc".getBytes(StandardCharsets.UTF_8));

        KafkaMessage a = new KafkaMessage(bytes("k1"), bytes("v1"), 10L, headers);
        KafkaMessage b = new KafkaMessage(bytes("k1"), bytes("v1"), 10L, Map.of("trace", bytes("abc")));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, KafkaMessage.of("k1", "v1", 10L));
        assertNotEquals(a, new KafkaMessage(bytes("k1"), bytes("v2"), 10L, headers));
    }

    @Test
    void testSettersReshapeMessage() {
        KafkaMessage message = KafkaMessage.of("k", "v", 1L);

        message.setKey(null);
        message.setPayload(bytes("other"));
        message.setTimestamp(2L);

        assertEquals(KafkaMessage.of("", "other", 2L), message);
    }

    @Test
    void testHeadersAreCopied() {
        Map<String, byte[]> headers = new LinkedHashMap<>();
        headers.put("a", bytes("1"));
        KafkaMessage message = new KafkaMessage(null, bytes("v"), 0L, headers);

        headers.put("b", bytes("2"));

        assertEquals(1, message.getHeaders().size());
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
