package com.kafcat.core.model;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory form of a Kafka record.
 * <p>
 * Key and payload are never {@code null}: an absent key or payload is an empty array.
 * Consumers hand these out as-is; the setters exist for re-shaping a message before
 * it is published again.
 * </p>
 */
@Getter
public class KafkaMessage {
    private static final byte[] EMPTY = new byte[0];

    /**
     * Record key, empty when the record had none.
     */
    private byte[] key;

    /**
     * Record value, empty when the record had none.
     */
    private byte[] payload;

    /**
     * Record timestamp (epoch millis), or a non-positive value when unknown.
     */
    private long timestamp;

    /**
     * Record headers in arrival order. A repeated header name keeps its last value.
     */
    private Map<String, byte[]> headers;

    public KafkaMessage(byte[] key, byte[] payload, long timestamp) {
        this(key, payload, timestamp, Collections.emptyMap());
    }

    public KafkaMessage(byte[] key, byte[] payload, long timestamp, Map<String, byte[]> headers) {
        setKey(key);
        setPayload(payload);
        setTimestamp(timestamp);
        setHeaders(headers);
    }

    public static KafkaMessage of(String key, String payload, long timestamp) {
        return new KafkaMessage(utf8(key), utf8(payload), timestamp);
    }

    public void setKey(byte[] key) {
        this.key = key == null ? EMPTY : key;
    }

    public void setPayload(byte[] payload) {
        this.payload = payload == null ? EMPTY : payload;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public void setHeaders(Map<String, byte[]> headers) {
        this.headers = headers == null || headers.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public boolean hasKey() {
        return key.length > 0;
    }

    public boolean hasPayload() {
        return payload.length > 0;
    }

    public String keyAsString() {
        return new String(key, StandardCharsets.UTF_8);
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    private static byte[] utf8(String value) {
        return value == null ? EMPTY : value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KafkaMessage other)) {
            return false;
        }
        if (timestamp != other.timestamp
            || !Arrays.equals(key, other.key)
            || !Arrays.equals(payload, other.payload)
            || headers.size() != other.headers.size()) {
            return false;
        }
        for (Map.Entry<String, byte[]> header : headers.entrySet()) {
            if (!Arrays.equals(header.getValue(), other.headers.get(header.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(timestamp, headers.keySet());
        result = 31 * result + Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return "KafkaMessage(key=" + keyAsString()
            + ", payloadBytes=" + payload.length
            + ", timestamp=" + timestamp
            + ", headers=" + headers.keySet() + ")";
    }
}
