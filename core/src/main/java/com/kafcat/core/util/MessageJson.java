package com.kafcat.core.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kafcat.core.model.KafkaMessage;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON view of a {@link KafkaMessage}, with key, payload and header values decoded as UTF-8.
 */
@Value
public class MessageJson {
    @JsonProperty("key")
    String key;

    @JsonProperty("payload")
    String payload;

    @JsonProperty("timestamp")
    long timestamp;

    @JsonProperty("headers")
    Map<String, String> headers;

    @JsonCreator
    public MessageJson(
        @JsonProperty("key") String key,
        @JsonProperty("payload") String payload,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("headers") Map<String, String> headers
    ) {
        this.key = key;
        this.payload = payload;
        this.timestamp = timestamp;
        this.headers = headers;
    }

    public static MessageJson from(KafkaMessage message) {
        Map<String, String> headers = new LinkedHashMap<>();
        message.getHeaders().forEach((name, value) -> headers.put(name, new String(value, StandardCharsets.UTF_8)));
        return new MessageJson(message.keyAsString(), message.payloadAsString(), message.getTimestamp(), headers);
    }

    public KafkaMessage toMessage() {
        Map<String, byte[]> raw = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> raw.put(name, value.getBytes(StandardCharsets.UTF_8)));
        }
        return new KafkaMessage(
            key == null ? null : key.getBytes(StandardCharsets.UTF_8),
            payload == null ? null : payload.getBytes(StandardCharsets.UTF_8),
            timestamp,
            raw
        );
    }
}
