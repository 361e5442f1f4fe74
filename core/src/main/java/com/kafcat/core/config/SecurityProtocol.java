package com.kafcat.core.config;

import java.util.Locale;

/**
 * Security protocols a client can be configured with.
 * SASL variants are recognised so they can be rejected explicitly.
 */
public enum SecurityProtocol {
    PLAINTEXT("PLAINTEXT"),
    SASL_PLAINTEXT("SASL_PLAINTEXT"),
    SSL("SSL"),
    SASL_SSL("SASL_SSL");

    private final String kafkaName;

    SecurityProtocol(String kafkaName) {
        this.kafkaName = kafkaName;
    }

    /**
     * Name understood by the {@code security.protocol} client setting.
     */
    public String kafkaName() {
        return kafkaName;
    }

    public boolean requiresTls() {
        return this == SSL || this == SASL_SSL;
    }

    public boolean isSasl() {
        return this == SASL_PLAINTEXT || this == SASL_SSL;
    }

    /**
     * Parses a protocol name, accepting any case and '-' in place of '_'.
     */
    public static SecurityProtocol parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (SecurityProtocol protocol : values()) {
            if (protocol.kafkaName.equals(normalized)) {
                return protocol;
            }
        }
        throw new IllegalArgumentException("Unknown security protocol: " + value);
    }
}
