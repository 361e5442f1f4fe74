package com.kafcat.core.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Connection and security settings shared by consumers, producers and admin clients.
 * <p>
 * {@code tls} must be present for {@link SecurityProtocol#SSL} and {@link SecurityProtocol#SASL_SSL};
 * this is checked when client parameters are built, before any connection is attempted.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class KafkaAuthConfig {

    @Singular
    List<String> brokers;

    @Builder.Default
    SecurityProtocol securityProtocol = SecurityProtocol.PLAINTEXT;

    TlsConfig tls;

    /**
     * Brokers in {@code host:port,host:port} form.
     */
    public String bootstrapServers() {
        return String.join(",", brokers);
    }

    public static KafkaAuthConfig plaintext(String... brokers) {
        return KafkaAuthConfig.builder().brokers(List.of(brokers)).build();
    }
}
