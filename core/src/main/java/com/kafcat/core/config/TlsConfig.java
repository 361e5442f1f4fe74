package com.kafcat.core.config;

import lombok.Builder;
import lombok.Value;

/**
 * Paths to PEM-encoded TLS material. Nothing is read here; the engine loads the files.
 */
@Value
@Builder(toBuilder = true)
public class TlsConfig {
    /**
     * CA certificate(s) used to verify the brokers.
     */
    String caFile;

    /**
     * Client certificate chain presented to the brokers.
     */
    String clientCertFile;

    /**
     * Private key matching {@link #clientCertFile}.
     */
    String clientKeyFile;
}
