package com.kafcat.kafka;

import com.kafcat.core.config.KafkaAuthConfig;
import com.kafcat.core.config.KafkaConsumerConfig;
import com.kafcat.core.config.KafkaProducerConfig;
import com.kafcat.core.config.SecurityProtocol;
import com.kafcat.core.config.TlsConfig;
import com.kafcat.core.error.ConfigurationException;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps kafcat configuration onto Kafka client properties.
 * <p>
 * SASL protocols are rejected instead of falling back to plaintext. For SSL, all three PEM
 * paths are required: the CA file becomes a PEM truststore, the client certificate chain and
 * key are inlined into a PEM keystore because the Java client cannot take them as separate files.
 * </p>
 */
public class ClientParamsBuilder {

    static final String SESSION_TIMEOUT_MS = "6000";
    static final String MESSAGE_TIMEOUT_MS = "5000";
    private static final String PEM = "PEM";

    private final PemReader pemReader;

    public ClientParamsBuilder() {
        this(PemReader.FILES);
    }

    public ClientParamsBuilder(PemReader pemReader) {
        this.pemReader = pemReader;
    }

    /**
     * Connection and security properties common to every client.
     */
    public Map<String, Object> build(KafkaAuthConfig auth) {
        if (auth == null || auth.getBrokers().isEmpty()) {
            throw new ConfigurationException("At least one broker must be configured");
        }

        SecurityProtocol protocol = auth.getSecurityProtocol();
        if (protocol.isSasl()) {
            throw new ConfigurationException("Security protocol " + protocol + " is not implemented");
        }

        Map<String, Object> props = new HashMap<>();
        props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, auth.bootstrapServers());
        props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, protocol.kafkaName());

        if (protocol.requiresTls()) {
            putTls(props, protocol, auth.getTls());
        }
        return props;
    }

    public Map<String, Object> consumer(KafkaConsumerConfig config) {
        requireTopic(config.getTopic());
        if (config.getPartition() != null && config.getPartition() < 0) {
            throw new ConfigurationException("Partition must be >= 0, got " + config.getPartition());
        }

        Map<String, Object> props = build(config.getAuth());
        if (config.getGroupId() != null && !config.getGroupId().isBlank()) {
            props.put(ConsumerConfig.GROUP_ID_CONFIG, config.getGroupId());
        }
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, SESSION_TIMEOUT_MS);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        return props;
    }

    public Map<String, Object> producer(KafkaProducerConfig config) {
        requireTopic(config.getTopic());

        Map<String, Object> props = build(config.getAuth());
        // delivery.timeout.ms must cover linger.ms + request.timeout.ms
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, MESSAGE_TIMEOUT_MS);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, MESSAGE_TIMEOUT_MS);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, MESSAGE_TIMEOUT_MS);
        props.put(ProducerConfig.LINGER_MS_CONFIG, "0");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        return props;
    }

    public Map<String, Object> admin(KafkaAuthConfig auth) {
        return build(auth);
    }

    private void putTls(Map<String, Object> props, SecurityProtocol protocol, TlsConfig tls) {
        if (tls == null) {
            throw new ConfigurationException("Security protocol " + protocol + " requires TLS settings");
        }
        String caFile = requirePath(tls.getCaFile(), "CA file");
        String certFile = requirePath(tls.getClientCertFile(), "client certificate file");
        String keyFile = requirePath(tls.getClientKeyFile(), "client key file");

        props.put(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, PEM);
        props.put(SslConfigs.SSL_TRUSTSTORE_LOCATION_CONFIG, caFile);
        props.put(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, PEM);
        props.put(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG, readPem(certFile));
        props.put(SslConfigs.SSL_KEYSTORE_KEY_CONFIG, readPem(keyFile));
    }

    private String readPem(String path) {
        try {
            return pemReader.read(path);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read TLS material from " + path, e);
        }
    }

    private static String requirePath(String path, String what) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("TLS " + what + " is required");
        }
        return path;
    }

    private static void requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new ConfigurationException("Topic is required");
        }
    }
}
