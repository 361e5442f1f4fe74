package com.kafcat.app.config;

import com.kafcat.core.config.KafkaAuthConfig;
import com.kafcat.core.config.KafkaConsumerConfig;
import com.kafcat.core.config.KafkaProducerConfig;
import com.kafcat.core.config.SecurityProtocol;
import com.kafcat.core.config.TlsConfig;
import com.kafcat.core.error.ConfigurationException;
import com.kafcat.core.model.KafkaOffset;
import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the kafcat executable, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class AppConfig {

    Mode mode;
    List<String> brokers;
    SecurityProtocol securityProtocol;
    String tlsCaFile;
    String tlsCertFile;
    String tlsKeyFile;
    String groupId;
    String topic;
    Integer partition;
    KafkaOffset offset;
    boolean exitOnDone;
    OutputFormat format;

    /**
     * Separates key from payload in text input and output; {@code null} means payload only.
     */
    String keyDelimiter;

    /**
     * Destination of the copy mode.
     */
    String targetTopic;

    public static AppConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    static AppConfig fromEnv(Function<String, String> env) {
        return AppConfig.builder()
            .mode(Mode.parse(getEnv(env, "KAFCAT_MODE", "consume")))
            .brokers(splitBrokers(getEnv(env, "KAFKA_BROKERS", "localhost:9092")))
            .securityProtocol(parseProtocol(getEnv(env, "KAFKA_SECURITY_PROTOCOL", "plaintext")))
            .tlsCaFile(getEnv(env, "KAFKA_TLS_CA_FILE", null))
            .tlsCertFile(getEnv(env, "KAFKA_TLS_CERT_FILE", null))
            .tlsKeyFile(getEnv(env, "KAFKA_TLS_KEY_FILE", null))
            .groupId(getEnv(env, "KAFKA_GROUP_ID", "kafcat"))
            .topic(getEnv(env, "KAFKA_TOPIC", null))
            .partition(parsePartition(getEnv(env, "KAFKA_PARTITION", null)))
            .offset(OffsetParser.parse(getEnv(env, "KAFCAT_OFFSET", "beginning")))
            .exitOnDone(Boolean.parseBoolean(getEnv(env, "KAFCAT_EXIT_ON_DONE", "false")))
            .format(OutputFormat.parse(getEnv(env, "KAFCAT_FORMAT", "text")))
            .keyDelimiter(getEnv(env, "KAFCAT_KEY_DELIMITER", null))
            .targetTopic(getEnv(env, "KAFCAT_TARGET_TOPIC", null))
            .build();
    }

    public KafkaAuthConfig auth() {
        KafkaAuthConfig.KafkaAuthConfigBuilder builder = KafkaAuthConfig.builder()
            .brokers(brokers)
            .securityProtocol(securityProtocol);
        if (securityProtocol.requiresTls()) {
            builder.tls(TlsConfig.builder()
                .caFile(tlsCaFile)
                .clientCertFile(tlsCertFile)
                .clientKeyFile(tlsKeyFile)
                .build());
        }
        return builder.build();
    }

    public KafkaConsumerConfig consumerConfig() {
        return KafkaConsumerConfig.builder()
            .groupId(groupId)
            .topic(topic)
            .partition(partition)
            .exitOnDone(exitOnDone)
            .auth(auth())
            .build();
    }

    /**
     * Producer for {@link #topic}, used by the produce mode.
     */
    public KafkaProducerConfig producerConfig() {
        return KafkaProducerConfig.builder().topic(topic).auth(auth()).build();
    }

    /**
     * Producer for {@link #targetTopic}, used by the copy mode.
     */
    public KafkaProducerConfig targetProducerConfig() {
        if (targetTopic == null) {
            throw new ConfigurationException("KAFCAT_TARGET_TOPIC is required in copy mode");
        }
        return KafkaProducerConfig.builder().topic(targetTopic).auth(auth()).build();
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    private static List<String> splitBrokers(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(broker -> !broker.isEmpty())
            .collect(Collectors.toList());
    }

    private static SecurityProtocol parseProtocol(String value) {
        try {
            return SecurityProtocol.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid KAFKA_SECURITY_PROTOCOL: " + value, e);
        }
    }

    private static Integer parsePartition(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid KAFKA_PARTITION: " + value, e);
        }
    }

    public enum Mode {
        CONSUME,
        PRODUCE,
        COPY;

        static Mode parse(String value) {
            try {
                return Mode.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid KAFCAT_MODE: " + value, e);
            }
        }
    }

    public enum OutputFormat {
        TEXT,
        JSON;

        static OutputFormat parse(String value) {
            try {
                return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid KAFCAT_FORMAT: " + value, e);
            }
        }
    }
}
