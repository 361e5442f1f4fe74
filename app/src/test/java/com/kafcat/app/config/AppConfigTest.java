package com.kafcat.app.config;

import com.kafcat.core.config.KafkaAuthConfig;
import com.kafcat.core.config.KafkaConsumerConfig;
import com.kafcat.core.config.SecurityProtocol;
import com.kafcat.core.error.ConfigurationException;
import com.kafcat.core.model.KafkaOffset;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigTest {

    private final Map<String, String> env = new HashMap<>();

    private AppConfig load() {
        return AppConfig.fromEnv(env::get);
    }

    @Test
    void testDefaults() {
        AppConfig config = load();

        assertEquals(AppConfig.Mode.CONSUME, config.getMode());
        assertEquals(List.of("localhost:9092"), config.getBrokers());
        assertEquals(SecurityProtocol.PLAINTEXT, config.getSecurityProtocol());
        assertEquals(KafkaOffset.beginning(), config.getOffset());
        assertEquals(AppConfig.OutputFormat.TEXT, config.getFormat());
        assertFalse(config.isExitOnDone());
        assertNull(config.getPartition());
        assertNull(config.getKeyDelimiter());
    }

    @Test
    void testConsumerConfigFromEnvironment() {
        env.put("KAFKA_BROKERS", "b1:9092, b2:9092");
        env.put("KAFKA_TOPIC", "orders");
        env.put("KAFKA_PARTITION", "3");
        env.put("KAFKA_GROUP_ID", "audit");
        env.put("KAFCAT_OFFSET", "-5");
        env.put("KAFCAT_EXIT_ON_DONE", "true");

        AppConfig config = load();
        KafkaConsumerConfig consumer = config.consumerConfig();

        assertEquals("orders", consumer.getTopic());
        assertEquals(3, consumer.partitionOrDefault());
        assertEquals("audit", consumer.getGroupId());
        assertTrue(consumer.isExitOnDone());
        assertEquals("b1:9092,b2:9092", consumer.getAuth().bootstrapServers());
        assertEquals(KafkaOffset.fromTail(-5), config.getOffset());
    }

    @Test
    void testTlsSettingsOnlyForTlsProtocols() {
        env.put("KAFKA_SECURITY_PROTOCOL", "ssl");
        env.put("KAFKA_TLS_CA_FILE", "/tls/ca.pem");
        env.put("KAFKA_TLS_CERT_FILE", "/tls/client.pem");
        env.put("KAFKA_TLS_KEY_FILE", "/tls/client.key");

        KafkaAuthConfig auth = load().auth();

        assertEquals(SecurityProtocol.SSL, auth.getSecurityProtocol());
        assertEquals("/tls/ca.pem", auth.getTls().getCaFile());
        assertEquals("/tls/client.key", auth.getTls().getClientKeyFile());

        env.put("KAFKA_SECURITY_PROTOCOL", "plaintext");
        assertNull(load().auth().getTls());
    }

    @Test
    void testCopyRequiresTargetTopic() {
        env.put("KAFCAT_MODE", "copy");
        env.put("KAFKA_TOPIC", "orders");

        AppConfig config = load();
        assertEquals(AppConfig.Mode.COPY, config.getMode());
        assertThrows(ConfigurationException.class, config::targetProducerConfig);

        env.put("KAFCAT_TARGET_TOPIC", "orders-copy");
        assertEquals("orders-copy", load().targetProducerConfig().getTopic());
    }

    @Test
    void testInvalidValuesAreConfigurationErrors() {
        env.put("KAFCAT_MODE", "tail");
        assertThrows(ConfigurationException.class, this::load);

        env.remove("KAFCAT_MODE");
        env.put("KAFKA_PARTITION", "first");
        assertThrows(ConfigurationException.class, this::load);

        env.remove("KAFKA_PARTITION");
        env.put("KAFKA_SECURITY_PROTOCOL", "kerberos");
        assertThrows(ConfigurationException.class, this::load);

        env.remove("KAFKA_SECURITY_PROTOCOL");
        env.put("KAFCAT_FORMAT", "xml");
        assertThrows(ConfigurationException.class, this::load);
    }
}
