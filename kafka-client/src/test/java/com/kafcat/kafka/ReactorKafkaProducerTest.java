package com.kafcat.kafka;

import com.kafcat.core.config.KafkaAuthConfig;
import com.kafcat.core.config.KafkaProducerConfig;
import com.kafcat.core.error.BrokerRoundTripException;
import com.kafcat.core.error.InvariantViolationException;
import com.kafcat.core.metrics.MetricsNames;
import com.kafcat.core.model.KafkaMessage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderRecord;
import reactor.kafka.sender.SenderResult;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReactorKafkaProducerTest {

    private static final String TOPIC = "orders";

    private KafkaSender<byte[], byte[]> sender;
    private SenderResult<Object> result;
    private SimpleMeterRegistry registry;
    private ReactorKafkaProducer producer;
    private final List<ProducerRecord<byte[], byte[]>> sent = new ArrayList<>();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        sender = mock(KafkaSender.class);
        result = mock(SenderResult.class);
        when(result.recordMetadata()).thenReturn(new RecordMetadata(new TopicPartition(TOPIC, 0), 7L, 0, 0L, 0, 0));
        registry = new SimpleMeterRegistry();

        doAnswer(invocation -> {
            Publisher<SenderRecord<byte[], byte[], Object>> records = invocation.getArgument(0);
            return Flux.from(records).map(record -> {
                sent.add(record);
                return result;
            });
        }).when(sender).send(any());

        producer = new ReactorKafkaProducer(
            KafkaProducerConfig.builder().topic(TOPIC).auth(KafkaAuthConfig.plaintext("localhost:9092")).build(),
            sender,
            registry
        );
    }

    @Test
    void testMessageMappedToRecord() {
        KafkaMessage message = new KafkaMessage(
            bytes("k1"), bytes("v1"), 1_700_000_000_000L, Map.of("trace", bytes("abc"))
        );

        StepVerifier.create(producer.writeOne(message)).verifyComplete();

        ProducerRecord<byte[], byte[]> record = sent.get(0);
        assertEquals(TOPIC, record.topic());
        assertNull(record.partition());
        assertArrayEquals(bytes("k1"), record.key());
        assertArrayEquals(bytes("v1"), record.value());
        assertEquals(1_700_000_000_000L, record.timestamp());
        assertArrayEquals(bytes("abc"), record.headers().lastHeader("trace").value());
        assertEquals(1.0, registry.get(MetricsNames.PRODUCER_SENT_TOTAL).counter().count());
    }

    @Test
    void testEmptyKeyAndPayloadSentAsAbsent() {
        StepVerifier.create(producer.writeOne(new KafkaMessage(new byte[0], new byte[0], 0L))).verifyComplete();

        ProducerRecord<byte[], byte[]> record = sent.get(0);
        assertNull(record.key());
        assertNull(record.value());
        assertNull(record.timestamp());
    }

    @Test
    void testSendFailureMapped() {
        when(result.exception()).thenReturn(new TimeoutException("Expiring 1 record(s) after 5000 ms"));

        StepVerifier.create(producer.writeOne(KafkaMessage.of("k", "v", 0L)))
            .expectError(BrokerRoundTripException.class)
            .verify();

        assertEquals(1.0, registry.get(MetricsNames.CLIENT_ERRORS_TOTAL).counter().count());
    }

    @Test
    void testMissingSendResultIsInvariantViolation() {
        doReturn(Flux.empty()).when(sender).send(any());

        StepVerifier.create(producer.writeOne(KafkaMessage.of("k", "v", 0L)))
            .expectError(InvariantViolationException.class)
            .verify();
    }

    @Test
    void testCloseClosesSender() {
        producer.close();

        verify(sender).close();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
