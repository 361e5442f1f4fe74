package com.kafcat.kafka;

import com.kafcat.core.client.IKafkaProducer;
import com.kafcat.core.config.KafkaProducerConfig;
import com.kafcat.core.error.InvariantViolationException;
import com.kafcat.core.model.KafkaMessage;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link IKafkaProducer} publishing through a reactor-kafka {@link KafkaSender}.
 */
public class ReactorKafkaProducer implements IKafkaProducer {
    private static final Logger log = LoggerFactory.getLogger(ReactorKafkaProducer.class);

    private final KafkaSender<byte[], byte[]> sender;
    private final String topic;
    private final ClientMetrics metrics;

    public ReactorKafkaProducer(KafkaProducerConfig config, KafkaSender<byte[], byte[]> sender, MeterRegistry registry) {
        this.sender = sender;
        this.topic = config.getTopic();
        this.metrics = new ClientMetrics(registry, topic);
    }

    @Override
    public Mono<Void> writeOne(KafkaMessage message) {
        ProducerRecord<byte[], byte[]> record = toRecord(message);

        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .next()
            .switchIfEmpty(Mono.error(() ->
                new InvariantViolationException("Sender completed without a result for " + topic)))
            .flatMap(result -> {
                if (result.exception() != null) {
                    return Mono.error(result.exception());
                }
                return Mono.just(result);
            })
            .doOnNext(result -> {
                metrics.recordSent();
                if (log.isDebugEnabled()) {
                    log.debug("Message acknowledged: topic={}, partition={}, offset={}",
                        topic, result.recordMetadata().partition(), result.recordMetadata().offset());
                }
            })
            .onErrorMap(error -> {
                metrics.recordError("write");
                return KafkaErrors.wrap("write to " + topic, error);
            })
            .then();
    }

    private ProducerRecord<byte[], byte[]> toRecord(KafkaMessage message) {
        List<Header> headers = new ArrayList<>(message.getHeaders().size());
        message.getHeaders().forEach((name, value) -> headers.add(new RecordHeader(name, value)));

        return new ProducerRecord<>(
            topic,
            null, // partitioner decides
            message.getTimestamp() > 0 ? message.getTimestamp() : null,
            message.hasKey() ? message.getKey() : null,
            message.hasPayload() ? message.getPayload() : null,
            headers
        );
    }

    @Override
    public void close() {
        sender.close();
        log.info("Producer for {} closed", topic);
    }
}
