package com.kafcat.app.command;

import com.kafcat.app.config.AppConfig.OutputFormat;
import com.kafcat.core.model.KafkaMessage;
import com.kafcat.core.util.JsonUtils;
import com.kafcat.core.util.MessageJson;

import java.nio.charset.StandardCharsets;

/**
 * Line-oriented rendering of messages, in both directions.
 * <p>
 * Text lines are {@code key<delimiter>payload} when a key delimiter is configured, otherwise
 * just the payload. JSON lines are {@link MessageJson} objects.
 * </p>
 */
public class MessageFormatter {

    private final OutputFormat format;
    private final String keyDelimiter;

    public MessageFormatter(OutputFormat format, String keyDelimiter) {
        this.format = format;
        this.keyDelimiter = keyDelimiter;
    }

    public String format(KafkaMessage message) {
        if (format == OutputFormat.JSON) {
            return JsonUtils.writeValueAsString(MessageJson.from(message));
        }
        if (keyDelimiter == null) {
            return message.payloadAsString();
        }
        return message.keyAsString() + keyDelimiter + message.payloadAsString();
    }

    /**
     * @throws IllegalArgumentException if a JSON line cannot be parsed
     */
    public KafkaMessage parse(String line) {
        if (format == OutputFormat.JSON) {
            return JsonUtils.readValue(line, MessageJson.class).toMessage();
        }
        int split = keyDelimiter == null ? -1 : line.indexOf(keyDelimiter);
        if (split < 0) {
            return new KafkaMessage(null, utf8(line), 0L);
        }
        return new KafkaMessage(
            utf8(line.substring(0, split)),
            utf8(line.substring(split + keyDelimiter.length())),
            0L
        );
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
