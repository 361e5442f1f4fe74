package com.kafcat.app;

import com.kafcat.app.command.KafcatCommands;
import com.kafcat.app.config.AppConfig;
import com.kafcat.core.client.IKafkaEngine;
import com.kafcat.core.error.ConfigurationException;
import com.kafcat.core.error.ConnectionException;
import com.kafcat.kafka.ApacheKafkaEngine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Main entry point for kafcat.
 * <p>
 * Configuration comes from the environment (see {@link AppConfig#fromEnv()}). Messages go to
 * stdout, logs to stderr. Exit status:
 * <ul>
 *   <li>0 - the command finished</li>
 *   <li>1 - invalid configuration or the client could not be created</li>
 *   <li>2 - the command failed while running</li>
 *   <li>130 - interrupted</li>
 * </ul>
 * </p>
 */
public class KafcatApp {
    private static final Logger log = LoggerFactory.getLogger(KafcatApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SETUP_FAILED = 1;
    static final int EXIT_RUN_FAILED = 2;
    static final int EXIT_INTERRUPTED = 130;

    public static void main(String[] args) {
        System.exit(run());
    }

    static int run() {
        AppConfig config;
        try {
            config = AppConfig.fromEnv();
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_SETUP_FAILED;
        }
        if (config.getTopic() != null) {
            MDC.put("topic", config.getTopic());
        }

        log.info("Starting kafcat: mode={}, brokers={}, topic={}, offset={}",
            config.getMode(), config.getBrokers(), config.getTopic(), config.getOffset());

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        IKafkaEngine engine = new ApacheKafkaEngine(registry);
        PrintStream out = new PrintStream(System.out, false, StandardCharsets.UTF_8);

        CompletableFuture<Void> done = command(new KafcatCommands(engine, config), config, out).toFuture();
        handleShutdown(config, done, registry);

        try {
            done.join();
            return EXIT_OK;
        } catch (CancellationException e) {
            return EXIT_INTERRUPTED;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("kafcat {} failed: {}", config.getMode(), cause.getMessage(), cause);
            return exitCodeFor(cause);
        } finally {
            out.flush();
        }
    }

    static Mono<Void> command(KafcatCommands commands, AppConfig config, PrintStream out) {
        switch (config.getMode()) {
            case CONSUME:
                return commands.consume(out);
            case PRODUCE:
                return commands.produce(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
            case COPY:
                return commands.copy();
            default:
                return Mono.error(new ConfigurationException("Unsupported mode: " + config.getMode()));
        }
    }

    static int exitCodeFor(Throwable error) {
        if (error instanceof ConfigurationException || error instanceof ConnectionException) {
            return EXIT_SETUP_FAILED;
        }
        return EXIT_RUN_FAILED;
    }

    private static void handleShutdown(AppConfig config, CompletableFuture<Void> done, MeterRegistry registry) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (config.getTopic() != null) {
                MDC.put("topic", config.getTopic());
            }
            if (!done.isDone()) {
                log.info("Shutdown signal received, stopping {}", config.getMode());
                // Cancels the subscription, which closes the clients
                done.cancel(true);
            }
            logTotals(registry);
        }));
    }

    private static void logTotals(MeterRegistry registry) {
        registry.getMeters().stream()
            .filter(meter -> meter instanceof Counter)
            .forEach(meter -> log.info("{} {} = {}",
                meter.getId().getName(), meter.getId().getTags(), (long) ((Counter) meter).count()));
    }
}
