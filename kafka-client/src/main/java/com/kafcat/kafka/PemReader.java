package com.kafcat.kafka;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads PEM-encoded TLS material.
 */
@FunctionalInterface
public interface PemReader {

    PemReader FILES = path -> Files.readString(Path.of(path), StandardCharsets.US_ASCII);

    String read(String path) throws IOException;
}
