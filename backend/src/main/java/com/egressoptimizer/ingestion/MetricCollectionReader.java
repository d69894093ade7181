package com.egressoptimizer.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads metrics collection documents from JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricCollectionReader {

    private final ObjectMapper objectMapper;

    public MetricCollection read(InputStream input) {
        try {
            MetricCollection collection = objectMapper.readValue(input, MetricCollection.class);
            if (collection == null) {
                throw new MetricCollectionException("Metrics collection document is empty");
            }
            log.debug("Read metrics collection {} with {} resource types",
                    collection.collectionId(), collection.resources().size());
            return collection;
        } catch (IOException e) {
            throw new MetricCollectionException("Malformed metrics collection: " + e.getMessage(), e);
        }
    }

    public MetricCollection read(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return read(input);
        } catch (IOException e) {
            throw new MetricCollectionException("Cannot read metrics collection " + path, e);
        }
    }
}
