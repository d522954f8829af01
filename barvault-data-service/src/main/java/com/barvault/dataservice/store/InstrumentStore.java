package com.barvault.dataservice.store;

import com.barvault.core.model.InstrumentDescriptor;
import com.barvault.core.model.InstrumentId;
import com.barvault.dataservice.exception.CatalogException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Instrument descriptors, one JSON file per instrument id.
 *
 * Directory structure: {root}/data/instrument/{instrumentId}.json
 */
public class InstrumentStore {

    private static final Logger log = LoggerFactory.getLogger(InstrumentStore.class);

    private final Path directory;
    private final ObjectMapper mapper;

    public InstrumentStore(Path directory) {
        this.directory = directory;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Write a descriptor, replacing any previous one for the same id.
     */
    public void save(InstrumentDescriptor descriptor) throws CatalogException {
        Path target = fileFor(descriptor.instrumentId());
        try {
            Files.createDirectories(directory);
            byte[] json = mapper.writeValueAsBytes(descriptor);
            AtomicFiles.write(target, json);
            log.debug("Saved descriptor {}", descriptor.instrumentId());
        } catch (IOException e) {
            throw new CatalogException("Failed to save descriptor " + descriptor.instrumentId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Look up a descriptor by exact id. A file whose stored id differs from the
     * requested one is ignored.
     */
    public Optional<InstrumentDescriptor> load(InstrumentId instrumentId) throws CatalogException {
        Path file = fileFor(instrumentId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            InstrumentDescriptor descriptor = mapper.readValue(file.toFile(), InstrumentDescriptor.class);
            if (!instrumentId.equals(descriptor.instrumentId())) {
                log.warn("Descriptor file {} holds {}, expected {}", file, descriptor.instrumentId(), instrumentId);
                return Optional.empty();
            }
            return Optional.of(descriptor);
        } catch (IOException e) {
            throw new CatalogException("Failed to read descriptor " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * All readable descriptors. Unreadable files are logged and skipped.
     */
    public List<InstrumentDescriptor> loadAll() {
        List<InstrumentDescriptor> descriptors = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return descriptors;
        }
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(f -> f.getFileName().toString().endsWith(".json"))
                .sorted()
                .forEach(f -> {
                    try {
                        descriptors.add(mapper.readValue(f.toFile(), InstrumentDescriptor.class));
                    } catch (IOException e) {
                        log.warn("Failed to read descriptor {}: {}", f, e.getMessage());
                    }
                });
        } catch (IOException e) {
            log.warn("Failed to list descriptors in {}: {}", directory, e.getMessage());
        }
        return descriptors;
    }

    Path fileFor(InstrumentId instrumentId) {
        return directory.resolve(URLEncoder.encode(instrumentId.toString(), StandardCharsets.UTF_8) + ".json");
    }
}
