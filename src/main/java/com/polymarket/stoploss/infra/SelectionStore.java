package com.polymarket.stoploss.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.stoploss.config.StopLossProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Durable set of token ids monitored in SELECTED mode, stored as a JSON array.
 */
@Slf4j
@Component
public class SelectionStore {

    private static final TypeReference<List<String>> TOKEN_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path file;

    @Autowired
    public SelectionStore(ObjectMapper objectMapper, StopLossProperties properties) {
        this(objectMapper, Path.of(properties.selectionFile()));
    }

    public SelectionStore(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper;
        this.file = file;
    }

    public Set<String> load() {
        if (!Files.exists(file)) {
            return Set.of();
        }
        try {
            List<String> ids = objectMapper.readValue(file.toFile(), TOKEN_LIST);
            if (ids == null) {
                return Set.of();
            }
            return ids.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(id -> !id.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        } catch (IOException e) {
            log.warn("Ignoring unreadable selection file {}: {}", file, e.getMessage());
            return Set.of();
        }
    }

    /**
     * Overwrites the stored selection. Written to a sibling temp file first, then moved into place.
     */
    public void save(Set<String> tokenIds) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new ArrayList<>(tokenIds));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.info("Saved {} selected positions to {}", tokenIds.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save selection to " + file, e);
        }
    }
}
