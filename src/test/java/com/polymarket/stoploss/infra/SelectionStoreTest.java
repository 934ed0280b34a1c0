package com.polymarket.stoploss.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SelectionStoreTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void missingFileMeansNothingSelected() {
        SelectionStore store = new SelectionStore(objectMapper, dir.resolve("selected_positions.json"));

        assertThat(store.load()).isEmpty();
    }

    @Test
    void savedSelectionSurvivesRestart() {
        Path file = dir.resolve("state/selected_positions.json");
        new SelectionStore(objectMapper, file).save(new LinkedHashSet<>(List.of("111", "222")));

        SelectionStore reopened = new SelectionStore(objectMapper, file);

        assertThat(reopened.load()).containsExactly("111", "222");
        assertThat(file.resolveSibling("selected_positions.json.tmp")).doesNotExist();
    }

    @Test
    void malformedFileIsIgnored() throws Exception {
        Path file = dir.resolve("selected_positions.json");
        Files.writeString(file, "{not json");

        assertThat(new SelectionStore(objectMapper, file).load()).isEmpty();
    }

    @Test
    void blankAndNullEntriesAreDropped() throws Exception {
        Path file = dir.resolve("selected_positions.json");
        Files.writeString(file, "[\" 333 \", \"\", null, \"444\"]");

        assertThat(new SelectionStore(objectMapper, file).load()).containsExactly("333", "444");
    }
}
