package com.catdb.registry;

import com.catdb.config.CatdbSettings;
import com.catdb.model.ConnectionConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionConfigStoreTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConnectionConfigStore store;

    @BeforeEach
    void setUp() {
        store = new ConnectionConfigStore(CatdbSettings.defaults().toBuilder().configDir(dir).build(), objectMapper);
    }

    @Test
    void missingFileLoadsEmpty() {
        assertThat(store.load()).isEmpty();
    }

    @Test
    void savesObfuscatedPasswordAndLoadsItBack() throws Exception {
        Map<String, ConnectionConfig> configs = new LinkedHashMap<>();
        configs.put("warehouse", ConnectionConfig.builder()
                .kind("postgresql")
                .host("db.internal")
                .port(5432)
                .user("analyst")
                .password("Secret1")
                .database("dw")
                .build());
        configs.put("local", ConnectionConfig.builder().kind("sqlite").path("/tmp/local.db").build());

        store.save(configs);

        JsonNode onDisk = objectMapper.readTree(store.getFile().toFile());
        assertThat(onDisk.get("warehouse").get("type").asText()).isEqualTo("postgresql");
        assertThat(onDisk.get("warehouse").get("password").asText()).isEqualTo("Frperg1");
        assertThat(onDisk.get("local").has("password")).isFalse();

        Map<String, ConnectionConfig> loaded = store.load();
        assertThat(loaded).containsOnlyKeys("warehouse", "local");
        assertThat(loaded.get("warehouse").getPassword()).isEqualTo("Secret1");
        assertThat(loaded.get("warehouse").getDisplayName()).isEqualTo("warehouse");
        assertThat(loaded.get("local").getPath()).isEqualTo("/tmp/local.db");
        assertThat(loaded.get("local").getExtraParams()).isEmpty();
    }

    @Test
    void toleratesByteOrderMark() throws Exception {
        Files.createDirectories(dir);
        Files.writeString(store.getFile(), "\uFEFF{\"a\":{\"type\":\"sqlite\",\"path\":\"/x.db\"}}", StandardCharsets.UTF_8);

        assertThat(store.load()).containsOnlyKeys("a");
    }

    @Test
    void unreadableFileIsBackedUpAndLoadsEmpty() throws Exception {
        Files.writeString(store.getFile(), "{not json", StandardCharsets.UTF_8);

        assertThat(store.load()).isEmpty();

        Path backup = dir.resolve(CatdbSettings.CONFIG_FILE + ConnectionConfigStore.BACKUP_SUFFIX);
        assertThat(backup).exists();
        assertThat(Files.readString(backup)).isEqualTo("{not json");
    }

    @Test
    void malformedEntryIsSkipped() throws Exception {
        Files.writeString(store.getFile(), "{\"good\":{\"type\":\"sqlite\",\"path\":\"/g.db\"},\"bad\":42}");

        assertThat(store.load()).containsOnlyKeys("good");
    }
}
