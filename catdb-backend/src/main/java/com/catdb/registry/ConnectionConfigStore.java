package com.catdb.registry;

import com.catdb.config.CatdbSettings;
import com.catdb.model.ConnectionConfig;
import com.catdb.util.PasswordObfuscator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes {@code config.json}: a JSON object mapping display name to
 * {@link ConnectionConfig}. Passwords are obfuscated on disk.
 *
 * <p>The file is read once at startup and rewritten whole on every change. A file that cannot be
 * decoded as JSON under any candidate encoding is copied to {@code config.json.bak} and the
 * registry starts empty.
 */
@Slf4j
@Component
public class ConnectionConfigStore {

    static final String BACKUP_SUFFIX = ".bak";
    private static final char BOM = '\uFEFF';

    private static final List<Charset> CANDIDATE_ENCODINGS = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("GBK"),
            StandardCharsets.ISO_8859_1
    );

    private final Path file;
    private final ObjectMapper objectMapper;

    /**
     * Create a store for the configured directory.
     *
     * @param settings settings
     * @param objectMapper Jackson object mapper
     */
    public ConnectionConfigStore(CatdbSettings settings, ObjectMapper objectMapper) {
        this.file = settings.configFile();
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Load all configurations. Never throws; an unreadable file yields an empty map.
     *
     * @return configurations keyed by display name, in file order
     */
    public synchronized Map<String, ConnectionConfig> load() {
        Map<String, ConnectionConfig> configs = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return configs;
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            log.warn("Failed to read connection config, starting empty (file={}, error={})", file, e.getMessage());
            return configs;
        }
        if (bytes.length == 0) {
            return configs;
        }

        JsonNode root = null;
        for (Charset charset : CANDIDATE_ENCODINGS) {
            root = tryDecode(bytes, charset);
            if (root != null) {
                if (!StandardCharsets.UTF_8.equals(charset)) {
                    log.info("Connection config decoded with fallback encoding (file={}, encoding={})", file, charset.name());
                }
                break;
            }
        }
        if (root == null || !root.isObject()) {
            backupUnreadable();
            return configs;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isObject()) {
                log.warn("Skipping malformed connection entry (name={})", entry.getKey());
                continue;
            }
            try {
                ConnectionConfig config = objectMapper.treeToValue(entry.getValue(), ConnectionConfig.class);
                config.setDisplayName(entry.getKey());
                config.setPassword(PasswordObfuscator.reveal(config.getPassword()));
                if (config.getExtraParams() == null) {
                    config.setExtraParams(new LinkedHashMap<>());
                }
                configs.put(entry.getKey(), config);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed connection entry (name={}, error={})", entry.getKey(), e.getOriginalMessage());
            }
        }
        log.info("Loaded connection configs (file={}, count={})", file, configs.size());
        return configs;
    }

    /**
     * Rewrite the whole file through a temporary sibling.
     *
     * @param configs configurations keyed by display name
     * @throws UncheckedIOException when the file cannot be written
     */
    public synchronized void save(Map<String, ConnectionConfig> configs) {
        ObjectNode root = objectMapper.createObjectNode();
        for (Map.Entry<String, ConnectionConfig> entry : configs.entrySet()) {
            ConnectionConfig stored = entry.getValue().copy();
            stored.setPassword(PasswordObfuscator.obfuscate(stored.getPassword()));
            root.set(entry.getKey(), objectMapper.valueToTree(stored));
        }
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, "config", ".json.tmp");
            try {
                Files.write(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root));
                try {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write connection config " + file, e);
        }
    }

    private JsonNode tryDecode(byte[] bytes, Charset charset) {
        String text;
        try {
            text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void backupUnreadable() {
        Path backup = file.resolveSibling(file.getFileName() + BACKUP_SUFFIX);
        try {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Connection config is unreadable, backed up and starting empty (file={}, backup={})", file, backup);
        } catch (IOException e) {
            log.warn("Connection config is unreadable and backup failed, starting empty (file={}, error={})", file, e.getMessage());
        }
    }
}
