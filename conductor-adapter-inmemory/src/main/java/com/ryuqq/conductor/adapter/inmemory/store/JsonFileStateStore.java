package com.ryuqq.conductor.adapter.inmemory.store;

import com.ryuqq.conductor.adapter.inmemory.codec.JsonMessageCodec;
import com.ryuqq.conductor.core.spi.WorkflowStateStore;
import com.ryuqq.conductor.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link WorkflowStateStore} that keeps one JSON file per key.
 *
 * <p>Files live at {@code <directory>/<key>.json}. Writes go to a {@code .tmp} sibling first and are
 * moved into place, so a reader never sees a half-written file.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class JsonFileStateStore implements WorkflowStateStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final Path directory;
    private final JsonMessageCodec codec;

    public JsonFileStateStore(Path directory) {
        this(directory, new JsonMessageCodec());
    }

    public JsonFileStateStore(Path directory, JsonMessageCodec codec) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.directory = directory;
        this.codec = codec;
    }

    @Override
    public synchronized void save(String key, WorkflowState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        Path target = fileFor(key);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(directory);
            Files.write(tmp, codec.encodePretty(state));
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved workflow state {} to {}", key, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save workflow state to " + target, e);
        }
    }

    @Override
    public synchronized Optional<WorkflowState> load(String key) {
        Path source = fileFor(key);
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        try {
            byte[] bytes = Files.readAllBytes(source);
            if (bytes.length == 0) {
                return Optional.empty();
            }
            return Optional.of(codec.decode(bytes, WorkflowState.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load workflow state from " + source, e);
        }
    }

    public Path fileFor(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (key.contains("/") || key.contains("\\") || key.contains("..")) {
            throw new IllegalArgumentException("key cannot contain path separators: " + key);
        }
        return directory.resolve(key + ".json");
    }
}
