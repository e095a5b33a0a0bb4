package net.linkcoverage.support.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.domain.task.TaskTransition;

/**
 * Durable transition log: one JSON document per line, appended and flushed per transition.
 * Unreadable lines (for example a torn final write) are skipped on replay.
 *
 * <p>Task results are replayed with JSON value types: whole numbers come back as {@code Integer}
 * when they fit, whatever numeric type the handler stored. Readers of a recovered result should
 * treat counts as {@link Number}.</p>
 */
@Slf4j
public class JsonLinesTaskTransitionLog implements TaskTransitionLog {

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonLinesTaskTransitionLog(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public synchronized void append(TaskTransition transition) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = objectMapper.writeValueAsString(transition);
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append task transition to " + path, e);
        }
    }

    @Override
    public synchronized List<TaskTransition> readAll() {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<TaskTransition> transitions = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    transitions.add(objectMapper.readValue(line, TaskTransition.class));
                } catch (JsonProcessingException e) {
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read task transition log " + path, e);
        }
        if (skipped > 0) {
            log.warn("Skipped {} unreadable line(s) in task transition log {}", skipped, path);
        }
        return transitions;
    }
}
