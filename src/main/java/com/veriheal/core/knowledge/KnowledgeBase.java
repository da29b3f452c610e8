package com.veriheal.core.knowledge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only store of learned failure outcomes, one JSON object per line,
 * shared across runs.
 *
 * The diagnosis classifier reads it as a prior; only
 * {@link LearningRecorder} appends to it.
 */
@Component
public class KnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBase.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path file;
    private final Map<String, PatternStats> index = new ConcurrentHashMap<>();

    public KnowledgeBase(
            @Value("${veriheal.knowledge.path}") String knowledgePath
    ) {
        this.file = Paths.get(knowledgePath).toAbsolutePath().normalize();
        load();
    }

    public PatternStats statsFor(String signatureKey) {
        if (signatureKey == null) return PatternStats.NONE;
        return index.getOrDefault(signatureKey, PatternStats.NONE);
    }

    public synchronized void append(FailurePattern pattern) throws IOException {
        String line = MAPPER.writeValueAsString(pattern) + "\n";
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.write(file, line.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        index.merge(pattern.getSignatureKey(), PatternStats.NONE.plus(pattern.getOutcome()),
                (a, b) -> a.plus(pattern.getOutcome()));
        log.debug("[Knowledge] Recorded {} for '{}'", pattern.getOutcome(), pattern.getSignatureKey());
    }

    public int size() {
        return index.values().stream().mapToInt(s -> s.getHealed() + s.getEscalated()).sum();
    }

    private void load() {
        if (!Files.isRegularFile(file)) {
            log.info("[Knowledge] No knowledge base at {}, starting empty", file);
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read knowledge base: " + file, e);
        }

        int skipped = 0;
        for (String line : lines) {
            if (line.isBlank()) continue;
            try {
                FailurePattern p = MAPPER.readValue(line, FailurePattern.class);
                if (p.getSignatureKey() == null || p.getOutcome() == null) {
                    skipped++;
                    continue;
                }
                index.merge(p.getSignatureKey(), PatternStats.NONE.plus(p.getOutcome()),
                        (a, b) -> a.plus(p.getOutcome()));
            } catch (JsonProcessingException e) {
                // a torn last line from an interrupted append
                skipped++;
            }
        }
        log.info("[Knowledge] Loaded {} patterns from {} ({} unreadable lines skipped)",
                size(), file, skipped);
    }
}
