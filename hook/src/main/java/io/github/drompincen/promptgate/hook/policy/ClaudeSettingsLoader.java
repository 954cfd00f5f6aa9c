package io.github.drompincen.promptgate.hook.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads {@code permissions.allow} from the user's global settings and the project's local settings.
 * Missing or unreadable files contribute nothing.
 */
public class ClaudeSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(ClaudeSettingsLoader.class);

    private final ObjectMapper objectMapper;

    public ClaudeSettingsLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> loadAllowPatterns(Path userHome, Path projectPath) {
        Set<String> patterns = new LinkedHashSet<>();
        if (userHome != null) {
            patterns.addAll(read(userHome.resolve(".claude").resolve("settings.json")));
        }
        if (projectPath != null) {
            patterns.addAll(read(projectPath.resolve(".claude").resolve("settings.local.json")));
        }
        for (String pattern : patterns) {
            PermissionPatterns.validate(pattern).ifPresent(w ->
                    log.warn("Allow rule {}: {} Did you mean {}?", w.pattern(), w.message(), w.suggestion()));
        }
        return List.copyOf(patterns);
    }

    List<String> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            JsonNode allow = objectMapper.readTree(file.toFile()).path("permissions").path("allow");
            List<String> patterns = new ArrayList<>();
            allow.forEach(node -> {
                if (node.isTextual()) {
                    patterns.add(node.asText());
                }
            });
            log.debug("Loaded {} allow rules from {}", patterns.size(), file);
            return patterns;
        } catch (IOException e) {
            log.warn("Ignoring unreadable settings {}: {}", file, e.getMessage());
            return List.of();
        }
    }
}
