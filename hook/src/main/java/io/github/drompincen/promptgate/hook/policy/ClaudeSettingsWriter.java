package io.github.drompincen.promptgate.hook.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.promptgate.protocol.prompt.PermissionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Appends "always allow" rules to the same files {@link ClaudeSettingsLoader} reads: the project's
 * {@code .claude/settings.local.json} or the user's {@code ~/.claude/settings.json}. Other keys in
 * the file are preserved.
 */
public class ClaudeSettingsWriter {

    private static final Logger log = LoggerFactory.getLogger(ClaudeSettingsWriter.class);

    private final ObjectMapper objectMapper;
    private final Path userHome;
    private final Path projectPath;

    public ClaudeSettingsWriter(ObjectMapper objectMapper, Path userHome, Path projectPath) {
        this.objectMapper = objectMapper;
        this.userHome = userHome;
        this.projectPath = projectPath;
    }

    /**
     * Adds {@code pattern} to {@code permissions.allow} of the file matching {@code scope}.
     *
     * @return true if the file was written, false if the rule was already there or could not be saved
     */
    public boolean remember(String pattern, PermissionScope scope) {
        if (pattern == null || pattern.isBlank() || !scope.persistent()) {
            return false;
        }
        Optional<Path> target = settingsFile(scope);
        if (target.isEmpty()) {
            log.warn("No {} settings location known; not saving rule {}", scope.wireName(), pattern);
            return false;
        }
        Path file = target.get();
        try {
            ObjectNode root = readRoot(file);
            ArrayNode allow = allowArray(root);
            for (JsonNode existing : allow) {
                if (pattern.equals(existing.asText())) {
                    log.debug("Rule {} already in {}", pattern, file);
                    return false;
                }
            }
            allow.add(pattern);
            Files.createDirectories(file.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
            log.info("Saved allow rule {} to {}", pattern, file);
            return true;
        } catch (IOException e) {
            log.warn("Could not save allow rule {} to {}: {}", pattern, file, e.getMessage());
            return false;
        }
    }

    Optional<Path> settingsFile(PermissionScope scope) {
        return switch (scope) {
            case GLOBAL -> Optional.ofNullable(userHome).map(h -> h.resolve(".claude").resolve("settings.json"));
            case PROJECT -> Optional.ofNullable(projectPath)
                    .map(p -> p.resolve(".claude").resolve("settings.local.json"));
            case ONCE -> Optional.empty();
        };
    }

    // an unparseable file is left alone rather than replaced
    private ObjectNode readRoot(Path file) throws IOException {
        if (!Files.exists(file)) {
            return objectMapper.createObjectNode();
        }
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || root.isMissingNode()) {
            return objectMapper.createObjectNode();
        }
        if (!root.isObject()) {
            throw new IOException("settings root is not a JSON object");
        }
        return (ObjectNode) root;
    }

    private static ArrayNode allowArray(ObjectNode root) throws IOException {
        JsonNode permissions = root.get("permissions");
        if (permissions == null) {
            permissions = root.putObject("permissions");
        } else if (!permissions.isObject()) {
            throw new IOException("\"permissions\" is not a JSON object");
        }
        JsonNode allow = permissions.get("allow");
        if (allow == null) {
            return ((ObjectNode) permissions).putArray("allow");
        }
        if (!allow.isArray()) {
            throw new IOException("\"permissions.allow\" is not a JSON array");
        }
        return (ArrayNode) allow;
    }
}
