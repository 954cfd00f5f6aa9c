package io.github.drompincen.promptgate.hook.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PermissionPatternsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void bareToolNameMatchesEveryCall() {
        assertThat(PermissionPatterns.matches("Bash", "Bash", input("command", "anything"))).isTrue();
        assertThat(PermissionPatterns.matches("Bash()", "Bash", input("command", "anything"))).isTrue();
        assertThat(PermissionPatterns.matches("Bash", "Write", input("file_path", "/a"))).isFalse();
    }

    @Test
    void bashPrefixRule() {
        assertThat(PermissionPatterns.matches("Bash(npm run:*)", "Bash", input("command", "npm run build"))).isTrue();
        assertThat(PermissionPatterns.matches("Bash(npm run:*)", "Bash", input("command", "npm install"))).isFalse();
    }

    @Test
    void exactMatchWithoutWildcard() {
        assertThat(PermissionPatterns.matches("Bash(ls)", "Bash", input("command", "ls"))).isTrue();
        assertThat(PermissionPatterns.matches("Bash(ls)", "Bash", input("command", "ls -la"))).isFalse();
    }

    @Test
    void fileGlobs() {
        assertThat(PermissionPatterns.matches("Edit(/src/**)", "Edit", input("file_path", "/src/a/b/C.java"))).isTrue();
        assertThat(PermissionPatterns.matches("Edit(/src/*)", "Edit", input("file_path", "/src/a/b/C.java"))).isFalse();
        assertThat(PermissionPatterns.matches("Edit(/src/*)", "Edit", input("file_path", "/src/C.java"))).isTrue();
        assertThat(PermissionPatterns.matches("Read(/tmp/?.txt)", "Read", input("file_path", "/tmp/a.txt"))).isTrue();
    }

    @Test
    void globEscapesRegexCharacters() {
        assertThat(PermissionPatterns.matches("Write(/a.b/*)", "Write", input("file_path", "/axb/c"))).isFalse();
        assertThat(PermissionPatterns.matches("Write(/a.b/*)", "Write", input("file_path", "/a.b/c"))).isTrue();
    }

    @Test
    void validateFlagsPrefixSyntaxOnFileTools() {
        assertThat(PermissionPatterns.validate("Edit(/src:*)"))
                .hasValueSatisfying(w -> assertThat(w.suggestion()).isEqualTo("Edit(/src**)"));
    }

    @Test
    void validateFlagsBareStarOnBash() {
        assertThat(PermissionPatterns.validate("Bash(npm *)"))
                .hasValueSatisfying(w -> {
                    assertThat(w.message()).isEqualTo("Use \":*\" for prefix matching, not just \"*\".");
                    assertThat(w.suggestion()).isEqualTo("Bash(npm :*)");
                });
        assertThat(PermissionPatterns.validate("Bash(npm:*)")).isEmpty();
        assertThat(PermissionPatterns.validate("Read")).isEmpty();
    }

    @Test
    void describeTruncatesLongCommands() {
        String longCommand = "x".repeat(150);

        assertThat(PermissionPatterns.describe("Bash", input("command", longCommand)))
                .isEqualTo("Run command: " + "x".repeat(100));
        assertThat(PermissionPatterns.describe("WebFetch", input("url", "https://example.com")))
                .isEqualTo("Fetch URL: https://example.com");
        assertThat(PermissionPatterns.describe("Custom", null)).isEqualTo("Custom tool");
    }

    @Test
    void suggestBuildsRememberableRule() {
        assertThat(PermissionPatterns.suggest("Bash", input("command", "git status --short")))
                .isEqualTo("Bash(git status:*)");
        assertThat(PermissionPatterns.suggest("Bash", input("command", "ls"))).isEqualTo("Bash(ls:*)");
        assertThat(PermissionPatterns.suggest("Edit", input("file_path", "/src/main/App.java")))
                .isEqualTo("Edit(/src/main/**)");
        assertThat(PermissionPatterns.suggest("Glob", input("pattern", "docs/*.md"))).isEqualTo("Glob(docs/**)");
        assertThat(PermissionPatterns.suggest("WebFetch", input("url", "https://x"))).isEqualTo("WebFetch(:*)");
    }

    private JsonNode input(String field, String value) {
        return mapper.createObjectNode().put(field, value);
    }
}
