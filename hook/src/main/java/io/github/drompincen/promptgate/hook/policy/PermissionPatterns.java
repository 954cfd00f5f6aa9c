package io.github.drompincen.promptgate.hook.policy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Allow-rule syntax shared with the agent's settings files.
 * <ul>
 *   <li>{@code Tool} and {@code Tool()} match every call of the tool</li>
 *   <li>{@code Bash(git status:*)} matches commands starting with the prefix</li>
 *   <li>{@code Edit(/src/**)} globs the file path; {@code **} crosses directories</li>
 * </ul>
 */
public final class PermissionPatterns {

    static final Set<String> FILE_TOOLS = Set.of("Read", "Write", "Edit", "Glob");
    static final Set<String> PREFIX_TOOLS = Set.of("Bash");

    private static final Pattern RULE = Pattern.compile("^(\\w+)\\((.*)\\)$");
    private static final int MAX_COMMAND_PREVIEW = 100;

    private PermissionPatterns() {}

    public static boolean matches(String pattern, String toolName, JsonNode toolInput) {
        Matcher m = RULE.matcher(pattern);
        if (!m.matches()) {
            return pattern.equals(toolName);
        }
        if (!m.group(1).equals(toolName)) {
            return false;
        }
        String content = m.group(2);
        if (content.isEmpty()) {
            return true;
        }
        String value = matchValue(toolName, toolInput);
        if (content.endsWith(":*") && !FILE_TOOLS.contains(toolName)) {
            return value.startsWith(content.substring(0, content.length() - 2));
        }
        if (FILE_TOOLS.contains(toolName) && (content.contains("*") || content.contains("?"))) {
            return globToRegex(content).matcher(value).matches();
        }
        return value.equals(content);
    }

    public static Optional<String> firstMatch(List<String> patterns, String toolName, JsonNode toolInput) {
        return patterns.stream().filter(p -> matches(p, toolName, toolInput)).findFirst();
    }

    /**
     * Flags the two common mistakes: prefix syntax on file tools and a bare {@code *} on Bash.
     */
    public static Optional<PatternWarning> validate(String pattern) {
        Matcher m = RULE.matcher(pattern);
        if (!m.matches()) {
            return Optional.empty();
        }
        String tool = m.group(1);
        String content = m.group(2);
        if (FILE_TOOLS.contains(tool) && content.endsWith(":*")) {
            return Optional.of(new PatternWarning(pattern,
                    "The \":*\" syntax is only for Bash prefix rules. Use glob patterns like \"*\" or \"**\" for file matching.",
                    tool + "(" + content.substring(0, content.length() - 2) + "**)"));
        }
        if (PREFIX_TOOLS.contains(tool) && content.endsWith("*") && !content.endsWith(":*")) {
            return Optional.of(new PatternWarning(pattern,
                    "Use \":*\" for prefix matching, not just \"*\".",
                    tool + "(" + content.substring(0, content.length() - 1) + ":*)"));
        }
        return Optional.empty();
    }

    public static String describe(String toolName, JsonNode input) {
        if (input == null || !input.isObject()) {
            return toolName + " tool";
        }
        return switch (toolName) {
            case "Bash" -> "Run command: " + truncate(input.path("command").asText(""));
            case "Read" -> "Read file: " + input.path("file_path").asText();
            case "Write" -> "Write file: " + input.path("file_path").asText();
            case "Edit" -> "Edit file: " + input.path("file_path").asText();
            case "NotebookEdit" -> "Edit notebook: " + input.path("notebook_path").asText();
            case "Glob" -> "Search files: " + input.path("pattern").asText();
            case "Grep" -> "Search content: " + input.path("pattern").asText();
            case "WebFetch" -> "Fetch URL: " + input.path("url").asText();
            case "WebSearch" -> "Web search: " + input.path("query").asText();
            default -> toolName + " tool";
        };
    }

    /** Rule the user can remember to stop being asked about similar calls. */
    public static String suggest(String toolName, JsonNode input) {
        if (input == null || !input.isObject()) {
            return FILE_TOOLS.contains(toolName) ? toolName + "(**)" : toolName + "(:*)";
        }
        switch (toolName) {
            case "Bash": {
                String[] parts = input.path("command").asText("").trim().split("\\s+");
                return parts.length >= 2
                        ? "Bash(" + parts[0] + " " + parts[1] + ":*)"
                        : "Bash(" + parts[0] + ":*)";
            }
            case "Read":
            case "Write":
            case "Edit": {
                String path = input.path("file_path").asText("");
                int slash = path.lastIndexOf('/');
                return slash > 0 ? toolName + "(" + path.substring(0, slash + 1) + "**)" : toolName + "(**)";
            }
            case "Glob": {
                String glob = input.path("pattern").asText("");
                int slash = glob.lastIndexOf('/');
                return slash >= 0 ? "Glob(" + glob.substring(0, slash + 1) + "**)" : "Glob(**)";
            }
            default:
                return toolName + "(:*)";
        }
    }

    static String matchValue(String toolName, JsonNode input) {
        if (input == null || !input.isObject()) {
            return "";
        }
        return switch (toolName) {
            case "Bash" -> input.path("command").asText("");
            case "Read", "Write", "Edit", "Glob" -> input.hasNonNull("file_path")
                    ? input.path("file_path").asText()
                    : input.path("pattern").asText("");
            case "Grep" -> input.path("pattern").asText("");
            case "WebFetch" -> input.path("url").asText("");
            case "WebSearch" -> input.path("query").asText("");
            default -> "";
        };
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder("^");
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append('.');
            } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return Pattern.compile(regex.append('$').toString());
    }

    private static String truncate(String command) {
        return command.length() > MAX_COMMAND_PREVIEW ? command.substring(0, MAX_COMMAND_PREVIEW) : command;
    }
}
