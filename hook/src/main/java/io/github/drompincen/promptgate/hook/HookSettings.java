package io.github.drompincen.promptgate.hook;

import io.github.drompincen.promptgate.hook.policy.GatePolicy;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hook configuration, read from the environment the agent passes to every hook invocation.
 */
public record HookSettings(
        String sessionId,
        String backendUrl,
        Path projectPath,
        Strategy strategy,
        SignalBackend signalBackend,
        Path signalDir,
        Set<String> permissionTools,
        Set<String> commitTools
) {
    public static final String DEFAULT_BACKEND_URL = "http://localhost:3006";

    public enum Strategy { LONG_POLL, REDIRECT }

    public enum SignalBackend { FILE, HTTP }

    public static HookSettings fromEnvironment(Map<String, String> env) {
        return new HookSettings(
                blankToNull(env.get("WEBUI_SESSION_ID")),
                orDefault(env.get("WEBUI_BACKEND_URL"), DEFAULT_BACKEND_URL),
                env.containsKey("WEBUI_PROJECT_PATH") ? Path.of(env.get("WEBUI_PROJECT_PATH")) : null,
                "redirect".equalsIgnoreCase(env.get("PROMPTGATE_HOOK_STRATEGY")) ? Strategy.REDIRECT : Strategy.LONG_POLL,
                "http".equalsIgnoreCase(env.get("PROMPTGATE_SIGNAL_BACKEND")) ? SignalBackend.HTTP : SignalBackend.FILE,
                Path.of(orDefault(env.get("PROMPTGATE_SIGNAL_DIR"),
                        System.getProperty("java.io.tmpdir") + "/promptgate-signals")),
                toolSet(env.get("PROMPTGATE_PERMISSION_TOOLS"), GatePolicy.DEFAULT_PERMISSION_TOOLS),
                toolSet(env.get("PROMPTGATE_COMMIT_TOOLS"), GatePolicy.DEFAULT_COMMIT_TOOLS));
    }

    public GatePolicy policy() {
        return new GatePolicy(permissionTools, commitTools, List.of());
    }

    public String strategyName() {
        return strategy.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    static Set<String> toolSet(String value, Set<String> defaults) {
        if (value == null || value.isBlank()) {
            return defaults;
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
