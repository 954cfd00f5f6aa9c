package io.github.drompincen.promptgate.hook.policy;

public record PatternWarning(String pattern, String message, String suggestion) {}
