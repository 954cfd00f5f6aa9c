package io.github.drompincen.promptgate.protocol.prompt;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code pattern} is the allow rule the user chose to remember, if any; {@code scope} says where it
 * is remembered. A missing scope means {@link PermissionScope#ONCE}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionResponse(
        boolean approved,
        String pattern,
        String reason,
        PermissionScope scope
) implements PromptResponse {

    @Override
    public PromptType type() {
        return PromptType.PERMISSION;
    }

    public PermissionScope effectiveScope() {
        return approved && scope != null ? scope : PermissionScope.ONCE;
    }
}
