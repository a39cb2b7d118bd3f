package me.botfleet.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Map;

/**
 * Opaque secret value. Accepts either a bare string or
 * {@code {"value": ..., "present": ...}} in JSON, so a redacted export can be
 * imported back without wiping stored secrets.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Secret {

    @ToString.Exclude
    private String value;

    @Builder.Default
    private Boolean present = false;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Secret fromJson(Object source) {
        if (source == null) {
            return null;
        }

        if (source instanceof Map<?, ?>) {
            Map<?, ?> map = (Map<?, ?>) source;
            Object valueObj = map.get("value");
            Object presentObj = map.get("present");
            String value = valueObj != null ? String.valueOf(valueObj) : null;
            boolean present = presentObj instanceof Boolean && (Boolean) presentObj;
            if (!present && value != null && !value.isBlank()) {
                present = true;
            }
            return Secret.builder()
                    .value(value)
                    .present(present)
                    .build();
        }

        String value = String.valueOf(source);
        return Secret.builder()
                .value(value)
                .present(!value.isBlank())
                .build();
    }

    public static Secret of(String value) {
        return fromJson(value);
    }

    public static Secret redacted(Secret source) {
        if (source == null) {
            return null;
        }
        boolean isPresent = Boolean.TRUE.equals(source.getPresent()) || hasValue(source);
        return Secret.builder()
                .value(null)
                .present(isPresent)
                .build();
    }

    /**
     * Keeps the stored secret when the incoming one carries no value (for
     * example a redacted export being imported).
     */
    public static Secret merge(Secret existing, Secret incoming) {
        if (hasValue(incoming)) {
            return incoming;
        }
        return existing;
    }

    public static String valueOrEmpty(Secret secret) {
        if (secret == null || secret.getValue() == null) {
            return "";
        }
        return secret.getValue();
    }

    public static boolean hasValue(Secret secret) {
        return secret != null && secret.getValue() != null && !secret.getValue().isBlank();
    }
}
