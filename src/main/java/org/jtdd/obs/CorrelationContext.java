package org.jtdd.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every run event.
 *
 * <p>An empty suite name identifies the ungrouped tests and is kept as-is.
 */
public final class CorrelationContext {
    private final String runId;
    private final String suiteName;
    private final String unitName;
    private final String phase;

    private CorrelationContext(Builder builder) {
        this.runId = requireText(builder.runId, "runId");
        this.suiteName = builder.suiteName;
        this.unitName = normalize(builder.unitName);
        this.phase = normalize(builder.phase);
    }

    public static CorrelationContext of(String runId) {
        return builder(runId).build();
    }

    public static Builder builder(String runId) {
        return new Builder(runId);
    }

    public String runId() {
        return runId;
    }

    public Optional<String> suiteName() {
        return Optional.ofNullable(suiteName);
    }

    public Optional<String> unitName() {
        return Optional.ofNullable(unitName);
    }

    public Optional<String> phase() {
        return Optional.ofNullable(phase);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("runId", runId);
        if (suiteName != null) {
            fields.put("suite", suiteName);
        }
        if (unitName != null) {
            fields.put("unit", unitName);
        }
        if (phase != null) {
            fields.put("phase", phase);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String runId;
        private String suiteName;
        private String unitName;
        private String phase;

        private Builder(String runId) {
            this.runId = Objects.requireNonNull(runId, "runId");
        }

        public Builder suiteName(String suiteName) {
            this.suiteName = suiteName;
            return this;
        }

        public Builder unitName(String unitName) {
            this.unitName = unitName;
            return this;
        }

        public Builder phase(String phase) {
            this.phase = phase;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
