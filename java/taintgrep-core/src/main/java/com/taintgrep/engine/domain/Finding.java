package com.taintgrep.engine.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// ============================================
// Finding: one reported rule match
// ============================================
public class Finding {
    private final String ruleId;
    private final String message;
    private final Severity severity;
    private final Confidence confidence;
    private final Location location;
    private final Map<String, String> metadata;
    private final String fix;

    public Finding(String ruleId, String message, Severity severity, Confidence confidence,
                   Location location, Map<String, String> metadata, String fix) {
        this.ruleId = ruleId;
        this.message = message;
        this.severity = severity;
        this.confidence = confidence;
        this.location = location;
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Collections.emptyMap();
        this.fix = fix;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getMessage() {
        return message;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public Location getLocation() {
        return location;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * @return fix suggestion, or null
     */
    public String getFix() {
        return fix;
    }

    @Override
    public String toString() {
        return ruleId + " " + severity + "/" + confidence + " at " + location + ": " + message;
    }
}
