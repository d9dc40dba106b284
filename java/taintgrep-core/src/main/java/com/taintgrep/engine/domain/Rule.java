package com.taintgrep.engine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

// ============================================
// Rule: patterns plus optional data-flow requirement
// ============================================
public class Rule {
    private final String id;
    private final String name;
    private final String description;
    private final Severity severity;
    private final Confidence confidence;
    private final Set<String> languages;
    private final List<Pattern> patterns;
    private final Map<String, String> metadata;
    private DataFlowSpec dataFlow;
    private String fix;
    private boolean enabled = true;

    /**
     * @param description finding message template; {@code $NAME} is replaced by the binding of NAME
     */
    public Rule(String id, String name, String description, Severity severity, Confidence confidence) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.severity = severity;
        this.confidence = confidence;
        this.languages = new LinkedHashSet<>();
        this.patterns = new ArrayList<>();
        this.metadata = new LinkedHashMap<>();
    }

    public Rule addLanguage(String language) {
        if (language != null && !language.trim().isEmpty()) {
            languages.add(language.trim().toLowerCase(Locale.ROOT));
        }
        return this;
    }

    public Rule addPattern(Pattern pattern) {
        if (pattern != null) {
            patterns.add(pattern);
        }
        return this;
    }

    public Rule putMetadata(String key, String value) {
        if (key != null && value != null) {
            metadata.put(key, value);
        }
        return this;
    }

    public Rule withDataFlow(DataFlowSpec dataFlow) {
        this.dataFlow = dataFlow;
        return this;
    }

    public Rule withFix(String fix) {
        this.fix = fix;
        return this;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @param language language tag, compared case-insensitively
     * @return true if the rule is enabled and declares the language
     */
    public boolean appliesTo(String language) {
        return enabled && language != null && languages.contains(language.toLowerCase(Locale.ROOT));
    }

    /**
     * Check required fields.
     *
     * @throws RuleValidationException naming the first missing field
     */
    public void validate() throws RuleValidationException {
        if (isBlank(id)) {
            throw new RuleValidationException(null, "id cannot be empty");
        }
        if (isBlank(name)) {
            throw new RuleValidationException(id, "name cannot be empty");
        }
        if (isBlank(description)) {
            throw new RuleValidationException(id, "description cannot be empty");
        }
        if (severity == null) {
            throw new RuleValidationException(id, "severity is required");
        }
        if (confidence == null) {
            throw new RuleValidationException(id, "confidence is required");
        }
        if (languages.isEmpty()) {
            throw new RuleValidationException(id, "at least one language is required");
        }
        if (patterns.isEmpty()) {
            throw new RuleValidationException(id, "at least one pattern is required");
        }
        for (int i = 0; i < patterns.size(); i++) {
            Pattern pattern = patterns.get(i);
            if ((pattern.getType() == PatternType.SIMPLE || pattern.getType() == PatternType.REGEX
                || pattern.getType() == PatternType.NOT_REGEX) && isBlank(pattern.getValue())) {
                throw new RuleValidationException(id, "pattern " + i + " is empty");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public Set<String> getLanguages() {
        return Collections.unmodifiableSet(languages);
    }

    public List<Pattern> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public DataFlowSpec getDataFlow() {
        return dataFlow;
    }

    public String getFix() {
        return fix;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String toString() {
        return id + " (" + name + ")";
    }
}
