package com.taintgrep.engine;

import com.taintgrep.engine.domain.Rule;
import com.taintgrep.engine.domain.RuleValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated rules. Invalid or duplicate rules are excluded and kept as
 * rejections; their siblings still load.
 */
public class RuleSet {
    private static final Logger logger = LoggerFactory.getLogger(RuleSet.class);

    private final List<Rule> rules;
    private final List<RuleValidationException> rejected;

    private RuleSet(List<Rule> rules, List<RuleValidationException> rejected) {
        this.rules = Collections.unmodifiableList(rules);
        this.rejected = Collections.unmodifiableList(rejected);
    }

    public static RuleSet load(Collection<Rule> candidates) {
        List<Rule> valid = new ArrayList<>();
        List<RuleValidationException> rejected = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (Rule rule : candidates) {
            try {
                rule.validate();
                if (!ids.add(rule.getId())) {
                    throw new RuleValidationException(rule.getId(), "duplicate rule id");
                }
                valid.add(rule);
            } catch (RuleValidationException e) {
                logger.warn("Rejected rule: {}", e.getMessage());
                rejected.add(e);
            }
        }

        logger.info("Loaded {} rule(s), rejected {}", valid.size(), rejected.size());
        return new RuleSet(valid, rejected);
    }

    public static RuleSet defaults() {
        return load(DefaultRules.all());
    }

    public List<Rule> getRules() {
        return rules;
    }

    public List<RuleValidationException> getRejected() {
        return rejected;
    }

    public Rule find(String id) {
        for (Rule rule : rules) {
            if (rule.getId().equals(id)) {
                return rule;
            }
        }
        return null;
    }

    public int size() {
        return rules.size();
    }
}
