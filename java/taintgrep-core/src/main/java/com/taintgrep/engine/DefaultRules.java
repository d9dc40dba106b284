package com.taintgrep.engine;

import com.taintgrep.engine.domain.Condition;
import com.taintgrep.engine.domain.Confidence;
import com.taintgrep.engine.domain.DataFlowSpec;
import com.taintgrep.engine.domain.Pattern;
import com.taintgrep.engine.domain.Rule;
import com.taintgrep.engine.domain.Severity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Built-in rule set used by the Maven goal and as a baseline for callers.
 */
public final class DefaultRules {

    public static final String CODE_EVAL = "taintgrep.code-eval";
    public static final String SQL_INJECTION = "taintgrep.sql-injection";
    public static final String COMMAND_EXEC = "taintgrep.command-exec";
    public static final String WEAK_HASH = "taintgrep.weak-hash";
    public static final String HARDCODED_SECRET = "taintgrep.hardcoded-secret";

    private static final String[] LANGUAGES = {"java", "javascript", "python"};

    private DefaultRules() {
    }

    public static List<Rule> all() {
        List<Rule> rules = new ArrayList<>();
        rules.add(codeEval());
        rules.add(sqlInjection());
        rules.add(commandExec());
        rules.add(weakHash());
        rules.add(hardcodedSecret());
        return Collections.unmodifiableList(rules);
    }

    public static Rule codeEval() {
        return languages(new Rule(CODE_EVAL, "Dynamic code evaluation",
            "eval() executes dynamically built code", Severity.ERROR, Confidence.HIGH))
            .addPattern(Pattern.simple("eval"))
            .putMetadata("category", "code_injection")
            .withFix("Parse the input as data instead of evaluating it");
    }

    public static Rule sqlInjection() {
        DataFlowSpec dataFlow = new DataFlowSpec(
            Arrays.asList("user_input", "header_input", "cookie_input", "url_parameter_input"),
            Collections.singletonList("SQL_INJECTION"));
        return languages(new Rule(SQL_INJECTION, "SQL query built from request input",
            "SQL statement executed through $CALL may include untrusted input", Severity.CRITICAL,
            Confidence.MEDIUM))
            .addPattern(callNamed("(^|\\.)(executeQuery|executeUpdate|query)\\s*\\("))
            .withDataFlow(dataFlow)
            .putMetadata("category", "injection")
            .putMetadata("cwe", "CWE-89")
            .withFix("Use a PreparedStatement with bound parameters");
    }

    public static Rule commandExec() {
        DataFlowSpec dataFlow = new DataFlowSpec(null, Collections.singletonList("COMMAND_INJECTION"));
        dataFlow.setMustFlow(false);
        return languages(new Rule(COMMAND_EXEC, "Operating system command execution",
            "Process started through $CALL", Severity.ERROR, Confidence.MEDIUM))
            .addPattern(callNamed("(^|\\.)(exec|system)\\s*\\(|ProcessBuilder\\.start\\s*\\("))
            .withDataFlow(dataFlow)
            .putMetadata("category", "injection")
            .putMetadata("cwe", "CWE-78");
    }

    public static Rule weakHash() {
        return languages(new Rule(WEAK_HASH, "Weak hash algorithm",
            "MD5 and SHA-1 are not collision resistant", Severity.WARNING, Confidence.HIGH))
            .addPattern(Pattern.all(
                Pattern.either(Pattern.simple("getInstance"), Pattern.simple("createHash"),
                    Pattern.simple("hashlib.md5"), Pattern.simple("hashlib.sha1")),
                Pattern.regex("(?i)([\"'](md5|sha-?1)[\"']|hashlib\\.(md5|sha1))")))
            .putMetadata("category", "crypto")
            .putMetadata("cwe", "CWE-328")
            .withFix("Use SHA-256 or stronger");
    }

    public static Rule hardcodedSecret() {
        Pattern assignment = Pattern.simple("$NAME $VALUE")
            .addCondition(Condition.regex("NAME", "(?i)(password|passwd|secret|token|api_?key|credential)"))
            .addCondition(Condition.regex("VALUE", "^[\"'].+[\"']$"));
        return languages(new Rule(HARDCODED_SECRET, "Hard-coded secret",
            "Secret value hard-coded in $NAME", Severity.ERROR, Confidence.MEDIUM))
            .addPattern(Pattern.all(
                Pattern.either(Pattern.simple("@assignment_expression"), Pattern.simple("@variable_declarator")),
                assignment).addFocus("VALUE"))
            .putMetadata("category", "secrets")
            .putMetadata("cwe", "CWE-798")
            .withFix("Load the value from configuration or a secret store");
    }

    /**
     * A call expression whose text, bound to CALL, matches {@code regex}.
     */
    private static Pattern callNamed(String regex) {
        return Pattern.all(Pattern.simple("@call_expression"),
            Pattern.simple("$CALL").addCondition(Condition.regex("CALL", regex)));
    }

    private static Rule languages(Rule rule) {
        for (String language : LANGUAGES) {
            rule.addLanguage(language);
        }
        return rule;
    }
}
