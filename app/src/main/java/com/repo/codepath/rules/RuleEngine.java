package com.repo.codepath.rules;

import com.repo.codepath.core.LinterConfig;
import com.repo.codepath.tree.FileContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs the enabled lint rules over an analyzed file.
 * A rule that fails is reported and skipped; the other rules still run.
 */
public class RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final List<LintRule> rules;

    /**
     * Engine with the default rules, configured from the given settings.
     */
    public RuleEngine(LinterConfig config) {
        this(buildDefaultRules(config));
    }

    /**
     * Engine with custom rules, run in the given order.
     */
    public RuleEngine(List<LintRule> customRules) {
        this.rules = new ArrayList<>(customRules);
    }

    /**
     * Violations of every rule, ordered by position in the file.
     */
    public List<Violation> run(FileContext context) {
        List<Violation> violations = new ArrayList<>();
        for (LintRule rule : rules) {
            try {
                violations.addAll(rule.check(context));
            } catch (RuntimeException e) {
                LOG.warn("Rule {} failed on {}, skipping it: {}", rule.name(), context.fileName(), e.toString());
                LOG.debug("Rule failure", e);
            }
        }
        violations.sort(Comparator.comparingInt(violation -> violation.node().id()));
        return violations;
    }

    public List<LintRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    private static List<LintRule> buildDefaultRules(LinterConfig config) {
        List<LintRule> defaultRules = new ArrayList<>();
        if (config.isComplexityEnabled()) {
            defaultRules.add(new ComplexityRule(config.getComplexityMax()));
        }
        if (config.isNoUnreachableEnabled()) {
            defaultRules.add(new NoUnreachableRule());
        }
        return defaultRules;
    }
}
