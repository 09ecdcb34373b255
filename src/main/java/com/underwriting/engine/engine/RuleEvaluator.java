package com.underwriting.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.underwriting.engine.config.EvaluationConfig;
import com.underwriting.engine.domain.ConditionResult;
import com.underwriting.engine.domain.Rule;
import com.underwriting.engine.domain.RuleMatch;
import com.underwriting.engine.domain.RuleType;
import com.underwriting.engine.ruleset.RuleCatalogRegistry;
import com.underwriting.engine.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs a list of rules against a case context.
 * <p>
 * Disabled rules are skipped. The rest are ordered by priority, highest first,
 * keeping input order among equal priorities. A rule appears in the result
 * when it matched or when it is flagged {@code alwaysInclude}.
 * <p>
 * A rule that throws is logged, counted and treated as not matched; it never
 * aborts the rest of the batch.
 */
@ApplicationScoped
public class RuleEvaluator {

    private static final Logger LOG = Logger.getLogger(RuleEvaluator.class);

    private static final boolean STATIC_DEBUG_ENABLED = EvaluationConfig.isStaticDebugEnabled();

    @Inject
    ConditionEvaluator conditionEvaluator;

    @Inject
    ContextEnricher contextEnricher;

    @Inject
    RuleCatalogRegistry registry;

    @Inject
    EvaluationConfig evaluationConfig;

    @Inject
    EngineMetrics engineMetrics;

    public List<RuleMatch> evaluateRules(List<Rule> rules, JsonNode context) {
        List<Rule> ordered = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.isEnabled()) {
                ordered.add(rule);
            }
        }
        ordered.sort(Comparator.comparingInt(Rule::getPriority).reversed());

        List<RuleMatch> results = new ArrayList<>();
        int matches = 0;
        for (Rule rule : ordered) {
            ConditionResult result = evaluateRule(rule, context);
            if (result.isMatched()) {
                matches++;
            }
            if (result.isMatched() || rule.isAlwaysInclude()) {
                results.add(new RuleMatch(rule, result));
            }
        }

        if (engineMetrics != null) {
            engineMetrics.incrementRulesEvaluated(ordered.size());
            engineMetrics.incrementRuleMatches(matches);
        }
        if (shouldLogDebug()) {
            LOG.debugf("Evaluated %d rule(s): %d matched, %d returned", ordered.size(), matches, results.size());
        }
        return results;
    }

    /**
     * Enriches {@code context} and evaluates the currently loaded catalog of
     * the given type.
     */
    public List<RuleMatch> evaluate(RuleType type, JsonNode context) {
        JsonNode enriched = contextEnricher.enrich(context);
        return evaluateRules(registry.getRules(type), enriched);
    }

    private ConditionResult evaluateRule(Rule rule, JsonNode context) {
        try {
            ConditionResult result = conditionEvaluator.evaluate(rule.getConditions(), context);
            if (shouldLogDebug() && result.isMatched()) {
                if (evaluationConfig != null && evaluationConfig.includeMatchedItems) {
                    LOG.debugf("Rule %s matched with items %s", rule.getId(), result.getMatchedItems());
                } else {
                    LOG.debugf("Rule %s matched (%d item(s))", rule.getId(), result.getMatchedItems().size());
                }
            }
            return result;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error evaluating rule %s, treating as not matched", rule.getId());
            if (engineMetrics != null) {
                engineMetrics.incrementRuleEvaluationError();
            }
            return ConditionResult.noMatch();
        }
    }

    private boolean shouldLogDebug() {
        if (STATIC_DEBUG_ENABLED) {
            return true;
        }
        return evaluationConfig != null && evaluationConfig.shouldLogDebug() && LOG.isDebugEnabled();
    }
}
