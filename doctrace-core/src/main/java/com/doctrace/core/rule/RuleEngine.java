package com.doctrace.core.rule;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.model.Enforcement;
import com.doctrace.core.model.ValidationReport;
import com.doctrace.core.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Evaluates a {@link RuleSet} against a fully built {@link ProjectContext}.
 *
 * <p>Evaluation runs in two phases:
 * <ol>
 *   <li>asset-level rules, for every asset, on up to {@code parallelism} threads; within one asset
 *       rules run in load order and results are collected in asset order</li>
 *   <li>project-level rules, once each, sequentially in load order</li>
 * </ol>
 * Project-level rules may therefore read metadata written by asset-level rules.
 *
 * <p>All violations are collected before returning; nothing fails fast. A rule that throws is
 * reported as one violation of that rule. The engine never terminates the process.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final RuleSet ruleSet;
    private final int parallelism;

    public RuleEngine(RuleSet ruleSet) {
        this(ruleSet, 1);
    }

    public RuleEngine(RuleSet ruleSet, int parallelism) {
        this.ruleSet = ruleSet;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Evaluates all rules.
     *
     * @param context complete project context
     * @return report with every violation
     */
    public ValidationReport evaluate(ProjectContext context) {
        List<Violation> violations = new ArrayList<>(evaluateAssets(context));

        for (Rule rule : ruleSet.projectRules()) {
            violations.addAll(run(rule, null, context));
        }

        violations.forEach(RuleEngine::logViolation);
        ValidationReport report = new ValidationReport(violations, context.assets().size(), ruleSet.size());
        log.info("Evaluated {} rules against {} assets: {} errors, {} warnings",
            ruleSet.size(), context.assets().size(), report.errors().size(), report.warnings().size());
        return report;
    }

    private List<Violation> evaluateAssets(ProjectContext context) {
        List<Rule> assetRules = ruleSet.assetRules();
        List<Callable<List<Violation>>> tasks = new ArrayList<>();
        for (Asset asset : context.assets()) {
            tasks.add(() -> evaluateAsset(asset, assetRules, context));
        }

        List<Violation> violations = new ArrayList<>();
        if (parallelism == 1 || tasks.size() <= 1) {
            for (Asset asset : context.assets()) {
                violations.addAll(evaluateAsset(asset, assetRules, context));
            }
            return violations;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
        try {
            for (Future<List<Violation>> future : executor.invokeAll(tasks)) {
                violations.addAll(future.get());
            }
            return violations;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Rule evaluation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Rule evaluation failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private List<Violation> evaluateAsset(Asset asset, List<Rule> assetRules, ProjectContext context) {
        List<Violation> violations = new ArrayList<>();
        for (Rule rule : assetRules) {
            if (rule.appliesTo(asset)) {
                violations.addAll(run(rule, asset, context));
            }
        }
        return violations;
    }

    private List<Violation> run(Rule rule, Asset asset, ProjectContext context) {
        String filePath = asset == null ? null : asset.relativePath();
        long start = System.nanoTime();
        List<String> messages;
        try {
            messages = rule.validate(asset, context);
        } catch (RuntimeException e) {
            log.debug("Rule {} threw on {}", rule.id(), filePath, e);
            messages = List.of("Rule failed to execute: " + e.getMessage());
        }
        if (log.isDebugEnabled()) {
            log.debug("Rule {} on {} took {} ms", rule.id(), filePath == null ? "project" : filePath,
                (System.nanoTime() - start) / 1_000_000);
        }
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<Violation> violations = new ArrayList<>(messages.size());
        for (String message : messages) {
            violations.add(Violation.of(rule.id(), rule.name(), filePath, message, rule.enforcement()));
        }
        return violations;
    }

    private static void logViolation(Violation violation) {
        String location = violation.filePath() == null ? "project" : violation.filePath();
        if (violation.severity() == Enforcement.ERROR) {
            log.error("[{}] {}: {}", violation.ruleId(), location, violation.message());
        } else {
            log.warn("[{}] {}: {}", violation.ruleId(), location, violation.message());
        }
    }
}
