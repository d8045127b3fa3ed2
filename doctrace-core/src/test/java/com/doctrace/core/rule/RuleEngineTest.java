package com.doctrace.core.rule;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.AssetCollection;
import com.doctrace.core.graph.GraphBuilder;
import com.doctrace.core.graph.GraphSettings;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.model.Enforcement;
import com.doctrace.core.model.ValidationReport;
import com.doctrace.core.model.Violation;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RuleEngine}.
 */
class RuleEngineTest {

    private static final Path ROOT = Path.of("/docs");

    private static ProjectContext context(String... ids) {
        List<Asset> assets = new ArrayList<>();
        for (String id : ids) {
            String path = id + ".mermaid";
            assets.add(Asset.of(path, ROOT.resolve(path), "---\nid: " + id + "\n---\ngraph TD\n"));
        }
        return new GraphBuilder(GraphSettings.empty())
            .build(new AssetCollection(ROOT, assets, List.of(), List.of()), Map.of());
    }

    private static StubRule rule(String id, RuleLevel level, Enforcement enforcement,
                                 BiFunction<Asset, ProjectContext, List<String>> body) {
        return new StubRule(RuleDefinition.of(id, level, RuleTarget.any(), enforcement), body);
    }

    @Test
    void evaluate_onlyWarnings_reportPasses() {
        RuleSet ruleSet = new RuleSet(List.of(
            rule("soft", RuleLevel.FILE, Enforcement.WARNING, (asset, ctx) -> List.of("hmm " + asset.id()))));

        ValidationReport report = new RuleEngine(ruleSet).evaluate(context("A_1", "A_2"));

        assertThat(report.passed()).isTrue();
        assertThat(report.warnings()).extracting(Violation::message).containsExactly("hmm A_1", "hmm A_2");
        assertThat(report.errors()).isEmpty();
        assertThat(report.assetCount()).isEqualTo(2);
        assertThat(report.rulesEvaluated()).isEqualTo(1);
    }

    @Test
    void evaluate_errorViolation_failsReportWithFilePath() {
        RuleSet ruleSet = new RuleSet(List.of(
            rule("hard", RuleLevel.FILE, Enforcement.ERROR,
                (asset, ctx) -> asset.id().equals("B_1") ? List.of("broken") : List.of())));

        ValidationReport report = new RuleEngine(ruleSet).evaluate(context("A_1", "B_1"));

        assertThat(report.passed()).isFalse();
        assertThat(report.errors()).singleElement().satisfies(violation -> {
            assertThat(violation.ruleId()).isEqualTo("hard");
            assertThat(violation.filePath()).isEqualTo("B_1.mermaid");
            assertThat(violation.message()).isEqualTo("broken");
        });
    }

    @Test
    void evaluate_throwingRule_isReportedAndOtherRulesStillRun() {
        RuleSet ruleSet = new RuleSet(List.of(
            rule("explodes", RuleLevel.FILE, Enforcement.ERROR, (asset, ctx) -> {
                throw new IllegalStateException("boom");
            }),
            rule("fine", RuleLevel.FILE, Enforcement.WARNING, (asset, ctx) -> List.of("ran"))));

        ValidationReport report = new RuleEngine(ruleSet).evaluate(context("A_1"));

        assertThat(report.forRule("explodes")).extracting(Violation::message)
            .containsExactly("Rule failed to execute: boom");
        assertThat(report.forRule("fine")).hasSize(1);
    }

    @Test
    void evaluate_projectRules_runOnceAfterAssetRulesAndSeeTheirMetadata() {
        // Given
        RuleSet ruleSet = new RuleSet(List.of(
            rule("summary", RuleLevel.PROJECT, Enforcement.ERROR, (asset, ctx) -> {
                long marked = ctx.nodeMap().values().stream()
                    .filter(node -> node.metadata().isTrue("visited"))
                    .count();
                return List.of((asset == null ? "project" : "asset") + " saw " + marked);
            }),
            rule("marker", RuleLevel.FILE, Enforcement.WARNING, (asset, ctx) -> {
                ctx.node(asset.id()).orElseThrow().metadata().put("visited", Boolean.TRUE);
                return List.of();
            })));

        // When
        ValidationReport report = new RuleEngine(ruleSet, 4).evaluate(context("A_1", "A_2", "A_3"));

        // Then
        assertThat(report.forRule("summary")).singleElement().satisfies(violation -> {
            assertThat(violation.message()).isEqualTo("project saw 3");
            assertThat(violation.filePath()).isNull();
        });
    }

    @Test
    void evaluate_parallel_keepsAssetOrder() {
        RuleSet ruleSet = new RuleSet(List.of(
            rule("echo", RuleLevel.NODE, Enforcement.WARNING, (asset, ctx) -> List.of(asset.id()))));
        String[] ids = new String[20];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = String.format("N_%02d", i);
        }

        ValidationReport report = new RuleEngine(ruleSet, 8).evaluate(context(ids));

        assertThat(report.violations()).extracting(Violation::message).containsExactly(ids);
    }

    @Test
    void evaluate_targetedRule_skipsUnselectedAssets() {
        StubRule targeted = new StubRule(
            RuleDefinition.of("only-per", RuleLevel.FILE, new RuleTarget("PER_", null), Enforcement.ERROR),
            (asset, ctx) -> List.of("seen " + asset.id()));

        ValidationReport report = new RuleEngine(new RuleSet(List.of(targeted))).evaluate(context("PER_A", "REQ_B"));

        assertThat(report.violations()).extracting(Violation::message).containsExactly("seen PER_A");
    }
}
