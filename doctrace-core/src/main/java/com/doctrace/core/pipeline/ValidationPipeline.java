package com.doctrace.core.pipeline;

import com.doctrace.core.analyzer.AnalyzerRegistry;
import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.AssetCollection;
import com.doctrace.core.asset.AssetCollector;
import com.doctrace.core.cache.ParseCache;
import com.doctrace.core.cache.ParseResult;
import com.doctrace.core.graph.GraphBuilder;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.model.ValidationReport;
import com.doctrace.core.rule.RuleCatalog;
import com.doctrace.core.rule.RuleEngine;
import com.doctrace.core.rule.RuleSet;
import com.doctrace.core.rule.RuleSetLoader;
import com.doctrace.core.rule.builtin.BuiltinRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One validation pass over a docs tree.
 *
 * <p>Stages run in order: load rules, collect assets, analyze diagrams through the parse
 * cache, build the graph, evaluate rules, flush the cache. A rule configuration problem aborts
 * before any asset is read; everything later is reported as violations.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.loadFromProject(root);
 * ValidationPipeline pipeline = new ValidationPipeline(
 *     PipelineOptions.fromConfig(root, config), ParseCache.open(root.resolve(config.cache().file())));
 * ValidationReport report = pipeline.run();
 * }</pre>
 */
public class ValidationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ValidationPipeline.class);

    private final PipelineOptions options;
    private final ParseCache cache;
    private final AnalyzerRegistry analyzers;
    private final RuleCatalog catalog;

    public ValidationPipeline(PipelineOptions options, ParseCache cache) {
        this(options, cache, AnalyzerRegistry.discover(), BuiltinRules.catalog());
    }

    public ValidationPipeline(PipelineOptions options, ParseCache cache, AnalyzerRegistry analyzers, RuleCatalog catalog) {
        this.options = options;
        this.cache = cache == null ? ParseCache.inMemory() : cache;
        this.analyzers = analyzers;
        this.catalog = catalog;
    }

    /**
     * Runs the pass.
     *
     * @return report with every violation
     * @throws com.doctrace.core.rule.RuleConfigurationException if the rule configuration is unusable
     * @throws com.doctrace.core.asset.AssetCollectionException if the docs tree cannot be read
     */
    public ValidationReport run() {
        log.info("Step 1: Loading rules");
        RuleSet rules = new RuleSetLoader(catalog).load(options.rulesFile());

        log.info("Step 2: Collecting assets from {}", options.docsRoot());
        AssetCollection collection = new AssetCollector().collect(options.docsRoot());

        log.info("Step 3: Analyzing {} assets", collection.assets().size());
        Map<String, DiagramAnalysis> analyses = analyze(collection.assets());

        log.info("Step 4: Building traceability graph");
        ProjectContext context = new GraphBuilder(rules.graphSettings(options.exemptIds())).build(collection, analyses);

        log.info("Step 5: Evaluating {} rules", rules.size());
        ValidationReport report = new RuleEngine(rules, options.parallelism()).evaluate(context);

        cache.flush();
        log.info("Validation {}: {} errors, {} warnings",
            report.passed() ? "passed" : "failed", report.errors().size(), report.warnings().size());
        return report;
    }

    public ParseCache cache() {
        return cache;
    }

    private Map<String, DiagramAnalysis> analyze(List<Asset> assets) {
        AtomicInteger hits = new AtomicInteger();
        List<Callable<DiagramAnalysis>> tasks = new ArrayList<>();
        for (Asset asset : assets) {
            tasks.add(() -> analyze(asset, hits));
        }

        List<DiagramAnalysis> results = new ArrayList<>();
        if (options.parallelism() == 1 || tasks.size() <= 1) {
            for (Asset asset : assets) {
                results.add(analyze(asset, hits));
            }
        } else {
            ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.parallelism(), tasks.size()));
            try {
                for (Future<DiagramAnalysis> future : executor.invokeAll(tasks)) {
                    results.add(future.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Diagram analysis interrupted", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Diagram analysis failed", e.getCause());
            } finally {
                executor.shutdownNow();
            }
        }

        Map<String, DiagramAnalysis> analyses = new LinkedHashMap<>();
        for (int i = 0; i < assets.size(); i++) {
            analyses.put(assets.get(i).relativePath(), results.get(i));
        }
        log.debug("Analyzed {} assets, {} served from cache", assets.size(), hits.get());
        return analyses;
    }

    private DiagramAnalysis analyze(Asset asset, AtomicInteger hits) {
        if (!asset.isDiagram()) {
            return DiagramAnalysis.empty(NotationType.UNKNOWN);
        }
        ParseResult result = cache.getOrAnalyze(asset.absolutePath(), asset.rawContent(), analyzers::analyze);
        if (result.fromCache()) {
            hits.incrementAndGet();
        }
        return result.analysis();
    }
}
