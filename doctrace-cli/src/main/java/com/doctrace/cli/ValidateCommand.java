package com.doctrace.cli;

import com.doctrace.core.asset.AssetCollectionException;
import com.doctrace.core.model.Enforcement;
import com.doctrace.core.model.ValidationReport;
import com.doctrace.core.model.Violation;
import com.doctrace.core.pipeline.PipelineOptions;
import com.doctrace.core.pipeline.ValidationPipeline;
import com.doctrace.core.rule.RuleConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate a project's docs tree.
 *
 * <p>Prints violations grouped by severity. Exit code is 0 when no error-level violation was
 * reported, 1 when one was, and 2 when the rule configuration or docs tree cannot be read.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Validate the current directory
 * doctrace validate
 *
 * # Validate a specific project
 * doctrace validate /path/to/project
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate diagrams, metadata and traceability of a docs tree",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final int EXIT_FAILED = 1;
    static final int EXIT_UNUSABLE = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        ProjectSupport project = ProjectSupport.load(projectPath);
        log.info("Validating project: {}", project.root());

        ValidationReport report;
        try {
            ValidationPipeline pipeline = new ValidationPipeline(
                PipelineOptions.fromConfig(project.root(), project.config()), project.openCache());
            report = pipeline.run();
        } catch (RuleConfigurationException | AssetCollectionException e) {
            log.error("Validation aborted: {}", e.getMessage());
            spec.commandLine().getErr().println("✗ Validation aborted: " + e.getMessage());
            return EXIT_UNUSABLE;
        }

        printGroup(out, "Errors", report.bySeverity().getOrDefault(Enforcement.ERROR, List.of()));
        printGroup(out, "Warnings", report.bySeverity().getOrDefault(Enforcement.WARNING, List.of()));

        out.printf("%d assets, %d rules: %d errors, %d warnings%n",
            report.assetCount(), report.rulesEvaluated(), report.errors().size(), report.warnings().size());
        if (report.passed()) {
            out.println("✓ Validation passed");
            return 0;
        }
        out.println("✗ Validation failed");
        return EXIT_FAILED;
    }

    private static void printGroup(PrintWriter out, String title, List<Violation> violations) {
        if (violations.isEmpty()) {
            return;
        }
        out.printf("%s (%d):%n", title, violations.size());
        for (Violation violation : violations) {
            String location = violation.filePath() == null ? "project" : violation.filePath();
            out.printf("  • [%s] %s: %s%n", violation.ruleId(), location, violation.message());
        }
        out.println();
    }
}
