package com.doctrace.cli;

import com.doctrace.core.analyzer.AnalyzerRegistry;
import com.doctrace.core.analyzer.DiagramAnalyzer;
import com.doctrace.core.rule.Rule;
import com.doctrace.core.rule.RuleConfigurationException;
import com.doctrace.core.rule.RuleSet;
import com.doctrace.core.rule.RuleSetLoader;
import com.doctrace.core.rule.builtin.BuiltinRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available diagram analyzers or the active rules of a project.
 *
 * <p>Analyzers are discovered via Java Service Provider Interface (SPI); rules are the built-in
 * rule set with the project's overrides applied.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * doctrace list analyzers
 * doctrace list rules /path/to/project
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available analyzers or active rules",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: analyzers or rules")
    private String type;

    @Parameters(
        index = "1",
        description = "Project directory for rule overrides (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "analyzers", "analyzer" -> listAnalyzers();
            case "rules", "rule" -> listRules();
            default -> {
                log.error("Unknown type: {}. Use: analyzers or rules", type);
                yield 1;
            }
        };
    }

    private int listAnalyzers() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Analyzers:");
        out.println();
        for (DiagramAnalyzer analyzer : AnalyzerRegistry.discover().getAnalyzers()) {
            out.printf("  • %s (ID: %s)%n", analyzer.getDisplayName(), analyzer.getId());
            out.printf("    Keywords: %s%n", analyzer.getKeywords());
            out.println();
        }
        return 0;
    }

    private int listRules() {
        PrintWriter out = spec.commandLine().getOut();
        ProjectSupport project = ProjectSupport.load(projectPath);
        Path rulesFile = project.root().resolve(project.config().docs().rulesFile());
        RuleSet rules;
        try {
            rules = new RuleSetLoader(BuiltinRules.catalog()).load(rulesFile);
        } catch (RuleConfigurationException e) {
            log.error("Cannot load rules: {}", e.getMessage());
            return ValidateCommand.EXIT_UNUSABLE;
        }
        out.println("Active Rules:");
        out.println();
        for (Rule rule : rules.rules()) {
            out.printf("  • %s (ID: %s)%n", rule.name(), rule.id());
            out.printf("    Level: %s, Enforcement: %s%n", rule.level().toValue(), rule.enforcement().toValue());
            out.println();
        }
        return 0;
    }
}
