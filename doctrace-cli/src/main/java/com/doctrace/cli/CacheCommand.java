package com.doctrace.cli;

import com.doctrace.core.cache.CacheStats;
import com.doctrace.core.cache.ParseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to inspect or maintain the parse cache.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * doctrace cache stats
 * doctrace cache clear
 * doctrace cache prune /path/to/project
 * }</pre>
 */
@Command(
    name = "cache",
    description = "Show, clear or prune the parse cache",
    mixinStandardHelpOptions = true
)
public class CacheCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CacheCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Action: stats, clear or prune")
    private String action;

    @Parameters(
        index = "1",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        ProjectSupport project = ProjectSupport.load(projectPath);
        ParseCache cache = ParseCache.open(project.cacheFile());

        return switch (action.toLowerCase(Locale.ROOT)) {
            case "stats" -> {
                CacheStats stats = cache.stats();
                out.printf("Parse cache: %s%n", cache.getCacheFile());
                out.printf("  Entries: %d%n", stats.entries());
                out.printf("  Tracked files: %d%n", stats.trackedFiles());
                yield 0;
            }
            case "clear" -> {
                cache.clear();
                cache.flush();
                out.println("✓ Cleared parse cache");
                yield 0;
            }
            case "prune" -> {
                int removed = cache.prune(Duration.ofDays(project.config().cache().maxAgeDays()));
                cache.flush();
                out.printf("✓ Pruned %d cache records%n", removed);
                yield 0;
            }
            default -> {
                log.error("Unknown action: {}. Use: stats, clear or prune", action);
                yield 1;
            }
        };
    }
}
