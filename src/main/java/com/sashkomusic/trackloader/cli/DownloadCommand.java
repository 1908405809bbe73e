package com.sashkomusic.trackloader.cli;

import com.sashkomusic.trackloader.config.LoaderConfig;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Parsed command line: {@code <url> [--output=DIR] [--workers=N] [--verbose]}.
 */
public record DownloadCommand(
        String url,
        Path outputDir,
        int workers,
        boolean verbose
) {
    public static final String USAGE = """
            Usage: track-loader <url> [--output=DIR] [--workers=N] [--verbose]

              url          YouTube video or playlist URL
              --output     Output directory (default: %s)
              --workers    Number of parallel download workers (default: %d)
              --verbose    Enable verbose logging

            Option values must be joined with '=' (--workers=5, not --workers 5).
            """;

    public static DownloadCommand from(ApplicationArguments args, LoaderConfig defaults) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty() || positional.get(0).isBlank()) {
            throw new IllegalArgumentException("Missing source URL");
        }
        if (positional.size() > 1) {
            throw new IllegalArgumentException("Expected exactly one URL, got " + positional.size()
                    + " (option values must be written as --name=value)");
        }

        String output = lastValue(args, "output", defaults.getOutputDir());
        String workersText = lastValue(args, "workers", String.valueOf(defaults.getWorkers()));

        int workers;
        try {
            workers = Integer.parseInt(workersText.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Worker count must be a number, got '" + workersText + "'");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workers);
        }

        return new DownloadCommand(positional.get(0), Paths.get(output), workers, args.containsOption("verbose"));
    }

    public static String usage(LoaderConfig defaults) {
        return String.format(USAGE, defaults.getOutputDir(), defaults.getWorkers());
    }

    private static String lastValue(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        return values.get(values.size() - 1);
    }
}
