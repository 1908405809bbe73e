package com.sashkomusic.trackloader.cli;

import com.sashkomusic.trackloader.config.LoaderConfig;
import com.sashkomusic.trackloader.domain.service.RunCancelledException;
import com.sashkomusic.trackloader.domain.service.TrackOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;

@Slf4j
@Component
@RequiredArgsConstructor
public class DownloadCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELLED = 130;

    private static final String APPLICATION_PACKAGE = "com.sashkomusic.trackloader";

    private final TrackOrchestrator orchestrator;
    private final LoaderConfig loaderConfig;
    private final LoggingSystem loggingSystem;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        DownloadCommand command;
        try {
            command = DownloadCommand.from(args, loaderConfig);
        } catch (IllegalArgumentException ex) {
            log.error("{}", ex.getMessage());
            System.err.println(DownloadCommand.usage(loaderConfig));
            exitCode = EXIT_USAGE;
            return;
        }

        if (command.verbose()) {
            loggingSystem.setLogLevel(APPLICATION_PACKAGE, LogLevel.DEBUG);
        }

        exitCode = execute(command);
    }

    int execute(DownloadCommand command) {
        try (CancellationHook ignored = CancellationHook.install()) {
            Files.createDirectories(command.outputDir());
            orchestrator.processUrl(command.url(), command.outputDir(), command.workers());
            return EXIT_OK;

        } catch (RunCancelledException ex) {
            log.info("Operation cancelled by user");
            return EXIT_CANCELLED;
        } catch (IOException ex) {
            log.error("Fatal error: cannot create output directory {}: {}", command.outputDir(), ex.getMessage());
            return EXIT_FAILURE;
        } catch (Exception ex) {
            log.error("Fatal error: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
