package com.sashkomusic.trackloader.cli;

import com.sashkomusic.trackloader.config.LoaderConfig;
import com.sashkomusic.trackloader.domain.model.RunStatistics;
import com.sashkomusic.trackloader.domain.service.RunCancelledException;
import com.sashkomusic.trackloader.domain.service.TrackOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DownloadCommandRunnerTest {

    private static final String URL = "https://www.youtube.com/playlist?list=PL1";

    @Mock
    private TrackOrchestrator orchestrator;

    @Mock
    private LoggingSystem loggingSystem;

    @TempDir
    Path tempDir;

    private DownloadCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new DownloadCommandRunner(orchestrator, new LoaderConfig(), loggingSystem);
    }

    @Test
    void runCreatesOutputDirectoryAndExitsCleanly() {
        Path output = tempDir.resolve("nested/music");
        when(orchestrator.processUrl(URL, output, 4)).thenReturn(new RunStatistics(2));

        runner.run(new DefaultApplicationArguments(URL, "--output=" + output, "--workers=4"));

        assertThat(runner.getExitCode()).isEqualTo(DownloadCommandRunner.EXIT_OK);
        assertThat(Files.isDirectory(output)).isTrue();
        verifyNoInteractions(loggingSystem);
    }

    @Test
    void runEnablesDebugLoggingWhenVerbose() {
        when(orchestrator.processUrl(eq(URL), any(Path.class), anyInt())).thenReturn(RunStatistics.empty());

        runner.run(new DefaultApplicationArguments(URL, "--output=" + tempDir, "--verbose"));

        verify(loggingSystem).setLogLevel("com.sashkomusic.trackloader", LogLevel.DEBUG);
    }

    @Test
    void runReportsUsageErrors() {
        runner.run(new DefaultApplicationArguments("--workers=abc"));

        assertThat(runner.getExitCode()).isEqualTo(DownloadCommandRunner.EXIT_USAGE);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void executeMapsCancellationToInterruptExitCode() {
        when(orchestrator.processUrl(anyString(), any(Path.class), anyInt()))
                .thenThrow(new RunCancelledException(new RunStatistics(3), new InterruptedException()));

        int exitCode = runner.execute(new DownloadCommand(URL, tempDir, 2, false));

        assertThat(exitCode).isEqualTo(DownloadCommandRunner.EXIT_CANCELLED);
    }

    @Test
    void executeMapsUnexpectedErrorToFailure() {
        when(orchestrator.processUrl(anyString(), any(Path.class), anyInt()))
                .thenThrow(new IllegalStateException("pool rejected task"));

        int exitCode = runner.execute(new DownloadCommand(URL, tempDir, 2, false));

        assertThat(exitCode).isEqualTo(DownloadCommandRunner.EXIT_FAILURE);
    }

    @Test
    void executeFailsWhenOutputDirectoryCannotBeCreated() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("occupied"), "a file, not a directory");

        int exitCode = runner.execute(new DownloadCommand(URL, blocker.resolve("sub"), 2, false));

        assertThat(exitCode).isEqualTo(DownloadCommandRunner.EXIT_FAILURE);
        verifyNoInteractions(orchestrator);
    }
}
