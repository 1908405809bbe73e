package com.sashkomusic.trackloader.infrastructure.process;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs command-line tools (yt-dlp, ffmpeg) and captures their output.
 */
@Slf4j
@Component
public class ExternalCommandRunner {

    private final SimpleAsyncTaskExecutor streamReaders = new SimpleAsyncTaskExecutor("process-io-");

    public ExternalCommandRunner() {
        streamReaders.setDaemon(true);
    }

    public CommandResult run(List<String> command, String stage, Duration timeout)
            throws IOException, InterruptedException {
        log.debug("Running command for stage {}: {}", stage, String.join(" ", command));
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()), streamReaders);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), streamReaders);

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new IOException(command.get(0) + " timed out during stage: " + stage);
            }
        } catch (IOException | InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        try {
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (ExecutionException e) {
            throw new IOException("Could not read output of " + command.get(0), e.getCause());
        }
    }

    private static String readFully(InputStream stream) {
        try (InputStream in = stream) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public record CommandResult(int exitCode, String stdout, String stderr) {

        public boolean isSuccess() {
            return exitCode == 0;
        }

        public String errorTail(int maxChars) {
            String text = stderr != null ? stderr.strip() : "";
            return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
        }
    }
}
