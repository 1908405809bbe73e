package com.sashkomusic.trackloader.infrastructure.transcode;

import com.sashkomusic.trackloader.config.LoaderConfig;
import com.sashkomusic.trackloader.domain.port.TranscoderPort;
import com.sashkomusic.trackloader.infrastructure.process.ExternalCommandRunner;
import com.sashkomusic.trackloader.infrastructure.process.ExternalCommandRunner.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class FfmpegTranscoder implements TranscoderPort {

    private final ExternalCommandRunner commandRunner;
    private final LoaderConfig config;

    @Override
    public void transcode(Path source, Path target) throws IOException, InterruptedException {
        CommandResult result = commandRunner.run(buildCommand(source, target), "convert to mp3",
                config.getTranscode().getTimeout());

        if (!result.isSuccess()) {
            throw new IOException("FFmpeg failed with exit code " + result.exitCode()
                    + ". Output: " + result.errorTail(1000));
        }
        log.info("Converted to MP3: {}", target.getFileName());
    }

    List<String> buildCommand(Path source, Path target) {
        return List.of(
                config.getTranscode().getFfmpegPath(),
                "-y",
                "-hide_banner",
                "-loglevel",
                "error",
                "-i",
                source.toString(),
                "-vn",
                "-codec:a",
                "libmp3lame",
                "-b:a",
                config.getTranscode().getBitrate(),
                "-f",
                "mp3",
                target.toString());
    }
}
