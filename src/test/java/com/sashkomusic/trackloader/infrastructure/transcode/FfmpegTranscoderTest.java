package com.sashkomusic.trackloader.infrastructure.transcode;

import com.sashkomusic.trackloader.config.LoaderConfig;
import com.sashkomusic.trackloader.infrastructure.process.ExternalCommandRunner;
import com.sashkomusic.trackloader.infrastructure.process.ExternalCommandRunner.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FfmpegTranscoderTest {

    @Mock
    private ExternalCommandRunner commandRunner;

    private FfmpegTranscoder transcoder;

    @BeforeEach
    void setUp() {
        LoaderConfig config = new LoaderConfig();
        config.getTranscode().setFfmpegPath("ffmpeg");
        config.getTranscode().setBitrate("256k");
        config.getTranscode().setTimeout(Duration.ofMinutes(2));
        transcoder = new FfmpegTranscoder(commandRunner, config);
    }

    @Test
    void buildCommandEncodesMp3AtConfiguredBitrate() {
        List<String> command = transcoder.buildCommand(Path.of("in.temp"), Path.of("out.mp3"));

        assertThat(command).containsExactly(
                "ffmpeg", "-y", "-hide_banner", "-loglevel", "error",
                "-i", "in.temp", "-vn", "-codec:a", "libmp3lame", "-b:a", "256k", "-f", "mp3", "out.mp3");
    }

    @Test
    void transcodeSucceedsOnZeroExit() throws Exception {
        Path source = Path.of("in.temp");
        Path target = Path.of("out.mp3");
        when(commandRunner.run(eq(transcoder.buildCommand(source, target)), anyString(), eq(Duration.ofMinutes(2))))
                .thenReturn(new CommandResult(0, "", ""));

        transcoder.transcode(source, target);
    }

    @Test
    void transcodeFailsWithErrorOutputOnNonZeroExit() throws Exception {
        Path source = Path.of("in.temp");
        Path target = Path.of("out.mp3");
        when(commandRunner.run(eq(transcoder.buildCommand(source, target)), anyString(), eq(Duration.ofMinutes(2))))
                .thenReturn(new CommandResult(1, "", "in.temp: Invalid data found when processing input\n"));

        assertThatThrownBy(() -> transcoder.transcode(source, target))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("exit code 1")
                .hasMessageContaining("Invalid data found");
    }
}
