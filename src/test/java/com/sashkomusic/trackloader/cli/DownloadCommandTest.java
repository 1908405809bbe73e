package com.sashkomusic.trackloader.cli;

import com.sashkomusic.trackloader.config.LoaderConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DownloadCommandTest {

    private static final String URL = "https://www.youtube.com/watch?v=abc";

    private final LoaderConfig defaults = new LoaderConfig();

    @Test
    void fromUsesConfiguredDefaults() {
        DownloadCommand command = parse(URL);

        assertThat(command.url()).isEqualTo(URL);
        assertThat(command.outputDir()).isEqualTo(Paths.get("downloads"));
        assertThat(command.workers()).isEqualTo(3);
        assertThat(command.verbose()).isFalse();
    }

    @Test
    void fromReadsOptions() {
        DownloadCommand command = parse("--output=/music/new", URL, "--workers=5", "--verbose");

        assertThat(command.outputDir()).isEqualTo(Paths.get("/music/new"));
        assertThat(command.workers()).isEqualTo(5);
        assertThat(command.verbose()).isTrue();
    }

    @Test
    void fromTakesLastValueOfRepeatedOption() {
        assertThat(parse(URL, "--workers=2", "--workers=7").workers()).isEqualTo(7);
    }

    @Test
    void fromRejectsMissingUrl() {
        assertThatThrownBy(() -> parse("--workers=2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing source URL");
    }

    @Test
    void fromRejectsSeveralUrls() {
        assertThatThrownBy(() -> parse(URL, "https://www.youtube.com/watch?v=def"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromRejectsInvalidWorkerCounts() {
        assertThatThrownBy(() -> parse(URL, "--workers=0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse(URL, "--workers=-2")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse(URL, "--workers=many"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("many");
    }

    @Test
    void fromRejectsSpaceSeparatedOptionValue() {
        assertThatThrownBy(() -> parse(URL, "--output", "/music/new"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--name=value");
    }

    @Test
    void usageShowsDefaults() {
        defaults.setWorkers(4);

        assertThat(DownloadCommand.usage(defaults))
                .contains("default: downloads")
                .contains("default: 4")
                .contains("must be joined with '='");
    }

    private DownloadCommand parse(String... args) {
        return DownloadCommand.from(new DefaultApplicationArguments(args), defaults);
    }
}
