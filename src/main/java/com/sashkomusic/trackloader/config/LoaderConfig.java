package com.sashkomusic.trackloader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "loader")
public class LoaderConfig {

    private String outputDir = "downloads";
    private int workers = 3;
    private Catalog catalog = new Catalog();
    private Source source = new Source();
    private Transcode transcode = new Transcode();

    @Data
    public static class Catalog {
        private String baseUrl = "https://saavn.sumit.co";
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
    }

    @Data
    public static class Source {
        private String ytDlpPath = "yt-dlp";
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Transcode {
        private String ffmpegPath = "ffmpeg";
        private String bitrate = "320k";
        private Duration timeout = Duration.ofMinutes(30);
    }
}
