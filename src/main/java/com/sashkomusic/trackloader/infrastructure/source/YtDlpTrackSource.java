package com.sashkomusic.trackloader.infrastructure.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.trackloader.config.LoaderConfig;
import com.sashkomusic.trackloader.domain.model.TrackDescriptor;
import com.sashkomusic.trackloader.domain.port.TrackSourcePort;
import com.sashkomusic.trackloader.infrastructure.process.ExternalCommandRunner;
import com.sashkomusic.trackloader.infrastructure.process.ExternalCommandRunner.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads video and playlist metadata with yt-dlp without downloading any media.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class YtDlpTrackSource implements TrackSourcePort {

    private final ExternalCommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final LoaderConfig config;

    @Override
    public List<TrackDescriptor> extractTracks(String url) {
        try {
            CommandResult result = commandRunner.run(buildCommand(url), "extract metadata",
                    config.getSource().getTimeout());
            if (!result.isSuccess()) {
                log.error("Error extracting metadata from {}: yt-dlp exited with {}: {}",
                        url, result.exitCode(), result.errorTail(500));
                return List.of();
            }
            return parseTracks(result.stdout());

        } catch (JsonProcessingException e) {
            log.error("Error parsing yt-dlp output for {}: {}", url, e.getOriginalMessage());
            return List.of();
        } catch (IOException e) {
            log.error("Error extracting metadata from {}: {}", url, e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Metadata extraction interrupted for {}", url);
            return List.of();
        }
    }

    List<String> buildCommand(String url) {
        return List.of(
                config.getSource().getYtDlpPath(),
                "--flat-playlist",
                "--dump-single-json",
                "--no-warnings",
                url);
    }

    List<TrackDescriptor> parseTracks(String json) throws JsonProcessingException {
        JsonNode info = objectMapper.readTree(json);

        JsonNode entries = info.path("entries");
        if (entries.isArray()) {
            List<TrackDescriptor> tracks = new ArrayList<>();
            for (JsonNode entry : entries) {
                if (entry == null || entry.isNull()) {
                    continue;
                }
                tracks.add(toDescriptor(entry));
            }
            log.info("Found {} tracks in playlist", tracks.size());
            return tracks;
        }

        if (!info.isObject()) {
            return List.of();
        }
        return List.of(toDescriptor(info));
    }

    private TrackDescriptor toDescriptor(JsonNode node) {
        return new TrackDescriptor(
                node.path("title").asText(""),
                node.path("uploader").asText(""),
                node.path("id").asText(""));
    }
}
