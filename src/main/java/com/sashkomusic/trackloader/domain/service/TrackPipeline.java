package com.sashkomusic.trackloader.domain.service;

import com.sashkomusic.trackloader.domain.model.SearchCandidate;
import com.sashkomusic.trackloader.domain.model.SongDetail;
import com.sashkomusic.trackloader.domain.model.TagSet;
import com.sashkomusic.trackloader.domain.model.TrackDescriptor;
import com.sashkomusic.trackloader.domain.model.TrackOutcome;
import com.sashkomusic.trackloader.domain.port.AudioTransferPort;
import com.sashkomusic.trackloader.domain.port.CatalogPort;
import com.sashkomusic.trackloader.domain.port.TagWriterPort;
import com.sashkomusic.trackloader.domain.port.TranscoderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs one track through match, detail, asset selection, transfer, transcode and tagging.
 * Every per-track error ends up in the returned outcome; nothing is thrown to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackPipeline {

    static final String OUTPUT_EXTENSION = ".mp3";
    static final String TEMP_EXTENSION = ".temp";

    private final TitleNormalizer titleNormalizer;
    private final CatalogPort catalog;
    private final AssetSelector assetSelector;
    private final FilenameBuilder filenameBuilder;
    private final MetadataProjector metadataProjector;
    private final AudioTransferPort audioTransfer;
    private final TranscoderPort transcoder;
    private final TagWriterPort tagWriter;

    public TrackOutcome process(TrackDescriptor track, Path outputDir) {
        String label = track.displayLabel();
        try {
            return runStages(track, label, outputDir);
        } catch (TrackProcessingException ex) {
            log.warn("Track '{}' failed at {}: {}", label, ex.getStage().displayName(), ex.getMessage());
            log.debug("Failure details for '{}'", label, ex);
            return TrackOutcome.failed(label, ex.reason());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Track '{}' interrupted", label);
            return TrackOutcome.failed(label, "interrupted");
        } catch (Exception ex) {
            log.error("Unexpected error processing '{}': {}", label, ex.getMessage(), ex);
            return TrackOutcome.failed(label, "unexpected error: " + ex.getMessage());
        }
    }

    private TrackOutcome runStages(TrackDescriptor track, String label, Path outputDir) throws InterruptedException {
        String query = titleNormalizer.normalize(track.title());
        if (query.isEmpty()) {
            throw new TrackProcessingException(PipelineStage.MATCH, "title is empty after cleanup");
        }
        log.info("Processing: {}", query);

        SearchCandidate candidate = catalog.search(query)
                .filter(match -> match.id() != null && !match.id().isBlank())
                .orElseThrow(() -> new TrackProcessingException(PipelineStage.MATCH, "not found in catalog: " + query));

        SongDetail detail = catalog.fetchDetail(candidate.id())
                .orElseThrow(() -> new TrackProcessingException(PipelineStage.DETAIL,
                        "could not retrieve song details for id " + candidate.id()));

        String audioUrl = assetSelector.selectAudio(detail.downloadUrl())
                .orElseThrow(() -> new TrackProcessingException(PipelineStage.SELECT_ASSET, "no download URL available"));

        String baseName = filenameBuilder.baseName(detail);
        Path outputFile = outputDir.resolve(baseName + OUTPUT_EXTENSION);
        if (Files.exists(outputFile)) {
            log.info("Already exists: {}", outputFile.getFileName());
            return TrackOutcome.skippedExisting(label, outputFile);
        }

        Path tempFile = outputDir.resolve(baseName + TEMP_EXTENSION);
        transferAndTranscode(audioUrl, tempFile, outputFile);

        embedTags(outputFile, metadataProjector.project(detail));

        log.info("Successfully processed: {}", outputFile.getFileName());
        return TrackOutcome.success(label, outputFile);
    }

    private void transferAndTranscode(String audioUrl, Path tempFile, Path outputFile) throws InterruptedException {
        try {
            try {
                audioTransfer.transfer(audioUrl, tempFile);
            } catch (IOException | RuntimeException ex) {
                throw new TrackProcessingException(PipelineStage.TRANSFER, ex.getMessage(), ex);
            }

            try {
                transcoder.transcode(tempFile, outputFile);
            } catch (IOException | RuntimeException ex) {
                deleteQuietly(outputFile);
                throw new TrackProcessingException(PipelineStage.TRANSCODE, ex.getMessage(), ex);
            } catch (InterruptedException ex) {
                deleteQuietly(outputFile);
                throw ex;
            }
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private void embedTags(Path outputFile, TagSet tags) {
        try {
            tagWriter.writeTags(outputFile, tags);
        } catch (RuntimeException ex) {
            // The audio is already in place; missing tags do not fail the track.
            log.warn("Metadata embedding failed for {}: {}", outputFile.getFileName(), ex.getMessage());
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Could not delete {}: {}", path.getFileName(), ex.getMessage());
        }
    }
}
