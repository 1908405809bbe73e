package com.sashkomusic.trackloader.domain.service;

import com.sashkomusic.trackloader.config.WorkerPoolFactory;
import com.sashkomusic.trackloader.domain.model.RunStatistics;
import com.sashkomusic.trackloader.domain.model.SearchCandidate;
import com.sashkomusic.trackloader.domain.model.SongDetail;
import com.sashkomusic.trackloader.domain.model.SongDetailFixtures;
import com.sashkomusic.trackloader.domain.model.TrackDescriptor;
import com.sashkomusic.trackloader.domain.port.AudioTransferPort;
import com.sashkomusic.trackloader.domain.port.CatalogPort;
import com.sashkomusic.trackloader.domain.port.TagWriterPort;
import com.sashkomusic.trackloader.domain.port.TrackSourcePort;
import com.sashkomusic.trackloader.domain.port.TranscoderPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wires the orchestrator to a real pipeline backed by in-memory adapters.
 */
class TrackOrchestratorEndToEndTest {

    private static final String URL = "https://www.youtube.com/playlist?list=PLmix";

    @TempDir
    Path outputDir;

    private final AtomicInteger transfers = new AtomicInteger();
    private final AtomicInteger taggedFiles = new AtomicInteger();

    private TrackOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        TrackSourcePort source = url -> List.of(
                new TrackDescriptor("Alpha (Official Video)", "Channel", "v1"),
                new TrackDescriptor("Beta [Lyric Video]", "Channel", "v2"),
                new TrackDescriptor("Gamma | Live at Somewhere", "Channel", "v3"));

        CatalogPort catalog = new InMemoryCatalog(Map.of(
                "Alpha", SongDetailFixtures.song("a1", "Alpha", "Artist A"),
                "Gamma", SongDetailFixtures.song("g1", "Gamma", "Artist G")));

        AudioTransferPort transfer = (url, destination) -> {
            transfers.incrementAndGet();
            Files.writeString(destination, "source:" + url);
        };
        TranscoderPort transcoder = (sourceFile, target) -> Files.copy(sourceFile, target);
        TagWriterPort tagWriter = (file, tags) -> taggedFiles.incrementAndGet();

        AssetSelector assetSelector = new AssetSelector();
        MetadataProjector projector = new MetadataProjector(assetSelector);
        TrackPipeline pipeline = new TrackPipeline(new TitleNormalizer(), catalog, assetSelector,
                new FilenameBuilder(projector), projector, transfer, transcoder, tagWriter);

        orchestrator = new TrackOrchestrator(source, pipeline, new WorkerPoolFactory(), new RunReportBuilder());
    }

    @Test
    void processUrlDownloadsMatchedTracksAndReportsTheRest() throws IOException {
        RunStatistics stats = orchestrator.processUrl(URL, outputDir, 2);

        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.getSucceeded()).isEqualTo(2);
        assertThat(stats.getFailedTracks()).containsExactly("Beta [Lyric Video]");
        assertThat(stats.getCancelled()).isZero();
        assertThat(listFiles()).containsExactlyInAnyOrder("Alpha - Artist A.mp3", "Gamma - Artist G.mp3");
        assertThat(taggedFiles).hasValue(2);
    }

    @Test
    void secondRunSkipsEverythingAlreadyDownloaded() throws IOException {
        orchestrator.processUrl(URL, outputDir, 2);
        int transfersAfterFirstRun = transfers.get();

        RunStatistics second = orchestrator.processUrl(URL, outputDir, 2);

        assertThat(second.getSucceeded()).isEqualTo(2);
        assertThat(second.getAlreadyPresent()).isEqualTo(2);
        assertThat(second.getFailed()).isEqualTo(1);
        assertThat(transfers).hasValue(transfersAfterFirstRun);
        assertThat(listFiles()).hasSize(2);
    }

    private List<String> listFiles() throws IOException {
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.map(path -> path.getFileName().toString()).toList();
        }
    }

    private static final class InMemoryCatalog implements CatalogPort {

        private final Map<String, SongDetail> songsByQuery;

        private InMemoryCatalog(Map<String, SongDetail> songsByQuery) {
            this.songsByQuery = songsByQuery;
        }

        @Override
        public Optional<SearchCandidate> search(String query) {
            return Optional.ofNullable(songsByQuery.get(query)).map(song -> new SearchCandidate(song.id()));
        }

        @Override
        public Optional<SongDetail> fetchDetail(String id) {
            return songsByQuery.values().stream().filter(song -> song.id().equals(id)).findFirst();
        }
    }
}
