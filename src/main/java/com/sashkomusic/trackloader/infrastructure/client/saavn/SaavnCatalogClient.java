package com.sashkomusic.trackloader.infrastructure.client.saavn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sashkomusic.trackloader.config.LoaderConfig;
import com.sashkomusic.trackloader.domain.model.SearchCandidate;
import com.sashkomusic.trackloader.domain.model.SongDetail;
import com.sashkomusic.trackloader.domain.port.CatalogPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * Client for the public JioSaavn API mirror.
 * <p>
 * Search prefers the first entry of the {@code songs} group and falls back to the first
 * entry of {@code topQuery}; ambiguous queries often only match there.
 */
@Component
public class SaavnCatalogClient implements CatalogPort {

    private static final Logger log = LoggerFactory.getLogger(SaavnCatalogClient.class);

    static final String SEARCH_PATH = "/api/search?query={query}";
    static final String SONG_PATH = "/api/songs/{id}";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public SaavnCatalogClient(RestClient.Builder restClientBuilder, ObjectMapper objectMapper, LoaderConfig config) {
        this.restClient = restClientBuilder.clone()
                .baseUrl(config.getCatalog().getBaseUrl())
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SearchCandidate> search(String query) {
        try {
            String body = restClient.get()
                    .uri(SEARCH_PATH, query)
                    .retrieve()
                    .body(String.class);

            JsonNode root = objectMapper.readTree(body != null ? body : "");
            if (!root.path("success").asBoolean(false)) {
                log.warn("Search failed for query: {}", query);
                return Optional.empty();
            }

            JsonNode data = root.path("data");
            Optional<JsonNode> first = firstResult(data.path("songs").path("results"))
                    .or(() -> firstResult(data.path("topQuery").path("results")));

            if (first.isEmpty()) {
                log.warn("No results found for query: {}", query);
                return Optional.empty();
            }

            String id = first.get().path("id").asText("");
            if (id.isBlank()) {
                log.warn("Top result for query '{}' has no id", query);
                return Optional.empty();
            }
            log.debug("Query '{}' matched catalog id {}", query, id);
            return Optional.of(new SearchCandidate(id));

        } catch (RestClientException e) {
            log.error("Network error while searching '{}': {}", query, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.error("Error parsing search results for '{}': {}", query, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<SongDetail> fetchDetail(String id) {
        try {
            String body = restClient.get()
                    .uri(SONG_PATH, id)
                    .retrieve()
                    .body(String.class);

            JsonNode root = objectMapper.readTree(body != null ? body : "");
            if (!root.path("success").asBoolean(false)) {
                log.error("Failed to retrieve song details for ID: {}", id);
                return Optional.empty();
            }

            JsonNode data = root.path("data");
            JsonNode song = data.isArray() ? data.path(0) : data;
            if (!song.isObject()) {
                log.warn("Song details for ID {} are empty", id);
                return Optional.empty();
            }

            return Optional.of(objectMapper.treeToValue(song, SongDetail.class));

        } catch (RestClientException e) {
            log.error("Network error while fetching song details for {}: {}", id, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.error("Error parsing song details for {}: {}", id, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Optional<JsonNode> firstResult(JsonNode results) {
        if (results.isArray() && !results.isEmpty()) {
            return Optional.of(results.get(0));
        }
        return Optional.empty();
    }
}
