package com.sashkomusic.trackloader.infrastructure.tagging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

@Slf4j
@Service
public class CoverArtService {

    private final RestClient restClient;

    public CoverArtService(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
    }

    public Optional<byte[]> fetchCover(String coverUrl) {
        if (coverUrl == null || coverUrl.isEmpty()) {
            log.debug("No cover URL provided, skipping cover art");
            return Optional.empty();
        }

        try {
            log.debug("Downloading cover art from: {}", coverUrl);

            byte[] imageData = restClient.get()
                    .uri(URI.create(coverUrl))
                    .retrieve()
                    .onStatus(status -> status.value() >= 400, (request, response) -> {
                        throw new IOException("HTTP error: " + response.getStatusCode());
                    })
                    .body(byte[].class);

            if (imageData == null || imageData.length == 0) {
                log.warn("Empty response from cover URL: {}", coverUrl);
                return Optional.empty();
            }

            if (!isValidImageData(imageData)) {
                log.warn("Downloaded cover is not a valid image (first bytes: {})",
                        bytesToHex(imageData, Math.min(8, imageData.length)));
                return Optional.empty();
            }

            return Optional.of(imageData);

        } catch (RestClientException | IllegalArgumentException ex) {
            log.debug("Failed to download cover art from {}: {}", coverUrl, ex.getMessage());
            return Optional.empty();
        }
    }

    static boolean isValidImageData(byte[] data) {
        if (data.length < 4) {
            return false;
        }
        // JPEG: FF D8 FF
        if (data[0] == (byte) 0xFF && data[1] == (byte) 0xD8 && data[2] == (byte) 0xFF) {
            return true;
        }
        // PNG: 89 50 4E 47
        return data[0] == (byte) 0x89 && data[1] == (byte) 0x50
                && data[2] == (byte) 0x4E && data[3] == (byte) 0x47;
    }

    static String mimeTypeOf(byte[] data) {
        return data[0] == (byte) 0x89 ? "image/png" : "image/jpeg";
    }

    private String bytesToHex(byte[] bytes, int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            sb.append(String.format("%02X ", bytes[i]));
        }
        return sb.toString().trim();
    }
}
