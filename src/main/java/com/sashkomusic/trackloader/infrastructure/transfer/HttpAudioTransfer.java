package com.sashkomusic.trackloader.infrastructure.transfer;

import com.sashkomusic.trackloader.domain.port.AudioTransferPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Slf4j
@Component
public class HttpAudioTransfer implements AudioTransferPort {

    private final RestClient restClient;

    public HttpAudioTransfer(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
    }

    @Override
    public void transfer(String url, Path destination) throws IOException {
        try {
            Long bytes = restClient.get()
                    .uri(URI.create(url))
                    .exchange((request, response) -> {
                        if (response.getStatusCode().isError()) {
                            throw new IOException("HTTP error: " + response.getStatusCode());
                        }
                        try (InputStream body = response.getBody()) {
                            return Files.copy(body, destination, StandardCopyOption.REPLACE_EXISTING);
                        }
                    });

            log.info("Downloaded: {} ({} bytes)", destination.getFileName(), bytes);

        } catch (RestClientException e) {
            throw new IOException("Download failed: " + e.getMessage(), e);
        }
    }
}
