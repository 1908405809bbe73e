package com.sashkomusic.trackloader.domain.port;

import java.io.IOException;
import java.nio.file.Path;

public interface AudioTransferPort {

    void transfer(String url, Path destination) throws IOException;
}
