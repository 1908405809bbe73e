package com.sashkomusic.trackloader.domain.port;

import java.io.IOException;
import java.nio.file.Path;

public interface TranscoderPort {

    void transcode(Path source, Path target) throws IOException, InterruptedException;
}
