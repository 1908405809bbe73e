package com.sashkomusic.trackloader.domain.port;

import com.sashkomusic.trackloader.domain.model.TagSet;

import java.nio.file.Path;

public interface TagWriterPort {

    /**
     * Embeds the tag set into an existing audio file.
     *
     * @throws TaggingException if the file could not be read or written
     */
    void writeTags(Path audioFile, TagSet tags);

    class TaggingException extends RuntimeException {
        public TaggingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
