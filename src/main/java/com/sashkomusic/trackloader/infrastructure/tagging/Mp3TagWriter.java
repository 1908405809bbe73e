package com.sashkomusic.trackloader.infrastructure.tagging;

import com.sashkomusic.trackloader.domain.model.TagSet;
import com.sashkomusic.trackloader.domain.port.TagWriterPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.id3.AbstractID3v2Frame;
import org.jaudiotagger.tag.id3.AbstractID3v2Tag;
import org.jaudiotagger.tag.id3.ID3v24Frames;
import org.jaudiotagger.tag.id3.framebody.FrameBodyCOMM;
import org.jaudiotagger.tag.id3.valuepair.TextEncoding;
import org.jaudiotagger.tag.images.Artwork;
import org.jaudiotagger.tag.images.ArtworkFactory;
import org.jaudiotagger.tag.reference.PictureTypes;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Writes ID3 tags, comment frames and the front cover into transcoded MP3 files.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Mp3TagWriter implements TagWriterPort {

    private static final String COMMENT_LANGUAGE = "eng";

    private final CoverArtService coverArtService;

    @Override
    public void writeTags(Path audioFile, TagSet tags) {
        try {
            AudioFile f = AudioFileIO.read(audioFile.toFile());
            // Returns the existing tag, or creates and attaches an empty one.
            Tag tag = f.getTagOrCreateAndSetDefault();

            setText(tag, FieldKey.TITLE, tags.title());
            setText(tag, FieldKey.ARTIST, tags.artist());
            setText(tag, FieldKey.ALBUM, tags.album());
            setText(tag, FieldKey.YEAR, tags.year());
            setText(tag, FieldKey.ALBUM_ARTIST, tags.albumArtist());
            setText(tag, FieldKey.GENRE, tags.language());
            setText(tag, FieldKey.COMPOSER, tags.composers());
            setText(tag, FieldKey.RECORD_LABEL, tags.label());

            addComment(tag, "Copyright", tags.copyright());
            addComment(tag, "URL", tags.url());
            addComment(tag, "Duration", tags.durationText());

            coverArtService.fetchCover(tags.coverImageUrl())
                    .ifPresent(image -> embedCover(tag, image, audioFile));

            f.commit();
            log.info("Embedded metadata: {}", audioFile.getFileName());

        } catch (Exception ex) {
            log.debug("Tagging error details for {}", audioFile.getFileName(), ex);
            throw new TaggingException("Failed to tag file: " + audioFile.getFileName(), ex);
        }
    }

    private void setText(Tag tag, FieldKey key, String value) throws Exception {
        if (value != null && !value.isBlank()) {
            tag.setField(key, value);
        }
    }

    private void addComment(Tag tag, String description, String text) throws Exception {
        if (text == null || text.isBlank()) {
            return;
        }

        if (tag instanceof AbstractID3v2Tag id3Tag) {
            AbstractID3v2Frame frame = id3Tag.createFrame(ID3v24Frames.FRAME_ID_COMMENT);
            frame.setBody(new FrameBodyCOMM(TextEncoding.UTF_8, COMMENT_LANGUAGE, description, text));
            id3Tag.addField(frame);
            log.debug("Added comment {}={}", description, text);
        } else {
            tag.addField(FieldKey.COMMENT, description + ": " + text);
        }
    }

    private void embedCover(Tag tag, byte[] image, Path audioFile) {
        try {
            Artwork artwork = ArtworkFactory.getNew();
            artwork.setBinaryData(image);
            artwork.setMimeType(CoverArtService.mimeTypeOf(image));
            artwork.setDescription("Cover");
            artwork.setPictureType(PictureTypes.DEFAULT_ID);
            tag.deleteArtworkField();
            tag.setField(artwork);
        } catch (Exception ex) {
            log.warn("Failed to embed cover art in {}: {}", audioFile.getFileName(), ex.getMessage());
        }
    }
}
