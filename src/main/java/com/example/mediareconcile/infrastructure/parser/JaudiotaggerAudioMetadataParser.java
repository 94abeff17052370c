package com.example.mediareconcile.infrastructure.parser;

import com.example.mediareconcile.domain.model.FormatKind;
import com.example.mediareconcile.domain.model.TagRecord;
import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioMetadataParser implements AudioMetadataParser {

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");

    @Override
    public TagRecord parse(File mediaFile, FormatKind formatKind) throws Exception {
        // Video containers other than MP4 have no reader and fail here.
        AudioFile parsed = AudioFileIO.read(mediaFile);
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        TagRecord record = new TagRecord();
        record.setTitle(safeTagValue(tag, FieldKey.TITLE));
        record.setArtist(safeTagValue(tag, FieldKey.ARTIST));
        record.setAlbum(safeTagValue(tag, FieldKey.ALBUM));
        if (header != null) {
            record.setDurationSec(Math.max(0, header.getTrackLength()));
            record.setBitrate(parseInteger(header.getBitRate()));
        }
        record.setExtracted(true);
        return record;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value = tag.getFirst(fieldKey);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private int parseInteger(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return 0;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
