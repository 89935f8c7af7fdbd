package com.example.librarysync.application.service;

import com.example.librarysync.common.exception.MalformedRecordException;
import com.example.librarysync.infrastructure.persistence.entity.TrackEntity;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.springframework.stereotype.Component;

/**
 * Builds a track row from a catalog record. Required fields fail the whole record. Optional fields
 * keep their defaults only when absent; a value that is present but unreadable fails the record.
 */
@Component
public class TrackMaterializer {

    private static final long MAX_UNSIGNED_INT = 0xFFFFFFFFL;

    public TrackEntity materialize(Long accountId, Map<String, Object> record, LocalDateTime touchedAt) {
        String id = CatalogRecords.id(record);
        if (id == null) {
            throw new MalformedRecordException(null, CatalogRecords.ID, "missing");
        }
        String title = CatalogRecords.text(record, "title");
        if (title == null) {
            throw new MalformedRecordException(id, "title", "missing");
        }

        TrackEntity track = new TrackEntity();
        track.setAccountId(accountId);
        track.setRemoteId(id);
        track.setTitle(title);
        track.setDurationMs(requiredLong(record, id, CatalogRecords.DURATION));
        track.setCreatedAt(toUtc(requiredLong(record, id, "creationTimestamp")));
        track.setModifiedAt(toUtc(requiredLong(record, id, CatalogRecords.LAST_MODIFIED)));
        track.setRecentAt(toUtc(requiredLong(record, id, "recentTimestamp")));

        Integer playCount = optionalInt(record, id, "playCount");
        if (playCount != null) {
            track.setPlayCount(playCount);
        }
        Integer rating = optionalInt(record, id, "rating");
        if (rating != null) {
            if (rating < 0 || rating > 5) {
                throw new MalformedRecordException(id, "rating", "expected 0..5 but was " + rating);
            }
            track.setRating(rating);
        }

        setText(record, "artist", track::setArtist);
        setText(record, "album", track::setAlbum);
        setText(record, "albumArtist", track::setAlbumArtist);
        setText(record, "composer", track::setComposer);
        setText(record, "genre", track::setGenre);
        setText(record, "comment", track::setComment);
        track.setDiscNumber(optionalInt(record, id, "discNumber"));
        track.setTotalDiscCount(optionalInt(record, id, "totalDiscCount"));
        track.setTrackNumber(optionalInt(record, id, "trackNumber"));
        track.setTotalTrackCount(optionalInt(record, id, "totalTrackCount"));
        track.setYear(optionalInt(record, id, "year"));
        track.setArtistArtUrl(CatalogRecords.firstRefUrl(record, "artistArtRef"));
        track.setAlbumArtUrl(CatalogRecords.firstRefUrl(record, "albumArtRef"));

        track.setRandNum(ThreadLocalRandom.current().nextLong(MAX_UNSIGNED_INT + 1));
        track.setLastTouchedAt(touchedAt);
        return track;
    }

    static LocalDateTime toUtc(long micros) {
        long seconds = Math.floorDiv(micros, TimeUnit.SECONDS.toMicros(1));
        long microOfSecond = Math.floorMod(micros, TimeUnit.SECONDS.toMicros(1));
        return LocalDateTime.ofEpochSecond(seconds, (int) TimeUnit.MICROSECONDS.toNanos(microOfSecond), ZoneOffset.UTC);
    }

    private long requiredLong(Map<String, Object> record, String id, String key) {
        if (!record.containsKey(key) || record.get(key) == null) {
            throw new MalformedRecordException(id, key, "missing");
        }
        Long value = CatalogRecords.longValue(record, key);
        if (value == null) {
            throw new MalformedRecordException(id, key, "not an integer: " + record.get(key));
        }
        return value;
    }

    /**
     * @return null when the key is absent or null
     * @throws MalformedRecordException when a value is present but is not an int
     */
    private Integer optionalInt(Map<String, Object> record, String id, String key) {
        if (record.get(key) == null) {
            return null;
        }
        Long value = CatalogRecords.longValue(record, key);
        if (value == null || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new MalformedRecordException(id, key, "not an integer: " + record.get(key));
        }
        return value.intValue();
    }

    private void setText(Map<String, Object> record, String key, Consumer<String> setter) {
        String value = CatalogRecords.text(record, key);
        if (value != null) {
            setter.accept(value);
        }
    }
}
