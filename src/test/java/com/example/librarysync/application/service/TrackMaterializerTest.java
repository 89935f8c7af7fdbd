package com.example.librarysync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.librarysync.common.exception.MalformedRecordException;
import com.example.librarysync.infrastructure.persistence.entity.TrackEntity;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TrackMaterializerTest {

    private static final LocalDateTime TOUCHED_AT = LocalDateTime.of(2024, 5, 1, 12, 0);

    private final TrackMaterializer materializer = new TrackMaterializer();

    @Test
    void shouldMapRequiredAndOptionalFields() {
        Map<String, Object> record = fullRecord();

        TrackEntity track = materializer.materialize(7L, record, TOUCHED_AT);

        assertEquals(7L, track.getAccountId().longValue());
        assertEquals("trk-1", track.getRemoteId());
        assertEquals("Paranoid Android", track.getTitle());
        assertEquals("Radiohead", track.getArtist());
        assertEquals("OK Computer", track.getAlbum());
        assertEquals("Radiohead", track.getAlbumArtist());
        assertEquals(383000L, track.getDurationMs().longValue());
        assertEquals(2, track.getTrackNumber().intValue());
        assertEquals(12, track.getTotalTrackCount().intValue());
        assertEquals(1, track.getDiscNumber().intValue());
        assertEquals(1997, track.getYear().intValue());
        assertEquals(42, track.getPlayCount().intValue());
        assertEquals(5, track.getRating().intValue());
        assertEquals("http://art/artist.jpg", track.getArtistArtUrl());
        assertEquals("http://art/album.jpg", track.getAlbumArtUrl());
        assertEquals(LocalDateTime.of(2023, 11, 14, 22, 13, 20), track.getCreatedAt());
        assertEquals(LocalDateTime.of(2023, 11, 14, 22, 13, 20, 500_000_000), track.getModifiedAt());
        assertEquals(TOUCHED_AT, track.getLastTouchedAt());
        assertNotNull(track.getRandNum());
        assertTrue(track.getRandNum() >= 0 && track.getRandNum() <= 0xFFFFFFFFL);
    }

    @Test
    void shouldLeaveDefaultsWhenOptionalFieldsMissing() {
        Map<String, Object> record = requiredOnly();
        record.put("artistArtRef", new ArrayList<>());
        record.put("albumArtRef", Collections.singletonList(Collections.singletonMap("kind", "thumb")));

        TrackEntity track = materializer.materialize(7L, record, TOUCHED_AT);

        assertEquals("", track.getArtist());
        assertEquals("", track.getAlbum());
        assertEquals("", track.getAlbumArtist());
        assertEquals("", track.getComposer());
        assertEquals("", track.getGenre());
        assertEquals("", track.getComment());
        assertNull(track.getArtistArtUrl());
        assertNull(track.getAlbumArtUrl());
        assertNull(track.getYear());
        assertNull(track.getTrackNumber());
        assertEquals(0, track.getPlayCount().intValue());
        assertEquals(0, track.getRating().intValue());
    }

    @Test
    void shouldFailWhenDurationMissing() {
        Map<String, Object> record = requiredOnly();
        record.remove("durationMillis");

        MalformedRecordException e = assertThrows(MalformedRecordException.class,
                () -> materializer.materialize(7L, record, TOUCHED_AT));

        assertEquals("trk-1", e.getRecordId());
        assertEquals("durationMillis", e.getField());
    }

    @Test
    void shouldFailWhenTitleOrTimestampMissing() {
        Map<String, Object> noTitle = requiredOnly();
        noTitle.remove("title");
        Map<String, Object> noRecent = requiredOnly();
        noRecent.remove("recentTimestamp");

        assertThrows(MalformedRecordException.class, () -> materializer.materialize(7L, noTitle, TOUCHED_AT));
        MalformedRecordException e = assertThrows(MalformedRecordException.class,
                () -> materializer.materialize(7L, noRecent, TOUCHED_AT));
        assertEquals("recentTimestamp", e.getField());
    }

    @Test
    void shouldFailWhenOptionalNumberUnreadable() {
        Map<String, Object> badYear = requiredOnly();
        badYear.put("year", "unknown");
        Map<String, Object> badPlayCount = requiredOnly();
        badPlayCount.put("playCount", "abc");
        Map<String, Object> hugeDisc = requiredOnly();
        hugeDisc.put("discNumber", 1L << 40);

        MalformedRecordException e = assertThrows(MalformedRecordException.class,
                () -> materializer.materialize(7L, badYear, TOUCHED_AT));
        assertEquals("trk-1", e.getRecordId());
        assertEquals("year", e.getField());
        assertEquals("playCount", assertThrows(MalformedRecordException.class,
                () -> materializer.materialize(7L, badPlayCount, TOUCHED_AT)).getField());
        assertEquals("discNumber", assertThrows(MalformedRecordException.class,
                () -> materializer.materialize(7L, hugeDisc, TOUCHED_AT)).getField());
    }

    @Test
    void shouldRejectRatingOutsideRange() {
        Map<String, Object> record = requiredOnly();
        record.put("rating", 6);

        assertThrows(MalformedRecordException.class, () -> materializer.materialize(7L, record, TOUCHED_AT));
    }

    @Test
    void shouldConvertMicrosecondsToUtc() {
        assertEquals(LocalDateTime.of(1970, 1, 1, 0, 0, 0, 1000), TrackMaterializer.toUtc(1L));
        assertEquals(LocalDateTime.of(1969, 12, 31, 23, 59, 59, 999_999_000), TrackMaterializer.toUtc(-1L));
    }

    private Map<String, Object> requiredOnly() {
        Map<String, Object> record = new HashMap<>();
        record.put("id", "trk-1");
        record.put("title", "Paranoid Android");
        record.put("durationMillis", "383000");
        record.put("creationTimestamp", 1700000000000000L);
        record.put("lastModifiedTimestamp", 1700000000500000L);
        record.put("recentTimestamp", 1700000000000000L);
        return record;
    }

    private Map<String, Object> fullRecord() {
        Map<String, Object> record = requiredOnly();
        record.put("artist", "Radiohead");
        record.put("album", "OK Computer");
        record.put("albumArtist", "Radiohead");
        record.put("trackNumber", 2);
        record.put("totalTrackCount", 12);
        record.put("discNumber", 1);
        record.put("year", 1997);
        record.put("playCount", "42");
        record.put("rating", "5");
        record.put("artistArtRef", Collections.singletonList(Collections.singletonMap("url", "http://art/artist.jpg")));
        record.put("albumArtRef", Collections.singletonList(Collections.singletonMap("url", "http://art/album.jpg")));
        return record;
    }
}
