package com.example.librarysync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class TrackEntity {

    private Long accountId;

    private String remoteId;

    private String title;

    private String artist = "";

    private String album = "";

    private String albumArtist = "";

    private Integer discNumber;

    private Integer totalDiscCount;

    private Integer trackNumber;

    private Integer totalTrackCount;

    private Integer year;

    private String composer = "";

    private String genre = "";

    private String comment = "";

    private String artistArtUrl;

    private String albumArtUrl;

    private LocalDateTime createdAt;

    private LocalDateTime modifiedAt;

    private LocalDateTime recentAt;

    private Integer playCount = 0;

    private Long durationMs;

    private Integer rating = 0;

    /** Unsigned 32-bit random value for sampling. */
    private Long randNum;

    private LocalDateTime lastTouchedAt;
}
