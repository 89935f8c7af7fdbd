package com.example.librarysync.infrastructure.persistence.mapper;

import com.example.librarysync.infrastructure.persistence.entity.TrackEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TrackMapper {

    /**
     * Full overwrite by (account_id, remote_id): every column is replaced, nothing is merged.
     */
    @Insert("<script>"
            + "INSERT INTO track("
            + "account_id, remote_id, title, artist, album, album_artist, disc_number, total_disc_count, "
            + "track_number, total_track_count, `year`, composer, genre, comment, artist_art_url, album_art_url, "
            + "created_at, modified_at, recent_at, play_count, duration_ms, rating, rand_num, last_touched_at"
            + ") VALUES "
            + "<foreach item='t' collection='tracks' separator=','>"
            + "(#{t.accountId}, #{t.remoteId}, #{t.title}, #{t.artist}, #{t.album}, #{t.albumArtist}, "
            + "#{t.discNumber}, #{t.totalDiscCount}, #{t.trackNumber}, #{t.totalTrackCount}, #{t.year}, "
            + "#{t.composer}, #{t.genre}, #{t.comment}, #{t.artistArtUrl}, #{t.albumArtUrl}, "
            + "#{t.createdAt}, #{t.modifiedAt}, #{t.recentAt}, #{t.playCount}, #{t.durationMs}, #{t.rating}, "
            + "#{t.randNum}, #{t.lastTouchedAt})"
            + "</foreach>"
            + " ON DUPLICATE KEY UPDATE "
            + "title = VALUES(title), "
            + "artist = VALUES(artist), "
            + "album = VALUES(album), "
            + "album_artist = VALUES(album_artist), "
            + "disc_number = VALUES(disc_number), "
            + "total_disc_count = VALUES(total_disc_count), "
            + "track_number = VALUES(track_number), "
            + "total_track_count = VALUES(total_track_count), "
            + "`year` = VALUES(`year`), "
            + "composer = VALUES(composer), "
            + "genre = VALUES(genre), "
            + "comment = VALUES(comment), "
            + "artist_art_url = VALUES(artist_art_url), "
            + "album_art_url = VALUES(album_art_url), "
            + "created_at = VALUES(created_at), "
            + "modified_at = VALUES(modified_at), "
            + "recent_at = VALUES(recent_at), "
            + "play_count = VALUES(play_count), "
            + "duration_ms = VALUES(duration_ms), "
            + "rating = VALUES(rating), "
            + "rand_num = VALUES(rand_num), "
            + "last_touched_at = VALUES(last_touched_at)"
            + "</script>")
    int upsertBatch(@Param("tracks") List<TrackEntity> tracks);

    @Delete("<script>"
            + "DELETE FROM track WHERE account_id = #{accountId} AND remote_id IN "
            + "<foreach item='rid' collection='remoteIds' open='(' separator=',' close=')'>"
            + "#{rid}"
            + "</foreach>"
            + "</script>")
    int deleteByRemoteIds(@Param("accountId") Long accountId, @Param("remoteIds") List<String> remoteIds);

    @Delete("DELETE FROM track WHERE account_id = #{accountId} AND last_touched_at < #{touchedBefore} "
            + "LIMIT #{limit}")
    int deleteUntouchedBefore(@Param("accountId") Long accountId,
                              @Param("touchedBefore") LocalDateTime touchedBefore,
                              @Param("limit") int limit);

    @Select("SELECT COUNT(1) FROM track WHERE account_id = #{accountId}")
    long countByAccount(@Param("accountId") Long accountId);
}
