package com.example.librarysync.infrastructure.persistence.mapper;

import com.example.librarysync.infrastructure.persistence.entity.SyncAccountEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SyncAccountMapper {

    String COLUMNS = "id, name, catalog_username, password_enc, enabled, syncing, sync_run_id, "
            + "sync_started_at, sync_finished_at, last_successful_sync_at, track_count, deleted_count, "
            + "merged_count, mean_duration_ms, last_sync_status, last_error, created_at, updated_at";

    @Insert("INSERT INTO sync_account(name, catalog_username, password_enc, enabled, syncing, "
            + "track_count, deleted_count, merged_count, mean_duration_ms) "
            + "VALUES(#{name}, #{catalogUsername}, #{passwordEnc}, #{enabled}, 0, 0, 0, 0, 0)")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SyncAccountEntity entity);

    @Select("SELECT " + COLUMNS + " FROM sync_account WHERE id = #{id}")
    SyncAccountEntity selectById(@Param("id") Long id);

    /**
     * Row lock serializing every read-modify-write of one account's run state.
     */
    @Select("SELECT " + COLUMNS + " FROM sync_account WHERE id = #{id} FOR UPDATE")
    SyncAccountEntity selectByIdForUpdate(@Param("id") Long id);

    @Select("SELECT id FROM sync_account WHERE enabled = 1 AND syncing = 0 ORDER BY id ASC")
    List<Long> selectIdleEnabledIds();

    @Select("SELECT " + COLUMNS + " FROM sync_account "
            + "WHERE syncing = 1 AND sync_started_at < #{startedBefore} ORDER BY id ASC")
    List<SyncAccountEntity> selectSyncingStartedBefore(@Param("startedBefore") LocalDateTime startedBefore);

    @Update("UPDATE sync_account SET syncing = 1, sync_run_id = #{runId}, sync_started_at = #{startedAt}, "
            + "sync_finished_at = NULL, track_count = 0, deleted_count = 0, merged_count = 0, "
            + "last_sync_status = #{status}, last_error = NULL, updated_at = NOW() "
            + "WHERE id = #{id} AND syncing = 0")
    int markSyncStarted(@Param("id") Long id,
                        @Param("runId") String runId,
                        @Param("startedAt") LocalDateTime startedAt,
                        @Param("status") String status);

    @Update("UPDATE sync_account SET track_count = track_count + #{trackDelta}, "
            + "deleted_count = deleted_count + #{numDeletes}, merged_count = merged_count + #{numMerges}, "
            + "updated_at = NOW() "
            + "WHERE id = #{id} AND syncing = 1 AND sync_run_id = #{runId}")
    int applyBatchContribution(@Param("id") Long id,
                               @Param("runId") String runId,
                               @Param("trackDelta") int trackDelta,
                               @Param("numDeletes") int numDeletes,
                               @Param("numMerges") int numMerges);

    @Update("UPDATE sync_account SET syncing = 0, mean_duration_ms = #{meanDurationMs}, "
            + "sync_finished_at = #{finishedAt}, last_successful_sync_at = sync_started_at, "
            + "last_sync_status = #{status}, updated_at = NOW() "
            + "WHERE id = #{id} AND syncing = 1 AND sync_run_id = #{runId}")
    int markFinalized(@Param("id") Long id,
                      @Param("runId") String runId,
                      @Param("meanDurationMs") long meanDurationMs,
                      @Param("finishedAt") LocalDateTime finishedAt,
                      @Param("status") String status);

    @Update("UPDATE sync_account SET syncing = 0, sync_finished_at = #{finishedAt}, "
            + "last_sync_status = #{status}, last_error = #{error}, updated_at = NOW() "
            + "WHERE id = #{id} AND syncing = 1 AND sync_run_id = #{runId}")
    int markAborted(@Param("id") Long id,
                    @Param("runId") String runId,
                    @Param("finishedAt") LocalDateTime finishedAt,
                    @Param("error") String error,
                    @Param("status") String status);
}
