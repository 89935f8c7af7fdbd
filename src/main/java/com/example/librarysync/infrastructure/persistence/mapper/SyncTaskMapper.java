package com.example.librarysync.infrastructure.persistence.mapper;

import com.example.librarysync.infrastructure.persistence.entity.SyncTaskEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SyncTaskMapper {

    String CLAIMABLE = "((status = 'PENDING' AND available_at <= #{now}) "
            + "OR (status = 'RUNNING' AND locked_until < #{now}))";

    @Insert("INSERT INTO sync_task(queue_name, task_type, payload, status, attempts, max_attempts, available_at) "
            + "VALUES(#{queueName}, #{taskType}, #{payload}, #{status}, #{attempts}, #{maxAttempts}, #{availableAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SyncTaskEntity entity);

    @Select("SELECT id, queue_name, task_type, payload, status, attempts, max_attempts, available_at, "
            + "locked_by, locked_until, last_error, created_at, updated_at "
            + "FROM sync_task WHERE id = #{id}")
    SyncTaskEntity selectById(@Param("id") Long id);

    /**
     * Due PENDING tasks plus RUNNING tasks whose lease expired (their worker is presumed dead).
     */
    @Select("SELECT id FROM sync_task WHERE queue_name = #{queueName} AND " + CLAIMABLE + " "
            + "ORDER BY available_at ASC, id ASC LIMIT #{limit}")
    List<Long> selectClaimableIds(@Param("queueName") String queueName,
                                  @Param("now") LocalDateTime now,
                                  @Param("limit") int limit);

    @Update("UPDATE sync_task SET status = 'RUNNING', locked_by = #{owner}, locked_until = #{lockedUntil}, "
            + "attempts = attempts + 1, updated_at = NOW() "
            + "WHERE id = #{id} AND " + CLAIMABLE)
    int claim(@Param("id") Long id,
              @Param("owner") String owner,
              @Param("now") LocalDateTime now,
              @Param("lockedUntil") LocalDateTime lockedUntil);

    @Update("UPDATE sync_task SET status = 'SUCCEEDED', locked_by = NULL, locked_until = NULL, "
            + "last_error = NULL, updated_at = NOW() "
            + "WHERE id = #{id} AND status = 'RUNNING' AND locked_by = #{owner}")
    int markSucceeded(@Param("id") Long id, @Param("owner") String owner);

    @Update("UPDATE sync_task SET status = 'PENDING', available_at = #{availableAt}, locked_by = NULL, "
            + "locked_until = NULL, last_error = #{lastError}, updated_at = NOW() "
            + "WHERE id = #{id} AND status = 'RUNNING' AND locked_by = #{owner}")
    int markRetry(@Param("id") Long id,
                  @Param("owner") String owner,
                  @Param("availableAt") LocalDateTime availableAt,
                  @Param("lastError") String lastError);

    @Update("UPDATE sync_task SET status = 'DEAD', locked_by = NULL, locked_until = NULL, "
            + "last_error = #{lastError}, updated_at = NOW() "
            + "WHERE id = #{id} AND status = 'RUNNING' AND locked_by = #{owner}")
    int markDead(@Param("id") Long id, @Param("owner") String owner, @Param("lastError") String lastError);

    @Delete("DELETE FROM sync_task WHERE status = 'SUCCEEDED' AND updated_at < #{before}")
    int deleteSucceededBefore(@Param("before") LocalDateTime before);
}
