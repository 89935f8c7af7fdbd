package com.example.librarysync.infrastructure.persistence.mapper;

import com.example.librarysync.infrastructure.persistence.entity.SyncBatchLedgerEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface SyncBatchLedgerMapper {

    @Insert("INSERT INTO sync_batch_ledger(account_id, run_id, fingerprint, batch_num, partial_product, track_delta) "
            + "VALUES(#{accountId}, #{runId}, #{fingerprint}, #{batchNum}, #{partialProduct}, #{trackDelta})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SyncBatchLedgerEntity entity);

    @Select("SELECT COUNT(1) FROM sync_batch_ledger WHERE account_id = #{accountId} AND fingerprint = #{fingerprint}")
    int countByFingerprint(@Param("accountId") Long accountId, @Param("fingerprint") String fingerprint);

    @Select("SELECT COUNT(1) FROM sync_batch_ledger WHERE account_id = #{accountId} AND run_id = #{runId}")
    int countByRun(@Param("accountId") Long accountId, @Param("runId") String runId);

    @Select("SELECT partial_product FROM sync_batch_ledger "
            + "WHERE account_id = #{accountId} AND run_id = #{runId} ORDER BY batch_num ASC")
    List<String> selectPartialProducts(@Param("accountId") Long accountId, @Param("runId") String runId);

    @Delete("DELETE FROM sync_batch_ledger WHERE account_id = #{accountId}")
    int deleteByAccount(@Param("accountId") Long accountId);
}
