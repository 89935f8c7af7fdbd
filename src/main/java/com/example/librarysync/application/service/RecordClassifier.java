package com.example.librarysync.application.service;

import com.example.librarysync.common.exception.MalformedRecordException;
import com.example.librarysync.domain.model.ClassifiedBatch;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Splits a page into delete, merge and skip buckets. A record is a delete when the catalog flags
 * it deleted; otherwise it is merged when there is no watermark or it changed at or after the
 * watermark, and skipped when it has not changed since.
 */
@Component
public class RecordClassifier {

    public ClassifiedBatch classify(List<Map<String, Object>> records, Long watermarkMicros) {
        List<String> allIds = new ArrayList<>(records.size());
        List<Map<String, Object>> deletes = new ArrayList<>();
        List<Map<String, Object>> merges = new ArrayList<>();
        List<Map<String, Object>> skips = new ArrayList<>();

        for (Map<String, Object> record : records) {
            String id = CatalogRecords.id(record);
            if (id == null) {
                throw new MalformedRecordException(null, CatalogRecords.ID, "missing");
            }
            allIds.add(id);
            if (CatalogRecords.isDeleted(record)) {
                deletes.add(record);
                continue;
            }
            if (watermarkMicros == null) {
                merges.add(record);
                continue;
            }
            Long modified = CatalogRecords.longValue(record, CatalogRecords.LAST_MODIFIED);
            if (modified == null) {
                throw new MalformedRecordException(id, CatalogRecords.LAST_MODIFIED, "missing or not an integer");
            }
            if (modified >= watermarkMicros) {
                merges.add(record);
            } else {
                skips.add(record);
            }
        }
        return new ClassifiedBatch(allIds, deletes, merges, skips);
    }
}
