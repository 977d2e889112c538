package com.whereq.vigil.sink;

import com.whereq.vigil.model.SinkRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * External store that findings and snapshot records are upserted into.
 * Records are keyed by (identity, capture time), so writing the same batch twice leaves one copy.
 */
public interface RecordSink {

    /**
     * Insert or replace a batch of records.
     *
     * @param table   logical table the records belong to
     * @param records records of one batch
     * @return Mono of the number of records written, erroring with
     *         {@link com.whereq.vigil.exception.SinkUnavailableException} when the store rejects the batch
     */
    Mono<Integer> upsertBatch(String table, List<SinkRecord> records);

    /**
     * Number of distinct records stored in a table.
     */
    Mono<Long> count(String table);
}
