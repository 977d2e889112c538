package com.whereq.vigil.scan;

import com.whereq.vigil.model.ProbeResult;
import com.whereq.vigil.model.ScanReport;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Running counters of one scan. Updated by the result stream, read by the progress ticker.
 */
@Getter
public class ScanBatch {

    private final int total;
    private final Instant startedAt;
    private final Instant captureTime;
    private final int previewLimit;

    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger persisted = new AtomicInteger();
    private final List<ProbeResult> failurePreview = new ArrayList<>();

    public ScanBatch(int total, Instant captureTime, int previewLimit) {
        this.total = total;
        this.startedAt = Instant.now();
        this.captureTime = captureTime != null ? captureTime : startedAt;
        this.previewLimit = previewLimit;
    }

    /**
     * Account for one finished target.
     *
     * @return completed count including this target
     */
    public int record(ProbeResult result) {
        if (result.isSuccess()) {
            succeeded.incrementAndGet();
        } else {
            failed.incrementAndGet();
            synchronized (failurePreview) {
                if (failurePreview.size() < previewLimit) {
                    failurePreview.add(result);
                }
            }
        }
        return completed.incrementAndGet();
    }

    public void addPersisted(int count) {
        persisted.addAndGet(count);
    }

    public ScanReport report() {
        List<ProbeResult> preview;
        synchronized (failurePreview) {
            preview = List.copyOf(failurePreview);
        }
        return ScanReport.builder()
            .total(total)
            .completed(completed.get())
            .succeeded(succeeded.get())
            .failed(failed.get())
            .failurePreview(preview)
            .findingsPersisted(persisted.get())
            .startedAt(startedAt)
            .finishedAt(Instant.now())
            .build();
    }
}
