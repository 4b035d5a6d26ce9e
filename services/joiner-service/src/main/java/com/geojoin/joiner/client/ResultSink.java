package com.geojoin.joiner.client;

import com.geojoin.joiner.domain.OutputRecord;
import java.util.List;

/**
 * Append-only destination for resolved records. Callers serialize flushes.
 */
public interface ResultSink {

    void flush(List<OutputRecord> records);
}
