package com.synthgen.perftuner.service;

import com.synthgen.perftuner.model.JobRecord;

/**
 * Receives every JobRecord emitted by the worker pool.
 *
 * Called on worker threads; implementations must be quick and must not
 * throw (failures are logged and ignored by the pool).
 */
public interface JobRecordListener {

    void onJobRecord(JobRecord record);
}
