package com.pharmacy.fraud.engine;

import com.pharmacy.fraud.model.DatasetSnapshot;
import com.pharmacy.fraud.model.Finding;

import java.util.List;

/**
 * Interface for all fraud detectors.
 * Every Detector bean in the application context takes part in each ranking run.
 */
public interface Detector {

    /**
     * Unique detector name. Used as the key of the weight map and of every finding the detector produces.
     */
    String getName();

    /**
     * Analyze the snapshot and report at most one finding per pharmacy.
     * Implementations must not modify the snapshot and must react to interruption, which is how
     * timeouts and run cancellation are delivered.
     *
     * @param snapshot read-only claim data shared with all other detectors of the run
     * @return findings whose detectorName equals {@link #getName()} and whose score lies in [0, 1]
     * @throws Exception any failure; it is isolated to this detector for the current run
     */
    List<Finding> detect(DatasetSnapshot snapshot) throws Exception;
}
