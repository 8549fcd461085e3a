package com.threatsentinel.core.monitor;

import com.threatsentinel.core.model.HealthRecord;
import com.threatsentinel.core.model.MonitorConfig;

/**
 * Performs one health check against a monitored target.
 */
public interface MonitorBackend {

    /**
     * @param config normalised target configuration
     * @return outcome of the check, including derived findings
     * @throws RuntimeException if the check itself could not be carried out;
     *                          the monitor logs it and retries next cadence
     */
    HealthRecord check(MonitorConfig config);
}
