package com.threatsentinel.core.incident;

import com.threatsentinel.core.model.IncidentReport;

import java.util.List;
import java.util.Map;

/**
 * Sink for incident reports.
 *
 * <p>
 * Implementations are called from background tasks and must be safe for
 * concurrent use. Exceptions are logged by the caller and never reach the
 * event submitter.
 * </p>
 */
public interface IncidentLog {

    /**
     * Persist one report.
     *
     * @param report report to store
     */
    void append(IncidentReport report);

    /**
     * @return every stored entry, oldest first, as written
     */
    List<Map<String, Object>> readAll();
}
