package com.medical.records.service;

import com.medical.records.security.Actor;
import com.medical.records.service.summary.SummaryResult;

public interface HealthSummaryService {
    /**
     * Aggregate the patient's record and ask the summarizer for a health summary.
     */
    SummaryResult summarize(Actor actor, String patientId);
}
