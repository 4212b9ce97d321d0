package com.medical.records.exception;

import com.medical.records.model.timeline.RecordKind;
import org.springframework.http.HttpStatus;

import java.util.Map;
import java.util.Set;

/**
 * One or more record kinds could not be fetched, so no timeline is produced.
 */
public class PartialDataException extends AppException {

    private final Set<RecordKind> failedKinds;

    public PartialDataException(String patientId, Set<RecordKind> failedKinds, Throwable cause) {
        super("PARTIAL_DATA", HttpStatus.SERVICE_UNAVAILABLE, Map.of("patientId", patientId, "failedKinds", failedKinds));
        this.failedKinds = failedKinds;
        initCause(cause);
    }

    public Set<RecordKind> getFailedKinds() {
        return failedKinds;
    }
}
