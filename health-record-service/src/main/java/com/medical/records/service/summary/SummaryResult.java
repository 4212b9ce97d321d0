package com.medical.records.service.summary;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a summary request: either the summary text or the reason it is unavailable.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SummaryResult {

    private final String summaryText;
    private final FailureReason failureReason;
    private final String detail;

    public static SummaryResult success(String summaryText) {
        return new SummaryResult(summaryText, null, null);
    }

    public static SummaryResult unavailable(FailureReason reason) {
        return new SummaryResult(null, reason, null);
    }

    public static SummaryResult unavailable(FailureReason reason, String detail) {
        return new SummaryResult(null, reason, detail);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public enum FailureReason {
        /** No credential configured for the summarizer; a server configuration problem. */
        MISSING_CREDENTIAL,
        TRANSPORT_ERROR,
        EMPTY_CANDIDATES,
        MALFORMED_RESPONSE,
        TIMEOUT
    }
}
