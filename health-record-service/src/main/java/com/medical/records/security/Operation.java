package com.medical.records.security;

/**
 * Operations on a patient's record that go through {@link AuthorizationGuard}.
 */
public enum Operation {
    VITALS_READ(true),
    FILES_READ(true),
    NOTES_READ(true),
    NOTES_WRITE(false),
    PRESCRIPTIONS_READ(true),
    PRESCRIPTIONS_WRITE(false),
    TIMELINE_READ(true),
    SUMMARY_GENERATE(false);

    private final boolean selfService;

    Operation(boolean selfService) {
        this.selfService = selfService;
    }

    /**
     * Whether a patient may perform this operation on their own record.
     */
    public boolean isSelfService() {
        return selfService;
    }
}
