package com.medical.records.service;

import java.util.Set;

public interface ConsultationRegistry {
    /**
     * Whether the doctor has the patient in their consulted set.
     * An unknown doctor id is reported as not consulting.
     */
    boolean isConsulting(String doctorId, String patientId);

    /**
     * The doctor's consulted patient ids, empty when the doctor is unknown.
     */
    Set<String> getConsultedPatients(String doctorId);
}
