package com.medical.records.service;

import com.medical.records.model.dto.NoteDto;
import com.medical.records.model.dto.PatientSummaryDto;
import com.medical.records.model.dto.PrescriptionDto;
import com.medical.records.model.entity.ClinicalNote;
import com.medical.records.model.entity.FileRecord;
import com.medical.records.model.entity.Prescription;
import com.medical.records.model.entity.VitalRecord;
import com.medical.records.model.timeline.Timeline;
import com.medical.records.security.Actor;

import java.util.List;

/**
 * Access to a patient's record, each call checked against the actor's rights on that patient.
 * Listings are newest first.
 */
public interface PatientRecordService {

    List<VitalRecord> getVitals(Actor actor, String patientId);

    List<FileRecord> getFiles(Actor actor, String patientId);

    List<NoteDto> getNotes(Actor actor, String patientId);

    ClinicalNote addNote(Actor actor, String patientId, String content);

    List<PrescriptionDto> getPrescriptions(Actor actor, String patientId);

    Prescription issuePrescription(Actor actor, String patientId, List<String> medications, String instructions);

    /**
     * All record kinds merged in ascending time order.
     */
    Timeline getTimeline(Actor actor, String patientId);

    /**
     * Patients the acting doctor consults, optionally filtered by a case-insensitive name or email fragment.
     */
    List<PatientSummaryDto> getConsultedPatients(Actor actor, String search);
}
