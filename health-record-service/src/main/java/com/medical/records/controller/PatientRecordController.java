package com.medical.records.controller;

import com.medical.records.model.dto.HealthSummaryResponse;
import com.medical.records.model.dto.NoteCreateRequest;
import com.medical.records.model.dto.NoteDto;
import com.medical.records.model.dto.PrescriptionCreateRequest;
import com.medical.records.model.dto.PrescriptionDto;
import com.medical.records.model.entity.ClinicalNote;
import com.medical.records.model.entity.FileRecord;
import com.medical.records.model.entity.Prescription;
import com.medical.records.model.entity.VitalRecord;
import com.medical.records.model.timeline.Timeline;
import com.medical.records.security.Actor;
import com.medical.records.service.HealthSummaryService;
import com.medical.records.service.PatientRecordService;
import com.medical.records.service.summary.SummaryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/patients/{patientId}")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class PatientRecordController {

    private final PatientRecordService patientRecordService;
    private final HealthSummaryService healthSummaryService;

    @GetMapping("/vitals")
    public List<VitalRecord> getVitals(Actor actor, @PathVariable String patientId) {
        return patientRecordService.getVitals(actor, patientId);
    }

    @GetMapping("/files")
    public List<FileRecord> getFiles(Actor actor, @PathVariable String patientId) {
        return patientRecordService.getFiles(actor, patientId);
    }

    @GetMapping("/notes")
    public List<NoteDto> getNotes(Actor actor, @PathVariable String patientId) {
        return patientRecordService.getNotes(actor, patientId);
    }

    @PostMapping("/notes")
    public ResponseEntity<Map<String, Object>> addNote(Actor actor,
                                                       @PathVariable String patientId,
                                                       @Valid @RequestBody NoteCreateRequest request) {
        ClinicalNote note = patientRecordService.addNote(actor, patientId, request.getContent());

        Map<String, Object> response = new HashMap<>();
        response.put("message", "Note added");
        response.put("note", note);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/prescriptions")
    public List<PrescriptionDto> getPrescriptions(Actor actor, @PathVariable String patientId) {
        return patientRecordService.getPrescriptions(actor, patientId);
    }

    @PostMapping("/prescriptions")
    public ResponseEntity<Map<String, Object>> issuePrescription(Actor actor,
                                                                 @PathVariable String patientId,
                                                                 @Valid @RequestBody PrescriptionCreateRequest request) {
        Prescription prescription = patientRecordService.issuePrescription(
                actor, patientId, request.getMedications(), request.getInstructions());

        Map<String, Object> response = new HashMap<>();
        response.put("message", "Prescription issued successfully.");
        response.put("prescription", prescription);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Every record kind of the patient merged into one ascending timeline.
     */
    @GetMapping("/timeline")
    public Timeline getTimeline(Actor actor, @PathVariable String patientId) {
        return patientRecordService.getTimeline(actor, patientId);
    }

    /**
     * LLM-generated health summary. Failures of the summarizer come back as 500 when it is not
     * configured and 502 otherwise; the request may be retried as it writes nothing.
     */
    @GetMapping("/summary")
    public ResponseEntity<?> getSummary(Actor actor, @PathVariable String patientId) {
        SummaryResult result = healthSummaryService.summarize(actor, patientId);
        if (result.isSuccess()) {
            return ResponseEntity.ok(new HealthSummaryResponse(result.getSummaryText()));
        }

        Map<String, Object> error = new HashMap<>();
        error.put("reason", result.getFailureReason().name());
        if (result.getDetail() != null) {
            error.put("message", result.getDetail());
        }
        if (result.getFailureReason() == SummaryResult.FailureReason.MISSING_CREDENTIAL) {
            error.put("error", "SUMMARIZER_NOT_CONFIGURED");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
        }
        error.put("error", "SUMMARY_UNAVAILABLE");
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error);
    }
}
