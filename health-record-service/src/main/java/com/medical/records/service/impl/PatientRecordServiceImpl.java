package com.medical.records.service.impl;

import com.medical.records.exception.BadRequestException;
import com.medical.records.exception.ForbiddenException;
import com.medical.records.exception.NotFoundException;
import com.medical.records.model.dto.NoteDto;
import com.medical.records.model.dto.PatientSummaryDto;
import com.medical.records.model.dto.PrescriptionDto;
import com.medical.records.model.entity.ClinicalNote;
import com.medical.records.model.entity.FileRecord;
import com.medical.records.model.entity.Prescription;
import com.medical.records.model.entity.User;
import com.medical.records.model.entity.VitalRecord;
import com.medical.records.model.timeline.Timeline;
import com.medical.records.repository.ClinicalNoteRepository;
import com.medical.records.repository.FileRecordRepository;
import com.medical.records.repository.PrescriptionRepository;
import com.medical.records.repository.UserRepository;
import com.medical.records.repository.VitalRecordRepository;
import com.medical.records.security.Actor;
import com.medical.records.security.AuthorizationGuard;
import com.medical.records.security.Operation;
import com.medical.records.service.ConsultationRegistry;
import com.medical.records.service.PatientRecordService;
import com.medical.records.service.aggregation.RecordAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PatientRecordServiceImpl implements PatientRecordService {

    private final AuthorizationGuard authorizationGuard;
    private final ConsultationRegistry consultationRegistry;
    private final RecordAggregator recordAggregator;
    private final UserRepository userRepository;
    private final VitalRecordRepository vitalRecordRepository;
    private final FileRecordRepository fileRecordRepository;
    private final ClinicalNoteRepository clinicalNoteRepository;
    private final PrescriptionRepository prescriptionRepository;

    @Override
    public List<VitalRecord> getVitals(Actor actor, String patientId) {
        authorizationGuard.require(actor, patientId, Operation.VITALS_READ);
        return vitalRecordRepository.findByPatientIdOrderByCreatedAtDescIdDesc(patientId);
    }

    @Override
    public List<FileRecord> getFiles(Actor actor, String patientId) {
        authorizationGuard.require(actor, patientId, Operation.FILES_READ);
        return fileRecordRepository.findByPatientIdOrderByCreatedAtDescIdDesc(patientId);
    }

    @Override
    public List<NoteDto> getNotes(Actor actor, String patientId) {
        authorizationGuard.require(actor, patientId, Operation.NOTES_READ);
        List<ClinicalNote> notes = clinicalNoteRepository.findByPatientIdOrderByCreatedAtDescIdDesc(patientId);
        Map<String, User> doctors = usersById(notes.stream().map(ClinicalNote::getDoctorId).collect(Collectors.toSet()));

        return notes.stream()
                .map(note -> {
                    User doctor = doctors.get(note.getDoctorId());
                    return NoteDto.builder()
                            .id(note.getId())
                            .patientId(note.getPatientId())
                            .doctorId(note.getDoctorId())
                            .doctorName(doctor != null ? doctor.getName() : null)
                            .doctorEmail(doctor != null ? doctor.getEmail() : null)
                            .content(note.getContent())
                            .createdAt(note.getCreatedAt())
                            .build();
                })
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public ClinicalNote addNote(Actor actor, String patientId, String content) {
        authorizationGuard.require(actor, patientId, Operation.NOTES_WRITE);
        if (content == null || content.trim().isEmpty()) {
            throw new BadRequestException("NOTE_CONTENT_REQUIRED");
        }

        ClinicalNote note = new ClinicalNote();
        note.setPatientId(patientId);
        note.setDoctorId(actor.getId());
        note.setContent(content);
        ClinicalNote saved = clinicalNoteRepository.save(note);
        log.info("[Notes] doctor {} added note {} for patient {}", actor.getId(), saved.getId(), patientId);
        return saved;
    }

    @Override
    public List<PrescriptionDto> getPrescriptions(Actor actor, String patientId) {
        authorizationGuard.require(actor, patientId, Operation.PRESCRIPTIONS_READ);
        List<Prescription> prescriptions = prescriptionRepository.findByPatientIdOrderByCreatedAtDescIdDesc(patientId);
        Map<String, User> doctors = usersById(prescriptions.stream()
                .map(Prescription::getDoctorId)
                .collect(Collectors.toSet()));

        return prescriptions.stream()
                .map(prescription -> {
                    User doctor = doctors.get(prescription.getDoctorId());
                    return PrescriptionDto.builder()
                            .id(prescription.getId())
                            .patientId(prescription.getPatientId())
                            .doctorId(prescription.getDoctorId())
                            .doctorName(doctor != null ? doctor.getName() : null)
                            .doctorEmail(doctor != null ? doctor.getEmail() : null)
                            .medications(new ArrayList<>(prescription.getMedications()))
                            .instructions(prescription.getInstructions())
                            .createdAt(prescription.getCreatedAt())
                            .build();
                })
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public Prescription issuePrescription(Actor actor, String patientId, List<String> medications, String instructions) {
        authorizationGuard.require(actor, patientId, Operation.PRESCRIPTIONS_WRITE);
        if (medications == null || medications.isEmpty()
                || medications.stream().anyMatch(m -> m == null || m.trim().isEmpty())) {
            throw new BadRequestException("MEDICATIONS_REQUIRED");
        }
        if (instructions == null || instructions.trim().isEmpty()) {
            throw new BadRequestException("INSTRUCTIONS_REQUIRED");
        }

        Prescription prescription = new Prescription();
        prescription.setPatientId(patientId);
        prescription.setDoctorId(actor.getId());
        prescription.setMedications(new ArrayList<>(medications));
        prescription.setInstructions(instructions);
        Prescription saved = prescriptionRepository.save(prescription);
        log.info("[Prescriptions] doctor {} issued prescription {} ({} medications) for patient {}",
                actor.getId(), saved.getId(), medications.size(), patientId);
        return saved;
    }

    @Override
    public Timeline getTimeline(Actor actor, String patientId) {
        authorizationGuard.require(actor, patientId, Operation.TIMELINE_READ);
        return recordAggregator.aggregate(patientId);
    }

    @Override
    public List<PatientSummaryDto> getConsultedPatients(Actor actor, String search) {
        if (actor == null || !actor.isDoctor()) {
            throw new ForbiddenException("DOCTORS_ONLY");
        }
        userRepository.findByUserId(actor.getId())
                .orElseThrow(() -> new NotFoundException("DOCTOR_NOT_FOUND"));

        Set<String> patientIds = consultationRegistry.getConsultedPatients(actor.getId());
        if (patientIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<User> patients = search == null || search.trim().isEmpty()
                ? userRepository.findByUserIdIn(patientIds)
                : userRepository.searchByUserIdIn(patientIds, search.trim());

        return patients.stream()
                .map(patient -> PatientSummaryDto.builder()
                        .userId(patient.getUserId())
                        .name(patient.getName())
                        .email(patient.getEmail())
                        .build())
                .collect(Collectors.toList());
    }

    private Map<String, User> usersById(Collection<String> userIds) {
        if (userIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return userRepository.findByUserIdIn(userIds).stream()
                .collect(Collectors.toMap(User::getUserId, Function.identity(), (a, b) -> a));
    }
}
