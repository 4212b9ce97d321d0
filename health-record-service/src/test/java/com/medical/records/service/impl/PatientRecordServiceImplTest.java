package com.medical.records.service.impl;

import com.medical.records.TestRecords;
import com.medical.records.exception.BadRequestException;
import com.medical.records.exception.ForbiddenException;
import com.medical.records.exception.NotFoundException;
import com.medical.records.model.dto.NoteDto;
import com.medical.records.model.dto.PatientSummaryDto;
import com.medical.records.model.entity.ClinicalNote;
import com.medical.records.model.entity.Prescription;
import com.medical.records.repository.ClinicalNoteRepository;
import com.medical.records.repository.FileRecordRepository;
import com.medical.records.repository.PrescriptionRepository;
import com.medical.records.repository.UserRepository;
import com.medical.records.repository.VitalRecordRepository;
import com.medical.records.security.Actor;
import com.medical.records.security.AuthorizationGuard;
import com.medical.records.service.aggregation.RecordAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.medical.records.TestRecords.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

class PatientRecordServiceImplTest {

    private UserRepository userRepository;
    private VitalRecordRepository vitalRecordRepository;
    private ClinicalNoteRepository clinicalNoteRepository;
    private PrescriptionRepository prescriptionRepository;
    private RecordAggregator recordAggregator;
    private PatientRecordServiceImpl service;

    @BeforeEach
    void setUp() {
        userRepository = Mockito.mock(UserRepository.class);
        vitalRecordRepository = Mockito.mock(VitalRecordRepository.class);
        clinicalNoteRepository = Mockito.mock(ClinicalNoteRepository.class);
        prescriptionRepository = Mockito.mock(PrescriptionRepository.class);
        recordAggregator = Mockito.mock(RecordAggregator.class);

        ConsultationRegistryImpl registry = new ConsultationRegistryImpl(userRepository);
        service = new PatientRecordServiceImpl(
                new AuthorizationGuard(registry),
                registry,
                recordAggregator,
                userRepository,
                vitalRecordRepository,
                Mockito.mock(FileRecordRepository.class),
                clinicalNoteRepository,
                prescriptionRepository);

        when(userRepository.findByUserId("D1")).thenReturn(Optional.of(TestRecords.doctor("D1", "Ann Lee", "P1", "P2")));
        when(clinicalNoteRepository.save(any(ClinicalNote.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(prescriptionRepository.save(any(Prescription.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void getVitals_patientReadsOwnVitals() {
        when(vitalRecordRepository.findByPatientIdOrderByCreatedAtDescIdDesc("P1"))
                .thenReturn(List.of(TestRecords.vital("P1", T0, "120/80", 90.0, 70)));

        assertEquals(1, service.getVitals(Actor.patient("P1"), "P1").size());
    }

    @Test
    void getVitals_otherPatientIsForbidden() {
        assertThrows(ForbiddenException.class, () -> service.getVitals(Actor.patient("P2"), "P1"));
        verifyNoInteractions(vitalRecordRepository);
    }

    @Test
    void addNote_consultingDoctorBecomesAuthor() {
        ClinicalNote note = service.addNote(Actor.doctor("D1"), "P1", "Blood pressure improving");

        assertEquals("D1", note.getDoctorId());
        assertEquals("P1", note.getPatientId());
        assertEquals("Blood pressure improving", note.getContent());
    }

    @Test
    void addNote_patientCannotWriteForThemself() {
        assertThrows(ForbiddenException.class, () -> service.addNote(Actor.patient("P1"), "P1", "self note"));
        verify(clinicalNoteRepository, never()).save(any());
    }

    @Test
    void addNote_doctorWithoutLinkIsForbidden() {
        assertThrows(ForbiddenException.class, () -> service.addNote(Actor.doctor("D1"), "P3", "note"));
    }

    @Test
    void addNote_blankContentIsRejected() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> service.addNote(Actor.doctor("D1"), "P1", "  "));
        assertEquals("NOTE_CONTENT_REQUIRED", ex.getCode());
    }

    @Test
    void getNotes_resolvesAuthorNames() {
        when(clinicalNoteRepository.findByPatientIdOrderByCreatedAtDescIdDesc("P1")).thenReturn(List.of(
                TestRecords.note("P1", "D1", T0.plusDays(1), "newer"),
                TestRecords.note("P1", "D9", T0, "older")));
        when(userRepository.findByUserIdIn(anyCollection())).thenReturn(List.of(TestRecords.doctor("D1", "Ann Lee")));

        List<NoteDto> notes = service.getNotes(Actor.patient("P1"), "P1");

        assertEquals("Ann Lee", notes.get(0).getDoctorName());
        assertNull(notes.get(1).getDoctorName());
    }

    @Test
    void issuePrescription_requiresMedicationsAndInstructions() {
        assertEquals("MEDICATIONS_REQUIRED", assertThrows(BadRequestException.class,
                () -> service.issuePrescription(Actor.doctor("D1"), "P1", List.of(), "daily")).getCode());
        assertEquals("INSTRUCTIONS_REQUIRED", assertThrows(BadRequestException.class,
                () -> service.issuePrescription(Actor.doctor("D1"), "P1", List.of("Metformin"), "")).getCode());
    }

    @Test
    void issuePrescription_savedWithDoctorAsAuthor() {
        Prescription prescription = service.issuePrescription(
                Actor.doctor("D1"), "P2", List.of("Metformin 500mg"), "Twice daily");

        assertEquals("D1", prescription.getDoctorId());
        assertEquals(List.of("Metformin 500mg"), prescription.getMedications());
    }

    @Test
    void getTimeline_checksAccessBeforeAggregating() {
        assertThrows(ForbiddenException.class, () -> service.getTimeline(Actor.doctor("D1"), "P3"));
        verifyNoInteractions(recordAggregator);
    }

    @Test
    void getConsultedPatients_filtersBySearchWhenGiven() {
        when(userRepository.searchByUserIdIn(Set.of("P1", "P2"), "maria"))
                .thenReturn(List.of(TestRecords.patient("P1", "Maria Lopez")));

        List<PatientSummaryDto> patients = service.getConsultedPatients(Actor.doctor("D1"), " maria ");

        assertEquals(1, patients.size());
        assertEquals("P1", patients.get(0).getUserId());
        verify(userRepository, never()).findByUserIdIn(anyCollection());
    }

    @Test
    void getConsultedPatients_unknownDoctorIsNotFound() {
        when(userRepository.findByUserId("D404")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.getConsultedPatients(Actor.doctor("D404"), null));
    }

    @Test
    void getConsultedPatients_patientsAreRejected() {
        assertThrows(ForbiddenException.class, () -> service.getConsultedPatients(Actor.patient("P1"), null));
    }
}
