package com.medical.records.controller;

import com.medical.records.exception.ForbiddenException;
import com.medical.records.exception.GlobalExceptionHandler;
import com.medical.records.exception.NotFoundException;
import com.medical.records.model.dto.PatientSummaryDto;
import com.medical.records.security.Actor;
import com.medical.records.security.ActorArgumentResolver;
import com.medical.records.service.PatientRecordService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DoctorControllerTest {

    private PatientRecordService patientRecordService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        patientRecordService = Mockito.mock(PatientRecordService.class);
        DoctorController controller = new DoctorController();
        ReflectionTestUtils.setField(controller, "patientRecordService", patientRecordService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setCustomArgumentResolvers(new ActorArgumentResolver())
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void myPatients_passesSearchTerm() throws Exception {
        when(patientRecordService.getConsultedPatients(Actor.doctor("D1"), "ali"))
                .thenReturn(List.of(PatientSummaryDto.builder()
                        .userId("P1").name("Alice").email("alice@example.com").build()));

        mockMvc.perform(get("/api/doctor/my-patients").param("search", "ali")
                        .header(ActorArgumentResolver.ACTOR_ID_HEADER, "D1")
                        .header(ActorArgumentResolver.ACTOR_ROLE_HEADER, "doctor"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].userId").value("P1"))
                .andExpect(jsonPath("$[0].name").value("Alice"));
    }

    @Test
    void myPatients_unknownDoctorIsNotFound() throws Exception {
        when(patientRecordService.getConsultedPatients(Actor.doctor("D9"), null))
                .thenThrow(new NotFoundException("DOCTOR_NOT_FOUND"));

        mockMvc.perform(get("/api/doctor/my-patients")
                        .header(ActorArgumentResolver.ACTOR_ID_HEADER, "D9")
                        .header(ActorArgumentResolver.ACTOR_ROLE_HEADER, "doctor"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("DOCTOR_NOT_FOUND"));
    }

    @Test
    void myPatients_patientIsForbidden() throws Exception {
        when(patientRecordService.getConsultedPatients(Actor.patient("P1"), null))
                .thenThrow(new ForbiddenException("DOCTORS_ONLY"));

        mockMvc.perform(get("/api/doctor/my-patients")
                        .header(ActorArgumentResolver.ACTOR_ID_HEADER, "P1")
                        .header(ActorArgumentResolver.ACTOR_ROLE_HEADER, "patient"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("DOCTORS_ONLY"));
    }
}
