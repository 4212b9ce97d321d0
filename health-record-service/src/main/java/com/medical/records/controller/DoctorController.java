package com.medical.records.controller;

import com.medical.records.model.dto.PatientSummaryDto;
import com.medical.records.security.Actor;
import com.medical.records.service.PatientRecordService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/doctor")
@CrossOrigin(origins = "*")
public class DoctorController {

    @Autowired
    private PatientRecordService patientRecordService;

    /**
     * Patients the calling doctor consults, optionally filtered by name or email.
     */
    @GetMapping("/my-patients")
    public List<PatientSummaryDto> getMyPatients(Actor actor, @RequestParam(required = false) String search) {
        List<PatientSummaryDto> patients = patientRecordService.getConsultedPatients(actor, search);
        log.info("[Doctor] {} listed {} consulted patients", actor.getId(), patients.size());
        return patients;
    }
}
