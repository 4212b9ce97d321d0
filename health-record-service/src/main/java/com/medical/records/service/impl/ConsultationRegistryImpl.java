package com.medical.records.service.impl;

import com.medical.records.model.entity.User;
import com.medical.records.repository.UserRepository;
import com.medical.records.service.ConsultationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConsultationRegistryImpl implements ConsultationRegistry {

    private final UserRepository userRepository;

    @Override
    public boolean isConsulting(String doctorId, String patientId) {
        if (doctorId == null || patientId == null) {
            return false;
        }
        return getConsultedPatients(doctorId).contains(patientId);
    }

    @Override
    public Set<String> getConsultedPatients(String doctorId) {
        return userRepository.findByUserId(doctorId)
                .filter(user -> user.getRole() == User.UserRole.DOCTOR)
                .map(doctor -> doctor.getConsultedPatients() == null
                        ? Collections.<String>emptySet()
                        : Collections.unmodifiableSet(new HashSet<>(doctor.getConsultedPatients())))
                .orElseGet(() -> {
                    log.debug("[Consultation] no doctor record for {}", doctorId);
                    return Collections.emptySet();
                });
    }
}
