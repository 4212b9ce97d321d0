package com.medical.records.repository;

import com.medical.records.model.entity.Prescription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.List;

@Repository
public interface PrescriptionRepository extends JpaRepository<Prescription, Long> {
    List<Prescription> findByPatientIdOrderByCreatedAtAscIdAsc(String patientId);

    List<Prescription> findByPatientIdOrderByCreatedAtDescIdDesc(String patientId);
}
