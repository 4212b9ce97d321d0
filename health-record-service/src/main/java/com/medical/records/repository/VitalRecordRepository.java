package com.medical.records.repository;

import com.medical.records.model.entity.VitalRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.List;

@Repository
public interface VitalRecordRepository extends JpaRepository<VitalRecord, Long> {
    List<VitalRecord> findByPatientIdOrderByCreatedAtAscIdAsc(String patientId);

    List<VitalRecord> findByPatientIdOrderByCreatedAtDescIdDesc(String patientId);
}
