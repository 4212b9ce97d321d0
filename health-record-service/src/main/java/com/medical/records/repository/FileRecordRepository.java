package com.medical.records.repository;

import com.medical.records.model.entity.FileRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.List;

@Repository
public interface FileRecordRepository extends JpaRepository<FileRecord, Long> {
    List<FileRecord> findByPatientIdOrderByCreatedAtAscIdAsc(String patientId);

    List<FileRecord> findByPatientIdOrderByCreatedAtDescIdDesc(String patientId);
}
