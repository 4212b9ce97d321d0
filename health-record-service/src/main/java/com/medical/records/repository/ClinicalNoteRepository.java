package com.medical.records.repository;

import com.medical.records.model.entity.ClinicalNote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.List;

@Repository
public interface ClinicalNoteRepository extends JpaRepository<ClinicalNote, Long> {
    List<ClinicalNote> findByPatientIdOrderByCreatedAtAscIdAsc(String patientId);

    List<ClinicalNote> findByPatientIdOrderByCreatedAtDescIdDesc(String patientId);
}
