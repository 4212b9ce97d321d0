package com.medical.records.model.entity;

import com.medical.records.model.timeline.RecordEntry;
import com.medical.records.model.timeline.RecordKind;
import lombok.Data;
import javax.persistence.*;
import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "clinical_notes", indexes = @Index(name = "idx_note_patient_created", columnList = "patient_id, created_at"))
public class ClinicalNote implements RecordEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false, length = 100)
    private String patientId;

    @Column(name = "doctor_id", nullable = false, length = 100)
    private String doctorId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.NOTE;
    }

    @Override
    public String getAuthorId() {
        return doctorId;
    }
}
