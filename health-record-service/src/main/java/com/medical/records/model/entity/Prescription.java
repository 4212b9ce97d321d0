package com.medical.records.model.entity;

import com.medical.records.model.timeline.RecordEntry;
import com.medical.records.model.timeline.RecordKind;
import lombok.Data;
import javax.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Entity
@Table(name = "prescriptions", indexes = @Index(name = "idx_prescription_patient_created", columnList = "patient_id, created_at"))
public class Prescription implements RecordEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false, length = 100)
    private String patientId;

    @Column(name = "doctor_id", nullable = false, length = 100)
    private String doctorId;

    // Loaded eagerly: timelines are assembled on fetch threads and serialized after their sessions close
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "prescription_medications", joinColumns = @JoinColumn(name = "prescription_id"))
    @OrderColumn(name = "position")
    @Column(name = "medication", nullable = false, length = 255)
    private List<String> medications = new ArrayList<>();

    @Column(name = "instructions", nullable = false, columnDefinition = "TEXT")
    private String instructions;

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
        return RecordKind.PRESCRIPTION;
    }

    @Override
    public String getAuthorId() {
        return doctorId;
    }
}
