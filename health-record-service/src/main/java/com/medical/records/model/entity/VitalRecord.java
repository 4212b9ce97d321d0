package com.medical.records.model.entity;

import com.medical.records.model.timeline.RecordEntry;
import com.medical.records.model.timeline.RecordKind;
import lombok.Data;
import javax.persistence.*;
import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "vital_records", indexes = @Index(name = "idx_vital_patient_created", columnList = "patient_id, created_at"))
public class VitalRecord implements RecordEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false, length = 100)
    private String patientId;

    // e.g. "120/80"
    @Column(name = "blood_pressure", length = 20)
    private String bloodPressure;

    @Column(name = "sugar")
    private Double sugar;

    @Column(name = "heart_rate")
    private Integer heartRate;

    @Column(name = "temperature")
    private Double temperature;

    @Column(name = "weight")
    private Double weight;

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
        return RecordKind.VITAL;
    }

    @Override
    public String getAuthorId() {
        return patientId;
    }
}
