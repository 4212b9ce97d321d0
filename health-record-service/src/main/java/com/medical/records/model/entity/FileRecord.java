package com.medical.records.model.entity;

import com.medical.records.model.timeline.RecordEntry;
import com.medical.records.model.timeline.RecordKind;
import lombok.Data;
import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * Metadata of a file the patient uploaded. The file body lives in external storage.
 */
@Data
@Entity
@Table(name = "file_records", indexes = @Index(name = "idx_file_patient_created", columnList = "patient_id, created_at"))
public class FileRecord implements RecordEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false, length = 100)
    private String patientId;

    @Column(name = "file_name", nullable = false, length = 255)
    private String fileName;

    @Column(name = "file_url", length = 500)
    private String fileUrl;

    @Column(name = "content_type", length = 100)
    private String contentType;

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
        return RecordKind.FILE;
    }

    @Override
    public String getAuthorId() {
        return patientId;
    }
}
