package com.medical.records.model.entity;

import lombok.Data;
import javax.persistence.*;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

@Data
@Entity
@Table(name = "users")
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true, length = 100)
    private String userId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(unique = true, length = 150)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, columnDefinition = "ENUM('DOCTOR', 'PATIENT')")
    private UserRole role;

    // Doctor-owned consultation links: the patients this doctor may access
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "doctor_consulted_patients", joinColumns = @JoinColumn(name = "doctor_id"))
    @Column(name = "patient_id", nullable = false, length = 100)
    private Set<String> consultedPatients = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public enum UserRole {
        DOCTOR, PATIENT
    }
}
