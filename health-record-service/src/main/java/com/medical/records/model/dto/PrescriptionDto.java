package com.medical.records.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionDto {
    private Long id;
    private String patientId;
    private String doctorId;
    private String doctorName;
    private String doctorEmail;
    private List<String> medications;
    private String instructions;
    private LocalDateTime createdAt;
}
