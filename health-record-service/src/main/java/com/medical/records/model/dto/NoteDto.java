package com.medical.records.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteDto {
    private Long id;
    private String patientId;
    private String doctorId;
    private String doctorName;
    private String doctorEmail;
    private String content;
    private LocalDateTime createdAt;
}
