package com.medical.records.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directory entry for a patient in a doctor's consulted list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientSummaryDto {
    private String userId;
    private String name;
    private String email;
}
