package com.medical.records.model.dto;

import lombok.Data;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import java.util.List;

@Data
public class PrescriptionCreateRequest {
    @NotEmpty(message = "MEDICATIONS_REQUIRED")
    private List<@NotBlank(message = "MEDICATIONS_REQUIRED") String> medications;

    @NotBlank(message = "INSTRUCTIONS_REQUIRED")
    private String instructions;
}
