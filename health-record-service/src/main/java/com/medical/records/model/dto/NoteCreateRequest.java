package com.medical.records.model.dto;

import lombok.Data;
import javax.validation.constraints.NotBlank;

@Data
public class NoteCreateRequest {
    @NotBlank(message = "NOTE_CONTENT_REQUIRED")
    private String content;
}
