package com.flagship.letter_workflow.letter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.Map;

/**
 * Request DTO for starting a new letter draft.
 */
@Value
public class CreateLetterRequest {

    @NotBlank(message = "Letter type is required")
    @Size(max = 64, message = "Letter type must be at most 64 characters")
    @JsonProperty("letter_type")
    String letterType;

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must be at most 255 characters")
    @JsonProperty("title")
    String title;

    @JsonProperty("intake_data")
    Map<String, Object> intakeData;
}
