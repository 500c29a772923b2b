package com.graphload.core.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for creating a dataset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDatasetRequest {

    @NotBlank(message = "name is required")
    @Size(max = 255, message = "name must be at most 255 characters")
    private String name;

    private String description;

    /**
     * Re-uploads replace what the previous upload of the same label or type wrote.
     */
    private boolean cascadeDelete;
}
