package com.z254.butterfly.coordination.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for delivering a trait vector to the pressure wing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraitEventRequest {

    @NotNull(message = "Traits are required")
    private Map<String, Double> traits;

    private String correlationId;
}
