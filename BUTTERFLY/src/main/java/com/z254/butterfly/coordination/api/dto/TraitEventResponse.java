package com.z254.butterfly.coordination.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for trait delivery. The event is scored asynchronously, so
 * the pressure fields reflect the state at the time of delivery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraitEventResponse {

    private boolean accepted;
    private int pendingEvents;
    private double currentVp;
    private String vpClass;
    private long calculationCount;
    private String error;
}
