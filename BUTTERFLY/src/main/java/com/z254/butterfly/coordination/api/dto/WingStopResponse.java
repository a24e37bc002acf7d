package com.z254.butterfly.coordination.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for stopping a wing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WingStopResponse {

    private String wing;
    private boolean stopped;
    private String message;
}
