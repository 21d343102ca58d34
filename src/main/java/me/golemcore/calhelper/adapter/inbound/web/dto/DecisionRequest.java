package me.golemcore.calhelper.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Verdict on one pending invocation. Feedback is only used when rejecting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRequest {
    private String invocationId;
    private boolean approved;
    private String feedback;
}
