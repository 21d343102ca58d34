package me.golemcore.calhelper.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.calhelper.domain.model.PendingApproval;
import me.golemcore.calhelper.domain.model.TurnResult;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnResponse {
    private String threadId;
    private String phase;
    private String answer;
    private int roundTrips;
    private boolean suspended;
    private boolean awaitingFeedback;
    private List<PendingApproval> pendingApprovals;

    public static TurnResponse from(TurnResult result) {
        return TurnResponse.builder()
                .threadId(result.threadId())
                .phase(result.phase().name())
                .answer(result.finalAnswer())
                .roundTrips(result.roundTrips())
                .suspended(result.suspended())
                .awaitingFeedback(result.awaitsFeedback())
                .pendingApprovals(result.pendingApprovals())
                .build();
    }
}
