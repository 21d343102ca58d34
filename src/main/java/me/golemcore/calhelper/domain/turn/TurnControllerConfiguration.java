package me.golemcore.calhelper.domain.turn;

import me.golemcore.calhelper.domain.service.ApprovalGate;
import me.golemcore.calhelper.domain.service.CapabilityRegistry;
import me.golemcore.calhelper.domain.service.CheckpointService;
import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;
import me.golemcore.calhelper.port.outbound.ConfirmationPort;
import me.golemcore.calhelper.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for the turn controller (domain orchestrator + ports). */
@Configuration
public class TurnControllerConfiguration {

    @Bean
    public HistoryWriter turnHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public TurnPrompts turnPrompts(CalHelperProperties properties, Clock clock) {
        return new TurnPrompts(properties.getPrompt(), clock);
    }

    @Bean
    public TurnController turnController(LlmPort llmPort, CapabilityRegistry registry, ApprovalGate approvalGate,
            ConfirmationPort confirmationPort, CheckpointService checkpointService, HistoryWriter historyWriter,
            TurnPrompts prompts, CalHelperProperties properties) {
        return new DefaultTurnController(llmPort, registry, approvalGate, confirmationPort, checkpointService,
                historyWriter, prompts, properties.getTurn().getMaxRoundTrips());
    }
}
