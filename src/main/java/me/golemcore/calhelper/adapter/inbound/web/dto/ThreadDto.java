package me.golemcore.calhelper.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadDto {
    private String threadId;
    private String phase;
    private int roundTrips;
    private long version;
    private Instant createdAt;
    private Instant updatedAt;
    private List<MessageDto> messages;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageDto {
        private String kind;
        private String content;
        private String invocationId;
        private String capabilityName;
        private Map<String, Object> arguments;
        private boolean failed;
        private String failureKind;
        private Instant timestamp;
    }
}
