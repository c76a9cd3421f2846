package io.github.drompincen.durableagent.protocol.api;

import java.util.List;

public record UserStatisticsDto(
        String userId,
        long totalConversations,
        long resolvedCount,
        List<IntentCount> intents
) {
    public static UserStatisticsDto empty(String userId) {
        return new UserStatisticsDto(userId, 0, 0, List.of());
    }

    public record IntentCount(String intent, long count) {}
}
