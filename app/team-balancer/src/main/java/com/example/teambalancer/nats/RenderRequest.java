package com.example.teambalancer.nats;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 描画要求。operation は render / terminal のいずれか。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RenderRequest(
    String operation,
    String sessionId,
    String guildId,
    String channelId,
    String surfaceRef,
    String terminalReason,
    SessionViewPayload view) {}
