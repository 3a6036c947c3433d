package com.example.teambalancer.nats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RenderReply(String status, String surfaceRef) {

  public static final String STATUS_OK = "ok";
  public static final String STATUS_STALE = "stale";

  public boolean isStale() {
    return STATUS_STALE.equals(status);
  }
}
