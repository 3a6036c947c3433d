package com.example.teambalancer.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rating")
public record RatingClientProperties(
    String baseUrl,
    String apiKey,
    String playersPath,
    List<String> gameIds,
    Duration connectTimeout,
    Duration readTimeout) {

  public RatingClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://open.faceit.com/data/v4" : baseUrl;
    apiKey = apiKey == null ? "" : apiKey;
    playersPath = playersPath == null || playersPath.isBlank() ? "/players" : playersPath;
    // cs2 を優先し、無ければ csgo の統計へフォールバックする。
    gameIds = gameIds == null || gameIds.isEmpty() ? List.of("cs2", "csgo") : List.copyOf(gameIds);
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
