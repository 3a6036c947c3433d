package com.example.teambalancer.repository;

import com.example.teambalancer.config.BalancerProperties;
import com.example.teambalancer.model.IdentityLink;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisIdentityLinkRepository implements IdentityLinkRepository {

  private static final String FIELD_HANDLE = "handle";
  private static final String FIELD_LAST_UPDATED = "last_updated";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final Clock clock;
  private final String keyPrefix;

  public RedisIdentityLinkRepository(
      StringRedisTemplate redisTemplate, Clock clock, BalancerProperties properties) {
    this.redisTemplate = redisTemplate;
    this.clock = clock;
    this.keyPrefix = properties.keyPrefix();
  }

  @Override
  public Optional<IdentityLink> findLink(String userId) {
    final Map<Object, Object> raw = redisTemplate.opsForHash().entries(linkKey(userId));
    if (raw == null || raw.isEmpty()) {
      return Optional.empty();
    }
    final String handle = stringValue(raw.get(FIELD_HANDLE));
    if (handle == null || handle.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(
        new IdentityLink(userId, handle, parseInstant(stringValue(raw.get(FIELD_LAST_UPDATED)))));
  }

  @Override
  public IdentityLink link(String userId, String handle) {
    final Instant now = Instant.now(clock);
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_HANDLE, handle);
    fields.put(FIELD_LAST_UPDATED, now.toString());
    redisTemplate.opsForHash().putAll(linkKey(userId), fields);
    return new IdentityLink(userId, handle, now);
  }

  @Override
  public boolean unlink(String userId) {
    return Boolean.TRUE.equals(redisTemplate.delete(linkKey(userId)));
  }

  String linkKey(String userId) {
    return keyPrefix + ":identity:" + userId;
  }

  private String stringValue(Object value) {
    return value == null ? null : String.valueOf(value);
  }

  private Instant parseInstant(String value) {
    return value == null || value.isBlank() ? null : Instant.parse(value);
  }
}
