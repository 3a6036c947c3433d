package com.example.teambalancer.repository;

import com.example.teambalancer.config.BalancerProperties;
import com.example.teambalancer.model.SessionSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisSessionStore implements SessionStore {

  private static final Logger logger = LoggerFactory.getLogger(RedisSessionStore.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final String keyPrefix;

  public RedisSessionStore(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, BalancerProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.keyPrefix = properties.keyPrefix();
  }

  @Override
  public void save(SessionSnapshot snapshot) {
    final String json = serialize(snapshot);
    try {
      redisTemplate.opsForValue().set(sessionKey(snapshot.sessionId()), json);
      redisTemplate.opsForZSet().add(allKey(), snapshot.sessionId(), snapshot.createdAt());
      redisTemplate
          .opsForZSet()
          .add(
              channelKey(snapshot.guildId(), snapshot.channelId()),
              snapshot.sessionId(),
              snapshot.createdAt());
    } catch (DataAccessException ex) {
      throw new SessionPersistenceException(
          "failed to save session snapshot sessionId=" + snapshot.sessionId(), ex);
    }
  }

  @Override
  public Optional<SessionSnapshot> findById(String sessionId) {
    final String json;
    try {
      json = redisTemplate.opsForValue().get(sessionKey(sessionId));
    } catch (DataAccessException ex) {
      throw new SessionPersistenceException(
          "failed to load session snapshot sessionId=" + sessionId, ex);
    }
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(deserialize(sessionId, json));
  }

  @Override
  public void delete(String sessionId) {
    final Optional<SessionSnapshot> existing = findForDelete(sessionId);
    try {
      existing.ifPresent(
          snapshot ->
              redisTemplate
                  .opsForZSet()
                  .remove(channelKey(snapshot.guildId(), snapshot.channelId()), sessionId));
      redisTemplate.opsForZSet().remove(allKey(), sessionId);
      redisTemplate.delete(sessionKey(sessionId));
    } catch (DataAccessException ex) {
      throw new SessionPersistenceException(
          "failed to delete session snapshot sessionId=" + sessionId, ex);
    }
  }

  @Override
  public Optional<SessionSnapshot> findLatestInChannel(String guildId, String channelId) {
    final Set<String> latest;
    try {
      latest = redisTemplate.opsForZSet().reverseRange(channelKey(guildId, channelId), 0, 0);
    } catch (DataAccessException ex) {
      throw new SessionPersistenceException(
          "failed to read channel index channel=" + guildId + ":" + channelId, ex);
    }
    if (latest == null || latest.isEmpty()) {
      return Optional.empty();
    }
    return findById(latest.iterator().next());
  }

  @Override
  public List<SessionSnapshot> findAll() {
    final Set<String> sessionIds;
    try {
      sessionIds = redisTemplate.opsForZSet().range(allKey(), 0, -1);
    } catch (DataAccessException ex) {
      throw new SessionPersistenceException("failed to read session index", ex);
    }
    if (sessionIds == null || sessionIds.isEmpty()) {
      return List.of();
    }
    final List<SessionSnapshot> snapshots = new ArrayList<>();
    for (String sessionId : sessionIds) {
      try {
        // 本体が消えたインデックスは読み飛ばす。
        findById(sessionId).ifPresent(snapshots::add);
      } catch (SessionPersistenceException ex) {
        logger.warn("discarding unreadable session snapshot sessionId={}", sessionId, ex);
        delete(sessionId);
      }
    }
    return snapshots;
  }

  private Optional<SessionSnapshot> findForDelete(String sessionId) {
    try {
      return findById(sessionId);
    } catch (SessionPersistenceException ex) {
      // 読めない本体でも削除は続行する。channel インデックスは読み出し時に読み飛ばされる。
      logger.warn("session snapshot unreadable on delete sessionId={}", sessionId, ex);
      return Optional.empty();
    }
  }

  String sessionKey(String sessionId) {
    return keyPrefix + ":session:" + sessionId;
  }

  String allKey() {
    return keyPrefix + ":sessions";
  }

  String channelKey(String guildId, String channelId) {
    return keyPrefix + ":channel:" + guildId + ":" + channelId;
  }

  private String serialize(SessionSnapshot snapshot) {
    try {
      return objectMapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException ex) {
      throw new SessionPersistenceException(
          "session snapshot serialization failed sessionId=" + snapshot.sessionId(), ex);
    }
  }

  private SessionSnapshot deserialize(String sessionId, String json) {
    try {
      return objectMapper.readValue(json, SessionSnapshot.class);
    } catch (JsonProcessingException ex) {
      throw new SessionPersistenceException(
          "session snapshot is unreadable sessionId=" + sessionId, ex);
    }
  }
}
