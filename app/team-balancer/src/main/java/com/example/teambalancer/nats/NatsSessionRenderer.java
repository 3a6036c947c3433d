/*
 * どこで: Team Balancer 描画境界 (NATS)
 * 何を: ビューモデルをチャット基盤アダプタへ request/reply で届ける
 * なぜ: 描画面のハンドル払い出しと消失検知をアダプタ側から受け取るため
 */
package com.example.teambalancer.nats;

import com.example.common.TraceIds;
import com.example.teambalancer.config.BalancerNatsProperties;
import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionView;
import com.example.teambalancer.model.TerminalReason;
import com.example.teambalancer.service.SessionRenderer;
import com.example.teambalancer.service.StaleSurfaceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Message;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsSessionRenderer implements SessionRenderer {

  private static final Logger logger = LoggerFactory.getLogger(NatsSessionRenderer.class);
  static final String HEADER_TRACE_ID = "Trace-Id";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Connection は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final Connection connection;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final BalancerNatsProperties properties;

  public NatsSessionRenderer(
      Connection connection, ObjectMapper objectMapper, BalancerNatsProperties properties) {
    this.connection = connection;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public String render(SessionLocation location, SessionView view) {
    final RenderRequest request =
        new RenderRequest(
            "render",
            view.sessionId(),
            location.guildId(),
            location.channelId(),
            location.surfaceRef(),
            null,
            SessionViewPayload.from(view));
    final Message reply = request(properties.renderSubject(), request);
    if (reply == null) {
      throw new IllegalStateException("render request timed out sessionId=" + view.sessionId());
    }
    final RenderReply renderReply = read(reply, RenderReply.class);
    if (renderReply.isStale()) {
      throw new StaleSurfaceException(location.surfaceRef());
    }
    return renderReply.surfaceRef() == null || renderReply.surfaceRef().isBlank()
        ? location.surfaceRef()
        : renderReply.surfaceRef();
  }

  @Override
  public void renderTerminal(SessionLocation location, SessionView view, TerminalReason reason) {
    final RenderRequest request =
        new RenderRequest(
            "terminal",
            view.sessionId(),
            location.guildId(),
            location.channelId(),
            location.surfaceRef(),
            reason.name().toLowerCase(Locale.ROOT),
            SessionViewPayload.from(view));
    connection.publish(properties.renderSubject(), traceHeaders(), write(request));
  }

  /**
   * 役割: 永続化されていた描画面がまだ存在するかをアダプタへ問い合わせる。
   * 動作: 応答なし (タイムアウト/応答者なし) と found=false は解決不能として empty を返す。
   */
  @Override
  public Optional<SessionLocation> resolveLocation(SessionLocation location) {
    final Message reply =
        request(
            properties.resolveSubject(),
            new ResolveRequest(location.guildId(), location.channelId(), location.surfaceRef()));
    if (reply == null) {
      logger.warn("surface resolve timed out channel={}", location.channelKey());
      return Optional.empty();
    }
    final ResolveReply resolveReply = read(reply, ResolveReply.class);
    if (!resolveReply.found()) {
      return Optional.empty();
    }
    return Optional.of(
        resolveReply.surfaceRef() == null
            ? location
            : location.withSurfaceRef(resolveReply.surfaceRef()));
  }

  private Message request(String subject, Object payload) {
    try {
      return connection.request(
          subject, traceHeaders(), write(payload), properties.requestTimeout());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for render reply", ex);
    }
  }

  private byte[] write(Object payload) {
    try {
      return objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize render payload", ex);
    }
  }

  private <T> T read(Message message, Class<T> type) {
    try {
      return objectMapper.readValue(message.getData(), type);
    } catch (IOException ex) {
      throw new IllegalStateException("invalid render reply", ex);
    }
  }

  private Headers traceHeaders() {
    final Headers headers = new Headers();
    headers.add(HEADER_TRACE_ID, resolveTraceId());
    return headers;
  }

  private String resolveTraceId() {
    return TraceIds.firstOrNew(MDC.get("trace_id"), MDC.get("request_id"));
  }
}
