/*
 * どこで: Team Balancer API
 * 何を: セッションの作成/参照/参加/離脱/バランス/調整/確定/取消エンドポイントを公開する
 * なぜ: チャット基盤アダプタや管理ツールからの利用者操作を受け付ける入口を提供するため
 */
package com.example.teambalancer.api;

import com.example.teambalancer.api.request.CreateSessionRequest;
import com.example.teambalancer.api.request.JoinSessionRequest;
import com.example.teambalancer.api.request.SwapPlayersRequest;
import com.example.teambalancer.api.response.SessionResponse;
import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionOutcome;
import com.example.teambalancer.service.SessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final SessionService sessionService;

  @PostMapping
  public ResponseEntity<SessionResponse> createSession(
      @Valid @RequestBody CreateSessionRequest request) {
    final SessionLocation location =
        new SessionLocation(request.guildId(), request.channelId(), request.surfaceRef());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(toResponse(sessionService.createSession(location)));
  }

  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> getSession(@PathVariable("sessionId") String sessionId) {
    return ResponseEntity.ok(toResponse(sessionService.view(sessionId)));
  }

  @GetMapping
  public ResponseEntity<SessionResponse> getLatestInChannel(
      @RequestParam("guildId") String guildId, @RequestParam("channelId") String channelId) {
    return ResponseEntity.ok(toResponse(sessionService.latestInChannel(guildId, channelId)));
  }

  @PostMapping("/{sessionId}/participants")
  public ResponseEntity<SessionResponse> join(
      @PathVariable("sessionId") String sessionId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody(required = false) JoinSessionRequest request) {
    final String displayName = request == null ? null : request.displayName();
    return ResponseEntity.ok(toResponse(sessionService.join(sessionId, userId, displayName)));
  }

  @DeleteMapping("/{sessionId}/participants/me")
  public ResponseEntity<SessionResponse> leave(
      @PathVariable("sessionId") String sessionId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(toResponse(sessionService.leave(sessionId, userId)));
  }

  @PostMapping("/{sessionId}/start")
  public ResponseEntity<SessionResponse> start(@PathVariable("sessionId") String sessionId) {
    return ResponseEntity.ok(toResponse(sessionService.start(sessionId)));
  }

  @PostMapping("/{sessionId}/swap")
  public ResponseEntity<SessionResponse> swap(
      @PathVariable("sessionId") String sessionId,
      @Valid @RequestBody SwapPlayersRequest request) {
    return ResponseEntity.ok(
        toResponse(
            sessionService.swap(sessionId, request.teamAPlayerId(), request.teamBPlayerId())));
  }

  @PostMapping("/{sessionId}/rebalance")
  public ResponseEntity<SessionResponse> rebalance(@PathVariable("sessionId") String sessionId) {
    return ResponseEntity.ok(toResponse(sessionService.rebalance(sessionId)));
  }

  @PostMapping("/{sessionId}/finalize")
  public ResponseEntity<SessionResponse> finalizeTeams(
      @PathVariable("sessionId") String sessionId) {
    return ResponseEntity.ok(toResponse(sessionService.finalizeTeams(sessionId)));
  }

  @DeleteMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> cancel(@PathVariable("sessionId") String sessionId) {
    return ResponseEntity.ok(toResponse(sessionService.cancel(sessionId)));
  }

  private SessionResponse toResponse(SessionOutcome outcome) {
    if (!outcome.isAccepted()) {
      throw new SessionOperationException(outcome);
    }
    return SessionResponse.from(outcome.view());
  }
}
