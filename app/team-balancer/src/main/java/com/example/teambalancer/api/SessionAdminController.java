package com.example.teambalancer.api;

import com.example.teambalancer.api.response.RecoveryResponse;
import com.example.teambalancer.model.RecoveryReport;
import com.example.teambalancer.service.SessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class SessionAdminController {

  private final SessionService sessionService;

  /** 稼働中でない永続セッションの再接続/破棄を手動で実行する。 */
  @PostMapping("/recovery")
  public ResponseEntity<RecoveryResponse> runRecovery() {
    final RecoveryReport report = sessionService.runRecovery();
    return ResponseEntity.ok(new RecoveryResponse(report.reattached(), report.discarded()));
  }
}
