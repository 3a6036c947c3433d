package com.example.teambalancer.api;

import com.example.teambalancer.api.request.LinkIdentityRequest;
import com.example.teambalancer.api.response.LinkedIdentityResponse;
import com.example.teambalancer.api.response.PlayerRatingResponse;
import com.example.teambalancer.api.response.UnlinkIdentityResponse;
import com.example.teambalancer.service.IdentityLinkService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/identities/me")
@RequiredArgsConstructor
public class IdentityController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final IdentityLinkService identityLinkService;

  @PutMapping
  public ResponseEntity<LinkedIdentityResponse> link(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody LinkIdentityRequest request) {
    return ResponseEntity.ok(identityLinkService.link(userId, request.profile()));
  }

  @DeleteMapping
  public ResponseEntity<UnlinkIdentityResponse> unlink(
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(identityLinkService.unlink(userId));
  }

  @GetMapping("/rating")
  public ResponseEntity<PlayerRatingResponse> myRating(
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(identityLinkService.myRating(userId));
  }
}
