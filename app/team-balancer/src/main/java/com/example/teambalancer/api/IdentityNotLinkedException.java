package com.example.teambalancer.api;

public class IdentityNotLinkedException extends RuntimeException {
  public IdentityNotLinkedException(String userId) {
    super("no rating profile linked for user " + userId);
  }
}
