package com.example.teambalancer.model;

import java.time.Instant;

public record IdentityLink(String userId, String handle, Instant lastUpdated) {}
