package com.example.teambalancer.service;

import com.example.teambalancer.config.BalancerProperties;
import com.example.teambalancer.repository.IdentityLinkRepository;
import com.example.teambalancer.repository.SessionStore;
import java.time.Clock;

/** 状態機械が遷移ごとに利用する共有コンポーネント一式。 */
record SessionCollaborators(
    BalancingEngine engine,
    ParticipantRatingResolver ratingResolver,
    IdentityLinkRepository identityLinks,
    SessionStore store,
    SessionRenderer renderer,
    BalancerMetrics metrics,
    BalancerProperties properties,
    Clock clock) {}
