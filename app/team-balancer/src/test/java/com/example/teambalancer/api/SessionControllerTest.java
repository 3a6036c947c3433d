package com.example.teambalancer.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.teambalancer.model.Participant;
import com.example.teambalancer.model.SessionErrorCode;
import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionOutcome;
import com.example.teambalancer.model.SessionState;
import com.example.teambalancer.model.SessionView;
import com.example.teambalancer.model.TeamStats;
import com.example.teambalancer.service.SessionService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SessionController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class SessionControllerTest {

  private static final String SESSION_ID = "guild-1-channel-1-1771934400000-0a1b2c3d";
  private static final SessionLocation LOCATION =
      new SessionLocation("guild-1", "channel-1", "msg-1");
  private static final Instant CREATED_AT = Instant.parse("2026-02-24T12:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private SessionService sessionService;

  @Test
  void createSessionReturns201() throws Exception {
    when(sessionService.createSession(LOCATION))
        .thenReturn(SessionOutcome.accepted(openView(List.of())));

    mockMvc
        .perform(
            post("/v1/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"guild_id":"guild-1","channel_id":"channel-1","surface_ref":"msg-1"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.session_id").value(SESSION_ID))
        .andExpect(jsonPath("$.state").value("OPEN"))
        .andExpect(jsonPath("$.required_players").value(4))
        .andExpect(jsonPath("$.team_a").doesNotExist());
  }

  @Test
  void createSessionRejectsMissingChannel() throws Exception {
    mockMvc
        .perform(
            post("/v1/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"guild_id\":\"guild-1\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BALANCER_VALIDATION_ERROR"));
  }

  @Test
  void joinPassesUserIdAndDisplayName() throws Exception {
    when(sessionService.join(SESSION_ID, "user-1", "Alice"))
        .thenReturn(
            SessionOutcome.accepted(openView(List.of(Participant.unrated("user-1", "Alice")))));

    mockMvc
        .perform(
            post("/v1/sessions/" + SESSION_ID + "/participants")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"display_name\":\"Alice\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.participant_count").value(1))
        .andExpect(jsonPath("$.participants[0].user_id").value("user-1"));
  }

  @Test
  void joinRejectedWhenNotLinkedReturns412() throws Exception {
    when(sessionService.join(SESSION_ID, "user-1", null))
        .thenReturn(SessionOutcome.rejected(SessionErrorCode.NOT_LINKED, "link a profile first"));

    mockMvc
        .perform(post("/v1/sessions/" + SESSION_ID + "/participants").header("X-User-Id", "user-1"))
        .andExpect(status().isPreconditionFailed())
        .andExpect(jsonPath("$.code").value("NOT_LINKED"));
  }

  @Test
  void leaveReturnsUpdatedRoster() throws Exception {
    when(sessionService.leave(SESSION_ID, "user-1"))
        .thenReturn(SessionOutcome.accepted(openView(List.of())));

    mockMvc
        .perform(
            delete("/v1/sessions/" + SESSION_ID + "/participants/me")
                .header("X-User-Id", "user-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.participant_count").value(0));
  }

  @Test
  void startReturnsBalancedTeams() throws Exception {
    when(sessionService.start(SESSION_ID)).thenReturn(SessionOutcome.accepted(balancedView()));

    mockMvc
        .perform(post("/v1/sessions/" + SESSION_ID + "/start"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("BALANCED"))
        .andExpect(jsonPath("$.team_a.total_rating").value(3000))
        .andExpect(jsonPath("$.team_b.players.length()").value(2))
        .andExpect(jsonPath("$.rating_gap").value(0));
  }

  @Test
  void startPartialFailureReturns502WithFailedParticipants() throws Exception {
    when(sessionService.start(SESSION_ID))
        .thenReturn(SessionOutcome.partialFailure(null, List.of("user-3")));

    mockMvc
        .perform(post("/v1/sessions/" + SESSION_ID + "/start"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("PARTIAL_FAILURE"))
        .andExpect(jsonPath("$.failed_participants[0]").value("user-3"));
  }

  @Test
  void swapRequiresBothPlayers() throws Exception {
    mockMvc
        .perform(
            post("/v1/sessions/" + SESSION_ID + "/swap")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_a_player_id\":\"user-1\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void swapNotMemberReturns404() throws Exception {
    when(sessionService.swap(SESSION_ID, "user-1", "user-9"))
        .thenReturn(
            SessionOutcome.rejected(SessionErrorCode.NOT_MEMBER, "user-9 is not on team B"));

    mockMvc
        .perform(
            post("/v1/sessions/" + SESSION_ID + "/swap")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_a_player_id\":\"user-1\",\"team_b_player_id\":\"user-9\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_MEMBER"));
  }

  @Test
  void finalizeOnTerminalSessionReturns409() throws Exception {
    when(sessionService.finalizeTeams(SESSION_ID))
        .thenReturn(
            SessionOutcome.rejected(SessionErrorCode.SESSION_TERMINAL, "session is finalized"));

    mockMvc
        .perform(post("/v1/sessions/" + SESSION_ID + "/finalize"))
        .andExpect(status().isConflict());
  }

  @Test
  void getUnknownSessionReturns404() throws Exception {
    when(sessionService.view("missing"))
        .thenReturn(SessionOutcome.rejected(SessionErrorCode.SESSION_NOT_FOUND, "missing"));

    mockMvc
        .perform(get("/v1/sessions/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
  }

  @Test
  void getLatestInChannelUsesQueryParameters() throws Exception {
    when(sessionService.latestInChannel("guild-1", "channel-1"))
        .thenReturn(SessionOutcome.accepted(openView(List.of())));

    mockMvc
        .perform(get("/v1/sessions").param("guildId", "guild-1").param("channelId", "channel-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.channel_id").value("channel-1"));
  }

  @Test
  void cancelUnavailableSessionReturns410() throws Exception {
    when(sessionService.cancel(SESSION_ID))
        .thenReturn(
            SessionOutcome.rejected(SessionErrorCode.SESSION_UNAVAILABLE, "surface is gone"));

    mockMvc.perform(delete("/v1/sessions/" + SESSION_ID)).andExpect(status().isGone());
  }

  private SessionView openView(List<Participant> participants) {
    return new SessionView(
        SESSION_ID,
        SessionState.OPEN,
        LOCATION,
        4,
        participants,
        List.of(),
        List.of(),
        TeamStats.EMPTY,
        TeamStats.EMPTY,
        0,
        false,
        List.of(),
        CREATED_AT,
        CREATED_AT.plusSeconds(1800));
  }

  private SessionView balancedView() {
    final List<Participant> teamA =
        List.of(new Participant("user-1", "A", 2000), new Participant("user-4", "D", 1000));
    final List<Participant> teamB =
        List.of(new Participant("user-2", "B", 1600), new Participant("user-3", "C", 1400));
    return new SessionView(
        SESSION_ID,
        SessionState.BALANCED,
        LOCATION,
        4,
        List.of(teamA.get(0), teamB.get(0), teamB.get(1), teamA.get(1)),
        teamA,
        teamB,
        new TeamStats(3000, 1500.0d, 2),
        new TeamStats(3000, 1500.0d, 2),
        0,
        false,
        List.of(),
        CREATED_AT,
        CREATED_AT.plusSeconds(1800));
  }
}
