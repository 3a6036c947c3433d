package com.example.teambalancer.service;

import com.example.teambalancer.config.RatingClientProperties;
import com.example.teambalancer.model.PlayerStats;
import com.example.teambalancer.service.dto.FaceitGameResponse;
import com.example.teambalancer.service.dto.FaceitPlayerResponse;
import java.net.SocketTimeoutException;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class FaceitRatingClient implements RatingLookup {

  private final RestClient ratingRestClient;
  private final RatingClientProperties properties;

  @Override
  public OptionalInt resolveRating(String handle) {
    final Optional<FaceitGameResponse> game = findPlayer(handle).flatMap(this::selectGame);
    if (game.isEmpty() || game.get().faceitElo() == null || game.get().faceitElo() <= 0) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(game.get().faceitElo());
  }

  @Override
  public boolean verifyHandleExists(String handle) {
    return findPlayer(handle).isPresent();
  }

  @Override
  public Optional<PlayerStats> findPlayerStats(String handle) {
    return findPlayer(handle).map(player -> toStats(handle, player));
  }

  private Optional<FaceitPlayerResponse> findPlayer(String handle) {
    if (handle == null || handle.isBlank()) {
      throw new IllegalArgumentException("handle is required");
    }
    try {
      final FaceitPlayerResponse response =
          ratingRestClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path(properties.playersPath())
                          .queryParam("nickname", handle)
                          .build())
              .retrieve()
              .body(FaceitPlayerResponse.class);
      return Optional.of(requireValid(response));
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return Optional.empty();
      }
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (RatingLookupException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new RatingLookupException(
          RatingLookupException.Reason.INVALID_RESPONSE, "rating response parse failed", ex);
    }
  }

  private Optional<FaceitGameResponse> selectGame(FaceitPlayerResponse player) {
    if (player.games() == null) {
      return Optional.empty();
    }
    for (String gameId : properties.gameIds()) {
      final FaceitGameResponse game = player.games().get(gameId);
      if (game != null) {
        return Optional.of(game);
      }
    }
    return Optional.empty();
  }

  private PlayerStats toStats(String handle, FaceitPlayerResponse player) {
    final Optional<FaceitGameResponse> game = selectGame(player);
    if (game.isEmpty()) {
      return new PlayerStats(handle, player.playerId(), null, null, false, player.avatar());
    }
    return new PlayerStats(
        handle,
        player.playerId(),
        game.get().faceitElo() == null ? 0 : game.get().faceitElo(),
        game.get().skillLevel() == null ? 0 : game.get().skillLevel(),
        true,
        player.avatar());
  }

  private FaceitPlayerResponse requireValid(FaceitPlayerResponse response) {
    if (response == null || isBlank(response.playerId())) {
      throw new RatingLookupException(
          RatingLookupException.Reason.INVALID_RESPONSE, "rating response is invalid");
    }
    return response;
  }

  private RatingLookupException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new RatingLookupException(
          RatingLookupException.Reason.UNAUTHORIZED, "rating service rejected api key", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new RatingLookupException(
          RatingLookupException.Reason.BAD_GATEWAY, "rating service error", ex);
    }
    return new RatingLookupException(
        RatingLookupException.Reason.BAD_GATEWAY, "rating request failed", ex);
  }

  private RatingLookupException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new RatingLookupException(
          RatingLookupException.Reason.TIMEOUT, "rating request timeout", ex);
    }
    return new RatingLookupException(
        RatingLookupException.Reason.BAD_GATEWAY, "rating connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
