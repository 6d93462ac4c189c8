package edu.brandeis.cosi103a.league.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import edu.brandeis.cosi103a.league.game.GameResult;
import edu.brandeis.cosi103a.league.game.ParityChoice;

/**
 * A referee's report of a finished or aborted match to the league manager.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchResultReport(
    @JsonProperty("league_id") String leagueId,
    @JsonProperty("match_id") String matchId,
    @JsonProperty("round_id") int roundId,
    @JsonProperty("result") Result result
) {
    public static final String COMPLETED = "COMPLETED";
    public static final String ABORTED = "ABORTED";

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Result(
        @JsonProperty("status") String status,
        @JsonProperty("winner") String winner,
        @JsonProperty("score") ImmutableMap<String, Integer> score,
        @JsonProperty("details") Details details,
        @JsonProperty("reason") String reason
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Details(
        @JsonProperty("drawn_number") int drawnNumber,
        @JsonProperty("choices") ImmutableMap<String, String> choices
    ) {}

    public static MatchResultReport completed(String leagueId, String matchId, int roundId, GameResult gameResult) {
        ImmutableMap.Builder<String, String> choices = ImmutableMap.builder();
        for (var entry : gameResult.choices().entrySet()) {
            choices.put(entry.getKey(), entry.getValue().wireValue());
        }
        Result result = new Result(
            COMPLETED,
            gameResult.winnerPlayerId().orElse(null),
            gameResult.scores(),
            new Details(gameResult.drawnNumber(), choices.build()),
            null);
        return new MatchResultReport(leagueId, matchId, roundId, result);
    }

    public static MatchResultReport aborted(String leagueId, String matchId, int roundId, String reason) {
        return new MatchResultReport(leagueId, matchId, roundId, new Result(ABORTED, null, null, null, reason));
    }

    @JsonIgnore
    public boolean isAborted() {
        return result != null && ABORTED.equals(result.status());
    }

    /**
     * Checks that a reported choice map only uses legal symbols.
     */
    @JsonIgnore
    public boolean hasValidChoices() {
        if (result == null || result.details() == null || result.details().choices() == null) {
            return true;
        }
        return result.details().choices().values().stream()
            .allMatch(choice -> ParityChoice.fromWire(choice).isPresent());
    }
}
