package edu.brandeis.cosi103a.league.player;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.protocol.ChooseParityCall;
import edu.brandeis.cosi103a.league.protocol.StandingRow;

/**
 * What a strategy may look at when choosing.
 */
public record ChoiceContext(
    String matchId,
    String playerId,
    String opponentId,
    ImmutableList<StandingRow> standings
) {
    public static ChoiceContext of(ChooseParityCall call) {
        ChooseParityCall.Context context = call.context();
        return new ChoiceContext(
            call.matchId(),
            call.playerId(),
            context != null ? context.opponentId() : null,
            context != null && context.standings() != null ? context.standings() : ImmutableList.of());
    }
}
