package edu.brandeis.cosi103a.league.scheduler;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Combines the round-robin pairing table with referee assignment into a {@link SchedulePlan}.
 * Performs no I/O.
 */
public final class MatchScheduler {

    private MatchScheduler() {}

    /**
     * Builds the full league plan.
     *
     * @throws ScheduleConfigurationException on fewer than two players or no referees
     */
    public static SchedulePlan buildPlan(String leagueId, List<String> playerIds, List<RefereeInfo> referees) {
        if (referees == null || referees.isEmpty()) {
            throw new ScheduleConfigurationException("Need at least 1 referee for a league");
        }
        List<List<Pairing>> pairingRounds = RoundRobinScheduler.generateRounds(playerIds);
        int matchCount = pairingRounds.stream().mapToInt(List::size).sum();
        List<String> refereeIds = RefereeAssigner.assign(matchCount, referees);

        ImmutableList.Builder<ImmutableList<ScheduledMatch>> rounds = ImmutableList.builder();
        int assigned = 0;
        for (int r = 0; r < pairingRounds.size(); r++) {
            int roundNumber = r + 1;
            ImmutableList.Builder<ScheduledMatch> matches = ImmutableList.builder();
            List<Pairing> pairings = pairingRounds.get(r);
            for (int m = 0; m < pairings.size(); m++) {
                Pairing pairing = pairings.get(m);
                matches.add(new ScheduledMatch(
                    matchId(leagueId, roundNumber, m + 1),
                    roundNumber,
                    pairing.playerA(),
                    pairing.playerB(),
                    refereeIds.get(assigned++)));
            }
            rounds.add(matches.build());
        }
        return new SchedulePlan(leagueId, rounds.build());
    }

    /**
     * Deterministic match id, e.g. {@code league_2025_even_odd_R2_M003}.
     */
    public static String matchId(String leagueId, int roundNumber, int sequence) {
        return String.format("%s_R%d_M%03d", leagueId, roundNumber, sequence);
    }
}
