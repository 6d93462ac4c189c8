package edu.brandeis.cosi103a.league.scheduler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy load balancing of referees over a sequence of matches.
 *
 * Each match, visited in (round, position) order, goes to the referee with the fewest
 * matches so far; ties go to the referee listed first. The workload counters live only
 * for the duration of one {@link #assign} call.
 */
public final class RefereeAssigner {

    private RefereeAssigner() {}

    /**
     * Picks a referee for each of {@code matchCount} matches.
     *
     * @return referee ids, one per match, in match order
     * @throws ScheduleConfigurationException if no referees are given
     */
    public static List<String> assign(int matchCount, List<RefereeInfo> referees) {
        if (referees == null || referees.isEmpty()) {
            throw new ScheduleConfigurationException("Need at least 1 referee to assign matches");
        }
        Map<String, Integer> workload = new LinkedHashMap<>();
        for (RefereeInfo referee : referees) {
            workload.putIfAbsent(referee.refereeId(), 0);
        }

        List<String> assignments = new ArrayList<>(matchCount);
        for (int i = 0; i < matchCount; i++) {
            String selected = null;
            int lowest = Integer.MAX_VALUE;
            for (Map.Entry<String, Integer> entry : workload.entrySet()) {
                if (entry.getValue() < lowest) {
                    selected = entry.getKey();
                    lowest = entry.getValue();
                }
            }
            workload.merge(selected, 1, Integer::sum);
            assignments.add(selected);
        }
        return assignments;
    }
}
