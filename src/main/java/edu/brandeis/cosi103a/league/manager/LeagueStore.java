package edu.brandeis.cosi103a.league.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.league.network.config.ObjectMapperFactory;
import edu.brandeis.cosi103a.league.scheduler.SchedulePlan;
import edu.brandeis.cosi103a.league.standings.PlayerStanding;
import edu.brandeis.cosi103a.league.tournament.Round;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes league state to JSON files in the data directory. Every write replaces the
 * whole document atomically to prevent partial writes.
 */
public class LeagueStore {

    public static final String SCHEDULE_FILE = "schedule.json";
    public static final String ROUNDS_FILE = "rounds.json";
    public static final String STANDINGS_FILE = "standings.json";
    public static final String AGENTS_FILE = "agents.json";

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public LeagueStore(Path dataDir) {
        this.dataDir = dataDir;
        this.objectMapper = ObjectMapperFactory.createIndented();
    }

    public void writeSchedule(SchedulePlan plan) throws IOException {
        writeAtomically(SCHEDULE_FILE, plan);
    }

    public void writeRounds(String leagueId, List<Round> rounds) throws IOException {
        writeAtomically(ROUNDS_FILE, Map.of("league_id", leagueId, "rounds", rounds));
    }

    public void writeStandings(String leagueId, List<PlayerStanding> standings) throws IOException {
        writeAtomically(STANDINGS_FILE, Map.of("league_id", leagueId, "standings", standings));
    }

    public void writeAgents(Collection<RegisteredAgent> agents) throws IOException {
        writeAtomically(AGENTS_FILE, agents);
    }

    /**
     * Reads previously registered agents, or an empty list if none were saved.
     */
    public List<RegisteredAgent> readAgents() throws IOException {
        Path file = dataDir.resolve(AGENTS_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        return objectMapper.readValue(file.toFile(), new TypeReference<List<RegisteredAgent>>() {});
    }

    public boolean exists(String filename) {
        return Files.exists(dataDir.resolve(filename));
    }

    public Path dataDir() {
        return dataDir;
    }

    private synchronized void writeAtomically(String filename, Object value) throws IOException {
        Files.createDirectories(dataDir);
        Path target = dataDir.resolve(filename);
        Path temp = Files.createTempFile(dataDir, filename, ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
