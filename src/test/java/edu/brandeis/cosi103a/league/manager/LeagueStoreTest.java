package edu.brandeis.cosi103a.league.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.league.protocol.RegistrationRequest;
import edu.brandeis.cosi103a.league.scheduler.MatchScheduler;
import edu.brandeis.cosi103a.league.scheduler.RefereeInfo;
import edu.brandeis.cosi103a.league.scheduler.SchedulePlan;
import edu.brandeis.cosi103a.league.standings.PlayerStanding;
import edu.brandeis.cosi103a.league.standings.StandingsEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LeagueStoreTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void writeSchedule_createsDirectoryAndWritesJson() throws IOException {
        LeagueStore store = new LeagueStore(dataDir.resolve("nested"));
        SchedulePlan plan = MatchScheduler.buildPlan("L1", List.of("P01", "P02", "P03", "P04"),
            List.of(new RefereeInfo("REF01", "http://localhost:8001/mcp")));

        store.writeSchedule(plan);

        Path file = dataDir.resolve("nested").resolve(LeagueStore.SCHEDULE_FILE);
        assertTrue(Files.exists(file));
        try (Stream<Path> files = Files.list(dataDir.resolve("nested"))) {
            assertEquals(List.of(file), files.collect(Collectors.toList()));
        }
        JsonNode json = objectMapper.readTree(file.toFile());
        assertEquals("L1", json.get("league_id").asText());
    }

    @Test
    void writeStandings_replacesPreviousContent() throws IOException {
        LeagueStore store = new LeagueStore(dataDir);

        store.writeStandings("L1", List.of(new PlayerStanding("P01", "Alice", 0, 0, 0, 0, 0, 1)));
        store.writeStandings("L1", List.of(new PlayerStanding("P01", "Alice", 1, 0, 0, 3, 1, 1)));

        JsonNode json = objectMapper.readTree(dataDir.resolve(LeagueStore.STANDINGS_FILE).toFile());
        assertEquals(3, json.get("standings").get(0).get("points").asInt());
        assertTrue(store.exists(LeagueStore.STANDINGS_FILE));
    }

    @Test
    void writeStandings_concurrentWritersAllSucceed() throws Exception {
        LeagueStore store = new LeagueStore(dataDir);
        StandingsEngine engine = new StandingsEngine();
        engine.addPlayer("P01", "Alice");
        engine.addPlayer("P02", "Bob");
        engine.recordMatchResult("L1_R1_M001", "P01", "P02", "P01");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> writers = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                writers.add(executor.submit(() -> {
                    for (int n = 0; n < 50; n++) {
                        store.writeStandings("L1", engine.getStandings());
                    }
                    return null;
                }));
            }
            for (Future<?> writer : writers) {
                writer.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        JsonNode json = objectMapper.readTree(dataDir.resolve(LeagueStore.STANDINGS_FILE).toFile());
        assertEquals("P01", json.get("standings").get(0).get("player_id").asText());
        try (Stream<Path> files = Files.list(dataDir)) {
            assertEquals(List.of(dataDir.resolve(LeagueStore.STANDINGS_FILE)), files.collect(Collectors.toList()));
        }
    }

    @Test
    void readAgents_returnsWhatWasWritten() throws IOException {
        LeagueStore store = new LeagueStore(dataDir);
        RegisteredAgent agent = new RegisteredAgent("REF01", AgentRole.REFEREE, "Ref", "http://localhost:8001/mcp",
            ImmutableList.of(RegistrationRequest.EVEN_ODD), "1.0.0", 2, "tok_ref01_abcdefghijklmnop",
            Instant.parse("2025-01-01T00:00:00Z"));

        store.writeAgents(List.of(agent));

        assertEquals(List.of(agent), store.readAgents());
    }

    @Test
    void readAgents_isEmptyWithoutFile() throws IOException {
        assertTrue(new LeagueStore(dataDir).readAgents().isEmpty());
    }
}
