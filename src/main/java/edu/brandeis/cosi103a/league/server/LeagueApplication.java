package edu.brandeis.cosi103a.league.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.league.broadcast.RetryPolicy;
import edu.brandeis.cosi103a.league.network.HttpClientWrapper;
import edu.brandeis.cosi103a.league.network.JsonRpcClient;
import edu.brandeis.cosi103a.league.network.RpcClient;
import edu.brandeis.cosi103a.league.network.config.ObjectMapperFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Duration;

/**
 * Runs one league agent. {@code league.role} selects whether this process is the league
 * manager, a referee or a player.
 */
@SpringBootApplication(scanBasePackages = "edu.brandeis.cosi103a.league")
public class LeagueApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeagueApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }

    @Bean
    public HttpClientWrapper httpClientWrapper() {
        return new HttpClientWrapper.Default();
    }

    @Bean
    public RpcClient rpcClient(HttpClientWrapper httpClientWrapper, ObjectMapper objectMapper) {
        return new JsonRpcClient(httpClientWrapper, objectMapper);
    }

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${league.broadcast.max-retries:2}") int maxRetries,
            @Value("${league.broadcast.request-timeout-ms:5000}") long requestTimeoutMs,
            @Value("${league.broadcast.backoff-unit-ms:500}") long backoffUnitMs) {
        return new RetryPolicy(maxRetries, Duration.ofMillis(requestTimeoutMs), Duration.ofMillis(backoffUnitMs));
    }
}
