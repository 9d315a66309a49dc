package com.careline.alert.escalation;

import com.careline.alert.model.CooldownKey;
import com.careline.alert.model.EscalationReasonKind;
import com.careline.alert.repository.CooldownRepository;
import io.r2dbc.h2.H2ConnectionConfiguration;
import io.r2dbc.h2.H2ConnectionFactory;
import io.r2dbc.spi.ConnectionFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.r2dbc.repository.support.R2dbcRepositoryFactory;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the cooldown SQL against a file-backed H2 database, the same kind the
 * service uses outside of tests.
 */
class R2dbcCooldownStoreTest {

    private static final Instant NOTIFIED_AT = Instant.parse("2025-08-10T08:00:00Z");
    private static final Duration COOLDOWN = Duration.ofHours(12);
    private static final CooldownKey KEY = CooldownKey.of("s-001", EscalationReasonKind.HIGH_PAIN);

    @TempDir
    Path dataDir;

    private R2dbcCooldownStore openStore() {
        ConnectionFactory connectionFactory = new H2ConnectionFactory(H2ConnectionConfiguration.builder()
            .file(dataDir.resolve("alertdb").toAbsolutePath().toString())
            .username("sa")
            .password("")
            .build());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).populate(connectionFactory).block();

        CooldownRepository repository = new R2dbcRepositoryFactory(new R2dbcEntityTemplate(connectionFactory))
            .getRepository(CooldownRepository.class);
        return new R2dbcCooldownStore(repository);
    }

    @Test
    @DisplayName("Cooldown written before a restart is still in force after it")
    void testCooldownSurvivesReopen() {
        openStore().markNotified(KEY, NOTIFIED_AT).block();

        R2dbcCooldownStore reopened = openStore();

        StepVerifier.create(reopened.lastNotified(KEY))
            .expectNext(NOTIFIED_AT)
            .verifyComplete();
        StepVerifier.create(reopened.claim(KEY, NOTIFIED_AT.plus(Duration.ofHours(1)), COOLDOWN))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    @DisplayName("Claim inserts a new pair, refuses while cooling and re-arms at the boundary")
    void testClaimLifecycle() {
        R2dbcCooldownStore store = openStore();

        StepVerifier.create(store.claim(KEY, NOTIFIED_AT, COOLDOWN))
            .expectNext(true)
            .verifyComplete();
        StepVerifier.create(store.claim(KEY, NOTIFIED_AT.plus(Duration.ofHours(11).plusMinutes(59)), COOLDOWN))
            .expectNext(false)
            .verifyComplete();
        StepVerifier.create(store.lastNotified(KEY))
            .expectNext(NOTIFIED_AT)
            .verifyComplete();

        Instant rearmed = NOTIFIED_AT.plus(COOLDOWN);
        StepVerifier.create(store.claim(KEY, rearmed, COOLDOWN))
            .expectNext(true)
            .verifyComplete();
        StepVerifier.create(store.lastNotified(KEY))
            .expectNext(rearmed)
            .verifyComplete();
    }

    @Test
    @DisplayName("Only one of several claims on a new pair wins")
    void testCompetingClaims() {
        R2dbcCooldownStore store = openStore();

        List<Boolean> results = Flux.merge(
                store.claim(KEY, NOTIFIED_AT, COOLDOWN),
                store.claim(KEY, NOTIFIED_AT, COOLDOWN),
                store.claim(KEY, NOTIFIED_AT, COOLDOWN))
            .collectList()
            .block();

        assertThat(results).containsOnlyOnce(true).hasSize(3);
    }

    @Test
    @DisplayName("Marking again replaces the stored time for the pair")
    void testMarkNotifiedUpserts() {
        R2dbcCooldownStore store = openStore();
        Instant later = NOTIFIED_AT.plus(Duration.ofHours(13));

        store.markNotified(KEY, NOTIFIED_AT).then(store.markNotified(KEY, later)).block();

        StepVerifier.create(store.lastNotified(KEY))
            .expectNext(later)
            .verifyComplete();
    }
}
