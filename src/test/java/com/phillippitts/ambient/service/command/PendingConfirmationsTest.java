package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.config.properties.CommandProperties;
import com.phillippitts.ambient.domain.Clarification;
import com.phillippitts.ambient.service.command.clarifier.ClarifierReply;
import com.phillippitts.ambient.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PendingConfirmationsTest {

    private static final ClarifierReply REPLY = new ClarifierReply("Play music", List.of("open spotify"), 0.8);

    private MutableClock clock;
    private PendingConfirmations pending;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
        pending = new PendingConfirmations(new CommandProperties(0.7, 2500, 60_000, 50, 5), clock);
    }

    @Test
    void shouldTakeClarificationOnlyOnce() {
        Clarification c = pending.register("s1", REPLY);

        assertThat(c.expiresAt()).isEqualTo(clock.instant().plusSeconds(60));
        assertThat(pending.take(c.requestId())).contains(c);
        assertThat(pending.take(c.requestId())).isEmpty();
    }

    @Test
    void shouldReplacePreviousClarificationForSameSession() {
        Clarification first = pending.register("s1", REPLY);
        Clarification second = pending.register("s1", REPLY);

        assertThat(pending.pendingFor("s1")).contains(second);
        assertThat(pending.take(first.requestId())).isEmpty();
        assertThat(pending.take(second.requestId())).isPresent();
    }

    @Test
    void shouldKeepSessionsIndependent() {
        Clarification a = pending.register("a", REPLY);
        Clarification b = pending.register("b", REPLY);

        assertThat(pending.take(a.requestId())).isPresent();
        assertThat(pending.pendingFor("b")).contains(b);
    }

    @Test
    void expiredClarificationCannotBeTaken() {
        Clarification c = pending.register("s1", REPLY);

        clock.advance(Duration.ofSeconds(60));

        assertThat(pending.pendingFor("s1")).isEmpty();
        assertThat(pending.take(c.requestId())).isEmpty();
    }

    @Test
    void blankSessionMapsToDefault() {
        Clarification c = pending.register(null, REPLY);

        assertThat(c.sessionId()).isEqualTo(PendingConfirmations.DEFAULT_SESSION);
        assertThat(pending.pendingFor(" ")).contains(c);
        assertThat(pending.take("unknown")).isEmpty();
        assertThat(pending.take(null)).isEmpty();
    }

    @Test
    void shouldEvictExpiredClarificationsFromOtherSessionsOnRegister() {
        for (int i = 0; i < 500; i++) {
            pending.register("session-" + i, REPLY);
        }
        assertThat(pending.size()).isEqualTo(500);

        clock.advance(Duration.ofHours(1));
        Clarification fresh = pending.register("late", REPLY);

        assertThat(pending.size()).isEqualTo(1);
        assertThat(pending.pendingFor("session-0")).isEmpty();
        assertThat(pending.pendingFor("late")).contains(fresh);
    }

    @Test
    void shouldKeepUnexpiredClarificationsWhenSweeping() {
        Clarification early = pending.register("early", REPLY);
        clock.advance(Duration.ofSeconds(30));
        Clarification recent = pending.register("recent", REPLY);

        clock.advance(Duration.ofSeconds(45));
        pending.register("latest", REPLY);

        assertThat(pending.size()).isEqualTo(2);
        assertThat(pending.take(early.requestId())).isEmpty();
        assertThat(pending.take(recent.requestId())).contains(recent);
    }
}
