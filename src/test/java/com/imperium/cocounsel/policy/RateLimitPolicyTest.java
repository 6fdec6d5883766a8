package com.imperium.cocounsel.policy;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitPolicyTest {

    /** 可拨动的测试时钟 */
    private static final class MutableClock extends Clock {

        private Instant now = Instant.parse("2026-03-14T10:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final MutableClock clock = new MutableClock();

    @Test
    void twentyFirstRequestInWindowIsDenied() {
        RateLimitPolicy policy = new RateLimitPolicy(clock);

        for (int i = 0; i < RateLimitPolicy.DEFAULT_MAX_REQUESTS; i++) {
            assertThat(policy.allow("u1", "10.0.0.1")).as("request %d", i + 1).isTrue();
        }
        assertThat(policy.allow("u1", "10.0.0.1")).isFalse();
        assertThat(policy.allow("u1", "10.0.0.1")).isFalse();
    }

    @Test
    void windowResetsAfterExpiry() {
        RateLimitPolicy policy = new RateLimitPolicy(clock, 1_000L, 1);

        assertThat(policy.allow("u1", "ip")).isTrue();
        assertThat(policy.allow("u1", "ip")).isFalse();

        clock.advance(Duration.ofMillis(1_001));

        assertThat(policy.allow("u1", "ip")).isTrue();
    }

    @Test
    void keysAreIndependent() {
        RateLimitPolicy policy = new RateLimitPolicy(clock, 60_000L, 1);

        assertThat(policy.allow("u1", "ip")).isTrue();
        assertThat(policy.allow("u2", "ip")).isTrue();
        assertThat(policy.allow("u1", "other-ip")).isTrue();
        assertThat(policy.allow("u1", "ip")).isFalse();
    }
}
