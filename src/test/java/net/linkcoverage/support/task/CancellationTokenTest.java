package net.linkcoverage.support.task;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import net.linkcoverage.exception.TaskCancelledException;
import net.linkcoverage.exception.TaskTimeoutException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    void should_PassCheckpoint_When_NotCancelledAndBeforeDeadline() {
        MutableClock clock = new MutableClock(Instant.parse("2025-10-01T00:00:00Z"));
        CancellationToken token = new CancellationToken("t-1", Duration.ofMinutes(30), clock);

        assertThatCode(token::checkpoint).doesNotThrowAnyException();
        assertThat(token.remaining()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void should_ThrowCancelled_When_CancelRequested() {
        CancellationToken token = new CancellationToken("t-1", Duration.ofMinutes(30), Clock.systemUTC());

        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThatThrownBy(token::checkpoint).isInstanceOf(TaskCancelledException.class);
    }

    @Test
    void should_ThrowTimeout_When_DeadlinePassed() {
        MutableClock clock = new MutableClock(Instant.parse("2025-10-01T00:00:00Z"));
        CancellationToken token = new CancellationToken("t-1", Duration.ofMinutes(30), clock);

        clock.advance(Duration.ofMinutes(31));

        assertThat(token.isExpired()).isTrue();
        assertThat(token.remaining()).isEqualTo(Duration.ZERO);
        assertThatThrownBy(token::checkpoint).isInstanceOf(TaskTimeoutException.class);
    }

    @Test
    void should_PreferCancellation_When_CancelledAndExpired() {
        MutableClock clock = new MutableClock(Instant.parse("2025-10-01T00:00:00Z"));
        CancellationToken token = new CancellationToken("t-1", Duration.ofSeconds(1), clock);
        clock.advance(Duration.ofSeconds(5));
        token.cancel();

        assertThatThrownBy(token::checkpoint).isInstanceOf(TaskCancelledException.class);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
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
}
