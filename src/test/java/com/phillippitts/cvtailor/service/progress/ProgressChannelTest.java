package com.phillippitts.cvtailor.service.progress;

import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressChannelTest {

    private final ProgressChannel channel = new ProgressChannel(Clock.systemUTC());

    @Test
    void shouldExposeBoundLogUntilReleased() {
        ProgressLog log = channel.open();
        channel.bind("s-1", log);

        assertThat(channel.active("s-1")).containsSame(log);

        channel.release("s-1", log);
        assertThat(channel.active("s-1")).isEmpty();
    }

    @Test
    void shouldKeepNewerRunBoundWhenOlderRunReleases() {
        ProgressLog first = channel.open();
        ProgressLog second = channel.open();
        channel.bind("s-1", first);
        channel.bind("s-1", second);

        channel.release("s-1", first);

        assertThat(channel.active("s-1")).containsSame(second);
    }

    @Test
    void shouldOpenIndependentLogs() {
        ProgressLog a = channel.open();
        ProgressLog b = channel.open();
        a.info("only a");

        assertThat(b.lines()).isEmpty();
        assertThat(a).isNotSameAs(b);
    }
}
