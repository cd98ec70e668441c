package io.nodelogs.client;

import io.nodelogs.core.RequestOutcome;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteRequestTest {

    @Test
    void newRequestIsPending() {
        RemoteRequest request = new RemoteRequest("/logs/list\n");

        RequestOutcome outcome = request.outcome();
        assertThat(outcome.served()).isFalse();
        assertThat(outcome.attempt()).isZero();
        assertThat(outcome.hasError()).isFalse();
    }

    @Test
    void everyRecordedOutcomeCountsAnAttempt() {
        RemoteRequest request = new RemoteRequest("/logs/list\n");

        request.recordFailure("timeout");
        request.restart();
        assertThat(request.outcome().served()).isFalse();
        assertThat(request.outcome().attempt()).isEqualTo(1);

        request.recordFailure("timeout");
        RequestOutcome done = request.recordSuccess("SUCCESS\n".getBytes(StandardCharsets.UTF_8));

        assertThat(done.served()).isTrue();
        assertThat(done.hasError()).isFalse();
        assertThat(done.attempt()).isEqualTo(3);
    }

    @Test
    void recordedPayloadIsIsolatedFromCaller() {
        RemoteRequest request = new RemoteRequest("/logs/list\n");
        byte[] body = "SUCCESS\n".getBytes(StandardCharsets.UTF_8);

        RequestOutcome done = request.recordSuccess(body);
        body[0] = 'X';

        assertThat(request.outcome().payload()).isEqualTo("SUCCESS\n".getBytes(StandardCharsets.UTF_8));
        assertThat(done).isEqualTo(RequestOutcome.success("SUCCESS\n".getBytes(StandardCharsets.UTF_8), 1));
    }

    @Test
    void channelHandsRequestsOverInOrderWithoutBlocking() throws Exception {
        RequestChannel channel = new RequestChannel();
        for (int i = 0; i < 1000; i++) {
            channel.submit("/logs/read?file=a&offset=" + i + "\n");
        }

        assertThat(channel.pending()).isEqualTo(1000);
        assertThat(channel.take().target()).isEqualTo("/logs/read?file=a&offset=0\n");
        assertThat(channel.poll(Duration.ofMillis(10)).target()).isEqualTo("/logs/read?file=a&offset=1\n");
    }

    @Test
    void snapshotReflectsLatestOutcome() {
        RequestChannel channel = new RequestChannel();
        RemoteRequest request = channel.submit("/logs/list\n");

        request.recordFailure("boom");

        RequestOutcome snapshot = channel.snapshot(request);
        assertThat(snapshot.served()).isTrue();
        assertThat(snapshot.error()).isEqualTo("boom");
        assertThat(snapshot.attempt()).isEqualTo(1);
    }
}
