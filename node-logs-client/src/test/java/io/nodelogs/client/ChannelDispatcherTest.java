package io.nodelogs.client;

import io.nodelogs.core.LogAccessConfig;
import io.nodelogs.core.RequestOutcome;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelDispatcherTest {

    private final RequestChannel channel = new RequestChannel();

    @Test
    void retriesSameRequestUntilSuccess() {
        FakeNode node = new FakeNode(64).file("erigon.log", "hello").failNext(2);
        ChannelDispatcher dispatcher = new ChannelDispatcher(channel, node, LogAccessConfig.defaults());
        RemoteRequest request = channel.submit("/logs/read?file=erigon.log&offset=0\n");

        dispatcher.dispatch(request);

        RequestOutcome outcome = request.outcome();
        assertThat(outcome.served()).isTrue();
        assertThat(outcome.hasError()).isFalse();
        assertThat(outcome.attempt()).isEqualTo(3);
        assertThat(new String(outcome.payload(), StandardCharsets.US_ASCII)).isEqualTo("SUCCESS: 0-5/5\nhello");
    }

    @Test
    void stopsAtRetryCeiling() {
        FakeNode node = new FakeNode(64).failNext(100);
        ChannelDispatcher dispatcher = new ChannelDispatcher(channel, node,
                LogAccessConfig.builder().retryCeiling(4).build());
        RemoteRequest request = channel.submit("/logs/list\n");

        dispatcher.dispatch(request);

        assertThat(request.outcome().error()).isEqualTo("node busy");
        assertThat(request.outcome().attempt()).isEqualTo(4);
        assertThat(node.calls()).isEqualTo(4);
    }

    @Test
    void transportExceptionsAreRecordedAsFailures() {
        NodeTransport broken = target -> {
            throw new java.io.IOException("connection refused");
        };
        ChannelDispatcher dispatcher = new ChannelDispatcher(channel, broken,
                LogAccessConfig.builder().retryCeiling(2).build());
        RemoteRequest request = channel.submit("/logs/list\n");

        dispatcher.dispatch(request);

        assertThat(request.outcome().error()).isEqualTo("connection refused");
        assertThat(request.outcome().attempt()).isEqualTo(2);
    }

    @Test
    void closeStopsDispatchBlockedInFetch() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch fetching = new CountDownLatch(1);
        NodeTransport slow = target -> {
            calls.incrementAndGet();
            fetching.countDown();
            Thread.sleep(200);
            return NodeResponse.failure("node busy");
        };
        ChannelDispatcher dispatcher = new ChannelDispatcher(channel, slow,
                LogAccessConfig.builder().retryCeiling(4).build()).start();
        RemoteRequest request = channel.submit("/logs/list\n");

        assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();
        dispatcher.close();
        Thread.sleep(400);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(request.outcome().served()).isFalse();
    }
}
