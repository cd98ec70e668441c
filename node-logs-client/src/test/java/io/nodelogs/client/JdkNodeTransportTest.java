package io.nodelogs.client;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JdkNodeTransportTest {

    private MockWebServer server;
    private JdkNodeTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        transport = new JdkNodeTransport(HttpClient.newHttpClient(), server.url("/").uri(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void successfulCallReturnsBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("SUCCESS: 0-4/10\nABCD"));

        NodeResponse response = transport.fetch("/logs/read?file=erigon.log&offset=0\n");

        assertThat(response.success()).isTrue();
        assertThat(response.bodyText()).isEqualTo("SUCCESS: 0-4/10\nABCD");
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/logs/read?file=erigon.log&offset=0");
    }

    @Test
    void errorStatusCarriesBodyAsErrorText() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("file not found"));

        NodeResponse response = transport.fetch("/logs/head?file=x\n");

        assertThat(response.success()).isFalse();
        assertThat(response.bodyText()).isEqualTo("file not found");
    }

    @Test
    void emptyErrorBodyNamesStatus() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));

        NodeResponse response = transport.fetch("/logs/list\n");

        assertThat(response.success()).isFalse();
        assertThat(response.bodyText()).isEqualTo("node returned status 503");
    }
}
