package io.nodelogs.server.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryStringTest {

    @Test
    void parseDecodesKeysAndValues() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/logs/s1/download?file=my+log%261.txt&size=10"));
        assertThat(parsed).containsEntry("file", "my log&1.txt");
        assertThat(parsed).containsEntry("size", "10");
    }

    @Test
    void parseHandlesMissingValueAsEmpty() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/logs/s1/head?file"));
        assertThat(parsed).containsEntry("file", "");
    }

    @Test
    void parseWithoutQueryIsEmpty() {
        assertThat(QueryString.parse(URI.create("http://localhost/logs/s1"))).isEmpty();
    }
}
