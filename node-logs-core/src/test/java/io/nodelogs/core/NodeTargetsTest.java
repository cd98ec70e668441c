package io.nodelogs.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NodeTargetsTest {

    @Test
    void readTargetEncodesFileName() {
        assertThat(NodeTargets.read("my log&1.txt", 4096)).isEqualTo("/logs/read?file=my+log%261.txt&offset=4096\n");
    }

    @Test
    void listAndPreviewTargets() {
        assertThat(NodeTargets.list()).isEqualTo("/logs/list\n");
        assertThat(NodeTargets.head("erigon.log")).isEqualTo("/logs/head?file=erigon.log\n");
        assertThat(NodeTargets.tail("erigon.log")).isEqualTo("/logs/tail?file=erigon.log\n");
    }
}
