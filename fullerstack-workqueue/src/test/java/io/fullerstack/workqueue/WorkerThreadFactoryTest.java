package io.fullerstack.workqueue;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerThreadFactoryTest {

    @Test
    void shouldNumberThreadsPerFactory() {
        WorkerThreadFactory factory = new WorkerThreadFactory("pool", "downloads", true);

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertThat(first.getName()).isEqualTo("pool-downloads-1");
        assertThat(second.getName()).isEqualTo("pool-downloads-2");
        assertThat(first.isDaemon()).isTrue();
    }

    @Test
    void shouldHonourDaemonFlag() {
        WorkerThreadFactory factory = new WorkerThreadFactory("pool", "builds", false);

        assertThat(factory.newThread(() -> { }).isDaemon()).isFalse();
    }
}
