package io.fullerstack.workqueue.benchmark;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkQueueBenchmarkTest {

    @Test
    void shouldRunEveryTaskBeforeReturning() throws Exception {
        WorkQueueBenchmark benchmark = new WorkQueueBenchmark();
        benchmark.maxActive = 4;
        benchmark.tasks = 1_000;
        benchmark.setupTrial();

        long joined = benchmark.submitAndDrain();

        assertThat(joined).isEqualTo(1_000L * "new string".length());
    }
}
