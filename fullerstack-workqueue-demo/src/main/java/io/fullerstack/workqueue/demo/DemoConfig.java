package io.fullerstack.workqueue.demo;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Demo configuration
 *
 * @param maxActive  queue capacity (DEMO_MAX_ACTIVE)
 * @param deadline   how long the demo waits before giving up (DEMO_DEADLINE_MS)
 * @param taskSleeps one sleeping task per entry (DEMO_TASK_SLEEPS_MS, comma separated)
 */
public record DemoConfig(
    int maxActive,
    Duration deadline,
    List<Duration> taskSleeps
) {

    public static DemoConfig fromArgs(String... args) {
        return fromEnvironment(System.getenv());
    }

    static DemoConfig fromEnvironment(Map<String, String> env) {
        int maxActive = Integer.parseInt(env.getOrDefault(
            "DEMO_MAX_ACTIVE",
            "2"
        ).trim());

        Duration deadline = Duration.ofMillis(Long.parseLong(env.getOrDefault(
            "DEMO_DEADLINE_MS",
            "4000"
        ).trim()));

        List<Duration> taskSleeps = Arrays.stream(env.getOrDefault(
                "DEMO_TASK_SLEEPS_MS",
                "5000,3000,6000"
            ).split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(s -> Duration.ofMillis(Long.parseLong(s)))
            .collect(Collectors.toList());

        return new DemoConfig(maxActive, deadline, taskSleeps);
    }
}
