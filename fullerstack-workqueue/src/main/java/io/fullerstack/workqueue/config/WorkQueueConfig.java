package io.fullerstack.workqueue.config;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;

/**
 * Work queue configuration using ResourceBundle (no extra dependencies).
 *
 * <p>Keys are written without the {@code workqueue.} prefix, e.g. {@link #MAX_ACTIVE}.
 * For a queue named {@code downloads} a lookup of {@code max-active} tries, in order:
 * <ol>
 *   <li>system property {@code workqueue.downloads.max-active}</li>
 *   <li>{@code workqueue.downloads.max-active} in workqueue.properties</li>
 *   <li>system property {@code workqueue.max-active}</li>
 *   <li>{@code workqueue.max-active} in workqueue.properties</li>
 * </ol>
 * The global configuration skips the first two steps.
 *
 * <p><strong>Example Property File:</strong>
 * <pre>
 * # workqueue.properties
 * workqueue.max-active=4
 * workqueue.thread-name-prefix=workqueue
 * workqueue.daemon-threads=true
 *
 * # builds are CPU-bound, keep them narrow
 * workqueue.builds.max-active=2
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <pre>
 * java -Dworkqueue.downloads.max-active=16 -jar app.jar
 * </pre>
 */
public class WorkQueueConfig {

    public static final String MAX_ACTIVE = "max-active";
    public static final String THREAD_NAME_PREFIX = "thread-name-prefix";
    public static final String DAEMON_THREADS = "daemon-threads";

    static final String BUNDLE = "workqueue";
    private static final String PREFIX = "workqueue.";

    private final ResourceBundle bundle;
    private final String queueName;  // null for global
    private final String context;

    private WorkQueueConfig(ResourceBundle bundle, String queueName) {
        this.bundle = bundle;
        this.queueName = queueName;
        this.context = queueName == null ? "global" : "queue:" + queueName;
    }

    /**
     * Get global configuration (workqueue.properties).
     */
    public static WorkQueueConfig global() {
        return new WorkQueueConfig(bundle(BUNDLE), null);
    }

    /**
     * Get configuration for one queue, falling back to the global keys.
     *
     * @param queueName queue name (e.g., "downloads")
     */
    public static WorkQueueConfig forQueue(String queueName) {
        return load(BUNDLE, queueName);
    }

    static WorkQueueConfig load(String baseName, String queueName) {
        Objects.requireNonNull(queueName, "queueName cannot be null");
        if (queueName.isBlank()) {
            throw new IllegalArgumentException("queueName cannot be blank");
        }
        return new WorkQueueConfig(bundle(baseName), queueName);
    }

    private static ResourceBundle bundle(String baseName) {
        try {
            return ResourceBundle.getBundle(baseName, Locale.ROOT);
        } catch (MissingResourceException e) {
            throw new ConfigurationException("Missing configuration bundle '" + baseName + "'", e);
        }
    }

    // =========================================================================
    // Lookup
    // =========================================================================

    private String lookup(String key) {
        if (queueName != null) {
            String value = lookupQualified(PREFIX + queueName + "." + key);
            if (value != null) {
                return value;
            }
        }
        return lookupQualified(PREFIX + key);
    }

    private String lookupQualified(String qualifiedKey) {
        String sysProp = System.getProperty(qualifiedKey);
        if (sysProp != null) {
            return sysProp.trim();
        }
        return bundle.containsKey(qualifiedKey) ? bundle.getString(qualifiedKey).trim() : null;
    }

    // =========================================================================
    // Type-safe getters
    // =========================================================================

    /**
     * @throws ConfigurationException if key not found
     */
    public String getString(String key) {
        String value = lookup(key);
        if (value == null) {
            throw new ConfigurationException(
                "Missing config key '" + key + "' in context: " + context
            );
        }
        return value;
    }

    public String getString(String key, String defaultValue) {
        String value = lookup(key);
        return value != null ? value : defaultValue;
    }

    /**
     * @throws ConfigurationException if key not found or invalid format
     */
    public int getInt(String key) {
        String value = getString(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid int value for key '" + key + "' in context " + context + ": " + value, e
            );
        }
    }

    /**
     * Get int value with default. An unparseable value also yields the default.
     */
    public int getInt(String key, int defaultValue) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Accepts only {@code true} or {@code false}, ignoring case.
     *
     * @throws ConfigurationException if key not found or invalid format
     */
    public boolean getBoolean(String key) {
        return parseBoolean(key, getString(key));
    }

    /**
     * @throws ConfigurationException if the key is set to something other than true or false
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        String value = lookup(key);
        return value != null ? parseBoolean(key, value) : defaultValue;
    }

    private boolean parseBoolean(String key, String value) {
        String normalized = value.trim();
        if (normalized.equalsIgnoreCase("true")) {
            return true;
        }
        if (normalized.equalsIgnoreCase("false")) {
            return false;
        }
        throw new ConfigurationException(
            "Invalid boolean value for key '" + key + "' in context " + context + ": " + value
        );
    }

    /**
     * Check if key resolves at this level or a fallback level.
     */
    public boolean contains(String key) {
        return lookup(key) != null;
    }

    /**
     * Get configuration context (for debugging).
     *
     * @return "global" or "queue:{name}"
     */
    public String context() {
        return context;
    }

    @Override
    public String toString() {
        return "WorkQueueConfig[context=" + context + "]";
    }
}
