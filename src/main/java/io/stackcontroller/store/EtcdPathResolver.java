package io.stackcontroller.store;

import static io.stackcontroller.config.Constants.*;

/**
 * Centralized etcd key layout for broker queues, dead letters and leases.
 * Every key lives under a namespace so that two tiers sharing one etcd cluster still never
 * see each other's keys; isolation itself comes from separate clients per tier.
 */
public class EtcdPathResolver {

    private final String namespace;

    public EtcdPathResolver(String namespace) {
        String trimmed = namespace == null ? "" : namespace.trim();
        while (trimmed.endsWith(PATH_DELIMITER)) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (!trimmed.startsWith(PATH_DELIMITER)) {
            trimmed = PATH_DELIMITER + trimmed;
        }
        this.namespace = trimmed;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Pattern: /&lt;ns&gt;/queues/&lt;queue&gt;/ready/
     */
    public String getReadyPrefix(String queueName) {
        return join(namespace, PATH_QUEUES, queueName, PATH_READY) + PATH_DELIMITER;
    }

    /**
     * Ready keys sort by delivery time, then by task id.
     * Pattern: /&lt;ns&gt;/queues/&lt;queue&gt;/ready/&lt;zero-padded-epoch-millis&gt;-&lt;task-id&gt;
     */
    public String getReadyPath(String queueName, long readyAtMillis, String taskId) {
        return getReadyPrefix(queueName) + String.format("%015d", readyAtMillis) + "-" + taskId;
    }

    /**
     * Inverse of the timestamp part of {@link #getReadyPath}.
     */
    public long parseReadyAtMillis(String readyPath) {
        String leaf = readyPath.substring(readyPath.lastIndexOf(PATH_DELIMITER) + 1);
        int dash = leaf.indexOf('-');
        return Long.parseLong(dash > 0 ? leaf.substring(0, dash) : leaf);
    }

    /**
     * Pattern: /&lt;ns&gt;/queues/&lt;queue&gt;/in-flight/
     */
    public String getInFlightPrefix(String queueName) {
        return join(namespace, PATH_QUEUES, queueName, PATH_IN_FLIGHT) + PATH_DELIMITER;
    }

    public String getInFlightPath(String queueName, String receipt) {
        return getInFlightPrefix(queueName) + receipt;
    }

    /**
     * Pattern: /&lt;ns&gt;/dead-letters/&lt;queue&gt;/
     */
    public String getDeadLetterPrefix(String queueName) {
        return join(namespace, PATH_DEAD_LETTERS, queueName) + PATH_DELIMITER;
    }

    public String getDeadLetterPath(String queueName, String taskId) {
        return getDeadLetterPrefix(queueName) + taskId;
    }

    /**
     * Pattern: /&lt;ns&gt;/leases/&lt;key&gt;
     */
    public String getLeasePath(String leaseKey) {
        return join(namespace, PATH_LEASES, leaseKey);
    }

    private static String join(String first, String... rest) {
        StringBuilder path = new StringBuilder(first);
        for (String segment : rest) {
            path.append(PATH_DELIMITER).append(segment);
        }
        return path.toString();
    }
}
