package io.stackcontroller.orchestration;

/**
 * The start plan cannot complete: a node failed without a restart policy, or the startup
 * budget ran out while a node was still blocked.
 */
public class UnsatisfiableDependencyException extends RuntimeException {

    private final String nodeName;
    private final String lastProbeError;

    public UnsatisfiableDependencyException(String nodeName, String lastProbeError, String message) {
        super(message);
        this.nodeName = nodeName;
        this.lastProbeError = lastProbeError;
    }

    public String getNodeName() {
        return nodeName;
    }

    public String getLastProbeError() {
        return lastProbeError;
    }
}
