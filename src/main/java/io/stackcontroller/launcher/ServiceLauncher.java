package io.stackcontroller.launcher;

import io.stackcontroller.models.ServiceNode;

import java.io.IOException;

/**
 * Starts the process behind a service node.
 */
public interface ServiceLauncher {

    ServiceHandle start(ServiceNode node) throws IOException;
}
