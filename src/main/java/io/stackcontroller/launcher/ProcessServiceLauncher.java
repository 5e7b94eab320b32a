package io.stackcontroller.launcher;

import io.stackcontroller.models.ServiceNode;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Launches nodes as child processes with {@link ProcessBuilder}. Nodes without a command are
 * treated as externally managed and get a handle that is always alive.
 */
@Slf4j
public class ProcessServiceLauncher implements ServiceLauncher {

    @Override
    public ServiceHandle start(ServiceNode node) throws IOException {
        if (node.isExternal()) {
            log.info("[Node: {}] No start command, treating as externally managed", node.getName());
            return new ExternalServiceHandle();
        }
        ProcessBuilder builder = new ProcessBuilder(node.getCommand()).inheritIO();
        if (node.getWorkingDirectory() != null && !node.getWorkingDirectory().isBlank()) {
            builder.directory(new File(node.getWorkingDirectory()));
        }
        builder.environment().putAll(node.getEnvironment());
        Process process = builder.start();
        log.info("[Node: {}] Started process pid={} command={}", node.getName(), process.pid(), node.getCommand());
        return new ProcessServiceHandle(process);
    }

    static class ProcessServiceHandle implements ServiceHandle {

        private final Process process;
        private final CompletableFuture<Integer> exit;

        ProcessServiceHandle(Process process) {
            this.process = process;
            this.exit = process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void requestStop() {
            process.destroy();
        }

        @Override
        public void forceStop() {
            process.destroyForcibly();
        }
    }

    static class ExternalServiceHandle implements ServiceHandle {

        private final CompletableFuture<Integer> exit = new CompletableFuture<>();

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public boolean isAlive() {
            return !exit.isDone();
        }

        @Override
        public void requestStop() {
            exit.complete(0);
        }

        @Override
        public void forceStop() {
            exit.complete(0);
        }
    }
}
