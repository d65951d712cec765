package com.beacon.statusservice.infrastructure.probe;

import com.beacon.statusservice.domain.ServiceState;
import com.beacon.statusservice.domain.ServiceStateProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a systemd unit state with {@code systemctl is-active}. Remote hosts are reached through
 * {@code systemctl -H host}, which tunnels over SSH.
 */
public class SystemctlServiceStateProvider implements ServiceStateProvider {

    private static final Logger log = LoggerFactory.getLogger(SystemctlServiceStateProvider.class);

    private static final Set<String> LOCAL_HOSTS = Set.of("", "localhost", "127.0.0.1", "::1");

    private final String command;
    private final String localHostName;
    private final Duration timeout;

    /**
     * @param localHostName host name that is queried without {@code -H}
     * @param timeout how long one {@code systemctl} call may run before it is killed
     */
    public SystemctlServiceStateProvider(String localHostName, Duration timeout) {
        this("systemctl", localHostName, timeout);
    }

    SystemctlServiceStateProvider(String command, String localHostName, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.command = command;
        this.localHostName = localHostName;
        this.timeout = timeout;
    }

    /**
     * Runs {@code systemctl is-active} and maps its answer. The child process never outlives the
     * call: it is killed when it overruns the timeout or when the calling thread is interrupted.
     *
     * @return {@link ServiceState#UNKNOWN} when the command did not finish within the timeout
     * @throws InterruptedException if the calling thread was interrupted; the child is killed first
     */
    @Override
    public ServiceState stateOf(String serviceName, String hostName)
            throws IOException, InterruptedException {
        List<String> commandLine = commandLine(serviceName, hostName);
        // Output goes to a file so waiting never blocks on a pipe read, which ignores interrupts.
        Path output = Files.createTempFile("beacon-systemctl-", ".out");
        Process process = null;
        try {
            process =
                    new ProcessBuilder(commandLine)
                            .redirectErrorStream(true)
                            .redirectOutput(output.toFile())
                            .start();
            if (!process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.warn("{} did not finish within {}, killing it", commandLine, timeout);
                return ServiceState.UNKNOWN;
            }
            int exitCode = process.exitValue();
            String text = Files.readString(output, StandardCharsets.UTF_8);
            ServiceState state = parse(exitCode, text);
            log.debug("{} exited {} with '{}' -> {}", commandLine, exitCode, text.trim(), state);
            return state;
        } finally {
            if (process != null) {
                kill(process);
            }
            deleteQuietly(output);
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        if (process.isAlive()) {
            process.destroyForcibly();
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove {}: {}", path, e.getMessage());
        }
    }

    List<String> commandLine(String serviceName, String hostName) {
        List<String> line = new ArrayList<>();
        line.add(command);
        if (!isLocal(hostName)) {
            line.add("-H");
            line.add(hostName);
        }
        line.add("is-active");
        line.add(serviceName);
        return line;
    }

    boolean isLocal(String hostName) {
        return hostName == null
                || LOCAL_HOSTS.contains(hostName.trim().toLowerCase())
                || hostName.equalsIgnoreCase(localHostName);
    }

    /**
     * Maps the output of {@code systemctl is-active} to a state. Exit code 0 means active; the
     * printed word distinguishes a stopped unit from a state systemd could not report.
     */
    static ServiceState parse(int exitCode, String output) {
        String word = output == null ? "" : output.trim().lines().findFirst().orElse("").trim();
        if (exitCode == 0 && "active".equals(word)) {
            return ServiceState.RUNNING;
        }
        switch (word) {
            case "inactive":
            case "failed":
                return ServiceState.STOPPED;
            default:
                return ServiceState.UNKNOWN;
        }
    }
}
