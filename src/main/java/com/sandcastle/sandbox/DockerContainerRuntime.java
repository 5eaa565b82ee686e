package com.sandcastle.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.command.StopContainerCmd;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.BlkioStatEntry;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.RestartPolicy;
import com.github.dockerjava.api.model.Statistics;
import com.github.dockerjava.api.model.StatisticNetworksConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import com.sandcastle.core.error.ContainerRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Docker-based {@link ContainerRuntime}.
 * Creates one long-running container per sandbox.
 *
 * <p>Each container is:
 * <ul>
 *   <li>named {@code <prefix>-<sandboxId>} and labelled with the sandbox id</li>
 *   <li>bind-mounted to the sandbox's repository directory</li>
 *   <li>limited to the resource tier's CPU and memory</li>
 *   <li>restarted by the daemon unless explicitly stopped</li>
 * </ul>
 *
 * <p>Sandbox ids are resolved to container ids through a {@link ContainerIdCache};
 * on a miss the container is looked up by name, then by label.
 */
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);

    private static final long LOG_TIMEOUT_SECONDS = 30;
    private static final long STATS_TIMEOUT_SECONDS = 15;

    private final DockerClient dockerClient;
    private final ContainerIdCache idCache;
    private final String containerPrefix;

    public DockerContainerRuntime(DockerClient dockerClient, ContainerIdCache idCache, String containerPrefix) {
        this.dockerClient = dockerClient;
        this.idCache = idCache;
        this.containerPrefix = containerPrefix != null ? containerPrefix : "sandcastle";
    }

    public String containerName(String sandboxId) {
        return containerPrefix + "-" + sandboxId;
    }

    @Override
    public ContainerRef create(ContainerSpec spec) {
        String sandboxId = spec.sandboxId();
        String containerName = spec.containerName() != null ? spec.containerName() : containerName(sandboxId);
        ensureImage(sandboxId, spec.image());

        var binds = spec.binds().stream()
                .map(m -> new Bind(m.hostPath(), new Volume(m.containerPath()),
                        m.readOnly() ? AccessMode.ro : AccessMode.rw))
                .toArray(Bind[]::new);

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(binds)
                .withNanoCPUs((long) (spec.cpuCores() * 1_000_000_000L))
                .withMemory(spec.memoryBytes())
                .withRestartPolicy(RestartPolicy.unlessStoppedRestart());
        if (spec.network() != null && !spec.network().isBlank()) {
            hostConfig.withNetworkMode(spec.network());
        }

        var envList = new ArrayList<String>();
        spec.env().forEach((k, v) -> envList.add(k + "=" + v));

        String containerId;
        try {
            var response = dockerClient.createContainerCmd(spec.image())
                    .withName(containerName)
                    .withLabels(spec.labels())
                    .withEnv(envList)
                    .withWorkingDir(spec.workdir())
                    .withCmd(spec.command())
                    .withHostConfig(hostConfig)
                    .exec();
            containerId = response.getId();
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException(sandboxId, "create", e.getMessage(), e);
        }
        idCache.put(sandboxId, containerId);
        log.info("Created container {} ({}) for sandbox {} from {}", containerName, containerId, sandboxId, spec.image());

        if (spec.start()) {
            try {
                dockerClient.startContainerCmd(containerId).exec();
            } catch (RuntimeException e) {
                var failure = new ContainerRuntimeException(sandboxId, "create", "container did not start: " + e.getMessage(), e);
                removeQuietly(sandboxId, containerId, failure);
                throw failure;
            }
            log.info("Started container {} for sandbox {}", containerName, sandboxId);
        }
        return new ContainerRef(containerId, containerName, ContainerLabels.urls(spec.labels()));
    }

    @Override
    public void start(String sandboxId) {
        onContainer(sandboxId, "start", containerId -> {
            var state = dockerClient.inspectContainerCmd(containerId).exec().getState();
            if (state != null && Boolean.TRUE.equals(state.getPaused())) {
                dockerClient.unpauseContainerCmd(containerId).exec();
                log.info("Resumed paused container for sandbox {}", sandboxId);
                return null;
            }
            try {
                dockerClient.startContainerCmd(containerId).exec();
            } catch (NotModifiedException e) {
                log.debug("Container for sandbox {} already running", sandboxId);
            }
            return null;
        });
    }

    @Override
    public void stop(String sandboxId, Integer timeoutSeconds) {
        onContainer(sandboxId, "stop", containerId -> {
            stopContainer(sandboxId, containerId, timeoutSeconds);
            return null;
        });
    }

    /**
     * Stop followed by start, so the timeout is honoured exactly as in {@link #stop}.
     */
    @Override
    public void restart(String sandboxId, Integer timeoutSeconds) {
        onContainer(sandboxId, "restart", containerId -> {
            stopContainer(sandboxId, containerId, timeoutSeconds);
            dockerClient.startContainerCmd(containerId).exec();
            return null;
        });
    }

    @Override
    public void pause(String sandboxId) {
        onContainer(sandboxId, "pause", containerId -> {
            dockerClient.pauseContainerCmd(containerId).exec();
            return null;
        });
    }

    @Override
    public void unpause(String sandboxId) {
        onContainer(sandboxId, "unpause", containerId -> {
            var state = dockerClient.inspectContainerCmd(containerId).exec().getState();
            if (state != null && Boolean.TRUE.equals(state.getPaused())) {
                dockerClient.unpauseContainerCmd(containerId).exec();
            } else {
                try {
                    dockerClient.startContainerCmd(containerId).exec();
                } catch (NotModifiedException e) {
                    log.debug("Container for sandbox {} already running", sandboxId);
                }
            }
            return null;
        });
    }

    @Override
    public void delete(String sandboxId, boolean removeVolumes) {
        try {
            onContainer(sandboxId, "delete", containerId -> {
                dockerClient.removeContainerCmd(containerId)
                        .withForce(true)
                        .withRemoveVolumes(removeVolumes)
                        .exec();
                return null;
            });
        } finally {
            idCache.invalidate(sandboxId);
        }
        log.info("Removed container for sandbox {}", sandboxId);
    }

    @Override
    public ExecResult exec(String sandboxId, List<String> command, ExecOptions options) {
        return onContainer(sandboxId, "exec", containerId -> {
            var createCmd = dockerClient.execCreateCmd(containerId)
                    .withCmd(command.toArray(new String[0]))
                    .withAttachStdout(true)
                    .withAttachStderr(true);
            if (options.workingDir() != null) {
                createCmd.withWorkingDir(options.workingDir());
            }
            if (!options.env().isEmpty()) {
                var envList = new ArrayList<String>();
                options.env().forEach((k, v) -> envList.add(k + "=" + v));
                createCmd.withEnv(envList);
            }
            if (options.user() != null) {
                createCmd.withUser(options.user());
            }
            String execId = createCmd.exec().getId();

            var stdout = new StringBuilder();
            var stderr = new StringBuilder();
            try {
                dockerClient.execStartCmd(execId)
                        .exec(new ResultCallback.Adapter<Frame>() {
                            @Override
                            public void onNext(Frame frame) {
                                String payload = new String(frame.getPayload(), StandardCharsets.UTF_8);
                                if (frame.getStreamType() == StreamType.STDERR) {
                                    stderr.append(payload);
                                } else {
                                    stdout.append(payload);
                                }
                            }
                        }).awaitCompletion();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerRuntimeException(sandboxId, "exec", "interrupted while waiting for command", e);
            }

            Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
            return new ExecResult(exitCode != null ? exitCode.intValue() : -1, stdout.toString(), stderr.toString());
        });
    }

    @Override
    public List<String> getLogs(String sandboxId, LogOptions options) {
        return onContainer(sandboxId, "logs", containerId -> {
            var cmd = dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .withTimestamps(options.timestamps());
            if (options.tail() != null) {
                cmd.withTail(options.tail());
            }
            if (options.since() != null) {
                cmd.withSince((int) options.since().getEpochSecond());
            }
            var sb = new StringBuilder();
            LogContainerResultCallback callback = new LogContainerResultCallback() {
                @Override
                public void onNext(Frame frame) {
                    sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                }
            };
            try (LogContainerResultCallback stream = cmd.exec(callback)) {
                if (!stream.awaitCompletion(LOG_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    throw new ContainerRuntimeException(sandboxId, "logs",
                            "timed out after %d s reading logs".formatted(LOG_TIMEOUT_SECONDS));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerRuntimeException(sandboxId, "logs", "interrupted while reading logs", e);
            } catch (IOException e) {
                throw new ContainerRuntimeException(sandboxId, "logs", "could not close log stream: " + e.getMessage(), e);
            }
            return splitLines(sb.toString());
        });
    }

    @Override
    public ContainerStats getStats(String sandboxId) {
        return onContainer(sandboxId, "stats", containerId -> {
            var latest = new AtomicReference<Statistics>();
            ResultCallback.Adapter<Statistics> callback = new ResultCallback.Adapter<>() {
                @Override
                public void onNext(Statistics statistics) {
                    latest.set(statistics);
                }
            };
            try (ResultCallback.Adapter<Statistics> stream = dockerClient.statsCmd(containerId)
                    .withNoStream(true)
                    .exec(callback)) {
                if (!stream.awaitCompletion(STATS_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    throw new ContainerRuntimeException(sandboxId, "stats",
                            "timed out after %d s reading stats".formatted(STATS_TIMEOUT_SECONDS));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerRuntimeException(sandboxId, "stats", "interrupted while reading stats", e);
            } catch (IOException e) {
                throw new ContainerRuntimeException(sandboxId, "stats", "could not close stats stream: " + e.getMessage(), e);
            }
            if (latest.get() == null) {
                throw new ContainerRuntimeException(sandboxId, "stats", "runtime returned no statistics");
            }
            return toStats(latest.get());
        });
    }

    @Override
    public ContainerState getState(String sandboxId) {
        return onContainer(sandboxId, "state", containerId ->
                mapState(dockerClient.inspectContainerCmd(containerId).exec().getState()));
    }

    @Override
    public boolean healthCheck() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (Exception e) {
            log.warn("Docker daemon ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public RuntimeInfo getInfo() {
        try {
            var info = dockerClient.infoCmd().exec();
            var version = dockerClient.versionCmd().exec();
            return new RuntimeInfo(
                    version.getVersion(),
                    version.getApiVersion(),
                    info.getOperatingSystem(),
                    info.getArchitecture(),
                    orZero(info.getNCPU()),
                    info.getMemTotal() != null ? info.getMemTotal() : 0L,
                    orZero(info.getContainersRunning()),
                    orZero(info.getContainersStopped()),
                    orZero(info.getImages()));
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException("-", "info", e.getMessage(), e);
        }
    }

    // ── Container resolution ──

    /**
     * Resolves the container and runs {@code action} against it, translating
     * Docker failures into {@link ContainerRuntimeException}. A stale cached id
     * is dropped and the lookup retried once.
     */
    private <T> T onContainer(String sandboxId, String operation, Function<String, T> action) {
        Optional<String> cached = idCache.get(sandboxId);
        if (cached.isPresent()) {
            try {
                return translate(sandboxId, operation, cached.get(), action);
            } catch (ContainerRuntimeException e) {
                if (!e.isContainerMissing()) {
                    throw e;
                }
                log.debug("Cached container id for sandbox {} is stale, looking it up again", sandboxId);
            }
        }
        String containerId = lookupContainerId(sandboxId)
                .orElseThrow(() -> ContainerRuntimeException.containerMissing(sandboxId, operation, null));
        idCache.put(sandboxId, containerId);
        return translate(sandboxId, operation, containerId, action);
    }

    private <T> T translate(String sandboxId, String operation, String containerId, Function<String, T> action) {
        try {
            return action.apply(containerId);
        } catch (NotFoundException e) {
            idCache.invalidate(sandboxId);
            throw ContainerRuntimeException.containerMissing(sandboxId, operation, e);
        } catch (ContainerRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException(sandboxId, operation, e.getMessage(), e);
        }
    }

    Optional<String> lookupContainerId(String sandboxId) {
        try {
            List<Container> byName = dockerClient.listContainersCmd()
                    .withShowAll(true)
                    .withNameFilter(List.of("^/" + containerName(sandboxId) + "$"))
                    .exec();
            if (!byName.isEmpty()) {
                return Optional.of(byName.get(0).getId());
            }
            List<Container> byLabel = dockerClient.listContainersCmd()
                    .withShowAll(true)
                    .withLabelFilter(Map.of(ContainerLabels.SANDBOX_ID, sandboxId))
                    .exec();
            return byLabel.stream().findFirst().map(Container::getId);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException(sandboxId, "lookup", e.getMessage(), e);
        }
    }

    // ── Helpers ──

    private void stopContainer(String sandboxId, String containerId, Integer timeoutSeconds) {
        StopContainerCmd cmd = dockerClient.stopContainerCmd(containerId);
        if (timeoutSeconds != null) {
            cmd.withTimeout(timeoutSeconds);
        }
        try {
            cmd.exec();
        } catch (NotModifiedException e) {
            log.debug("Container for sandbox {} already stopped", sandboxId);
        }
    }

    private void ensureImage(String sandboxId, String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            log.info("Image {} not present locally, pulling", image);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException(sandboxId, "create", "cannot inspect image " + image + ": " + e.getMessage(), e);
        }
        try {
            dockerClient.pullImageCmd(image).exec(new PullImageResultCallback()).awaitCompletion();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerRuntimeException(sandboxId, "create", "interrupted while pulling " + image, e);
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException(sandboxId, "create", "cannot pull image " + image + ": " + e.getMessage(), e);
        }
    }

    private void removeQuietly(String sandboxId, String containerId, ContainerRuntimeException failure) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
        } catch (RuntimeException e) {
            log.error("Container {} for sandbox {} failed to start and could not be removed", containerId, sandboxId, e);
            failure.addSuppressed(e);
        } finally {
            idCache.invalidate(sandboxId);
        }
    }

    static ContainerState mapState(InspectContainerResponse.ContainerState state) {
        if (state == null) {
            return ContainerState.UNKNOWN;
        }
        if (Boolean.TRUE.equals(state.getRunning())) {
            if (Boolean.TRUE.equals(state.getPaused())) return ContainerState.PAUSED;
            if (Boolean.TRUE.equals(state.getRestarting())) return ContainerState.RESTARTING;
            return ContainerState.RUNNING;
        }
        if (Boolean.TRUE.equals(state.getDead())) return ContainerState.DEAD;
        String status = state.getStatus();
        if ("created".equals(status)) return ContainerState.CREATED;
        if ("exited".equals(status)) return ContainerState.EXITED;
        if ("removing".equals(status)) return ContainerState.REMOVING;
        if ("paused".equals(status)) return ContainerState.PAUSED;
        return ContainerState.UNKNOWN;
    }

    static ContainerStats toStats(Statistics stats) {
        long cpuTotal = 0, preCpuTotal = 0, system = 0, preSystem = 0, onlineCpus = 1;
        var cpu = stats.getCpuStats();
        if (cpu != null) {
            if (cpu.getCpuUsage() != null) cpuTotal = orZero(cpu.getCpuUsage().getTotalUsage());
            system = orZero(cpu.getSystemCpuUsage());
            if (cpu.getOnlineCpus() != null && cpu.getOnlineCpus() > 0) onlineCpus = cpu.getOnlineCpus();
        }
        var preCpu = stats.getPreCpuStats();
        if (preCpu != null) {
            if (preCpu.getCpuUsage() != null) preCpuTotal = orZero(preCpu.getCpuUsage().getTotalUsage());
            preSystem = orZero(preCpu.getSystemCpuUsage());
        }

        long memoryUsage = 0, memoryLimit = 0;
        if (stats.getMemoryStats() != null) {
            memoryUsage = orZero(stats.getMemoryStats().getUsage());
            memoryLimit = orZero(stats.getMemoryStats().getLimit());
        }

        long rx = 0, tx = 0;
        Map<String, StatisticNetworksConfig> networks = stats.getNetworks();
        if (networks != null) {
            for (StatisticNetworksConfig net : networks.values()) {
                rx += orZero(net.getRxBytes());
                tx += orZero(net.getTxBytes());
            }
        }

        long blockRead = 0, blockWrite = 0;
        if (stats.getBlkioStats() != null && stats.getBlkioStats().getIoServiceBytesRecursive() != null) {
            for (BlkioStatEntry entry : stats.getBlkioStats().getIoServiceBytesRecursive()) {
                if ("Read".equalsIgnoreCase(entry.getOp())) blockRead += orZero(entry.getValue());
                if ("Write".equalsIgnoreCase(entry.getOp())) blockWrite += orZero(entry.getValue());
            }
        }

        return new ContainerStats(
                cpuPercent(cpuTotal - preCpuTotal, system - preSystem, onlineCpus),
                memoryUsage,
                memoryLimit,
                memoryLimit > 0 ? (double) memoryUsage / memoryLimit * 100 : 0,
                rx, tx, blockRead, blockWrite);
    }

    static double cpuPercent(long cpuDelta, long systemDelta, long onlineCpus) {
        if (systemDelta <= 0 || cpuDelta < 0) {
            return 0;
        }
        return (double) cpuDelta / systemDelta * onlineCpus * 100;
    }

    static List<String> splitLines(String output) {
        if (output.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(output.split("\\r?\\n")).toList();
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
