package com.sandcastle.core.engine;

import com.sandcastle.core.catalog.ResourceCatalog;
import com.sandcastle.core.config.SandcastleProperties;
import com.sandcastle.core.error.ConflictException;
import com.sandcastle.core.error.ContainerRuntimeException;
import com.sandcastle.core.error.EntityNotFoundException;
import com.sandcastle.core.error.GitBackendException;
import com.sandcastle.core.error.PreconditionException;
import com.sandcastle.core.error.SandboxException;
import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.logging.MdcContext;
import com.sandcastle.core.metrics.SandboxMetrics;
import com.sandcastle.core.model.Addon;
import com.sandcastle.core.model.ContainerFlavor;
import com.sandcastle.core.model.CreateSandboxOptions;
import com.sandcastle.core.model.DeleteOptions;
import com.sandcastle.core.model.ResourceTier;
import com.sandcastle.core.model.Sandbox;
import com.sandcastle.core.model.SandboxFilter;
import com.sandcastle.core.model.SandboxInfo;
import com.sandcastle.core.model.SandboxStatus;
import com.sandcastle.core.model.SandboxStatusReport;
import com.sandcastle.core.model.SandboxUpdate;
import com.sandcastle.core.model.SandboxWithRepo;
import com.sandcastle.core.persistence.SandboxRepository;
import com.sandcastle.git.CloneOptions;
import com.sandcastle.git.CommitAuthor;
import com.sandcastle.git.CommitRequest;
import com.sandcastle.git.CommitResult;
import com.sandcastle.git.CreateRepoOptions;
import com.sandcastle.git.GitBackend;
import com.sandcastle.git.GitLog;
import com.sandcastle.git.GitRepository;
import com.sandcastle.git.GitStatus;
import com.sandcastle.sandbox.ContainerRef;
import com.sandcastle.sandbox.ContainerRuntime;
import com.sandcastle.sandbox.ContainerSpecFactory;
import com.sandcastle.sandbox.ContainerState;
import com.sandcastle.sandbox.ContainerStats;
import com.sandcastle.sandbox.ExecOptions;
import com.sandcastle.sandbox.ExecResult;
import com.sandcastle.sandbox.LogOptions;
import com.sandcastle.sandbox.RuntimeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owns the lifecycle of sandboxes: keeps the sandbox record, the container
 * and the git repository consistent across create, state transitions and delete.
 *
 * <p>Mutating operations on one sandbox are serialized through {@link SandboxLocks};
 * the record is re-read and its status checked under the lock before any
 * adapter call. A failed lifecycle call leaves the recorded status untouched,
 * except when the runtime reports the container missing, which moves the
 * sandbox to {@link SandboxStatus#ERROR}.
 */
@Service
public class SandboxOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SandboxOrchestrator.class);

    static final String CONTAINER_MISSING_MESSAGE =
            "Container no longer exists; delete and recreate the sandbox";
    static final String CONTAINER_DEAD_MESSAGE = "Container is dead; restart or recreate the sandbox";

    /**
     * State table for lifecycle operations after creation.
     */
    private enum Transition {
        START("start", EnumSet.of(SandboxStatus.STOPPED, SandboxStatus.ERROR), SandboxStatus.RUNNING, true),
        STOP("stop", EnumSet.of(SandboxStatus.RUNNING), SandboxStatus.STOPPED, false),
        RESTART("restart", EnumSet.of(SandboxStatus.RUNNING, SandboxStatus.STOPPED, SandboxStatus.ERROR),
                SandboxStatus.RUNNING, true),
        // a paused sandbox is recorded as stopped
        PAUSE("pause", EnumSet.of(SandboxStatus.RUNNING), SandboxStatus.STOPPED, false),
        UNPAUSE("unpause", EnumSet.of(SandboxStatus.STOPPED), SandboxStatus.RUNNING, true);

        private final String operation;
        private final Set<SandboxStatus> allowedFrom;
        private final SandboxStatus to;
        private final boolean touches;

        Transition(String operation, Set<SandboxStatus> allowedFrom, SandboxStatus to, boolean touches) {
            this.operation = operation;
            this.allowedFrom = allowedFrom;
            this.to = to;
            this.touches = touches;
        }
    }

    private final SandboxRepository repository;
    private final ResourceCatalog catalog;
    private final ContainerRuntime runtime;
    private final GitBackend git;
    private final ContainerSpecFactory specFactory;
    private final SandcastleProperties properties;
    private final SandboxMetrics metrics;
    private final SandboxLocks locks;
    private final SlugGenerator slugGenerator;
    private final Supplier<String> idGenerator;

    @Autowired
    public SandboxOrchestrator(SandboxRepository repository,
                               ResourceCatalog catalog,
                               ContainerRuntime runtime,
                               GitBackend git,
                               ContainerSpecFactory specFactory,
                               SandcastleProperties properties,
                               @Autowired(required = false) SandboxMetrics metrics) {
        this(repository, catalog, runtime, git, specFactory, properties, metrics,
                new SandboxLocks(), SandboxIds::newId);
    }

    SandboxOrchestrator(SandboxRepository repository,
                        ResourceCatalog catalog,
                        ContainerRuntime runtime,
                        GitBackend git,
                        ContainerSpecFactory specFactory,
                        SandcastleProperties properties,
                        SandboxMetrics metrics,
                        SandboxLocks locks,
                        Supplier<String> idGenerator) {
        this.repository = repository;
        this.catalog = catalog;
        this.runtime = runtime;
        this.git = git;
        this.specFactory = specFactory;
        this.properties = properties;
        this.metrics = metrics;
        this.locks = locks;
        this.slugGenerator = new SlugGenerator(repository);
        this.idGenerator = idGenerator;
    }

    // ── Create ──

    public SandboxWithRepo createSandbox(CreateSandboxOptions options) {
        return timed("create", null, () -> {
            var limits = properties.getSandbox();
            String name = options.name() != null ? options.name().trim() : null;
            String userId = options.userId();
            if (name == null || name.isEmpty()) {
                throw new ValidationException("Sandbox name must not be blank");
            }
            if (name.length() > limits.getMaxNameLength()) {
                throw new ValidationException("Sandbox name must be at most %d characters"
                        .formatted(limits.getMaxNameLength()));
            }
            if (userId == null || userId.isBlank()) {
                throw new ValidationException("User id must not be blank");
            }
            if (options.description() != null && options.description().length() > limits.getMaxDescriptionLength()) {
                throw new ValidationException("Description must be at most %d characters"
                        .formatted(limits.getMaxDescriptionLength()));
            }
            if (options.githubUrl() != null && options.githubUrl().isBlank()) {
                throw new ValidationException("Repository URL must not be blank when given");
            }
            ResourceTier tier = resolveTier(options.resourceTierId());
            ContainerFlavor flavor = resolveFlavor(options.flavorId());
            List<Addon> addons = resolveAddons(options.addonIds());
            boolean autoStart = options.autoStartOrDefault(limits.isAutoStart());

            String id = idGenerator.get();
            MdcContext.setSandbox(id, userId);

            // the id lock is held until the record reflects the provisioned container
            return locks.withLock(id, () -> provision(id, userId, name, options, tier, flavor, addons, autoStart));
        });
    }

    private SandboxWithRepo provision(String id, String userId, String name, CreateSandboxOptions options,
                                      ResourceTier tier, ContainerFlavor flavor, List<Addon> addons,
                                      boolean autoStart) {
        Sandbox record = locks.withLock(userScope(userId), () -> {
            String slug = slugGenerator.generate(userId, name);
            var sandbox = Sandbox.builder()
                    .id(id)
                    .userId(userId)
                    .name(name)
                    .slug(slug)
                    .description(options.description())
                    .repoName(slug + "-" + id)
                    .githubUrl(options.githubUrl())
                    .status(SandboxStatus.CREATED)
                    .resourceTierId(tier.id())
                    .flavorId(flavor.id())
                    .addonIds(addons.stream().map(Addon::id).toList())
                    .build();
            if (!repository.insert(sandbox)) {
                throw new ConflictException("Sandbox id %s or slug '%s' is already taken".formatted(id, slug));
            }
            return repository.getById(id).orElse(sandbox);
        });
        log.info("Creating sandbox {} ('{}', flavor {}, tier {}, addons {})",
                id, record.slug(), flavor.id(), tier.id(), record.addonIds());

        var spec = specFactory.build(record, tier, flavor, addons, autoStart);
        ContainerRef container;
        try {
            container = runtime.create(spec);
        } catch (RuntimeException e) {
            var failure = e instanceof ContainerRuntimeException cre
                    ? cre : new ContainerRuntimeException(id, "create", e.getMessage(), e);
            log.warn("Container creation failed for sandbox {}: {}", id, e.getMessage());
            deleteRecordQuietly(id, failure);
            throw failure;
        }

        GitRepository repo;
        try {
            repo = record.githubUrl() != null
                    ? git.cloneRepo(record.githubUrl(), record.repoName(), CloneOptions.defaults())
                    : git.createRepo(record.repoName(), new CreateRepoOptions(record.description()));
        } catch (RuntimeException e) {
            var failure = e instanceof GitBackendException gbe
                    ? gbe : new GitBackendException(record.repoName(), "create", e.getMessage(), e);
            log.warn("Repository creation failed for sandbox {}: {}", id, e.getMessage());
            deleteContainerQuietly(id, container.containerId(), failure);
            deleteRecordQuietly(id, failure);
            throw failure;
        }

        SandboxStatus status = autoStart ? SandboxStatus.RUNNING : SandboxStatus.STOPPED;
        Sandbox created;
        try {
            boolean updated = repository.updateFields(id, SandboxUpdate.builder()
                    .containerId(container.containerId())
                    .containerName(container.containerName())
                    .opencodeUrl(container.url(ContainerSpecFactory.OPENCODE))
                    .codeServerUrl(container.url(ContainerSpecFactory.CODE_SERVER))
                    .vncUrl(container.url(ContainerSpecFactory.VNC))
                    .status(status)
                    .build());
            if (!updated) {
                throw new ConflictException("Sandbox %s was removed while it was being created".formatted(id));
            }
            created = load(id);
        } catch (RuntimeException e) {
            log.error("Could not record provisioned container for sandbox {}", id, e);
            deleteContainerQuietly(id, container.containerId(), e);
            deleteRepoQuietly(record.repoName(), e);
            deleteRecordQuietly(id, e);
            throw e;
        }
        log.info("Sandbox {} created ({}), container {}", id, status.value(), container.containerName());
        return new SandboxWithRepo(created, repo);
    }

    // ── Lifecycle ──

    public Sandbox startSandbox(String id) {
        return transition(id, Transition.START, runtime::start);
    }

    public Sandbox stopSandbox(String id, Integer timeoutSeconds) {
        requireTimeout(timeoutSeconds);
        return transition(id, Transition.STOP, sandboxId -> runtime.stop(sandboxId, timeoutSeconds));
    }

    public Sandbox restartSandbox(String id, Integer timeoutSeconds) {
        requireTimeout(timeoutSeconds);
        return transition(id, Transition.RESTART, sandboxId -> runtime.restart(sandboxId, timeoutSeconds));
    }

    public Sandbox pauseSandbox(String id) {
        return transition(id, Transition.PAUSE, runtime::pause);
    }

    public Sandbox unpauseSandbox(String id) {
        return transition(id, Transition.UNPAUSE, runtime::unpause);
    }

    public void deleteSandbox(String id, DeleteOptions options) {
        DeleteOptions opts = options != null ? options : DeleteOptions.defaults();
        timed("delete", id, () -> locks.withLock(id, () -> {
            Sandbox sandbox = load(id);
            MdcContext.setSandbox(id, sandbox.userId());
            try {
                runtime.delete(id, opts.removeVolumes());
            } catch (ContainerRuntimeException e) {
                if (!e.isContainerMissing()) {
                    throw e;
                }
                log.info("Container for sandbox {} already gone", id);
            } catch (RuntimeException e) {
                throw new ContainerRuntimeException(id, "delete", e.getMessage(), e);
            }
            if (opts.deleteRepo() && sandbox.hasRepository()) {
                try {
                    git.deleteRepo(sandbox.repoName());
                } catch (RuntimeException e) {
                    log.warn("Could not delete repository {} of sandbox {}: {}", sandbox.repoName(), id, e.getMessage());
                }
            }
            repository.delete(id);
            log.info("Sandbox {} deleted", id);
            return null;
        }));
    }

    // ── Queries ──

    public Optional<Sandbox> getSandbox(String id) {
        return repository.getById(id).map(this::reconcile);
    }

    /**
     * Returns the sandbox with its repository descriptor and records the access.
     */
    public SandboxInfo getSandboxInfo(String id) {
        return timed("info", id, () -> {
            load(id);
            repository.touch(id);
            Sandbox sandbox = reconcile(load(id));
            if (sandbox == null) {
                throw EntityNotFoundException.sandbox(id);
            }
            GitRepository repo = sandbox.hasRepository() ? git.getRepo(sandbox.repoName()).orElse(null) : null;
            return new SandboxInfo(sandbox, repo);
        });
    }

    /**
     * Lists sandboxes matching {@code filter}. Statuses are reconciled with the
     * runtime before the status criterion is applied.
     */
    public List<Sandbox> listSandboxes(SandboxFilter filter) {
        SandboxFilter effective = filter != null ? filter : SandboxFilter.all();
        return repository.listAll(SandboxFilter.forUser(effective.userId())).stream()
                .map(this::reconcile)
                .filter(Objects::nonNull)
                .filter(effective::matches)
                .toList();
    }

    /**
     * Recorded status together with the live container state. A sandbox whose
     * container has not been provisioned yet reports {@link ContainerState#CREATED}.
     * Drift between the two is written back to the record before returning.
     */
    public SandboxStatusReport getSandboxStatus(String id) {
        return timed("status", id, () -> {
            Sandbox sandbox = load(id);
            if (!sandbox.hasContainer()) {
                return new SandboxStatusReport(id, sandbox.status(), ContainerState.CREATED);
            }
            return locks.withLock(id, () -> {
                Sandbox current = load(id);
                ContainerState live;
                try {
                    live = query(id, "state", () -> runtime.getState(id));
                } catch (ContainerRuntimeException e) {
                    if (e.isContainerMissing() && current.status() != SandboxStatus.ERROR) {
                        markContainerMissing(current, "status");
                    }
                    throw e;
                }
                Sandbox synced = syncStatus(current, live);
                if (synced == null) {
                    throw EntityNotFoundException.sandbox(id);
                }
                return new SandboxStatusReport(id, synced.status(), live);
            });
        });
    }

    public List<String> getSandboxLogs(String id, LogOptions options) {
        LogOptions opts = options != null ? options : LogOptions.defaults();
        return timed("logs", id, () -> {
            load(id);
            return query(id, "logs", () -> runtime.getLogs(id, opts));
        });
    }

    public ContainerStats getSandboxStats(String id) {
        return timed("stats", id, () -> {
            load(id);
            return query(id, "stats", () -> runtime.getStats(id));
        });
    }

    public Map<SandboxStatus, Long> countSandboxesByStatus(String userId) {
        return repository.countByStatus(userId);
    }

    // ── Exec ──

    public ExecResult exec(String id, List<String> command, ExecOptions options) {
        if (command == null || command.isEmpty() || command.stream().allMatch(c -> c == null || c.isBlank())) {
            throw new ValidationException("Command must not be empty");
        }
        ExecOptions opts = options != null ? options : ExecOptions.defaults();
        return timed("exec", id, () -> {
            Sandbox sandbox = load(id);
            if (!sandbox.hasContainer()) {
                throw new PreconditionException("Sandbox %s has no container yet".formatted(id));
            }
            log.debug("Executing {} in sandbox {}", command.get(0), id);
            return query(id, "exec", () -> runtime.exec(id, command, opts));
        });
    }

    // ── Git ──

    /**
     * Stages and commits every change in the sandbox's repository.
     *
     * @param author commit author, {@code null} for the configured default
     */
    public CommitResult commitChanges(String id, String message, CommitAuthor author) {
        return timed("commit", id, () -> {
            Sandbox sandbox = requireRepository(id);
            int max = properties.getSandbox().getMaxCommitMessageLength();
            if (message == null || message.isBlank()) {
                throw new ValidationException("Commit message must not be blank");
            }
            if (message.length() > max) {
                throw new ValidationException("Commit message must be at most %d characters".formatted(max));
            }
            var gitProps = properties.getGit();
            CommitAuthor effective = author != null
                    ? author : new CommitAuthor(gitProps.getAuthorName(), gitProps.getAuthorEmail());
            CommitResult result = git.commit(sandbox.repoName(), new CommitRequest(message, effective));
            log.info("Committed {} in sandbox {}", result.sha(), id);
            return result;
        });
    }

    public GitStatus getGitStatus(String id) {
        return timed("git-status", id, () -> git.getStatus(requireRepository(id).repoName()));
    }

    public GitLog getGitLog(String id, Integer limit) {
        if (limit != null && limit < 1) {
            throw new ValidationException("Log limit must be positive");
        }
        return timed("git-log", id, () -> git.getLog(requireRepository(id).repoName(), limit));
    }

    // ── Health ──

    public boolean healthCheck() {
        return runtime.healthCheck();
    }

    public RuntimeInfo getDockerInfo() {
        return runtime.getInfo();
    }

    // ── Internals ──

    private Sandbox transition(String id, Transition transition, Consumer<String> runtimeCall) {
        return timed(transition.operation, id, () -> locks.withLock(id, () -> {
            Sandbox sandbox = load(id);
            MdcContext.setSandbox(id, sandbox.userId());
            if (!transition.allowedFrom.contains(sandbox.status())) {
                throw new PreconditionException("Cannot %s sandbox %s while it is %s"
                        .formatted(transition.operation, id, sandbox.status().value()));
            }
            try {
                runtimeCall.accept(id);
            } catch (ContainerRuntimeException e) {
                if (e.isContainerMissing()) {
                    markContainerMissing(sandbox, transition.operation);
                }
                throw e;
            } catch (RuntimeException e) {
                throw new ContainerRuntimeException(id, transition.operation, e.getMessage(), e);
            }
            repository.updateFields(id, SandboxUpdate.status(transition.to));
            if (transition.touches) {
                repository.touch(id);
            }
            log.info("Sandbox {} {}: {} -> {}", id, transition.operation,
                    sandbox.status().value(), transition.to.value());
            return load(id);
        }));
    }

    /**
     * Re-reads the sandbox under its lock and syncs the recorded status with the
     * live container. Read failures other than a missing container leave the
     * record as it is. Returns {@code null} when the record is gone.
     */
    private Sandbox reconcile(Sandbox sandbox) {
        if (!sandbox.hasContainer()) {
            return sandbox;
        }
        String id = sandbox.id();
        return locks.withLock(id, () -> {
            Sandbox current = repository.getById(id).orElse(null);
            if (current == null || !current.hasContainer()) {
                return current;
            }
            ContainerState live;
            try {
                live = runtime.getState(id);
            } catch (ContainerRuntimeException e) {
                if (e.isContainerMissing() && current.status() != SandboxStatus.ERROR) {
                    markContainerMissing(current, "reconcile");
                    return repository.getById(id).orElse(null);
                }
                log.debug("Could not read container state of sandbox {}: {}", id, e.getMessage());
                return current;
            } catch (RuntimeException e) {
                log.debug("Could not read container state of sandbox {}: {}", id, e.getMessage());
                return current;
            }
            return syncStatus(current, live);
        });
    }

    private Sandbox syncStatus(Sandbox sandbox, ContainerState live) {
        SandboxStatus observed = recordedStatusFor(live);
        if (observed == null || observed == sandbox.status()) {
            return sandbox;
        }
        log.info("Sandbox {} container is {}; recorded status {} -> {}", sandbox.id(),
                live.name().toLowerCase(Locale.ROOT), sandbox.status().value(), observed.value());
        SandboxUpdate update = observed == SandboxStatus.ERROR
                ? SandboxUpdate.builder().status(observed).errorMessage(CONTAINER_DEAD_MESSAGE).build()
                : SandboxUpdate.status(observed);
        if (!repository.updateFields(sandbox.id(), update)) {
            return null;
        }
        return repository.getById(sandbox.id()).orElse(null);
    }

    /**
     * Status a record should carry for a live container state, or {@code null}
     * for states that are in flux and leave the record alone.
     */
    static SandboxStatus recordedStatusFor(ContainerState state) {
        if (state == null) {
            return null;
        }
        return switch (state) {
            case RUNNING -> SandboxStatus.RUNNING;
            case PAUSED, EXITED -> SandboxStatus.STOPPED;
            case DEAD -> SandboxStatus.ERROR;
            case CREATED, RESTARTING, REMOVING, UNKNOWN -> null;
        };
    }

    private <T> T query(String id, String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (SandboxException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ContainerRuntimeException(id, operation, e.getMessage(), e);
        }
    }

    private void markContainerMissing(Sandbox sandbox, String operation) {
        log.warn("Container for sandbox {} is missing during {}; marking sandbox as error", sandbox.id(), operation);
        repository.updateStatus(sandbox.id(), SandboxStatus.ERROR, CONTAINER_MISSING_MESSAGE);
        if (metrics != null) {
            metrics.recordContainerMissing(operation);
        }
    }

    private void deleteRecordQuietly(String id, Exception failure) {
        try {
            repository.delete(id);
            recordCompensation("delete-record", true);
        } catch (RuntimeException e) {
            log.error("Could not delete record of failed sandbox {}", id, e);
            failure.addSuppressed(e);
            recordCompensation("delete-record", false);
        }
    }

    private void deleteContainerQuietly(String id, String containerId, Exception failure) {
        try {
            runtime.delete(id, true);
            recordCompensation("delete-container", true);
        } catch (ContainerRuntimeException e) {
            if (e.isContainerMissing()) {
                recordCompensation("delete-container", true);
                return;
            }
            orphaned(id, containerId, failure, e);
        } catch (RuntimeException e) {
            orphaned(id, containerId, failure, e);
        }
    }

    private void orphaned(String id, String containerId, Exception failure, RuntimeException cause) {
        log.error("Orphaned container {} of failed sandbox {} could not be removed; reconcile manually",
                containerId, id, cause);
        failure.addSuppressed(cause);
        recordCompensation("delete-container", false);
        if (metrics != null) {
            metrics.recordOrphanedContainer();
        }
    }

    private void deleteRepoQuietly(String repoName, Exception failure) {
        try {
            git.deleteRepo(repoName);
            recordCompensation("delete-repository", true);
        } catch (RuntimeException e) {
            log.error("Could not delete repository {} of failed sandbox", repoName, e);
            failure.addSuppressed(e);
            recordCompensation("delete-repository", false);
        }
    }

    private void recordCompensation(String action, boolean success) {
        if (metrics != null) {
            metrics.recordCompensation(action, success);
        }
    }

    private Sandbox load(String id) {
        if (id == null || id.isBlank()) {
            throw EntityNotFoundException.sandbox(String.valueOf(id));
        }
        return repository.getById(id).orElseThrow(() -> EntityNotFoundException.sandbox(id));
    }

    private Sandbox requireRepository(String id) {
        Sandbox sandbox = load(id);
        if (!sandbox.hasRepository()) {
            throw new PreconditionException("sandbox has no repository");
        }
        return sandbox;
    }

    private ResourceTier resolveTier(String tierId) {
        if (tierId == null) {
            return catalog.getDefaultResourceTier();
        }
        return catalog.getResourceTier(tierId)
                .orElseThrow(() -> new ValidationException("Unknown resource tier: " + tierId));
    }

    private ContainerFlavor resolveFlavor(String flavorId) {
        if (flavorId == null) {
            return catalog.getDefaultFlavor();
        }
        return catalog.getFlavor(flavorId)
                .orElseThrow(() -> new ValidationException("Unknown flavor: " + flavorId));
    }

    private List<Addon> resolveAddons(List<String> addonIds) {
        var ids = new LinkedHashSet<>(addonIds != null ? addonIds : catalog.defaultAddonIds());
        var addons = new ArrayList<Addon>();
        for (String addonId : ids) {
            addons.add(catalog.getAddon(addonId)
                    .orElseThrow(() -> new ValidationException("Unknown addon: " + addonId)));
        }
        return addons;
    }

    private static void requireTimeout(Integer timeoutSeconds) {
        if (timeoutSeconds != null && timeoutSeconds < 0) {
            throw new ValidationException("Timeout must not be negative");
        }
    }

    private static String userScope(String userId) {
        return "user:" + userId;
    }

    private <T> T timed(String operation, String sandboxId, Supplier<T> action) {
        MdcContext.setOperation(operation, sandboxId);
        long start = System.nanoTime();
        String outcome = "success";
        try {
            return action.get();
        } catch (RuntimeException e) {
            outcome = e.getClass().getSimpleName();
            throw e;
        } finally {
            if (metrics != null) {
                metrics.recordOperation(operation, outcome, Duration.ofNanos(System.nanoTime() - start));
            }
            MdcContext.clear();
        }
    }
}
