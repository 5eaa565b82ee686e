package com.sandcastle.core.engine;

import com.sandcastle.core.catalog.StaticResourceCatalog;
import com.sandcastle.core.config.SandcastleProperties;
import com.sandcastle.core.error.ConflictException;
import com.sandcastle.core.error.ContainerRuntimeException;
import com.sandcastle.core.error.EntityNotFoundException;
import com.sandcastle.core.error.GitBackendException;
import com.sandcastle.core.error.PreconditionException;
import com.sandcastle.core.error.ValidationException;
import com.sandcastle.core.metrics.SandboxMetrics;
import com.sandcastle.core.model.CreateSandboxOptions;
import com.sandcastle.core.model.DeleteOptions;
import com.sandcastle.core.model.Sandbox;
import com.sandcastle.core.model.SandboxFilter;
import com.sandcastle.core.model.SandboxStatus;
import com.sandcastle.core.persistence.InMemorySandboxRepository;
import com.sandcastle.git.CloneOptions;
import com.sandcastle.git.CommitAuthor;
import com.sandcastle.git.CommitRequest;
import com.sandcastle.git.CommitResult;
import com.sandcastle.git.CreateRepoOptions;
import com.sandcastle.git.GitBackend;
import com.sandcastle.git.GitLog;
import com.sandcastle.git.GitRepository;
import com.sandcastle.sandbox.ContainerRef;
import com.sandcastle.sandbox.ContainerRuntime;
import com.sandcastle.sandbox.ContainerSpec;
import com.sandcastle.sandbox.ContainerSpecFactory;
import com.sandcastle.sandbox.ContainerState;
import com.sandcastle.sandbox.ExecOptions;
import com.sandcastle.sandbox.ExecResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SandboxOrchestratorTest {

    private InMemorySandboxRepository repository;
    private ContainerRuntime runtime;
    private GitBackend git;
    private SimpleMeterRegistry registry;
    private SandboxOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        repository = new InMemorySandboxRepository();
        runtime = mock(ContainerRuntime.class);
        git = mock(GitBackend.class);
        registry = new SimpleMeterRegistry();

        var properties = new SandcastleProperties();
        var counter = new AtomicInteger();
        orchestrator = new SandboxOrchestrator(repository, new StaticResourceCatalog(), runtime, git,
                new ContainerSpecFactory(properties), properties, new SandboxMetrics(registry),
                new SandboxLocks(), () -> "sandbox%05d".formatted(counter.incrementAndGet()));

        when(runtime.create(any())).thenAnswer(inv -> {
            ContainerSpec spec = inv.getArgument(0);
            return new ContainerRef("cid-" + spec.sandboxId(), spec.containerName(),
                    Map.of(ContainerSpecFactory.OPENCODE, "http://opencode.localhost"));
        });
        when(git.createRepo(anyString(), any())).thenAnswer(inv -> repo(inv.getArgument(0)));
        when(git.cloneRepo(anyString(), anyString(), any())).thenAnswer(inv -> repo(inv.getArgument(1)));
    }

    private static GitRepository repo(String name) {
        return new GitRepository(name, Path.of("/repos", name), "main", false);
    }

    private Sandbox create(String name, String userId) {
        return orchestrator.createSandbox(CreateSandboxOptions.builder(name, userId).build()).sandbox();
    }

    private Sandbox insertBare(String id, SandboxStatus status, String repoName) {
        var sandbox = Sandbox.builder()
                .id(id).userId("alice").name(id).slug(id)
                .repoName(repoName)
                .status(status)
                .build();
        assertTrue(repository.insert(sandbox));
        return sandbox;
    }

    private double counter(String name, String... tags) {
        var found = registry.find(name).tags(tags).counter();
        return found == null ? 0.0 : found.count();
    }

    // ── Create ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("createSandbox")
    class Create {

        @Test
        @DisplayName("provisions record, container and repository with catalog defaults")
        void createsWithDefaults() {
            var result = orchestrator.createSandbox(CreateSandboxOptions.builder("My Project", "alice")
                    .description("Scratch space").build());

            Sandbox sandbox = result.sandbox();
            assertEquals("sandbox00001", sandbox.id());
            assertEquals("my-project", sandbox.slug());
            assertEquals("my-project-sandbox00001", sandbox.repoName());
            assertEquals(SandboxStatus.RUNNING, sandbox.status());
            assertEquals("starter", sandbox.resourceTierId());
            assertEquals("fullstack", sandbox.flavorId());
            assertEquals(List.of("code-server"), sandbox.addonIds());
            assertEquals("cid-sandbox00001", sandbox.containerId());
            assertEquals("http://opencode.localhost", sandbox.opencodeUrl());
            assertEquals("my-project-sandbox00001", result.repository().name());

            var spec = ArgumentCaptor.forClass(ContainerSpec.class);
            verify(runtime).create(spec.capture());
            assertTrue(spec.getValue().start());
            verify(git).createRepo("my-project-sandbox00001", new CreateRepoOptions("Scratch space"));
            verify(git, never()).cloneRepo(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("slugs are suffixed per user in creation order")
        void slugSuffixes() {
            assertEquals("my-project", create("My Project", "alice").slug());
            assertEquals("my-project-1", create("my project", "alice").slug());
            assertEquals("my-project-2", create("MY-PROJECT!", "alice").slug());
            assertEquals("my-project", create("My Project", "bob").slug());
        }

        @Test
        @DisplayName("autoStart=false leaves the sandbox stopped")
        void noAutoStart() {
            var sandbox = orchestrator.createSandbox(CreateSandboxOptions.builder("idle", "alice")
                    .autoStart(false).build()).sandbox();

            assertEquals(SandboxStatus.STOPPED, sandbox.status());
            var spec = ArgumentCaptor.forClass(ContainerSpec.class);
            verify(runtime).create(spec.capture());
            assertFalse(spec.getValue().start());
        }

        @Test
        @DisplayName("a repository URL is cloned instead of initialized")
        void clonesRepository() {
            orchestrator.createSandbox(CreateSandboxOptions.builder("fork", "alice")
                    .githubUrl("https://github.com/acme/app.git").build());

            verify(git).cloneRepo("https://github.com/acme/app.git", "fork-sandbox00001", CloneOptions.defaults());
            verify(git, never()).createRepo(anyString(), any());
        }

        @Test
        @DisplayName("explicit flavor, tier and addons are recorded")
        void explicitSelections() {
            var sandbox = orchestrator.createSandbox(CreateSandboxOptions.builder("ml", "alice")
                    .flavor("python").resourceTier("power").addons(List.of("gpu", "gui", "gpu")).build()).sandbox();

            assertEquals("python", sandbox.flavorId());
            assertEquals("power", sandbox.resourceTierId());
            assertEquals(List.of("gpu", "gui"), sandbox.addonIds());
        }

        @Test
        @DisplayName("an empty addon list means no addons")
        void noAddons() {
            var sandbox = orchestrator.createSandbox(CreateSandboxOptions.builder("bare", "alice")
                    .addons(List.of()).build()).sandbox();

            assertTrue(sandbox.addonIds().isEmpty());
        }

        @Test
        @DisplayName("unknown catalog ids are rejected before any side effect")
        void unknownCatalogIds() {
            assertThrows(ValidationException.class, () -> orchestrator.createSandbox(
                    CreateSandboxOptions.builder("x", "alice").flavor("cobol").build()));
            assertThrows(ValidationException.class, () -> orchestrator.createSandbox(
                    CreateSandboxOptions.builder("x", "alice").resourceTier("galactic").build()));
            assertThrows(ValidationException.class, () -> orchestrator.createSandbox(
                    CreateSandboxOptions.builder("x", "alice").addons(List.of("jetpack")).build()));

            verifyNoInteractions(runtime, git);
            assertTrue(repository.listAll(SandboxFilter.all()).isEmpty());
        }

        @Test
        @DisplayName("blank name and user are rejected")
        void blankInputs() {
            var ex = assertThrows(ValidationException.class,
                    () -> orchestrator.createSandbox(CreateSandboxOptions.builder("   ", "alice").build()));
            assertEquals("Sandbox name must not be blank", ex.getMessage());
            assertThrows(ValidationException.class,
                    () -> orchestrator.createSandbox(CreateSandboxOptions.builder("ok", "").build()));
            verifyNoInteractions(runtime, git);
        }

        @Test
        @DisplayName("container failure leaves no record and skips the repository")
        void containerFailure() {
            when(runtime.create(any())).thenThrow(new ContainerRuntimeException("sandbox00001", "create", "no such image"));

            assertThrows(ContainerRuntimeException.class, () -> create("doomed", "alice"));

            assertTrue(repository.listAll(SandboxFilter.all()).isEmpty());
            verifyNoInteractions(git);
            assertEquals(1.0, counter("sandcastle.create.compensations", "action", "delete-record", "success", "true"));
        }

        @Test
        @DisplayName("unexpected runtime errors are wrapped")
        void containerFailureWrapped() {
            when(runtime.create(any())).thenThrow(new IllegalStateException("socket closed"));

            var ex = assertThrows(ContainerRuntimeException.class, () -> create("doomed", "alice"));

            assertInstanceOf(IllegalStateException.class, ex.getCause());
            assertTrue(repository.listAll(SandboxFilter.all()).isEmpty());
        }

        @Test
        @DisplayName("repository failure removes the container and the record")
        void repositoryFailure() {
            when(git.createRepo(anyString(), any()))
                    .thenThrow(new GitBackendException("doomed-sandbox00001", "create", "disk full"));

            assertThrows(GitBackendException.class, () -> create("doomed", "alice"));

            verify(runtime).delete("sandbox00001", true);
            assertTrue(repository.listAll(SandboxFilter.all()).isEmpty());
            assertEquals(1.0, counter("sandcastle.create.compensations", "action", "delete-container", "success", "true"));
            assertEquals(0.0, counter("sandcastle.containers.orphaned"));
        }

        @Test
        @DisplayName("a container that cannot be removed is reported as orphaned")
        void orphanedContainer() {
            when(git.createRepo(anyString(), any()))
                    .thenThrow(new GitBackendException("doomed-sandbox00001", "create", "disk full"));
            doThrow(new ContainerRuntimeException("sandbox00001", "delete", "daemon unavailable"))
                    .when(runtime).delete("sandbox00001", true);

            var ex = assertThrows(GitBackendException.class, () -> create("doomed", "alice"));

            assertEquals(1, ex.getSuppressed().length);
            assertEquals(1.0, counter("sandcastle.containers.orphaned"));
            assertEquals(1.0, counter("sandcastle.create.compensations", "action", "delete-container", "success", "false"));
            assertTrue(repository.listAll(SandboxFilter.all()).isEmpty());
        }

        @Test
        @DisplayName("ids and slugs stay free after a failed create")
        void slugReusableAfterFailure() {
            when(runtime.create(any()))
                    .thenThrow(new ContainerRuntimeException("sandbox00001", "create", "boom"))
                    .thenAnswer(inv -> new ContainerRef("cid", "name", Map.of()));

            assertThrows(ContainerRuntimeException.class, () -> create("retry", "alice"));

            assertEquals("retry", create("retry", "alice").slug());
        }

        @Test
        @DisplayName("the name is trimmed before its length is checked")
        void nameTrimmedBeforeValidation() {
            String padded = "  " + "n".repeat(100) + "  ";

            var sandbox = create(padded, "alice");

            assertEquals("n".repeat(100), sandbox.name());
            assertThrows(ValidationException.class, () -> create(" " + "n".repeat(101), "alice"));
        }

        @Test
        @DisplayName("a delete issued during provisioning waits and then removes everything")
        void deleteWaitsForProvisioning() throws Exception {
            var executor = Executors.newSingleThreadExecutor();
            var pendingDelete = new AtomicReference<Future<?>>();
            var blockedWhileProvisioning = new AtomicBoolean();
            try {
                when(runtime.create(any())).thenAnswer(inv -> {
                    ContainerSpec spec = inv.getArgument(0);
                    Future<?> delete = executor.submit(
                            () -> orchestrator.deleteSandbox(spec.sandboxId(), new DeleteOptions(true, true)));
                    pendingDelete.set(delete);
                    try {
                        delete.get(200, TimeUnit.MILLISECONDS);
                    } catch (TimeoutException e) {
                        blockedWhileProvisioning.set(true);
                    }
                    return new ContainerRef("cid-" + spec.sandboxId(), spec.containerName(), Map.of());
                });

                var created = create("contested", "alice");

                assertEquals(SandboxStatus.RUNNING, created.status());
                assertTrue(blockedWhileProvisioning.get());
                pendingDelete.get().get(5, TimeUnit.SECONDS);
                assertTrue(repository.getById(created.id()).isEmpty());
                verify(runtime).delete(created.id(), true);
                verify(git).deleteRepo(created.repoName());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("a record removed behind the engine's back during provisioning is compensated")
        void recordVanishesDuringProvisioning() {
            when(runtime.create(any())).thenAnswer(inv -> {
                ContainerSpec spec = inv.getArgument(0);
                repository.delete(spec.sandboxId());
                return new ContainerRef("cid-" + spec.sandboxId(), spec.containerName(), Map.of());
            });

            var ex = assertThrows(ConflictException.class, () -> create("vanishing", "alice"));

            assertTrue(ex.getMessage().contains("removed while it was being created"));
            verify(runtime).delete("sandbox00001", true);
            verify(git).deleteRepo("vanishing-sandbox00001");
            assertTrue(repository.listAll(SandboxFilter.all()).isEmpty());
        }
    }

    // ── Lifecycle ────────────────────────────────────────────────────

    @Nested
    @DisplayName("lifecycle transitions")
    class Lifecycle {

        private String id;

        @BeforeEach
        void setUp() {
            id = create("Workbench", "alice").id();
            clearInvocations(runtime, git);
        }

        @Test
        @DisplayName("stop passes the timeout and records stopped")
        void stop() {
            var sandbox = orchestrator.stopSandbox(id, 5);

            verify(runtime).stop(id, 5);
            assertEquals(SandboxStatus.STOPPED, sandbox.status());
        }

        @Test
        @DisplayName("start from stopped records running and the access time")
        void start() {
            orchestrator.stopSandbox(id, null);

            var sandbox = orchestrator.startSandbox(id);

            verify(runtime).start(id);
            assertEquals(SandboxStatus.RUNNING, sandbox.status());
            assertNotNull(sandbox.lastAccessedAt());
        }

        @Test
        @DisplayName("start on a running sandbox is a precondition failure")
        void startWhileRunning() {
            var ex = assertThrows(PreconditionException.class, () -> orchestrator.startSandbox(id));

            assertTrue(ex.getMessage().contains("while it is running"));
            verify(runtime, never()).start(anyString());
        }

        @Test
        @DisplayName("pause records stopped and unpause resumes")
        void pauseAndUnpause() {
            assertEquals(SandboxStatus.STOPPED, orchestrator.pauseSandbox(id).status());
            verify(runtime).pause(id);

            assertEquals(SandboxStatus.RUNNING, orchestrator.unpauseSandbox(id).status());
            verify(runtime).unpause(id);
        }

        @Test
        @DisplayName("pause requires a running sandbox")
        void pauseCreated() {
            insertBare("fresh0000000", SandboxStatus.CREATED, null);

            assertThrows(PreconditionException.class, () -> orchestrator.pauseSandbox("fresh0000000"));
            verifyNoInteractions(runtime);
        }

        @Test
        @DisplayName("restart recovers an errored sandbox and clears the error")
        void restartFromError() {
            repository.updateStatus(id, SandboxStatus.ERROR, "crashed");

            var sandbox = orchestrator.restartSandbox(id, null);

            verify(runtime).restart(id, null);
            assertEquals(SandboxStatus.RUNNING, sandbox.status());
            assertNull(sandbox.errorMessage());
        }

        @Test
        @DisplayName("negative timeouts are rejected")
        void negativeTimeout() {
            assertThrows(ValidationException.class, () -> orchestrator.stopSandbox(id, -1));
            assertThrows(ValidationException.class, () -> orchestrator.restartSandbox(id, -1));
            verifyNoInteractions(runtime);
        }

        @Test
        @DisplayName("a missing container moves the sandbox to error")
        void containerMissing() {
            doThrow(ContainerRuntimeException.containerMissing(id, "stop", null)).when(runtime).stop(id, null);

            assertThrows(ContainerRuntimeException.class, () -> orchestrator.stopSandbox(id, null));

            var sandbox = orchestrator.getSandbox(id).orElseThrow();
            assertEquals(SandboxStatus.ERROR, sandbox.status());
            assertEquals(SandboxOrchestrator.CONTAINER_MISSING_MESSAGE, sandbox.errorMessage());
            assertEquals(1.0, counter("sandcastle.containers.missing", "operation", "stop"));
        }

        @Test
        @DisplayName("other runtime failures leave the recorded status alone")
        void runtimeFailure() {
            doThrow(new ContainerRuntimeException(id, "stop", "daemon busy")).when(runtime).stop(id, null);

            assertThrows(ContainerRuntimeException.class, () -> orchestrator.stopSandbox(id, null));

            assertEquals(SandboxStatus.RUNNING, orchestrator.getSandbox(id).orElseThrow().status());
        }

        @Test
        @DisplayName("unknown sandboxes are not found")
        void unknownSandbox() {
            assertThrows(EntityNotFoundException.class, () -> orchestrator.startSandbox("nope"));
            assertThrows(EntityNotFoundException.class, () -> orchestrator.stopSandbox("nope", null));
            assertThrows(EntityNotFoundException.class, () -> orchestrator.pauseSandbox(null));
            verifyNoInteractions(runtime);
        }
    }

    // ── Delete ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("deleteSandbox")
    class Delete {

        private Sandbox sandbox;

        @BeforeEach
        void setUp() {
            sandbox = create("Throwaway", "alice");
        }

        @Test
        @DisplayName("default delete keeps the repository")
        void keepsRepository() {
            orchestrator.deleteSandbox(sandbox.id(), null);

            verify(runtime).delete(sandbox.id(), false);
            verify(git, never()).deleteRepo(anyString());
            assertTrue(orchestrator.getSandbox(sandbox.id()).isEmpty());
        }

        @Test
        @DisplayName("deleteRepo and removeVolumes are honored")
        void deletesRepository() {
            orchestrator.deleteSandbox(sandbox.id(), new DeleteOptions(true, true));

            verify(runtime).delete(sandbox.id(), true);
            verify(git).deleteRepo(sandbox.repoName());
            assertTrue(orchestrator.getSandbox(sandbox.id()).isEmpty());
        }

        @Test
        @DisplayName("an already removed container does not block deletion")
        void containerAlreadyGone() {
            doThrow(ContainerRuntimeException.containerMissing(sandbox.id(), "delete", null))
                    .when(runtime).delete(sandbox.id(), false);

            orchestrator.deleteSandbox(sandbox.id(), DeleteOptions.defaults());

            assertTrue(orchestrator.getSandbox(sandbox.id()).isEmpty());
        }

        @Test
        @DisplayName("runtime failures keep the record")
        void runtimeFailure() {
            doThrow(new ContainerRuntimeException(sandbox.id(), "delete", "daemon busy"))
                    .when(runtime).delete(sandbox.id(), false);

            assertThrows(ContainerRuntimeException.class,
                    () -> orchestrator.deleteSandbox(sandbox.id(), DeleteOptions.defaults()));

            assertTrue(orchestrator.getSandbox(sandbox.id()).isPresent());
        }

        @Test
        @DisplayName("repository removal failure is not fatal")
        void repositoryFailure() {
            doThrow(new GitBackendException(sandbox.repoName(), "delete", "permission denied"))
                    .when(git).deleteRepo(sandbox.repoName());

            orchestrator.deleteSandbox(sandbox.id(), new DeleteOptions(true, false));

            assertTrue(orchestrator.getSandbox(sandbox.id()).isEmpty());
        }

        @Test
        @DisplayName("unknown sandbox is not found and nothing is touched")
        void unknownSandbox() {
            clearInvocations(runtime, git);

            assertThrows(EntityNotFoundException.class,
                    () -> orchestrator.deleteSandbox("missing", new DeleteOptions(true, true)));
            verifyNoInteractions(runtime, git);
        }
    }

    // ── Queries ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("filters combine user and status")
        void filterByUserAndStatus() {
            var running = create("one", "alice");
            var stopped = create("two", "alice");
            orchestrator.stopSandbox(stopped.id(), null);
            create("three", "bob");

            var result = orchestrator.listSandboxes(new SandboxFilter("alice", Set.of(SandboxStatus.RUNNING)));

            assertEquals(List.of(running.id()), result.stream().map(Sandbox::id).toList());
            assertEquals(3, orchestrator.listSandboxes(null).size());
        }

        @Test
        @DisplayName("counts sandboxes by status for a user")
        void countByStatus() {
            create("one", "alice");
            orchestrator.stopSandbox(create("two", "alice").id(), null);
            create("three", "bob");

            var counts = orchestrator.countSandboxesByStatus("alice");

            assertEquals(1L, counts.get(SandboxStatus.RUNNING));
            assertEquals(1L, counts.get(SandboxStatus.STOPPED));
            assertEquals(0L, counts.get(SandboxStatus.ERROR));
        }

        @Test
        @DisplayName("status without a container reports created")
        void statusWithoutContainer() {
            insertBare("fresh0000000", SandboxStatus.CREATED, null);

            var report = orchestrator.getSandboxStatus("fresh0000000");

            assertEquals(SandboxStatus.CREATED, report.recorded());
            assertEquals(ContainerState.CREATED, report.live());
            verifyNoInteractions(runtime);
        }

        @Test
        @DisplayName("status reports the live container state and records the drift")
        void liveStatus() {
            var sandbox = create("live", "alice");
            when(runtime.getState(sandbox.id())).thenReturn(ContainerState.EXITED);

            var report = orchestrator.getSandboxStatus(sandbox.id());

            assertEquals(SandboxStatus.STOPPED, report.recorded());
            assertEquals(ContainerState.EXITED, report.live());
            assertEquals(SandboxStatus.STOPPED, repository.getById(sandbox.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("a container that exited outside the engine can be started again")
        void exitedContainerCanBeStarted() {
            var sandbox = create("crashed", "alice");
            when(runtime.getState(sandbox.id())).thenReturn(ContainerState.EXITED);

            assertEquals(SandboxStatus.STOPPED, orchestrator.getSandbox(sandbox.id()).orElseThrow().status());

            assertEquals(SandboxStatus.RUNNING, orchestrator.startSandbox(sandbox.id()).status());
            verify(runtime).start(sandbox.id());
        }

        @Test
        @DisplayName("listing by status uses the live container state")
        void listReconciles() {
            var alive = create("alive", "alice");
            var exited = create("exited", "alice");
            var dead = create("dead", "alice");
            when(runtime.getState(alive.id())).thenReturn(ContainerState.RUNNING);
            when(runtime.getState(exited.id())).thenReturn(ContainerState.EXITED);
            when(runtime.getState(dead.id())).thenReturn(ContainerState.DEAD);

            var running = orchestrator.listSandboxes(new SandboxFilter("alice", Set.of(SandboxStatus.RUNNING)));

            assertEquals(List.of(alive.id()), running.stream().map(Sandbox::id).toList());
            var errored = repository.getById(dead.id()).orElseThrow();
            assertEquals(SandboxStatus.ERROR, errored.status());
            assertEquals(SandboxOrchestrator.CONTAINER_DEAD_MESSAGE, errored.errorMessage());
            assertEquals(SandboxStatus.STOPPED, repository.getById(exited.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("states in flux and unreadable containers leave the record alone")
        void reconcileLeavesRecordAlone() {
            var restarting = create("restarting", "alice");
            var unreachable = create("unreachable", "alice");
            when(runtime.getState(restarting.id())).thenReturn(ContainerState.RESTARTING);
            when(runtime.getState(unreachable.id()))
                    .thenThrow(new ContainerRuntimeException(unreachable.id(), "state", "daemon busy"));

            var all = orchestrator.listSandboxes(null);

            assertEquals(2, all.size());
            assertTrue(all.stream().allMatch(s -> s.status() == SandboxStatus.RUNNING));
        }

        @Test
        @DisplayName("a container missing on read moves the sandbox to error")
        void reconcileMissingContainer() {
            var sandbox = create("gone", "alice");
            when(runtime.getState(sandbox.id()))
                    .thenThrow(ContainerRuntimeException.containerMissing(sandbox.id(), "state", null));

            var read = orchestrator.getSandbox(sandbox.id()).orElseThrow();

            assertEquals(SandboxStatus.ERROR, read.status());
            assertEquals(SandboxOrchestrator.CONTAINER_MISSING_MESSAGE, read.errorMessage());
            assertEquals(1.0, counter("sandcastle.containers.missing", "operation", "reconcile"));

            orchestrator.getSandbox(sandbox.id());
            assertEquals(1.0, counter("sandcastle.containers.missing", "operation", "reconcile"));
        }

        @Test
        @DisplayName("container states map onto recorded statuses")
        void stateMapping() {
            assertEquals(SandboxStatus.RUNNING, SandboxOrchestrator.recordedStatusFor(ContainerState.RUNNING));
            assertEquals(SandboxStatus.STOPPED, SandboxOrchestrator.recordedStatusFor(ContainerState.PAUSED));
            assertEquals(SandboxStatus.STOPPED, SandboxOrchestrator.recordedStatusFor(ContainerState.EXITED));
            assertEquals(SandboxStatus.ERROR, SandboxOrchestrator.recordedStatusFor(ContainerState.DEAD));
            assertNull(SandboxOrchestrator.recordedStatusFor(ContainerState.CREATED));
            assertNull(SandboxOrchestrator.recordedStatusFor(ContainerState.UNKNOWN));
            assertNull(SandboxOrchestrator.recordedStatusFor(null));
        }

        @Test
        @DisplayName("info includes the repository and records the access")
        void info() {
            var sandbox = create("info", "alice");
            when(git.getRepo(sandbox.repoName())).thenReturn(Optional.of(repo(sandbox.repoName())));

            var info = orchestrator.getSandboxInfo(sandbox.id());

            assertEquals(sandbox.id(), info.sandbox().id());
            assertNotNull(info.sandbox().lastAccessedAt());
            assertEquals(sandbox.repoName(), info.repository().name());
        }

        @Test
        @DisplayName("unknown sandbox queries are not found")
        void unknown() {
            assertTrue(orchestrator.getSandbox("ghost").isEmpty());
            assertThrows(EntityNotFoundException.class, () -> orchestrator.getSandboxInfo("ghost"));
            assertThrows(EntityNotFoundException.class, () -> orchestrator.getSandboxStatus("ghost"));
            assertThrows(EntityNotFoundException.class, () -> orchestrator.getSandboxLogs("ghost", null));
            assertThrows(EntityNotFoundException.class, () -> orchestrator.getSandboxStats("ghost"));
        }
    }

    // ── Exec ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("exec")
    class Exec {

        @Test
        @DisplayName("empty commands are rejected before any lookup")
        void emptyCommand() {
            assertThrows(ValidationException.class, () -> orchestrator.exec("any", List.of(), null));
            assertThrows(ValidationException.class, () -> orchestrator.exec("any", List.of(" "), null));
            assertThrows(ValidationException.class, () -> orchestrator.exec("any", null, null));
            verifyNoInteractions(runtime);
        }

        @Test
        @DisplayName("sandboxes without a container cannot exec")
        void noContainer() {
            insertBare("fresh0000000", SandboxStatus.CREATED, null);

            assertThrows(PreconditionException.class,
                    () -> orchestrator.exec("fresh0000000", List.of("ls"), null));
            verifyNoInteractions(runtime);
        }

        @Test
        @DisplayName("result is returned as reported by the runtime")
        void passesResultThrough() {
            var sandbox = create("exec", "alice");
            when(runtime.exec(eq(sandbox.id()), eq(List.of("false")), any()))
                    .thenReturn(new ExecResult(1, "", "failed"));

            var result = orchestrator.exec(sandbox.id(), List.of("false"), ExecOptions.defaults());

            assertEquals(1, result.exitCode());
            assertFalse(result.succeeded());
        }
    }

    // ── Git ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("git operations")
    class Git {

        @Test
        @DisplayName("commit uses the configured author by default")
        void commitDefaultAuthor() {
            var sandbox = create("repo", "alice");
            when(git.commit(anyString(), any())).thenReturn(new CommitResult("abc123"));

            var result = orchestrator.commitChanges(sandbox.id(), "Save work", null);

            assertEquals("abc123", result.sha());
            verify(git).commit(sandbox.repoName(),
                    new CommitRequest("Save work", new CommitAuthor("Sandcastle", "sandcastle@localhost")));
        }

        @Test
        @DisplayName("commit message must not be blank")
        void blankMessage() {
            var sandbox = create("repo", "alice");

            var ex = assertThrows(ValidationException.class,
                    () -> orchestrator.commitChanges(sandbox.id(), "  ", null));
            assertEquals("Commit message must not be blank", ex.getMessage());
            verify(git, never()).commit(anyString(), any());
        }

        @Test
        @DisplayName("sandboxes without a repository are rejected")
        void noRepository() {
            insertBare("norepo000000", SandboxStatus.STOPPED, null);

            var ex = assertThrows(PreconditionException.class,
                    () -> orchestrator.commitChanges("norepo000000", "msg", null));
            assertEquals("sandbox has no repository", ex.getMessage());
            assertThrows(PreconditionException.class, () -> orchestrator.getGitStatus("norepo000000"));
            verifyNoInteractions(git);
        }

        @Test
        @DisplayName("log limit must be positive")
        void logLimit() {
            var sandbox = create("repo", "alice");
            when(git.getLog(sandbox.repoName(), 5)).thenReturn(new GitLog(List.of()));

            assertThrows(ValidationException.class, () -> orchestrator.getGitLog(sandbox.id(), 0));
            assertTrue(orchestrator.getGitLog(sandbox.id(), 5).commits().isEmpty());
            verify(git).getLog(sandbox.repoName(), 5);
        }
    }

    @Test
    @DisplayName("operations are timed by outcome")
    void operationsTimed() {
        create("timed", "alice");
        assertThrows(EntityNotFoundException.class, () -> orchestrator.startSandbox("ghost"));

        assertNotNull(registry.find("sandcastle.operation.duration")
                .tags("operation", "create", "outcome", "success").timer());
        assertNotNull(registry.find("sandcastle.operation.duration")
                .tags("operation", "start", "outcome", "EntityNotFoundException").timer());
    }

    @Test
    @DisplayName("health delegates to the runtime")
    void health() {
        when(runtime.healthCheck()).thenReturn(true);

        assertTrue(orchestrator.healthCheck());
        when(runtime.healthCheck()).thenReturn(false);
        assertFalse(orchestrator.healthCheck());
    }
}
