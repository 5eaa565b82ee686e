package com.sandcastle.sandbox;

import com.sandcastle.core.catalog.StaticResourceCatalog;
import com.sandcastle.core.config.SandcastleProperties;
import com.sandcastle.core.model.Addon;
import com.sandcastle.core.model.Sandbox;
import com.sandcastle.core.model.SandboxStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContainerSpecFactoryTest {

    private final StaticResourceCatalog catalog = new StaticResourceCatalog();
    private SandcastleProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SandcastleProperties();
        properties.getGit().setReposDir("/srv/repos");
        properties.getRuntime().setBaseDomain("sandbox.example.com");
    }

    private Sandbox sandbox(List<String> addonIds) {
        return Sandbox.builder()
                .id("abc123def456").userId("alice").name("My Project").slug("my-project")
                .repoName("my-project-abc123def456")
                .status(SandboxStatus.CREATED)
                .resourceTierId("builder").flavorId("python")
                .addonIds(addonIds)
                .build();
    }

    private ContainerSpec build(List<String> addonIds) {
        var factory = new ContainerSpecFactory(properties);
        List<Addon> addons = addonIds.stream().map(id -> catalog.getAddon(id).orElseThrow()).toList();
        return factory.build(sandbox(addonIds),
                catalog.getResourceTier("builder").orElseThrow(),
                catalog.getFlavor("python").orElseThrow(),
                addons, true);
    }

    @Test
    @DisplayName("image combines registry, flavor image and tag")
    void imageName() {
        var factory = new ContainerSpecFactory(properties);
        var python = catalog.getFlavor("python").orElseThrow();

        assertEquals("codeopen-python:latest", factory.imageFor(python));

        properties.getRuntime().setImageRegistry("ghcr.io/sandcastle/");
        properties.getRuntime().setImageTag("2024.03");
        assertEquals("ghcr.io/sandcastle/codeopen-python:2024.03", factory.imageFor(python));
    }

    @Test
    @DisplayName("container is named after the sandbox id with the configured prefix")
    void containerName() {
        var spec = build(List.of());
        assertEquals("sandcastle-abc123def456", spec.containerName());
        assertEquals("abc123def456", spec.sandboxId());
    }

    @Test
    @DisplayName("tier limits are applied")
    void resourceLimits() {
        var spec = build(List.of());
        assertEquals(2.0, spec.cpuCores());
        assertEquals(4L * 1024 * 1024 * 1024, spec.memoryBytes());
    }

    @Test
    @DisplayName("repository directory is bind-mounted at the workdir")
    void repositoryMount() {
        var spec = build(List.of());
        assertEquals(1, spec.binds().size());
        var mount = spec.binds().get(0);
        assertEquals(Path.of("/srv/repos/my-project-abc123def456").toAbsolutePath().toString(), mount.hostPath());
        assertEquals("/home/workspace", mount.containerPath());
        assertFalse(mount.readOnly());
        assertEquals("/home/workspace", spec.workdir());
    }

    @Test
    @DisplayName("ownership labels identify the sandbox")
    void ownershipLabels() {
        var labels = build(List.of()).labels();
        assertEquals("true", labels.get(ContainerLabels.MANAGED));
        assertEquals("abc123def456", labels.get(ContainerLabels.SANDBOX_ID));
        assertEquals("alice", labels.get(ContainerLabels.SANDBOX_USER));
        assertEquals("my-project-abc123def456", labels.get(ContainerLabels.SANDBOX_REPO));
        assertFalse(labels.containsKey(ContainerLabels.SANDBOX_GITHUB));
    }

    @Test
    @DisplayName("only opencode is published without interface addons")
    void opencodeOnly() {
        var urls = ContainerLabels.urls(build(List.of("databases")).labels());
        assertEquals(1, urls.size());
        assertEquals("http://my-project-api.sandbox.example.com", urls.get(ContainerSpecFactory.OPENCODE));
    }

    @Test
    @DisplayName("code-server and gui addons publish their URLs")
    void addonUrls() {
        properties.getRuntime().setTls(true);
        var urls = ContainerLabels.urls(build(List.of("code-server", "gui")).labels());
        assertEquals("https://my-project-api.sandbox.example.com", urls.get(ContainerSpecFactory.OPENCODE));
        assertEquals("https://my-project-code.sandbox.example.com", urls.get(ContainerSpecFactory.CODE_SERVER));
        assertEquals("https://my-project-vnc.sandbox.example.com", urls.get(ContainerSpecFactory.VNC));
    }

    @Test
    @DisplayName("environment describes the sandbox")
    void environment() {
        var env = build(List.of("code-server", "gui")).env();
        assertEquals("abc123def456", env.get("SANDBOX_ID"));
        assertEquals("my-project", env.get("SANDBOX_SLUG"));
        assertEquals("python", env.get("SANDBOX_FLAVOR"));
        assertEquals("code-server,gui", env.get("SANDBOX_ADDONS"));
        assertEquals("/home/workspace", env.get("WORKSPACE"));
    }

    @Test
    @DisplayName("container keeps running without a foreground process")
    void keepAliveCommand() {
        var spec = build(List.of());
        assertEquals(List.of("sh", "-c", "tail -f /dev/null"), spec.command());
        assertTrue(spec.start());
        assertNull(spec.network());
    }
}
