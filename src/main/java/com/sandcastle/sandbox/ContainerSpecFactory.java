package com.sandcastle.sandbox;

import com.sandcastle.core.config.SandcastleProperties;
import com.sandcastle.core.model.Addon;
import com.sandcastle.core.model.ContainerFlavor;
import com.sandcastle.core.model.ResourceTier;
import com.sandcastle.core.model.Sandbox;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives the {@link ContainerSpec} for a sandbox from its catalog entries
 * and the runtime configuration.
 *
 * <p>Image: {@code <registry>/<flavor image>:<tag>} (registry omitted when unset).
 * Published URLs: {@code opencode} always, {@code code-server} and {@code vnc}
 * when the matching addon is selected.
 */
public class ContainerSpecFactory {

    public static final String OPENCODE = "opencode";
    public static final String CODE_SERVER = "code-server";
    public static final String VNC = "vnc";

    static final String GUI_ADDON = "gui";
    static final String CODE_SERVER_ADDON = "code-server";

    private static final List<String> KEEP_ALIVE_COMMAND = List.of("sh", "-c", "tail -f /dev/null");

    private final SandcastleProperties.Runtime runtime;
    private final Path reposDir;

    public ContainerSpecFactory(SandcastleProperties properties) {
        this.runtime = properties.getRuntime();
        this.reposDir = Path.of(properties.getGit().getReposDir()).toAbsolutePath().normalize();
    }

    public String containerName(String sandboxId) {
        return runtime.getContainerPrefix() + "-" + sandboxId;
    }

    public String imageFor(ContainerFlavor flavor) {
        String registry = runtime.getImageRegistry();
        String image = flavor.imageName() + ":" + runtime.getImageTag();
        if (registry == null || registry.isBlank()) {
            return image;
        }
        return registry.endsWith("/") ? registry + image : registry + "/" + image;
    }

    public String urlFor(String slug, String service) {
        String protocol = runtime.isTls() ? "https" : "http";
        String host = switch (service) {
            case OPENCODE -> slug + "-api";
            case CODE_SERVER -> slug + "-code";
            case VNC -> slug + "-vnc";
            default -> slug + "-" + service;
        };
        return "%s://%s.%s".formatted(protocol, host, runtime.getBaseDomain());
    }

    public ContainerSpec build(Sandbox sandbox, ResourceTier tier, ContainerFlavor flavor,
                               List<Addon> addons, boolean start) {
        var addonIds = addons.stream().map(Addon::id).toList();

        var labels = new LinkedHashMap<String, String>();
        labels.put(ContainerLabels.MANAGED, "true");
        labels.put(ContainerLabels.SANDBOX_ID, sandbox.id());
        labels.put(ContainerLabels.SANDBOX_NAME, sandbox.name());
        labels.put(ContainerLabels.SANDBOX_SLUG, sandbox.slug());
        labels.put(ContainerLabels.SANDBOX_USER, sandbox.userId());
        labels.put(ContainerLabels.SANDBOX_REPO, sandbox.repoName());
        if (sandbox.githubUrl() != null) {
            labels.put(ContainerLabels.SANDBOX_GITHUB, sandbox.githubUrl());
        }
        labels.put(ContainerLabels.url(OPENCODE), urlFor(sandbox.slug(), OPENCODE));
        if (addonIds.contains(CODE_SERVER_ADDON)) {
            labels.put(ContainerLabels.url(CODE_SERVER), urlFor(sandbox.slug(), CODE_SERVER));
        }
        if (addonIds.contains(GUI_ADDON)) {
            labels.put(ContainerLabels.url(VNC), urlFor(sandbox.slug(), VNC));
        }

        var env = new LinkedHashMap<String, String>();
        env.put("SANDBOX_ID", sandbox.id());
        env.put("SANDBOX_NAME", sandbox.name());
        env.put("SANDBOX_SLUG", sandbox.slug());
        env.put("SANDBOX_FLAVOR", flavor.id());
        env.put("SANDBOX_ADDONS", addons.stream().map(Addon::id).collect(Collectors.joining(",")));
        env.put("WORKSPACE", runtime.getWorkdir());

        var repoPath = reposDir.resolve(sandbox.repoName()).toString();

        return new ContainerSpec(
                sandbox.id(),
                containerName(sandbox.id()),
                imageFor(flavor),
                runtime.getWorkdir(),
                labels,
                env,
                List.of(new ContainerSpec.Mount(repoPath, runtime.getWorkdir(), false)),
                tier.cpuCores(),
                tier.memoryBytes(),
                KEEP_ALIVE_COMMAND,
                runtime.getNetwork(),
                start);
    }
}
