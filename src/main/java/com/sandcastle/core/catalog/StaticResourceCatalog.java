package com.sandcastle.core.catalog;

import com.sandcastle.core.model.Addon;
import com.sandcastle.core.model.AddonCategory;
import com.sandcastle.core.model.ContainerFlavor;
import com.sandcastle.core.model.ResourceTier;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Catalog backed by fixed in-memory lists. The no-arg constructor uses the
 * seeded entries; the list constructor is validated so that ids are unique
 * and exactly one tier and one flavor are marked default.
 */
public class StaticResourceCatalog implements ResourceCatalog {

    public static final List<ResourceTier> SEEDED_TIERS = List.of(
            new ResourceTier("starter", "Starter", "Perfect for learning and small projects",
                    1, 2, 20, true, 1),
            new ResourceTier("builder", "Builder", "For active development and medium projects",
                    2, 4, 30, false, 2),
            new ResourceTier("creator", "Creator", "For professional development and larger projects",
                    4, 8, 50, false, 3),
            new ResourceTier("power", "Power", "Maximum resources for demanding workloads",
                    8, 16, 100, false, 4)
    );

    public static final List<ContainerFlavor> SEEDED_FLAVORS = List.of(
            new ContainerFlavor("js", "JavaScript", "JavaScript and TypeScript development",
                    List.of("javascript", "typescript"), "codeopen-js", false, 1),
            new ContainerFlavor("python", "Python", "Python development with data science tools",
                    List.of("python"), "codeopen-python", false, 2),
            new ContainerFlavor("go", "Go", "Go development environment",
                    List.of("go"), "codeopen-go", false, 3),
            new ContainerFlavor("rust", "Rust", "Rust development environment",
                    List.of("rust"), "codeopen-rust", false, 4),
            new ContainerFlavor("fullstack", "Fullstack", "JavaScript + Python for full-stack development",
                    List.of("javascript", "typescript", "python"), "codeopen-fullstack", true, 5),
            new ContainerFlavor("polyglot", "Polyglot", "All languages for maximum flexibility",
                    List.of("javascript", "typescript", "python", "go", "rust"), "codeopen-polyglot", false, 6)
    );

    public static final List<Addon> SEEDED_ADDONS = List.of(
            new Addon("gui", "Desktop GUI", "Full desktop environment via KasmVNC",
                    AddonCategory.INTERFACE, 6080, false, 1),
            new Addon("code-server", "VS Code", "VS Code in browser via code-server",
                    AddonCategory.INTERFACE, 8080, false, 2),
            new Addon("databases", "Databases", "PostgreSQL, Redis, and DuckDB",
                    AddonCategory.STORAGE, null, false, 3),
            new Addon("cloud", "Cloud Tools", "AWS CLI, gcloud, Terraform, kubectl",
                    AddonCategory.DEVOPS, null, false, 4),
            new Addon("gpu", "GPU Support", "NVIDIA CUDA toolkit for ML/AI workloads",
                    AddonCategory.COMPUTE, null, true, 5)
    );

    public static final List<String> SEEDED_DEFAULT_ADDONS = List.of("code-server");

    private final Map<String, ResourceTier> tiers;
    private final Map<String, ContainerFlavor> flavors;
    private final Map<String, Addon> addons;
    private final List<String> defaultAddonIds;
    private final ResourceTier defaultTier;
    private final ContainerFlavor defaultFlavor;

    public StaticResourceCatalog() {
        this(SEEDED_TIERS, SEEDED_FLAVORS, SEEDED_ADDONS, SEEDED_DEFAULT_ADDONS);
    }

    public StaticResourceCatalog(List<ResourceTier> tiers, List<ContainerFlavor> flavors,
                                 List<Addon> addons, List<String> defaultAddonIds) {
        this.tiers = index(tiers, ResourceTier::id, Comparator.comparingInt(ResourceTier::sortOrder), "resource tier");
        this.flavors = index(flavors, ContainerFlavor::id, Comparator.comparingInt(ContainerFlavor::sortOrder), "flavor");
        this.addons = index(addons, Addon::id, Comparator.comparingInt(Addon::sortOrder), "addon");
        this.defaultTier = single(this.tiers.values().stream().filter(ResourceTier::isDefault).toList(), "resource tier");
        this.defaultFlavor = single(this.flavors.values().stream().filter(ContainerFlavor::isDefault).toList(), "flavor");
        for (String addonId : defaultAddonIds) {
            if (!this.addons.containsKey(addonId)) {
                throw new IllegalArgumentException("Default addon is not in the catalog: " + addonId);
            }
        }
        this.defaultAddonIds = List.copyOf(defaultAddonIds);
    }

    @Override
    public Optional<ResourceTier> getResourceTier(String id) {
        return Optional.ofNullable(id).map(tiers::get);
    }

    @Override
    public ResourceTier getDefaultResourceTier() {
        return defaultTier;
    }

    @Override
    public Optional<ContainerFlavor> getFlavor(String id) {
        return Optional.ofNullable(id).map(flavors::get);
    }

    @Override
    public ContainerFlavor getDefaultFlavor() {
        return defaultFlavor;
    }

    @Override
    public Optional<Addon> getAddon(String id) {
        return Optional.ofNullable(id).map(addons::get);
    }

    @Override
    public List<ResourceTier> listResourceTiers() {
        return List.copyOf(tiers.values());
    }

    @Override
    public List<ContainerFlavor> listFlavors() {
        return List.copyOf(flavors.values());
    }

    @Override
    public List<Addon> listAddons() {
        return List.copyOf(addons.values());
    }

    @Override
    public List<String> defaultAddonIds() {
        return defaultAddonIds;
    }

    private static <T> Map<String, T> index(List<T> entries, Function<T, String> idOf,
                                            Comparator<T> order, String kind) {
        var seen = new HashSet<String>();
        var sorted = entries.stream().sorted(order).toList();
        var result = new LinkedHashMap<String, T>();
        for (T entry : sorted) {
            String id = idOf.apply(entry);
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Duplicate %s id: %s".formatted(kind, id));
            }
            result.put(id, entry);
        }
        return result;
    }

    private static <T> T single(List<T> defaults, String kind) {
        if (defaults.size() != 1) {
            throw new IllegalArgumentException(
                    "Expected exactly one default %s but found %d".formatted(kind, defaults.size()));
        }
        return defaults.get(0);
    }
}
