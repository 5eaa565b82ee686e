package com.sandcastle.core.catalog;

import com.sandcastle.core.model.Addon;
import com.sandcastle.core.model.ContainerFlavor;
import com.sandcastle.core.model.ResourceTier;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of the resource tiers, container flavors and addons a
 * sandbox can be created with. Entries do not change for the lifetime of the process.
 */
public interface ResourceCatalog {

    Optional<ResourceTier> getResourceTier(String id);

    ResourceTier getDefaultResourceTier();

    Optional<ContainerFlavor> getFlavor(String id);

    ContainerFlavor getDefaultFlavor();

    Optional<Addon> getAddon(String id);

    /** All tiers ordered by sort order. */
    List<ResourceTier> listResourceTiers();

    /** All flavors ordered by sort order. */
    List<ContainerFlavor> listFlavors();

    /** All addons ordered by sort order. */
    List<Addon> listAddons();

    /** Addons applied when a creation request does not name any. */
    List<String> defaultAddonIds();
}
