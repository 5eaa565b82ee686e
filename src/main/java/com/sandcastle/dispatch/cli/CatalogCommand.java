package com.sandcastle.dispatch.cli;

import com.sandcastle.core.catalog.ResourceCatalog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Locale;

/**
 * CLI command: sandcastle catalog
 * <p>
 * Lists the resource tiers, container flavors and addons a sandbox can be created with.
 */
@Command(name = "catalog", mixinStandardHelpOptions = true, description = "List tiers, flavors and addons")
@Component
public class CatalogCommand implements Runnable {

    private final ResourceCatalog catalog;

    public CatalogCommand(ResourceCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        System.out.println("RESOURCE TIERS");
        for (var tier : catalog.listResourceTiers()) {
            System.out.printf("  %-10s %4.1f CPU %3d GB RAM %4d GB disk%s%n",
                    tier.id(), tier.cpuCores(), tier.memoryGb(), tier.storageGb(),
                    tier.isDefault() ? "  (default)" : "");
        }

        System.out.println();
        System.out.println("FLAVORS");
        for (var flavor : catalog.listFlavors()) {
            System.out.printf("  %-10s %-30s %s%s%n",
                    flavor.id(), flavor.imageName(), String.join(", ", flavor.languages()),
                    flavor.isDefault() ? "  (default)" : "");
        }

        System.out.println();
        System.out.println("ADDONS");
        var defaults = catalog.defaultAddonIds();
        for (var addon : catalog.listAddons()) {
            System.out.printf("  %-14s %-8s %s%s%n",
                    addon.id(), addon.category().name().toLowerCase(Locale.ROOT),
                    ConsoleOutput.truncate(addon.description(), 50),
                    defaults.contains(addon.id()) ? "  (default)" : "");
        }
    }
}
