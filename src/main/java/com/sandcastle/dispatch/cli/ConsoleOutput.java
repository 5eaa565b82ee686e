package com.sandcastle.dispatch.cli;

import com.sandcastle.core.model.Sandbox;
import com.sandcastle.core.model.SandboxStatus;
import com.sandcastle.git.GitRepository;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Sandcastle CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SANDCASTLE v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SANDCASTLE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void field(String label, Object value) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + String.format("%-14s", label) + "|@ " + (value == null ? "-" : value)));
    }

    public static String status(SandboxStatus status) {
        String color = switch (status) {
            case RUNNING -> "fg(green)";
            case ERROR -> "fg(red)";
            case STOPPED, PAUSED -> "fg(yellow)";
            case CREATED -> "fg(cyan)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status.value() + "|@");
    }

    public static void sandbox(Sandbox s) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold SANDBOX " + s.id() + "|@ " + s.name()));
        field("Status", status(s.status()));
        field("Owner", s.userId());
        field("Slug", s.slug());
        if (s.description() != null) {
            field("Description", s.description());
        }
        field("Flavor", s.flavorId());
        field("Tier", s.resourceTierId());
        field("Addons", s.addonIds().isEmpty() ? "none" : String.join(", ", s.addonIds()));
        field("Container", s.containerName());
        if (s.opencodeUrl() != null) field("OpenCode", s.opencodeUrl());
        if (s.codeServerUrl() != null) field("Code server", s.codeServerUrl());
        if (s.vncUrl() != null) field("VNC", s.vncUrl());
        if (s.githubUrl() != null) field("Cloned from", s.githubUrl());
        if (s.errorMessage() != null) field("Error", s.errorMessage());
        field("Created", s.createdAt());
        field("Last access", s.lastAccessedAt());
    }

    public static void repository(GitRepository repo) {
        if (repo == null) {
            field("Repository", "-");
            return;
        }
        field("Repository", repo.path());
        field("Branch", repo.currentBranch());
        field("Working tree", repo.dirty() ? "dirty" : "clean");
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + "B";
        double kb = bytes / 1024.0;
        if (kb < 1024) return String.format("%.1fKiB", kb);
        double mb = kb / 1024.0;
        if (mb < 1024) return String.format("%.1fMiB", mb);
        return String.format("%.2fGiB", mb / 1024.0);
    }
}
