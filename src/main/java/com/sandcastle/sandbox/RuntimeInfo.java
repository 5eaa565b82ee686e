package com.sandcastle.sandbox;

/**
 * Description of the container runtime daemon.
 */
public record RuntimeInfo(
    String version,
    String apiVersion,
    String os,
    String arch,
    int cpus,
    long totalMemory,
    int containersRunning,
    int containersStopped,
    int images
) {}
