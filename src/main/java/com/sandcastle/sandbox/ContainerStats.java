package com.sandcastle.sandbox;

/**
 * Point-in-time resource usage of a container. Byte counts are cumulative.
 */
public record ContainerStats(
    double cpuPercent,
    long memoryUsage,
    long memoryLimit,
    double memoryPercent,
    long networkRx,
    long networkTx,
    long blockRead,
    long blockWrite
) {}
