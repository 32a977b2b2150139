package in.hostsnap.domain.inventory;

/**
 * Installed memory and processor capacity of the host.
 */
public record MemoryRecord(
    long totalPhysicalBytes,
    long totalSwapBytes,
    int availableProcessors
) {}
