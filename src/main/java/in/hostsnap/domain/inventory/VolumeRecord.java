package in.hostsnap.domain.inventory;

/**
 * One mounted storage volume.
 */
public record VolumeRecord(
    String name,
    String type,
    long totalBytes,
    boolean readOnly
) {}
