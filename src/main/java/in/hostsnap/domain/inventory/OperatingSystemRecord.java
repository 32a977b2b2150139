package in.hostsnap.domain.inventory;

/**
 * Operating system identity as seen by the JVM.
 */
public record OperatingSystemRecord(
    String name,
    String version,
    String arch,
    String javaVersion
) {}
