package in.hostsnap.domain.inventory;

/**
 * One live thread of the snapshotting JVM.
 */
public record ThreadRecord(
    long threadId,
    String name,
    String state,
    boolean daemon,
    int priority
) {}
