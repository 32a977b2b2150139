package in.hostsnap.infrastructure.jvm;

import in.hostsnap.domain.inventory.MemoryRecord;
import in.hostsnap.domain.inventory.NetworkInterfaceRecord;
import in.hostsnap.domain.inventory.OperatingSystemRecord;
import in.hostsnap.domain.inventory.ProcessRecord;
import in.hostsnap.domain.inventory.ThreadRecord;
import in.hostsnap.domain.inventory.VolumeRecord;
import in.hostsnap.source.Category;

import java.util.List;
import java.util.Optional;

/**
 * Categories answered by {@link JvmHostInventorySource}.
 */
public final class HostCategories {

    public static final Category<ProcessRecord> PROCESSES =
        Category.of("processes", ProcessRecord.class, "Processes running on the host");

    /** JVM threads of the snapshotting process only, not a host-wide thread table. */
    public static final Category<ThreadRecord> THREADS =
        Category.of("threads", ThreadRecord.class, "JVM threads of this process (not host-wide)");

    public static final Category<VolumeRecord> VOLUMES =
        Category.of("volumes", VolumeRecord.class, "Mounted storage volumes");

    public static final Category<NetworkInterfaceRecord> NETWORK_INTERFACES =
        Category.of("network_interfaces", NetworkInterfaceRecord.class, "Network interfaces and bound addresses");

    public static final Category<MemoryRecord> MEMORY =
        Category.of("memory", MemoryRecord.class, "Installed memory and processors");

    public static final Category<OperatingSystemRecord> OPERATING_SYSTEM =
        Category.of("operating_system", OperatingSystemRecord.class, "Operating system identity");

    /** Every built-in category, in default refresh order. */
    public static final List<Category<?>> ALL = List.of(
        PROCESSES, THREADS, VOLUMES, NETWORK_INTERFACES, MEMORY, OPERATING_SYSTEM);

    public static Optional<Category<?>> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim();
        for (Category<?> category : ALL) {
            if (category.name().equalsIgnoreCase(wanted)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    private HostCategories() {}
}
