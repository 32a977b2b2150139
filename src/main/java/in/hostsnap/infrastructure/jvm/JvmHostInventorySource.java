package in.hostsnap.infrastructure.jvm;

import in.hostsnap.domain.inventory.MemoryRecord;
import in.hostsnap.domain.inventory.NetworkInterfaceRecord;
import in.hostsnap.domain.inventory.OperatingSystemRecord;
import in.hostsnap.domain.inventory.ProcessRecord;
import in.hostsnap.domain.inventory.ThreadRecord;
import in.hostsnap.domain.inventory.VolumeRecord;
import in.hostsnap.source.Category;
import in.hostsnap.source.FailureReason;
import in.hostsnap.source.InventorySource;
import in.hostsnap.source.QueryFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Inventory source backed by the JDK's process, management and networking APIs.
 *
 * Answers every category in {@link HostCategories}. Queries are stateless reads, so one
 * instance serves any number of concurrent refreshes.
 */
public class JvmHostInventorySource implements InventorySource {
    private static final Logger log = LoggerFactory.getLogger(JvmHostInventorySource.class);

    private final AtomicBoolean open = new AtomicBoolean(false);
    private final Map<Category<?>, Supplier<List<?>>> readers = Map.of(
        HostCategories.PROCESSES, this::readProcesses,
        HostCategories.THREADS, this::readThreads,
        HostCategories.VOLUMES, this::readVolumes,
        HostCategories.NETWORK_INTERFACES, this::readNetworkInterfaces,
        HostCategories.MEMORY, this::readMemory,
        HostCategories.OPERATING_SYSTEM, this::readOperatingSystem
    );

    @Override
    public void open() {
        if (open.compareAndSet(false, true)) {
            log.info("[JvmHostSource] Opened ({} categories)", readers.size());
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> List<R> query(Category<R> category) {
        if (!open.get()) {
            throw new QueryFailureException(category.name(), FailureReason.CONNECTIVITY, "Source is not open");
        }
        Supplier<List<?>> reader = readers.get(category);
        if (reader == null) {
            throw new QueryFailureException(category.name(), FailureReason.UNSUPPORTED,
                "No reader for " + category);
        }

        try {
            return (List<R>) reader.get();
        } catch (QueryFailureException e) {
            throw e;
        } catch (SecurityException e) {
            throw new QueryFailureException(category.name(), FailureReason.PERMISSION_DENIED, e.getMessage(), e);
        } catch (UncheckedIOException e) {
            FailureReason reason = e.getCause() instanceof AccessDeniedException
                ? FailureReason.PERMISSION_DENIED
                : FailureReason.CONNECTIVITY;
            throw new QueryFailureException(category.name(), reason, e.getCause().getMessage(), e.getCause());
        }
    }

    @Override
    public boolean supports(Category<?> category) {
        return readers.containsKey(category);
    }

    @Override
    public String name() {
        return "jvm-host";
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            log.info("[JvmHostSource] Closed");
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // READERS
    // ════════════════════════════════════════════════════════════════════════

    private List<?> readProcesses() {
        return ProcessHandle.allProcesses()
            .map(p -> {
                ProcessHandle.Info info = p.info();
                return new ProcessRecord(
                    p.pid(),
                    p.parent().map(ProcessHandle::pid).orElse(null),
                    info.command().orElse(null),
                    info.user().orElse(null),
                    info.startInstant().orElse(null)
                );
            })
            .sorted(Comparator.comparingLong(ProcessRecord::pid))
            .collect(Collectors.toList());
    }

    private List<?> readThreads() {
        ThreadMXBean threads = ManagementFactory.getThreadMXBean();
        List<ThreadRecord> rows = new ArrayList<>();
        for (ThreadInfo info : threads.dumpAllThreads(false, false)) {
            rows.add(new ThreadRecord(
                info.getThreadId(),
                info.getThreadName(),
                info.getThreadState().name(),
                info.isDaemon(),
                info.getPriority()
            ));
        }
        return rows;
    }

    private List<?> readVolumes() {
        List<VolumeRecord> rows = new ArrayList<>();
        for (FileStore store : FileSystems.getDefault().getFileStores()) {
            try {
                rows.add(new VolumeRecord(store.name(), store.type(), store.getTotalSpace(), store.isReadOnly()));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read volume " + store.name(), e);
            }
        }
        return rows;
    }

    private List<?> readNetworkInterfaces() {
        try {
            List<NetworkInterfaceRecord> rows = new ArrayList<>();
            for (NetworkInterface nic : NetworkInterface.networkInterfaces().collect(Collectors.toList())) {
                rows.add(new NetworkInterfaceRecord(
                    nic.getName(),
                    nic.getDisplayName(),
                    nic.getIndex(),
                    nic.isUp(),
                    nic.isLoopback(),
                    nic.getMTU(),
                    formatHardwareAddress(nic.getHardwareAddress()),
                    nic.inetAddresses().map(InetAddress::getHostAddress).collect(Collectors.toList())
                ));
            }
            return rows;
        } catch (SocketException e) {
            throw new QueryFailureException(HostCategories.NETWORK_INTERFACES.name(), FailureReason.CONNECTIVITY,
                e.getMessage(), e);
        }
    }

    private List<?> readMemory() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        int processors = os.getAvailableProcessors();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean ext = (com.sun.management.OperatingSystemMXBean) os;
            return List.of(new MemoryRecord(ext.getTotalMemorySize(), ext.getTotalSwapSpaceSize(), processors));
        }
        throw new QueryFailureException(HostCategories.MEMORY.name(), FailureReason.UNSUPPORTED,
            "JVM does not expose physical memory size");
    }

    private List<?> readOperatingSystem() {
        return List.of(new OperatingSystemRecord(
            System.getProperty("os.name"),
            System.getProperty("os.version"),
            System.getProperty("os.arch"),
            System.getProperty("java.version")
        ));
    }

    static String formatHardwareAddress(byte[] mac) {
        if (mac == null || mac.length == 0) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < mac.length; i++) {
            if (i > 0) sb.append(':');
            sb.append(String.format("%02x", mac[i]));
        }
        return sb.toString();
    }
}
