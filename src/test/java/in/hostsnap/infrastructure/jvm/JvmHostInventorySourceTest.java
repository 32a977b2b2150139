package in.hostsnap.infrastructure.jvm;

import in.hostsnap.domain.inventory.NetworkInterfaceRecord;
import in.hostsnap.domain.inventory.OperatingSystemRecord;
import in.hostsnap.domain.inventory.ProcessRecord;
import in.hostsnap.domain.inventory.ThreadRecord;
import in.hostsnap.source.Category;
import in.hostsnap.source.FailureReason;
import in.hostsnap.source.QueryFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.management.ManagementFactory;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests against the live JVM and host.
 *
 * Only categories every supported platform can answer are asserted on.
 */
class JvmHostInventorySourceTest {

    private JvmHostInventorySource source;

    @BeforeEach
    void setUp() {
        source = new JvmHostInventorySource();
        source.open();
    }

    @AfterEach
    void tearDown() {
        source.close();
    }

    @Test
    void testProcessesIncludeCurrentProcess() {
        long self = ProcessHandle.current().pid();

        List<ProcessRecord> processes = source.query(HostCategories.PROCESSES);

        assertTrue(processes.stream().anyMatch(p -> p.pid() == self), "Current pid " + self + " missing");
        for (int i = 1; i < processes.size(); i++) {
            assertTrue(processes.get(i - 1).pid() < processes.get(i).pid(), "Processes sorted by pid");
        }
    }

    @Test
    void testThreadsIncludeCurrentThread() {
        String name = Thread.currentThread().getName();

        List<ThreadRecord> threads = source.query(HostCategories.THREADS);

        assertTrue(threads.stream().anyMatch(t -> t.name().equals(name)));
    }

    @Test
    void testThreadsCategoryIsScopedToThisJvm() {
        List<ThreadRecord> threads = source.query(HostCategories.THREADS);

        assertTrue(HostCategories.THREADS.description().contains("JVM"));
        assertTrue(HostCategories.THREADS.description().contains("not host-wide"));
        assertTrue(threads.stream().allMatch(t -> t.threadId() > 0));
        assertTrue(threads.size() <= ManagementFactory.getThreadMXBean().getPeakThreadCount(),
            "Thread rows come from this JVM's thread bean");
    }

    @Test
    void testOperatingSystemMatchesSystemProperties() {
        List<OperatingSystemRecord> os = source.query(HostCategories.OPERATING_SYSTEM);

        assertEquals(1, os.size());
        assertEquals(System.getProperty("os.name"), os.get(0).name());
        assertEquals(System.getProperty("java.version"), os.get(0).javaVersion());
    }

    @Test
    void testNetworkInterfacesOrConnectivityFailure() {
        try {
            List<NetworkInterfaceRecord> nics = source.query(HostCategories.NETWORK_INTERFACES);
            for (NetworkInterfaceRecord nic : nics) {
                assertNotNull(nic.name());
                assertNotNull(nic.addresses());
            }
        } catch (QueryFailureException e) {
            assertEquals(FailureReason.CONNECTIVITY, e.getReason());
        }
    }

    @Test
    void testQueryBeforeOpenFailsWithConnectivity() {
        JvmHostInventorySource closed = new JvmHostInventorySource();

        QueryFailureException e = assertThrows(QueryFailureException.class,
            () -> closed.query(HostCategories.THREADS));

        assertEquals(FailureReason.CONNECTIVITY, e.getReason());
    }

    @Test
    void testUnknownCategoryIsUnsupported() {
        Category<String> unknown = Category.of("kernel_modules", String.class);

        assertFalse(source.supports(unknown));
        QueryFailureException e = assertThrows(QueryFailureException.class, () -> source.query(unknown));
        assertEquals(FailureReason.UNSUPPORTED, e.getReason());
    }

    @Test
    void testHardwareAddressFormatting() {
        assertEquals("00:1a:2b:ff:0e:9c",
            JvmHostInventorySource.formatHardwareAddress(new byte[]{0x00, 0x1a, 0x2b, (byte) 0xff, 0x0e, (byte) 0x9c}));
        assertNull(JvmHostInventorySource.formatHardwareAddress(null));
        assertNull(JvmHostInventorySource.formatHardwareAddress(new byte[0]));
    }

    @Test
    void testCategoryLookupByName() {
        assertEquals(HostCategories.NETWORK_INTERFACES, HostCategories.byName(" Network_Interfaces ").orElseThrow());
        assertTrue(HostCategories.byName("kernel_modules").isEmpty());
        assertEquals(6, HostCategories.ALL.size());
    }
}
