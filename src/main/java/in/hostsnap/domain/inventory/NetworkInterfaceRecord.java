package in.hostsnap.domain.inventory;

import java.util.List;

/**
 * One network interface.
 *
 * @param hardwareAddress MAC address as colon-separated hex, or null if the interface has none
 * @param addresses bound IP addresses in platform order
 */
public record NetworkInterfaceRecord(
    String name,
    String displayName,
    int index,
    boolean up,
    boolean loopback,
    int mtu,
    String hardwareAddress,
    List<String> addresses
) {
    public NetworkInterfaceRecord {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
    }
}
