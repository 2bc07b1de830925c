package storagemigrator.inventory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Disks of one domain keyed by target device, in the order the domain lists them.
 *
 * <p>Built fresh from the domain description on every run and never persisted on its
 * own: the domain description is the source of truth.
 */
public final class VolumeMap {

    private static final VolumeMap EMPTY = new VolumeMap(Map.of());

    private final Map<String, VolumeDescriptor> byDevice;

    private VolumeMap(Map<String, VolumeDescriptor> byDevice) {
        this.byDevice = byDevice;
    }

    /**
     * Creates a map from descriptors in order.
     *
     * @param descriptors the descriptors
     * @return the map
     * @throws IllegalArgumentException if two descriptors share a target device
     */
    public static VolumeMap of(Collection<? extends VolumeDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors");
        Map<String, VolumeDescriptor> byDevice = new LinkedHashMap<>();
        for (VolumeDescriptor d : descriptors) {
            if (byDevice.putIfAbsent(d.targetDevice(), d) != null) {
                throw new IllegalArgumentException("Duplicate target device: " + d.targetDevice());
            }
        }
        return new VolumeMap(Collections.unmodifiableMap(byDevice));
    }

    public static VolumeMap of(VolumeDescriptor... descriptors) {
        return of(List.of(descriptors));
    }

    public static VolumeMap empty() {
        return EMPTY;
    }

    /** Returns the descriptor for a device, or null if the domain has no such disk. */
    public VolumeDescriptor get(String targetDevice) {
        return byDevice.get(targetDevice);
    }

    public boolean contains(String targetDevice) {
        return byDevice.containsKey(targetDevice);
    }

    /** Target devices in domain order. */
    public Set<String> devices() {
        return byDevice.keySet();
    }

    /** Descriptors in domain order. */
    public List<VolumeDescriptor> descriptors() {
        return List.copyOf(byDevice.values());
    }

    public int size() {
        return byDevice.size();
    }

    public boolean isEmpty() {
        return byDevice.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VolumeMap other)) return false;
        return List.copyOf(byDevice.entrySet()).equals(List.copyOf(other.byDevice.entrySet()));
    }

    @Override
    public int hashCode() {
        return byDevice.hashCode();
    }

    @Override
    public String toString() {
        return "VolumeMap" + byDevice.values();
    }
}
