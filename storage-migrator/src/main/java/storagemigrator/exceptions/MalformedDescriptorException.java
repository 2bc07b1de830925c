package storagemigrator.exceptions;

/**
 * Thrown when a domain description cannot be turned into volume descriptors.
 *
 * <p>Raised by {@link storagemigrator.inventory.VolumeInventory} for unparsable XML,
 * a disk without a target device, or a disk whose source names neither a file nor a
 * pool volume. Always raised before any mutating hypervisor call.
 */
public class MalformedDescriptorException extends MigrateException {

    /**
     * Creates a new malformed descriptor exception.
     *
     * @param message a description of the problem
     */
    public MalformedDescriptorException(String message) {
        super(message);
    }

    /**
     * Creates a new malformed descriptor exception for a specific device.
     *
     * @param message a description of the problem
     * @param device the target device of the offending disk, or null if it has none
     */
    public MalformedDescriptorException(String message, String device) {
        super(message, null, device, null);
    }

    /**
     * Creates a new malformed descriptor exception with a cause.
     *
     * @param message a description of the problem
     * @param cause the parser error
     */
    public MalformedDescriptorException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "MalformedDescriptor";
    }
}
