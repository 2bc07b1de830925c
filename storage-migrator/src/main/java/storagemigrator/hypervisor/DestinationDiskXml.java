package storagemigrator.hypervisor;

import storagemigrator.inventory.VolumeDescriptor;
import storagemigrator.plan.Destination;

/**
 * Builds the {@code <disk>} element handed to a block-copy request.
 *
 * <p>The copy keeps the disk's leaf name and always uses the qcow2 format:
 * <pre>
 * &lt;disk type='file' device='disk'&gt;&lt;driver name='qemu' type='qcow2'/&gt;&lt;source file='/dir/name'/&gt;&lt;/disk&gt;
 * &lt;disk type='volume' device='disk'&gt;&lt;driver name='qemu' type='qcow2'/&gt;&lt;source pool='p' volume='name'/&gt;&lt;/disk&gt;
 * </pre>
 */
public final class DestinationDiskXml {

    private DestinationDiskXml() {}

    /**
     * Renders the destination element for one disk.
     *
     * @param volume the disk being moved
     * @param destination where it goes
     * @return the disk XML
     */
    public static String render(VolumeDescriptor volume, Destination destination) {
        StringBuilder xml = new StringBuilder();
        if (destination instanceof Destination.Directory dir) {
            xml.append("<disk type='file' device='disk'>");
            xml.append("<driver name='qemu' type='qcow2'/>");
            xml.append("<source file='").append(escape(dir.fileFor(volume.volumeName()).toString())).append("'/>");
        } else {
            Destination.Pool pool = (Destination.Pool) destination;
            xml.append("<disk type='volume' device='disk'>");
            xml.append("<driver name='qemu' type='qcow2'/>");
            xml.append("<source pool='").append(escape(pool.name()))
                    .append("' volume='").append(escape(volume.volumeName())).append("'/>");
        }
        xml.append("</disk>");
        return xml.toString();
    }

    private static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '\'' -> sb.append("&apos;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
