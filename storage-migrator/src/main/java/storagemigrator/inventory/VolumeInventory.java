package storagemigrator.inventory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import storagemigrator.exceptions.MalformedDescriptorException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the disks of a domain out of its XML description.
 *
 * <p>Every {@code <disk>} under {@code <domain><devices>} becomes a
 * {@link VolumeDescriptor}:
 * <ul>
 *   <li>{@code <source file="/dir/name"/>} gives a {@link VolumeDescriptor.FileBacked}</li>
 *   <li>{@code <source pool="p" volume="v"/>} gives a {@link VolumeDescriptor.PoolBacked}</li>
 * </ul>
 * CD-ROM and floppy drives are skipped: removable media is not relocated.
 *
 * <p>This is a pure transformation with no side effects.
 */
public final class VolumeInventory {

    private static final Logger log = LoggerFactory.getLogger(VolumeInventory.class);

    private static final Set<String> SKIPPED_DEVICE_KINDS = Set.of("cdrom", "floppy");

    private VolumeInventory() {}

    /**
     * Builds the volume map of a domain.
     *
     * @param domainXml the domain description
     * @return the disks in document order
     * @throws MalformedDescriptorException if the description cannot be parsed into volumes
     */
    public static VolumeMap parse(String domainXml) throws MalformedDescriptorException {
        Objects.requireNonNull(domainXml, "domainXml");

        Element root = parseDocument(domainXml).getDocumentElement();
        if (!"domain".equals(root.getTagName())) {
            throw new MalformedDescriptorException("Root element is <" + root.getTagName() + ">, expected <domain>");
        }

        Element devices = firstChild(root, "devices");
        if (devices == null) {
            throw new MalformedDescriptorException("Domain description has no <devices> element");
        }

        List<VolumeDescriptor> volumes = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Element disk : children(devices, "disk")) {
            VolumeDescriptor d = toDescriptor(disk);
            if (d == null) {
                continue;
            }
            if (!seen.add(d.targetDevice())) {
                throw new MalformedDescriptorException("Duplicate target device", d.targetDevice());
            }
            volumes.add(d);
        }

        log.debug("Parsed {} volume(s): {}", volumes.size(), seen);
        return VolumeMap.of(volumes);
    }

    private static VolumeDescriptor toDescriptor(Element disk) throws MalformedDescriptorException {
        String deviceKind = disk.getAttribute("device");
        Element target = firstChild(disk, "target");
        String targetDev = target != null ? target.getAttribute("dev").trim() : "";

        if (SKIPPED_DEVICE_KINDS.contains(deviceKind)) {
            log.debug("Skipping {} device {}", deviceKind, targetDev);
            return null;
        }

        if (targetDev.isEmpty()) {
            throw new MalformedDescriptorException("Disk entry has no target device id");
        }

        Element source = firstChild(disk, "source");
        if (source == null) {
            throw new MalformedDescriptorException("Disk has no source", targetDev);
        }

        if (source.hasAttribute("file")) {
            return fileBacked(targetDev, source.getAttribute("file"));
        }

        String pool = source.getAttribute("pool");
        String volume = source.getAttribute("volume");
        if (!pool.isEmpty() && !volume.isEmpty()) {
            return new VolumeDescriptor.PoolBacked(targetDev, pool, volume);
        }

        throw new MalformedDescriptorException("Disk source names neither a file nor a pool volume", targetDev);
    }

    private static VolumeDescriptor fileBacked(String targetDev, String file) throws MalformedDescriptorException {
        try {
            return VolumeDescriptor.FileBacked.ofFile(targetDev, Path.of(file));
        } catch (IllegalArgumentException e) {
            throw new MalformedDescriptorException("Unusable source file '" + file + "'", targetDev);
        }
    }

    // ===== DOM helpers =====

    private static Document parseDocument(String xml) throws MalformedDescriptorException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(null);
            Document doc = builder.parse(new InputSource(new StringReader(xml)));
            doc.getDocumentElement().normalize();
            return doc;
        } catch (SAXException | IOException e) {
            throw new MalformedDescriptorException("Domain description is not valid XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        }
    }

    private static Element firstChild(Element parent, String tag) {
        List<Element> found = children(parent, tag);
        return found.isEmpty() ? null : found.get(0);
    }

    private static List<Element> children(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE && tag.equals(n.getNodeName())) {
                result.add((Element) n);
            }
        }
        return result;
    }
}
