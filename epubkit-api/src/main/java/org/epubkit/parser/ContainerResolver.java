package org.epubkit.parser;

import lombok.extern.slf4j.Slf4j;
import org.epubkit.archive.EpubArchive;
import org.epubkit.exception.EpubError;
import org.epubkit.util.XmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Reads {@code META-INF/container.xml} to locate the package document. When several
 * renditions are declared the first rootfile in document order wins.
 */
@Slf4j
public class ContainerResolver {

    public static final String CONTAINER_PATH = "META-INF/container.xml";

    public String resolve(EpubArchive archive) {
        byte[] data = archive.readBytes(CONTAINER_PATH);
        Document doc = XmlUtils.parse(data, CONTAINER_PATH);

        List<Element> rootfiles = XmlUtils.firstChild(doc.getDocumentElement(), "rootfiles")
                .map(el -> XmlUtils.childElements(el, "rootfile"))
                .orElse(List.of());
        if (rootfiles.isEmpty()) {
            throw EpubError.NOT_FOUND.createException("Rootfile declaration in " + CONTAINER_PATH);
        }
        if (rootfiles.size() > 1) {
            log.debug("{} declares {} rootfiles, using the first", CONTAINER_PATH, rootfiles.size());
        }

        String fullPath = XmlUtils.attribute(rootfiles.get(0), "full-path");
        if (fullPath.isEmpty()) {
            throw EpubError.NOT_FOUND.createException("full-path attribute of the first rootfile in " + CONTAINER_PATH);
        }
        return fullPath;
    }
}
