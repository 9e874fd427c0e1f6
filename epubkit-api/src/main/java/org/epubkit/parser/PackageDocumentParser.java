package org.epubkit.parser;

import lombok.extern.slf4j.Slf4j;
import org.epubkit.archive.EpubArchive;
import org.epubkit.model.ManifestItem;
import org.epubkit.model.Metadata;
import org.epubkit.model.PackageDocument;
import org.epubkit.model.SpineItemRef;
import org.epubkit.util.XmlUtils;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the OPF package document into metadata, manifest and spine. Manifest and spine keep
 * document order; nothing is validated.
 */
@Slf4j
public class PackageDocumentParser {

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    public PackageDocument parse(EpubArchive archive, String rootFile) {
        byte[] data = archive.readBytes(rootFile);
        Element packageEl = XmlUtils.parse(data, rootFile).getDocumentElement();

        Metadata metadata = XmlUtils.firstChild(packageEl, "metadata")
                .map(this::parseMetadata)
                .orElse(Metadata.EMPTY);

        List<ManifestItem> manifest = XmlUtils.firstChild(packageEl, "manifest")
                .map(this::parseManifest)
                .orElse(List.of());

        List<SpineItemRef> spine = XmlUtils.firstChild(packageEl, "spine")
                .map(this::parseSpine)
                .orElse(List.of());

        log.debug("Parsed package document {}: {} manifest items, {} spine entries",
                rootFile, manifest.size(), spine.size());

        return PackageDocument.builder()
                .metadata(metadata)
                .manifest(manifest)
                .spine(spine)
                .build();
    }

    private Metadata parseMetadata(Element metadataEl) {
        return Metadata.builder()
                .title(XmlUtils.lastChildText(metadataEl, "title"))
                .creator(XmlUtils.lastChildText(metadataEl, "creator"))
                .subject(XmlUtils.lastChildText(metadataEl, "subject"))
                .description(XmlUtils.lastChildText(metadataEl, "description"))
                .publisher(XmlUtils.lastChildText(metadataEl, "publisher"))
                .contributor(XmlUtils.lastChildText(metadataEl, "contributor"))
                .date(XmlUtils.lastChildText(metadataEl, "date"))
                .type(XmlUtils.lastChildText(metadataEl, "type"))
                .format(XmlUtils.lastChildText(metadataEl, "format"))
                .identifier(XmlUtils.lastChildText(metadataEl, "identifier"))
                .language(XmlUtils.lastChildText(metadataEl, "language"))
                .rights(XmlUtils.lastChildText(metadataEl, "rights"))
                .build();
    }

    private List<ManifestItem> parseManifest(Element manifestEl) {
        List<ManifestItem> manifest = new ArrayList<>();
        for (Element item : XmlUtils.childElements(manifestEl, "item")) {
            String properties = XmlUtils.attribute(item, "properties");
            List<String> propList = properties.isEmpty()
                    ? List.of()
                    : List.copyOf(Arrays.asList(WHITESPACE_PATTERN.split(properties)));

            manifest.add(ManifestItem.builder()
                    .id(XmlUtils.attribute(item, "id"))
                    .href(XmlUtils.attribute(item, "href"))
                    .mediaType(XmlUtils.attribute(item, "media-type"))
                    .properties(propList)
                    .build());
        }
        return List.copyOf(manifest);
    }

    private List<SpineItemRef> parseSpine(Element spineEl) {
        List<SpineItemRef> spine = new ArrayList<>();
        for (Element itemref : XmlUtils.childElements(spineEl, "itemref")) {
            spine.add(SpineItemRef.builder()
                    .idref(XmlUtils.attribute(itemref, "idref"))
                    .linear(!"no".equals(XmlUtils.attribute(itemref, "linear")))
                    .build());
        }
        return List.copyOf(spine);
    }
}
