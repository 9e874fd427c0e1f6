package org.epubkit.cover;

import org.epubkit.model.ManifestItem;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the cover image among manifest items declared under one of the conventional ids.
 */
public class CoverLocator {

    static final List<String> COVER_IDS = List.of("cover", "cover-image", "cover-img");
    static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif");

    public Optional<ManifestItem> locate(List<ManifestItem> manifest) {
        for (String id : COVER_IDS) {
            Optional<ManifestItem> candidate = manifest.stream()
                    .filter(item -> id.equals(item.getId()))
                    .findFirst();
            if (candidate.isPresent() && isImage(candidate.get())) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    static boolean isImage(ManifestItem item) {
        if (item.getMediaType() != null && item.getMediaType().startsWith("image/")) {
            return true;
        }
        String href = item.getHref() == null ? "" : item.getHref().toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(href::endsWith);
    }
}
