package com.fontlint.tag;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the tag catalog for diagnostics, sorted by tag path.
 * <p>
 * Output per tag: the tag path, then an indented filter signature line and/or an
 * indented {@code -- comment} line when requested and present. With {@code allTags} unset,
 * only tags that have something to show for the requested details are listed.
 *
 * @param allTags  List every tag
 * @param comments Show comments
 * @param filters  Show relation and argument type signatures
 */
public record TagListing(boolean allTags, boolean comments, boolean filters) {

    public boolean isEmpty() {
        return !(allTags || comments || filters);
    }

    public List<String> render(TagCatalog catalog) {
        List<String> lines = new ArrayList<>();
        for (String tag : catalog.tags()) {
            TagInfo info = catalog.info(tag);
            String comment = comments ? info.comment() : null;
            String signature = filters ? info.signature() : null;

            if (!allTags && comment == null && signature == null) {
                continue;
            }
            lines.add(tag);
            if (signature != null) {
                lines.add("  " + signature);
            }
            if (comment != null) {
                lines.add("  -- " + comment);
            }
        }
        return lines;
    }
}
