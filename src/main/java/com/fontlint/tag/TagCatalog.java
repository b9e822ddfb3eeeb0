package com.fontlint.tag;

import com.fontlint.exception.AmbiguousTagException;
import com.fontlint.exception.GrammarException;
import com.fontlint.exception.UnknownTagException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed hierarchy of test tags, built once from an indentation-significant description.
 * <p>
 * Description grammar, one tag per line:
 * <pre>
 * indent name [relation-regex argtype-regex] [-- comment]
 * </pre>
 * A line is the child of the nearest preceding line with a shorter indent. Any level of
 * the hierarchy can be enabled or disabled; enabling a tag covers its whole subtree.
 * <p>
 * Immutable after construction and safe to share between threads.
 */
public final class TagCatalog {

    private static final Logger log = LoggerFactory.getLogger(TagCatalog.class);

    public static final char PATH_SEPARATOR = '/';
    private static final String SEGMENT_DELIMITERS = "/_";

    // 1: indent, 2: tag, 3: relation regex, 4: arg type regex, 5: comment
    private static final Pattern LINE = Pattern.compile(
            "(\\s*)([a-z0-9_]+)(?:\\s+([^\\s-]\\S*)\\s+(\\S+))?\\s*(?:--\\s*(.+?))?\\s*$");

    static final String DEFAULT_DESCRIPTION = """
            name -- name table tests
              copyright
              family
              subfamily
              full
              version
                hinted_suffix
                match_head
                out_of_range
                expected_pattern
              postscript
              trademark
              manufacturer
              designer
              description
              vendor_url
              designer_url
              license
              license_url
            cmap -- cmap table tests
              tables
                missing
                unexpected
                format_12_has_bmp
                format_4_subset_of_12
              required
              script_required except|only cp
              private_use
              non_characters
              disallowed_ascii
            head -- head table tests
              hhea
                ascent
                descent
                linegap
              vhea
                linegap
              os2
                fstype
                ascender
                descender
                linegap
                winascent
                windescent
                achvendid
                weight_class
                fsselection
                unicoderange
            bounds -- glyf limits etc
              glyph
                ui_ymax except|only cp|gid
                ui_ymin except|only cp|gid
                ymax except|only cp|gid
                ymin except|only cp|gid
              font
                ui_ymax
                ui_ymin
                ymax
                ymin
            paths -- outline tests
              extrema -- missing on-curve extrema
              intersection -- self-intersecting paths
            gdef -- gdef tests
              classdef
                not_present -- table is missing but there are mark glyphs
                unlisted -- mark glyph is present and expected to be listed
                combining_mismatch -- mark glyph is combining but not listed as combining
                not_combining_mismatch -- mark glyph is not combining but listed as combining
              attachlist
                duplicates
                out_of_order
              ligcaretlist
                not_present -- table is missing but there are ligatures
                not_ligature -- listed but not a ligature
                unlisted -- is a ligature but no caret
            complex -- gpos and gsub tests
              gpos
                missing
              gsub
                missing
            bidi -- tests bidi pairs, properties
              rtlm_non_mirrored -- rtlm GSUB feature applied to private-use or non-mirrored character
              ompl_rtlm -- rtlm GSUB feature applied to ompl char
              ompl_missing_pair -- ompl sibling not in cmap
              rtlm_unlisted -- non-ompl bidi char does not have rtlm GSUB feature
            hints
              unexpected_tables -- unhinted fonts shouldn't have hint tables
              missing_bytecode -- hinted tt fonts should have bytecodes
              unexpected_bytecode -- unhinted tt fonts should not have bytecodes
            advances
              digits -- checks that ASCII digits have same advance as digit zero
              comma_period -- checks that comma and period have same advance
              whitespace -- checks for expected advance relationships in whitespace
            stem -- stem widths
              left_joiner -- non-zero lsb
              right_joiner -- rsb not -70
            reachable
            """;

    private final Map<String, TagInfo> tags;
    private final NavigableSet<String> tagSet;

    private TagCatalog(Map<String, TagInfo> tags) {
        this.tags = Collections.unmodifiableMap(tags);
        this.tagSet = Collections.unmodifiableNavigableSet(new TreeSet<>(tags.keySet()));
    }

    /**
     * The built-in catalog, parsed on first use and shared afterwards.
     */
    public static TagCatalog defaultCatalog() {
        return DefaultHolder.INSTANCE;
    }

    private static final class DefaultHolder {
        private static final TagCatalog INSTANCE = parse(DEFAULT_DESCRIPTION);
    }

    /**
     * Build a catalog from a hierarchical description.
     *
     * @param description Indentation-significant tag description
     * @return Immutable catalog
     * @throws GrammarException if a non-blank line does not match the line grammar
     */
    public static TagCatalog parse(String description) {
        Map<String, TagInfo> tags = new LinkedHashMap<>();
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(Frame.ROOT);

        int lineNumber = 0;
        for (String line : description.split("\\R")) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            Matcher m = LINE.matcher(line);
            if (!m.matches()) {
                throw new GrammarException("Catalog line " + lineNumber
                        + " does not match tag grammar: '" + line + "'");
            }

            int indent = m.group(1).length();
            while (indent <= frames.peek().indent()) {
                frames.pop();
            }

            String parent = frames.peek().path();
            String path = parent.isEmpty() ? m.group(2) : parent + PATH_SEPARATOR + m.group(2);
            if (tags.containsKey(path)) {
                throw new GrammarException("Catalog line " + lineNumber + " repeats tag '" + path + "'");
            }
            tags.put(path, new TagInfo(path, m.group(3), m.group(4), m.group(5)));
            frames.push(new Frame(indent, path));
        }

        TagCatalog catalog = new TagCatalog(tags);
        log.debug("Tag catalog built with {} tags", tags.size());
        return catalog;
    }

    /** Enclosing tag on the ancestry stack; the root never pops. */
    private record Frame(int indent, String path) {
        static final Frame ROOT = new Frame(-1, "");
    }

    /**
     * All tag paths, sorted.
     */
    public NavigableSet<String> tags() {
        return tagSet;
    }

    public boolean contains(String tag) {
        return tags.containsKey(tag);
    }

    public int size() {
        return tags.size();
    }

    /**
     * Get catalog data for a tag.
     *
     * @throws UnknownTagException if the tag is not in the catalog
     */
    public TagInfo info(String tag) {
        TagInfo info = tags.get(tag);
        if (info == null) {
            throw new UnknownTagException("Unknown tag: " + tag);
        }
        return info;
    }

    /**
     * Resolve a full or partial tag to the set of tags it covers.
     * <p>
     * An exact tag covers itself and its subtree. Otherwise the tag must match exactly one
     * catalog tag as a segment delimited by '/' or '_' (e.g., "script_required" or
     * "tables/missing"), and covers that tag's subtree.
     *
     * @param tag Full or partial tag
     * @return Sorted, unmodifiable set of covered tags
     * @throws UnknownTagException   if nothing matches
     * @throws AmbiguousTagException if the partial tag matches more than one tag
     */
    public Set<String> resolveTagSet(String tag) {
        String root = contains(tag) ? tag : findUniquePartial(tag);

        NavigableSet<String> result = new TreeSet<>();
        String childPrefix = root + PATH_SEPARATOR;
        for (String candidate : tagSet.tailSet(root, true)) {
            if (!candidate.equals(root) && !candidate.startsWith(childPrefix)) {
                if (!candidate.startsWith(root)) {
                    break;
                }
                continue;
            }
            result.add(candidate);
        }
        return Collections.unmodifiableNavigableSet(result);
    }

    private String findUniquePartial(String partial) {
        if (partial == null || partial.isEmpty()) {
            throw new UnknownTagException("Unknown tag: '" + partial + "'");
        }
        String match = null;
        for (String candidate : tagSet) {
            if (!containsSegment(candidate, partial)) {
                continue;
            }
            if (match != null) {
                throw new AmbiguousTagException("Multiple matches for partial tag '" + partial
                        + "': " + match + ", " + candidate);
            }
            match = candidate;
        }
        if (match == null) {
            throw new UnknownTagException("Unknown tag: " + partial);
        }
        return match;
    }

    private static boolean containsSegment(String tag, String partial) {
        int ix = tag.indexOf(partial);
        while (ix >= 0) {
            int end = ix + partial.length();
            boolean startOk = ix == 0 || SEGMENT_DELIMITERS.indexOf(tag.charAt(ix - 1)) >= 0;
            boolean endOk = end == tag.length() || SEGMENT_DELIMITERS.indexOf(tag.charAt(end)) >= 0;
            if (startOk && endOk) {
                return true;
            }
            ix = tag.indexOf(partial, ix + 1);
        }
        return false;
    }

    @Override
    public String toString() {
        return "TagCatalog{" + tags.size() + " tags}";
    }
}
