package com.fontlint.cli;

import com.fontlint.config.RuleLoader;
import com.fontlint.engine.DefaultFontLintEngine;
import com.fontlint.engine.FontLintEngine;
import com.fontlint.font.FontAttributes;
import com.fontlint.font.FontAttributesLoader;
import com.fontlint.report.AuditReport;
import com.fontlint.report.AuditReportWriter;
import com.fontlint.selection.ResolvedTests;
import com.fontlint.tag.TagListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line operations over the tag catalog and rules.
 */
public class FontLintCommand {

    private static final Logger log = LoggerFactory.getLogger(FontLintCommand.class);

    static final String OPT_TAGS = "tags";
    static final String OPT_COMMENTS = "comments";
    static final String OPT_FILTERS = "filters";
    static final String OPT_RULES = "rules";
    static final String OPT_FONTS = "fonts";
    static final String OPT_FORMAT = "format";
    static final String FORMAT_JSON = "json";

    private final FontLintEngine engine;
    private final PrintStream out;

    public FontLintCommand(FontLintEngine engine, PrintStream out) {
        this.engine = engine;
        this.out = out;
    }

    public void run(ApplicationArguments args) {
        TagListing listing = new TagListing(
                args.containsOption(OPT_TAGS),
                args.containsOption(OPT_COMMENTS),
                args.containsOption(OPT_FILTERS));
        boolean resolveFonts = args.containsOption(OPT_FONTS);

        if (listing.isEmpty() && !resolveFonts) {
            out.println("nothing to do.");
            return;
        }

        if (!listing.isEmpty()) {
            listing.render(engine.getCatalog()).forEach(out::println);
        }

        if (resolveFonts) {
            resolve(args);
        }
    }

    private void resolve(ApplicationArguments args) {
        FontLintEngine target = engine;
        List<String> rulesPaths = args.getOptionValues(OPT_RULES);
        if (rulesPaths != null && !rulesPaths.isEmpty()) {
            target = new DefaultFontLintEngine(RuleLoader.loadAll(rulesPaths, engine.getCatalog()));
        }

        List<AuditReport> reports = new ArrayList<>();
        for (String path : args.getOptionValues(OPT_FONTS)) {
            for (FontAttributes font : FontAttributesLoader.load(path)) {
                ResolvedTests tests = target.resolve(font);
                reports.add(AuditReport.of(font, tests, target.getCatalog().tags()));
            }
        }
        log.info("Resolved lint tests for {} fonts", reports.size());

        List<String> formats = args.getOptionValues(OPT_FORMAT);
        if (formats != null && formats.contains(FORMAT_JSON)) {
            out.println(AuditReportWriter.toJson(reports));
            return;
        }
        for (AuditReport report : reports) {
            out.println(describe(report.font()));
            report.enabled().forEach(tag -> {
                String filter = report.filters().get(tag);
                out.println("  " + (filter == null ? tag : tag + " " + filter));
            });
            if (!report.disabled().isEmpty()) {
                out.println("  disabled: " + String.join(", ", report.disabled()));
            }
        }
    }

    private static String describe(FontAttributes font) {
        return font.filename() != null ? font.filename() : String.valueOf(font.name());
    }
}
