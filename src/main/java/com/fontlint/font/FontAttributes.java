package com.fontlint.font;

/**
 * Immutable snapshot of the descriptive metadata of one font instance.
 * Used as the right-hand side of condition matching; never mutated.
 *
 * @param filename  Font file name (e.g., "NotoSansDevanagari-Regular.ttf")
 * @param name      Family name (e.g., "Noto Sans Devanagari")
 * @param style     Style (e.g., "Sans", "Serif")
 * @param script    Script code (e.g., "Deva")
 * @param variant   Variant (e.g., "UI")
 * @param weight    Weight name (e.g., "Regular", "Bold")
 * @param monospace Whether the font is monospaced
 * @param hinted    Whether the font is hinted
 * @param vendor    Vendor (e.g., "Monotype", "Adobe")
 * @param version   Version string (e.g., "1.02")
 */
public record FontAttributes(
        String filename,
        String name,
        String style,
        String script,
        String variant,
        String weight,
        boolean monospace,
        boolean hinted,
        String vendor,
        String version
) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FontAttributes. Unset string fields stay null.
     */
    public static final class Builder {
        private String filename;
        private String name;
        private String style;
        private String script;
        private String variant;
        private String weight;
        private boolean monospace;
        private boolean hinted;
        private String vendor;
        private String version;

        private Builder() {
        }

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder style(String style) {
            this.style = style;
            return this;
        }

        public Builder script(String script) {
            this.script = script;
            return this;
        }

        public Builder variant(String variant) {
            this.variant = variant;
            return this;
        }

        public Builder weight(String weight) {
            this.weight = weight;
            return this;
        }

        public Builder monospace(boolean monospace) {
            this.monospace = monospace;
            return this;
        }

        public Builder hinted(boolean hinted) {
            this.hinted = hinted;
            return this;
        }

        public Builder vendor(String vendor) {
            this.vendor = vendor;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public FontAttributes build() {
            return new FontAttributes(filename, name, style, script, variant, weight,
                    monospace, hinted, vendor, version);
        }
    }
}
