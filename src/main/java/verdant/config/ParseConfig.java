// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.config;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import verdant.util.collection.ImmutableList;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The immutable configuration of the parser, supplied at parse time and kept with the parsed document so that edits
 * are reparsed the same way.
 * <p>
 * Every field has a documented default; {@link #defaults()} returns a configuration with all defaults. Derived
 * configurations are created with the {@code with*} methods.
 */
public final class ParseConfig {
    private ParseConfig(
        final ImmutableList<String> activeTodoKeywords,
        final ImmutableList<String> doneTodoKeywords,
        final ImmutableList<String> dualKeywords,
        final ImmutableList<String> parsedKeywords,
        final ImmutableList<String> affiliatedKeywords,
        final UseSubSuperscript useSubSuperscript,
        final boolean cloze
    ) {
        this.activeTodoKeywords = activeTodoKeywords;
        this.doneTodoKeywords = doneTodoKeywords;
        this.dualKeywords = upperCase(dualKeywords);
        this.parsedKeywords = upperCase(parsedKeywords);
        this.affiliatedKeywords = upperCase(affiliatedKeywords);
        this.useSubSuperscript = useSubSuperscript;
        this.cloze = cloze;
    }

    /**
     * Returns the default configuration:
     * <ul>
     * <li>todo keywords: {@code TODO} active, {@code DONE} done;</li>
     * <li>dual keywords: {@code CAPTION}, {@code RESULTS};</li>
     * <li>parsed keywords: {@code CAPTION};</li>
     * <li>affiliated keywords: {@code CAPTION}, {@code DATA}, {@code HEADER}, {@code HEADERS}, {@code LABEL},
     * {@code NAME}, {@code PLOT}, {@code RESNAME}, {@code RESULT}, {@code RESULTS}, {@code SOURCE}, {@code SRCNAME},
     * {@code TBLNAME};</li>
     * <li>subscripts and superscripts: {@link UseSubSuperscript#TRUE};</li>
     * <li>cloze deletions: not parsed.</li>
     * </ul>
     */
    public static ParseConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a copy of this configuration with the given todo keywords. Keywords are matched case-sensitively.
     */
    @CheckReturnValue
    public ParseConfig withTodoKeywords(final List<String> active, final List<String> done) {
        return new ParseConfig(
            ImmutableList.copyOf(active),
            ImmutableList.copyOf(done),
            dualKeywords,
            parsedKeywords,
            affiliatedKeywords,
            useSubSuperscript,
            cloze
        );
    }

    /**
     * Returns a copy of this configuration with the given dual keywords, those affiliated keywords that accept an
     * optional {@code [secondary]} value.
     */
    @CheckReturnValue
    public ParseConfig withDualKeywords(final List<String> keywords) {
        return new ParseConfig(
            activeTodoKeywords,
            doneTodoKeywords,
            ImmutableList.copyOf(keywords),
            parsedKeywords,
            affiliatedKeywords,
            useSubSuperscript,
            cloze
        );
    }

    /**
     * Returns a copy of this configuration with the given parsed keywords, those affiliated keywords whose values
     * contain inline markup.
     */
    @CheckReturnValue
    public ParseConfig withParsedKeywords(final List<String> keywords) {
        return new ParseConfig(
            activeTodoKeywords,
            doneTodoKeywords,
            dualKeywords,
            ImmutableList.copyOf(keywords),
            affiliatedKeywords,
            useSubSuperscript,
            cloze
        );
    }

    /**
     * Returns a copy of this configuration with the given affiliated keywords. Keywords starting with {@code ATTR_}
     * are always affiliated.
     */
    @CheckReturnValue
    public ParseConfig withAffiliatedKeywords(final List<String> keywords) {
        return new ParseConfig(
            activeTodoKeywords,
            doneTodoKeywords,
            dualKeywords,
            parsedKeywords,
            ImmutableList.copyOf(keywords),
            useSubSuperscript,
            cloze
        );
    }

    @CheckReturnValue
    public ParseConfig withUseSubSuperscript(final UseSubSuperscript value) {
        return new ParseConfig(
            activeTodoKeywords,
            doneTodoKeywords,
            dualKeywords,
            parsedKeywords,
            affiliatedKeywords,
            value,
            cloze
        );
    }

    /**
     * Returns a copy of this configuration in which cloze deletions, {@code {{text}{hint}@id}}, are parsed or not.
     */
    @CheckReturnValue
    public ParseConfig withCloze(final boolean enabled) {
        return new ParseConfig(
            activeTodoKeywords,
            doneTodoKeywords,
            dualKeywords,
            parsedKeywords,
            affiliatedKeywords,
            useSubSuperscript,
            enabled
        );
    }

    public ImmutableList<String> activeTodoKeywords() {
        return activeTodoKeywords;
    }

    public ImmutableList<String> doneTodoKeywords() {
        return doneTodoKeywords;
    }

    public ImmutableList<String> dualKeywords() {
        return dualKeywords;
    }

    public ImmutableList<String> parsedKeywords() {
        return parsedKeywords;
    }

    public ImmutableList<String> affiliatedKeywords() {
        return affiliatedKeywords;
    }

    public UseSubSuperscript useSubSuperscript() {
        return useSubSuperscript;
    }

    public boolean cloze() {
        return cloze;
    }

    /**
     * Checks whether the given keyword key, in any case, is affiliated.
     */
    public boolean isAffiliatedKeyword(final String key) {
        final var upper = key.toUpperCase(Locale.ROOT);
        return upper.startsWith("ATTR_") || affiliatedKeywords.contains(upper);
    }

    public boolean isDualKeyword(final String key) {
        return dualKeywords.contains(key.toUpperCase(Locale.ROOT));
    }

    public boolean isParsedKeyword(final String key) {
        return parsedKeywords.contains(key.toUpperCase(Locale.ROOT));
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return this == object || (object instanceof ParseConfig other
            && activeTodoKeywords.equals(other.activeTodoKeywords)
            && doneTodoKeywords.equals(other.doneTodoKeywords)
            && dualKeywords.equals(other.dualKeywords)
            && parsedKeywords.equals(other.parsedKeywords)
            && affiliatedKeywords.equals(other.affiliatedKeywords)
            && useSubSuperscript == other.useSubSuperscript
            && cloze == other.cloze);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            activeTodoKeywords,
            doneTodoKeywords,
            dualKeywords,
            parsedKeywords,
            affiliatedKeywords,
            useSubSuperscript,
            cloze
        );
    }

    @Override
    public String toString() {
        return "ParseConfig[todo=" + activeTodoKeywords + ", done=" + doneTodoKeywords + ", dual=" + dualKeywords
            + ", parsed=" + parsedKeywords + ", affiliated=" + affiliatedKeywords + ", subSuperscript="
            + useSubSuperscript + ", cloze=" + cloze + "]";
    }

    private static ImmutableList<String> upperCase(final List<String> keywords) {
        return ImmutableList.map(keywords, (final String keyword) -> keyword.toUpperCase(Locale.ROOT));
    }

    private static final ParseConfig DEFAULTS = new ParseConfig(
        ImmutableList.of("TODO"),
        ImmutableList.of("DONE"),
        ImmutableList.of("CAPTION", "RESULTS"),
        ImmutableList.of("CAPTION"),
        ImmutableList.of(
            "CAPTION",
            "DATA",
            "HEADER",
            "HEADERS",
            "LABEL",
            "NAME",
            "PLOT",
            "RESNAME",
            "RESULT",
            "RESULTS",
            "SOURCE",
            "SRCNAME",
            "TBLNAME"
        ),
        UseSubSuperscript.TRUE,
        false
    );

    private final ImmutableList<String> activeTodoKeywords;
    private final ImmutableList<String> doneTodoKeywords;
    private final ImmutableList<String> dualKeywords;
    private final ImmutableList<String> parsedKeywords;
    private final ImmutableList<String> affiliatedKeywords;
    private final UseSubSuperscript useSubSuperscript;
    private final boolean cloze;
}
