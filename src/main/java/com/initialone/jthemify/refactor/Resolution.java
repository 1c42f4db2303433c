package com.initialone.jthemify.refactor;

import java.util.Objects;

/** Outcome of looking a qualified name up in the mapping table. */
public final class Resolution {
    private static final Resolution PRESERVED = new Resolution(ResolutionKind.PRESERVED, null, null, null);
    private static final Resolution UNMAPPED = new Resolution(ResolutionKind.UNMAPPED, null, null, null);

    private final ResolutionKind kind;
    private final String target;
    private final String group;
    private final String note;

    private Resolution(ResolutionKind kind, String target, String group, String note) {
        this.kind = kind;
        this.target = target;
        this.group = group;
        this.note = note;
    }

    public static Resolution strict(String target) {
        return strict(target, null);
    }

    /** @param note 映射文件里的说明/原色值，只用于展示 */
    public static Resolution strict(String target, String note) {
        return new Resolution(ResolutionKind.STRICT, Objects.requireNonNull(target, "target"), null, note);
    }

    public static Resolution extension(String group, String property) {
        return extension(group, property, null);
    }

    public static Resolution extension(String group, String property, String note) {
        return new Resolution(ResolutionKind.EXTENSION,
                Objects.requireNonNull(property, "property"), Objects.requireNonNull(group, "group"), note);
    }

    public static Resolution preserved() {
        return PRESERVED;
    }

    public static Resolution unmapped() {
        return UNMAPPED;
    }

    public ResolutionKind kind() { return kind; }

    /** Scheme slot for STRICT, property for EXTENSION, null otherwise */
    public String target() { return target; }

    /** Extension group for EXTENSION, null otherwise */
    public String group() { return group; }

    /** Informational text from the mapping entry, null when it has none */
    public String note() { return note; }

    public boolean isRewrite() {
        return kind == ResolutionKind.STRICT || kind == ResolutionKind.EXTENSION;
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRICT: return "strict -> " + target;
            case EXTENSION: return "extension -> " + group + "." + target;
            default: return kind.name().toLowerCase();
        }
    }
}
