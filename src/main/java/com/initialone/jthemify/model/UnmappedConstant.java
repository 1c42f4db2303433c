package com.initialone.jthemify.model;

import java.util.List;

/**
 * A Namespace.member reference that no mapping partition names, with every place it is used.
 * Reported for information only; unmapped constants are left as they are.
 */
public final class UnmappedConstant {

    /** 按使用次数分级：>=10 critical，3-9 warning，其余 info */
    public enum Level {
        CRITICAL, WARNING, INFO
    }

    private final String qualifiedName;
    private final List<String> locations;

    public UnmappedConstant(String qualifiedName, List<String> locations) {
        this.qualifiedName = qualifiedName;
        this.locations = List.copyOf(locations);
    }

    public String qualifiedName() { return qualifiedName; }

    /** file:line, in scan order */
    public List<String> locations() { return locations; }

    public int usageCount() { return locations.size(); }

    public Level level() {
        int n = usageCount();
        if (n >= 10) return Level.CRITICAL;
        if (n >= 3) return Level.WARNING;
        return Level.INFO;
    }

    @Override
    public String toString() {
        return qualifiedName + " x" + usageCount() + " (" + level() + ")";
    }
}
