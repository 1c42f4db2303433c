package com.initialone.jthemify.mapping;

import com.initialone.jthemify.model.ExtensionTarget;
import com.initialone.jthemify.model.MappingTable;
import com.initialone.jthemify.model.StrictMapping;
import com.initialone.jthemify.model.ValidationIssue;
import com.initialone.jthemify.model.ValidationReport;

import javax.lang.model.SourceVersion;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static checks of a mapping table. A table with errors must not drive a rewrite;
 * warnings describe entries that are ignored or shadowed at resolution time.
 */
public class MappingValidator {

    public ValidationReport validate(MappingTable table, String source) {
        ValidationReport report = ValidationReport.empty();

        Map<String, String> targetOwner = new HashMap<>();
        for (Map.Entry<String, StrictMapping> e : table.strictMappings.entrySet()) {
            String name = e.getKey();
            checkName(name, source, report);
            StrictMapping sm = e.getValue();
            if (sm == null || sm.target == null || sm.target.isBlank()) {
                report.add(ValidationIssue.error(source, null, "Missing target for " + name, null));
                continue;
            }
            if (!isDottedIdentifier(sm.target)) {
                report.add(ValidationIssue.error(source, null,
                        "Invalid strict target: " + sm.target + " for " + name,
                        "Use a dotted path of Java identifiers, e.g. colorScheme.primary"));
            }
            String previous = targetOwner.putIfAbsent(sm.target, name);
            if (previous != null) {
                report.add(ValidationIssue.warning(source, null,
                        "Duplicate strict target: " + sm.target + " (" + previous + ", " + name + ")", null));
            }
        }

        Map<String, String> groupOf = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, ExtensionTarget>> g : table.extensions.entrySet()) {
            String group = g.getKey();
            if (!isIdentifier(group)) {
                report.add(ValidationIssue.error(source, null,
                        "Invalid extension name: " + group + " (must be a valid Java identifier)", null));
            }
            if (g.getValue() == null) continue;
            for (Map.Entry<String, ExtensionTarget> e : g.getValue().entrySet()) {
                String name = e.getKey();
                checkName(name, source, report);
                ExtensionTarget et = e.getValue();
                if (et == null || et.target == null || !isIdentifier(et.target)) {
                    report.add(ValidationIssue.error(source, null,
                            "Invalid extension property name: " + (et == null ? null : et.target) + " for " + name, null));
                }
                String other = groupOf.putIfAbsent(name, group);
                if (other != null && !other.equals(group)) {
                    report.add(ValidationIssue.error(source, null,
                            name + " is mapped in two extension groups: " + other + ", " + group,
                            "Keep " + name + " in one group"));
                }
                if (table.strictMappings.containsKey(name)) {
                    report.add(ValidationIssue.warning(source, null,
                            name + " is both a strict mapping and in extension " + group + "; the strict mapping wins", null));
                }
            }
        }

        Set<String> seen = new HashSet<>();
        for (String name : table.preserved) {
            checkName(name, source, report);
            if (!seen.add(name)) continue;
            if (table.strictMappings.containsKey(name) || groupOf.containsKey(name)) {
                report.add(ValidationIssue.warning(source, null,
                        name + " is both mapped and preserved; the mapping wins", null));
            }
        }

        for (String ns : table.namespaces) {
            if (!isDottedIdentifier(ns)) {
                report.add(ValidationIssue.error(source, null, "Invalid namespace: " + ns, null));
            }
        }
        return report;
    }

    private static void checkName(String name, String source, ValidationReport report) {
        int i = name == null ? -1 : name.lastIndexOf('.');
        if (i <= 0 || i == name.length() - 1 || !isDottedIdentifier(name)) {
            report.add(ValidationIssue.error(source, null,
                    "Invalid constant name: " + name, "Use the form Namespace.member, e.g. AppColors.primaryBlue"));
        }
    }

    static boolean isIdentifier(String s) {
        return s != null && SourceVersion.isIdentifier(s) && !SourceVersion.isKeyword(s);
    }

    static boolean isDottedIdentifier(String s) {
        if (s == null || s.isEmpty()) return false;
        for (String part : s.split("\\.", -1)) {
            if (!isIdentifier(part)) return false;
        }
        return true;
    }
}
