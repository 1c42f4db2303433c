package com.initialone.jthemify.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * User-authored migration contract. Bound from the mapping file (snake_case keys):
 *
 * <pre>
 * version: "1.0"
 * namespaces: [AppColors]
 * strict_mappings:
 *   AppColors.primaryBlue: { target: colorScheme.primary }
 * extensions:
 *   BrandColors:
 *     AppColors.accent: { target: accent }
 * preserved: [AppColors.debugPink]
 * convention: { handle_type: BuildContext, accessor_type: Theme }
 * </pre>
 *
 * Names are unique keys. Extension groups keep their declared order.
 */
public class MappingTable {
    public String version = "1.0";
    /** 视为颜色常量的限定名；为空时从映射 key 推导 */
    public List<String> namespaces = new ArrayList<>();
    public Map<String, StrictMapping> strictMappings = new LinkedHashMap<>();
    public Map<String, Map<String, ExtensionTarget>> extensions = new LinkedHashMap<>();
    public List<String> preserved = new ArrayList<>();
    public ThemeConvention convention = ThemeConvention.defaults();

    public Set<String> effectiveNamespaces() {
        Set<String> out = new LinkedHashSet<>();
        if (namespaces != null && !namespaces.isEmpty()) {
            out.addAll(namespaces);
            return out;
        }
        for (String name : allNames()) {
            int i = name.lastIndexOf('.');
            if (i > 0) out.add(name.substring(0, i));
        }
        return out;
    }

    /** 所有分区里出现的名字，按声明顺序 */
    public List<String> allNames() {
        List<String> out = new ArrayList<>();
        if (strictMappings != null) out.addAll(strictMappings.keySet());
        if (extensions != null) {
            for (Map<String, ExtensionTarget> group : extensions.values()) {
                if (group != null) out.addAll(group.keySet());
            }
        }
        if (preserved != null) out.addAll(preserved);
        return out;
    }

    public ThemeConvention conventionOrDefault() {
        return convention == null ? ThemeConvention.defaults() : convention;
    }

    public MappingTable strict(String name, String target) {
        strictMappings.put(name, new StrictMapping(target));
        return this;
    }

    public MappingTable extension(String group, String name, String property) {
        extensions.computeIfAbsent(group, g -> new LinkedHashMap<>()).put(name, new ExtensionTarget(property));
        return this;
    }

    public MappingTable preserve(String name) {
        preserved.add(name);
        return this;
    }
}
