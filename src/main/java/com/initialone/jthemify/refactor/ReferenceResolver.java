package com.initialone.jthemify.refactor;

import com.initialone.jthemify.ast.QualifiedReferenceNode;
import com.initialone.jthemify.ast.SourceUnit;
import com.initialone.jthemify.model.ExtensionTarget;
import com.initialone.jthemify.model.MappingTable;
import com.initialone.jthemify.model.StrictMapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds every Namespace.member reference of a unit and classifies it against the mapping.
 * Priority: strict, first extension group in declared order, preserved, unmapped.
 * Pure function of (tree, mapping).
 */
public class ReferenceResolver {

    public List<SymbolReference> resolve(SourceUnit unit, MappingTable mapping) {
        Set<String> namespaces = mapping.effectiveNamespaces();
        List<SymbolReference> out = new ArrayList<>();
        if (namespaces.isEmpty()) return out;

        for (QualifiedReferenceNode ref : unit.tree().qualifiedReferences()) {
            String ns = matchNamespace(ref.qualifier(), namespaces);
            if (ns == null) continue;
            String qualifiedName = ns + "." + ref.member();
            out.add(new SymbolReference(ref, qualifiedName, ref.text(), resolve(qualifiedName, mapping)));
        }
        return out;
    }

    public Resolution resolve(String qualifiedName, MappingTable mapping) {
        Map<String, StrictMapping> strict = mapping.strictMappings;
        if (strict != null) {
            StrictMapping sm = strict.get(qualifiedName);
            if (sm != null && sm.target != null) return Resolution.strict(sm.target, note(sm.verifyValue, sm.description));
        }
        if (mapping.extensions != null) {
            for (Map.Entry<String, Map<String, ExtensionTarget>> group : mapping.extensions.entrySet()) {
                if (group.getValue() == null) continue;
                ExtensionTarget et = group.getValue().get(qualifiedName);
                if (et != null && et.target != null) {
                    return Resolution.extension(group.getKey(), et.target, note(et.value, null));
                }
            }
        }
        if (mapping.preserved != null && mapping.preserved.contains(qualifiedName)) {
            return Resolution.preserved();
        }
        return Resolution.unmapped();
    }

    /** "was 0xFF2196F3; Primary brand blue" */
    private static String note(String value, String description) {
        List<String> parts = new ArrayList<>();
        if (value != null && !value.isBlank()) parts.add("was " + value.trim());
        if (description != null && !description.isBlank()) parts.add(description.trim());
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    /** AppColors 同时匹配 AppColors 和 com.acme.AppColors；返回配置里的命名空间 */
    static String matchNamespace(String qualifier, Set<String> namespaces) {
        for (String ns : namespaces) {
            if (qualifier.equals(ns)) return ns;
        }
        for (String ns : namespaces) {
            if (qualifier.endsWith("." + ns)) return ns;
        }
        return null;
    }
}
