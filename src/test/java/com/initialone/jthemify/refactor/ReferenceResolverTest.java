package com.initialone.jthemify.refactor;

import com.initialone.jthemify.ast.SourceUnit;
import com.initialone.jthemify.ast.java.JavaSourceParser;
import com.initialone.jthemify.model.MappingTable;
import com.initialone.jthemify.model.ThemeConvention;
import com.initialone.jthemify.model.Transformation;
import com.initialone.jthemify.model.TransformationKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    private final ReferenceResolver resolver = new ReferenceResolver();

    private static SourceUnit parse(String src) throws Exception {
        return new JavaSourceParser().parse(null, src);
    }

    @Test
    void strictWinsOverExtensionForTheSameName() throws Exception {
        MappingTable mapping = new MappingTable()
                .extension("BrandColors", "AppColors.primaryBlue", "brandBlue")
                .strict("AppColors.primaryBlue", "colorScheme.primary");

        List<SymbolReference> refs = resolver.resolve(parse(
                "class Card { Object build(BuildContext context) { return AppColors.primaryBlue; } }"), mapping);
        assertEquals(1, refs.size());
        assertEquals(ResolutionKind.STRICT, refs.get(0).resolution().kind());

        List<Transformation> planned = new TransformationEngine(ThemeConvention.defaults()).plan(refs);
        assertEquals(1, planned.size());
        assertEquals(TransformationKind.STRICT, planned.get(0).kind());
        assertEquals("Theme.of(context).colorScheme.primary", planned.get(0).newText());
    }

    @Test
    void unmappedAndPreservedNamesProduceNoTransformation() throws Exception {
        MappingTable mapping = new MappingTable()
                .strict("AppColors.primaryBlue", "colorScheme.primary")
                .preserve("AppColors.debugPink");
        String src = "class Card {\n"
                + "  Object a(BuildContext context) { return AppColors.debugPink; }\n"
                + "  Object b(BuildContext context) { return AppColors.unknownTeal; }\n"
                + "}\n";

        List<SymbolReference> refs = resolver.resolve(parse(src), mapping);
        assertEquals(2, refs.size());
        assertEquals(ResolutionKind.PRESERVED, refs.get(0).resolution().kind());
        assertEquals(ResolutionKind.UNMAPPED, refs.get(1).resolution().kind());
        assertTrue(new TransformationEngine(ThemeConvention.defaults()).plan(refs).isEmpty());
    }

    @Test
    void firstExtensionGroupInDeclaredOrderWins() {
        MappingTable mapping = new MappingTable()
                .extension("StatusColors", "AppColors.ok", "success")
                .extension("BrandColors", "AppColors.ok", "brandOk");

        Resolution r = resolver.resolve("AppColors.ok", mapping);
        assertEquals(ResolutionKind.EXTENSION, r.kind());
        assertEquals("StatusColors", r.group());
        assertEquals("success", r.target());
    }

    @Test
    void fullyQualifiedNamespaceResolvesToConfiguredName() throws Exception {
        MappingTable mapping = new MappingTable().strict("AppColors.accent", "colorScheme.secondary");

        List<SymbolReference> refs = resolver.resolve(parse(
                "class Card { Object c = com.acme.AppColors.accent; }"), mapping);
        assertEquals(1, refs.size());
        SymbolReference ref = refs.get(0);
        assertEquals("AppColors.accent", ref.qualifiedName());
        assertEquals("com.acme.AppColors.accent", ref.text());
        assertEquals(ResolutionKind.STRICT, ref.resolution().kind());
    }

    @Test
    void otherQualifiersAreIgnoredAndOrderIsAscending() throws Exception {
        MappingTable mapping = new MappingTable()
                .strict("AppColors.a", "colorScheme.primary")
                .strict("AppColors.b", "colorScheme.secondary");
        String src = "class Card { Object[] all = { AppColors.b, Colors.a, MyAppColors.a, AppColors.a }; }";

        List<SymbolReference> refs = resolver.resolve(parse(src), mapping);
        assertEquals(2, refs.size());
        assertEquals("AppColors.b", refs.get(0).qualifiedName());
        assertEquals("AppColors.a", refs.get(1).qualifiedName());
        assertTrue(refs.get(0).offset() < refs.get(1).offset());
    }

    @Test
    void namespacesAreDerivedFromNamesUnlessListed() {
        MappingTable derived = new MappingTable()
                .strict("AppColors.a", "colorScheme.primary")
                .preserve("Legacy.Palette.old");
        assertEquals(Set.of("AppColors", "Legacy.Palette"), derived.effectiveNamespaces());

        MappingTable explicit = new MappingTable().strict("AppColors.a", "colorScheme.primary");
        explicit.namespaces.add("Brand");
        assertEquals(Set.of("Brand"), explicit.effectiveNamespaces());
    }

    @Test
    void emptyMappingFindsNothing() throws Exception {
        assertTrue(resolver.resolve(parse("class Card { Object c = AppColors.a; }"), new MappingTable()).isEmpty());
    }

    @Test
    void namespaceMatchPrefersExactQualifier() {
        assertEquals("AppColors", ReferenceResolver.matchNamespace("AppColors", Set.of("AppColors")));
        assertEquals("AppColors", ReferenceResolver.matchNamespace("com.acme.AppColors", Set.of("AppColors")));
        assertNull(ReferenceResolver.matchNamespace("MyAppColors", Set.of("AppColors")));
    }
}
