package com.initialone.jthemify.mapping;

import com.initialone.jthemify.model.MappingTable;
import com.initialone.jthemify.model.ValidationIssue;
import com.initialone.jthemify.model.ValidationReport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MappingValidatorTest {

    private final MappingValidator validator = new MappingValidator();

    private static boolean mentions(Iterable<ValidationIssue> issues, String text) {
        for (ValidationIssue i : issues) {
            if (i.message().contains(text)) return true;
        }
        return false;
    }

    @Test
    void wellFormedTableIsClean() {
        MappingTable t = new MappingTable()
                .strict("AppColors.primaryBlue", "colorScheme.primary")
                .extension("BrandColors", "AppColors.accent", "accent")
                .preserve("AppColors.debugPink");

        assertTrue(validator.validate(t, "mapping.yaml").isClean());
    }

    @Test
    void malformedNamesAndTargetsAreErrors() {
        MappingTable t = new MappingTable()
                .strict("primaryBlue", "colorScheme.primary")
                .strict("AppColors.a", "colorScheme..primary")
                .strict("AppColors.b", " ")
                .extension("Brand-Colors", "AppColors.c", "accent")
                .extension("BrandColors", "AppColors.d", "class");
        t.namespaces.add("App Colors");

        ValidationReport r = validator.validate(t, "mapping.yaml");

        assertTrue(mentions(r.errors(), "Invalid constant name: primaryBlue"));
        assertTrue(mentions(r.errors(), "Invalid strict target: colorScheme..primary"));
        assertTrue(mentions(r.errors(), "Missing target for AppColors.b"));
        assertTrue(mentions(r.errors(), "Invalid extension name: Brand-Colors"));
        assertTrue(mentions(r.errors(), "Invalid extension property name: class"));
        assertTrue(mentions(r.errors(), "Invalid namespace: App Colors"));
        assertEquals("mapping.yaml", r.errors().get(0).file());
    }

    @Test
    void nameInTwoGroupsIsAnError() {
        MappingTable t = new MappingTable()
                .extension("BrandColors", "AppColors.accent", "accent")
                .extension("StatusColors", "AppColors.accent", "accent");

        ValidationReport r = validator.validate(t, null);

        assertEquals(1, r.errors().size());
        assertTrue(r.errors().get(0).message().contains("two extension groups"));
    }

    @Test
    void overlapsBetweenPartitionsAreWarnings() {
        MappingTable t = new MappingTable()
                .strict("AppColors.primaryBlue", "colorScheme.primary")
                .strict("AppColors.mainBlue", "colorScheme.primary")
                .extension("BrandColors", "AppColors.primaryBlue", "primary")
                .preserve("AppColors.mainBlue");

        ValidationReport r = validator.validate(t, null);

        assertTrue(r.isValid());
        assertEquals(3, r.warnings().size());
        assertTrue(mentions(r.warnings(), "Duplicate strict target"));
        assertTrue(mentions(r.warnings(), "the strict mapping wins"));
        assertTrue(mentions(r.warnings(), "both mapped and preserved"));
    }
}
