package com.initialone.jthemify.refactor;

import com.initialone.jthemify.model.ContextAvailability;
import com.initialone.jthemify.model.FileRefactorResult;
import com.initialone.jthemify.model.RefactorRun;
import com.initialone.jthemify.model.RunMode;
import com.initialone.jthemify.model.Transformation;
import com.initialone.jthemify.model.TransformationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffGeneratorTest {

    private static final Path ROOT = Path.of("/work/project").toAbsolutePath();
    private static final String ORIGINAL = "class A {\n  Object c = AppColors.primaryBlue;\n}\n";

    private final DiffGenerator diff = new DiffGenerator();

    private static FileRefactorResult result() {
        int at = ORIGINAL.indexOf("AppColors.primaryBlue");
        Transformation t = new Transformation(at, "AppColors.primaryBlue".length(), "AppColors.primaryBlue",
                "Theme.of(context).colorScheme.primary", TransformationKind.STRICT,
                "Map to colorScheme.primary", ContextAvailability.UNAVAILABLE);
        String rewritten = ORIGINAL.replace("AppColors.primaryBlue", "Theme.of(context).colorScheme.primary");
        return new FileRefactorResult(ROOT.resolve("src/A.java"), ORIGINAL, rewritten, List.of(t));
    }

    @Test
    void unifiedDiffListsEachChangeWithLineAndAvailability() {
        String out = diff.unifiedDiff("src/A.java", result());

        assertEquals("--- src/A.java\n"
                + "+++ src/A.java\n"
                + "@@ Changes: 1 @@\n"
                + "\n"
                + "@ line 2\n"
                + "- AppColors.primaryBlue\n"
                + "+ Theme.of(context).colorScheme.primary\n"
                + "  // Map to colorScheme.primary [UNAVAILABLE]\n"
                + "\n", out);
    }

    @Test
    void unchangedFileProducesNoDiff() {
        FileRefactorResult none = new FileRefactorResult(ROOT.resolve("src/B.java"), "class B {}", "class B {}", List.of());
        assertEquals("", diff.unifiedDiff(none));
    }

    @Test
    void runDiffUsesRelativeNames() {
        RefactorRun run = new RefactorRun(ROOT, RunMode.DRY_RUN);
        run.addResult(result());

        assertTrue(diff.unifiedDiff(run).startsWith("--- src/A.java\n+++ src/A.java\n"));
    }

    @Test
    void htmlReportSummarizesAndEscapes(@TempDir Path out) throws Exception {
        RefactorRun run = new RefactorRun(ROOT, RunMode.DRY_RUN);
        run.fileScanned();
        run.fileScanned();
        run.addResult(result());

        Path page = out.resolve("reports/diff.html");
        diff.writeHtmlReport(run, page);
        String html = Files.readString(page);

        assertTrue(html.contains("<title>Refactoring Diff Report</title>"));
        assertTrue(html.contains("<strong>Files Scanned:</strong> 2"));
        assertTrue(html.contains("<strong>Files Modified:</strong> 1"));
        assertTrue(html.contains("<strong>Total Changes:</strong> 1"));
        assertTrue(html.contains("<h3>src/A.java</h3>"));
        assertTrue(html.contains("+ Theme.of(context).colorScheme.primary"));
    }

    @Test
    void lineCountingHandlesAllTerminators() {
        assertEquals(1, DiffGenerator.lineOf("abc", 2));
        assertEquals(2, DiffGenerator.lineOf("a\nb", 2));
        assertEquals(2, DiffGenerator.lineOf("a\r\nb", 3));
        assertEquals(3, DiffGenerator.lineOf("a\rb\nc", 4));
    }

    @Test
    void escapeCoversMarkupCharacters() {
        assertEquals("&lt;T&gt; &amp; &quot;x&quot; &#39;y&#39;", DiffGenerator.escape("<T> & \"x\" 'y'"));
    }
}
