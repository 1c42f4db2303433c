package com.initialone.jthemify.refactor;

import com.initialone.jthemify.ast.java.JavaSourceParser;
import com.initialone.jthemify.backup.BackupException;
import com.initialone.jthemify.backup.BackupManager;
import com.initialone.jthemify.backup.BackupManifest;
import com.initialone.jthemify.model.ContextAvailability;
import com.initialone.jthemify.model.FileRefactorResult;
import com.initialone.jthemify.model.MappingTable;
import com.initialone.jthemify.model.RefactorRun;
import com.initialone.jthemify.model.RunOutcome;
import com.initialone.jthemify.model.Transformation;
import com.initialone.jthemify.model.UnmappedConstant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeRefactorerTest {

    private static final String CARD = "package app;\n"
            + "\n"
            + "import ui.material.Theme;\n"
            + "\n"
            + "class Card extends StatelessWidget {\n"
            + "  Object build(BuildContext context) {\n"
            + "    return new Box(AppColors.primaryBlue, AppColors.accent);\n"
            + "  }\n"
            + "}\n";

    private static final String TONE = "package app;\n"
            + "\n"
            + "import ui.material.Theme;\n"
            + "\n"
            + "enum Tone {\n"
            + "  LIGHT;\n"
            + "  final Object color;\n"
            + "  Tone() { color = AppColors.primaryBlue; }\n"
            + "}\n";

    @TempDir
    Path project;

    private final MappingTable mapping = new MappingTable()
            .strict("AppColors.primaryBlue", "colorScheme.primary")
            .extension("BrandColors", "AppColors.accent", "accent");

    private Path write(String rel, String content) throws Exception {
        Path p = project.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    private static String read(Path p) throws Exception {
        return Files.readString(p, StandardCharsets.UTF_8);
    }

    @Test
    void dryRunPlansWithoutTouchingAnything() throws Exception {
        Path card = write("src/main/java/app/Card.java", CARD);
        write("src/main/java/app/Broken.java", "class Broken { Object c = AppColors.primaryBlue; ");
        write("src/test/java/app/CardTest.java", "class CardTest { Object c = AppColors.primaryBlue; }");
        write("target/generated/Gen.java", "class Gen { Object c = AppColors.primaryBlue; }");

        RefactorRun run = new CodeRefactorer().refactor(project, mapping, true);

        assertEquals(RunOutcome.PLANNED, run.outcome());
        assertEquals(2, run.filesScanned());
        assertEquals(1, run.modifiedFileCount());
        assertEquals(2, run.totalChangeCount());
        assertEquals(1, run.failures().size());
        assertTrue(run.failures().get(0).path().endsWith("Broken.java"));
        assertTrue(run.backupId().isEmpty());
        assertTrue(run.written().isEmpty());
        assertEquals(CARD, read(card));
        assertFalse(Files.exists(project.resolve(BackupManager.DEFAULT_DIR)));

        String planned = run.fileResults().get(0).rewrittenText();
        assertTrue(planned.contains(
                "new Box(Theme.of(context).colorScheme.primary, Theme.of(context).extension(BrandColors.class).accent)"));
    }

    @Test
    void applyWritesAfterBackupAndRollbackRestoresExactly() throws Exception {
        Path card = write("src/main/java/app/Card.java", CARD);
        Path untouched = write("src/main/java/app/Plain.java", "class Plain {}\n");

        RefactorRun run = new CodeRefactorer().refactor(project, mapping, false);

        assertEquals(RunOutcome.APPLIED, run.outcome());
        assertTrue(run.validation().isClean());
        assertEquals(List.of(card), run.written());
        assertEquals(run.fileResults().get(0).rewrittenText(), read(card));
        assertEquals("class Plain {}\n", read(untouched));

        String id = run.backupId().orElseThrow();
        BackupManager backups = new BackupManager(project);
        assertEquals(1, backups.manifest(id).fileCount());
        assertTrue(backups.verifyBackup(id).isValid());

        assertTrue(backups.restoreBackup(id).isComplete());
        assertEquals(CARD, read(card));
    }

    @Test
    void validationErrorsBlockUnlessForced() throws Exception {
        Path card = write("src/main/java/app/Card.java", CARD);
        Path tone = write("src/main/java/app/Tone.java", TONE);
        CodeRefactorer refactorer = new CodeRefactorer();

        RefactorRun blocked = refactorer.refactor(project, mapping, false);
        assertEquals(RunOutcome.BLOCKED, blocked.outcome());
        assertEquals(1, blocked.validation().errors().size());
        assertEquals("src/main/java/app/Tone.java", blocked.validation().errors().get(0).file());
        assertTrue(blocked.backupId().isEmpty());
        assertEquals(CARD, read(card));
        assertEquals(TONE, read(tone));

        RefactorRun forced = refactorer.refactor(project, mapping, false, true);
        assertEquals(RunOutcome.APPLIED, forced.outcome());
        assertEquals(2, forced.written().size());
        assertTrue(read(tone).contains("color = Theme.of(context).colorScheme.primary;"));
    }

    @Test
    void secondApplyFindsNothingToDo() throws Exception {
        Path card = write("src/main/java/app/Card.java", CARD);
        CodeRefactorer refactorer = new CodeRefactorer();
        refactorer.refactor(project, mapping, false);
        String once = read(card);

        RefactorRun again = refactorer.refactor(project, mapping, false);

        assertEquals(RunOutcome.APPLIED, again.outcome());
        assertEquals(0, again.totalChangeCount());
        assertTrue(again.backupId().isEmpty());
        assertEquals(once, read(card));
        assertEquals(1, new BackupManager(project).listBackups().size());
    }

    @Test
    void paletteReferenceInRenderMethodBecomesThemeLookup() throws Exception {
        String src = "import ui.material.Theme;\n"
                + "class Swatch extends StatelessWidget {\n"
                + "  Object build(BuildContext context) {\n"
                + "    return new Box(Palette.primaryBlue);\n"
                + "  }\n"
                + "}\n";
        Path swatch = write("lib/Swatch.java", src);
        MappingTable palette = new MappingTable().strict("Palette.primaryBlue", "scheme.primary");

        RefactorRun run = new CodeRefactorer(new JavaSourceParser(), BackupManager::new)
                .refactor(project, palette, false);

        FileRefactorResult r = run.fileResults().get(0);
        assertEquals(1, r.changeCount());
        Transformation t = r.transformations().get(0);
        assertEquals("Palette.primaryBlue", t.oldText());
        assertEquals(ContextAvailability.AVAILABLE, t.availability());
        assertTrue(run.validation().isClean());
        assertTrue(read(swatch).contains("return new Box(Theme.of(context).scheme.primary);"));
    }

    @Test
    void excludesAndBatchingStillCoverEveryFile() throws Exception {
        for (int i = 0; i < 5; i++) {
            write("src/main/java/app/Card" + i + ".java", CARD.replace("class Card ", "class Card" + i + " "));
        }
        write("src/main/java/legacy/Old.java", CARD.replace("class Card ", "class Old "));

        RefactorRun run = new CodeRefactorer()
                .batchSize(2)
                .excludes(List.of("src/main/java/legacy/**"))
                .refactor(project, mapping, true);

        assertEquals(5, run.filesScanned());
        assertEquals(5, run.modifiedFileCount());
        assertEquals(10, run.totalChangeCount());
    }

    @Test
    void interruptCancelsBeforeAnyWrite() throws Exception {
        Path card = write("src/main/java/app/Card.java", CARD);
        try {
            Thread.currentThread().interrupt();
            RefactorRun run = new CodeRefactorer().refactor(project, List.of(card), mapping, false, false);

            assertEquals(RunOutcome.CANCELLED, run.outcome());
            assertTrue(run.written().isEmpty());
            assertEquals(CARD, read(card));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void crashingFileIsIsolatedFromTheRest() throws Exception {
        Path card = write("src/main/java/app/Card.java", CARD);
        Path deep = write("src/main/java/app/Deep.java", CARD.replace("class Card ", "class Deep "));
        JavaSourceParser java = new JavaSourceParser();
        CodeRefactorer refactorer = new CodeRefactorer((path, text) -> {
            if (path.endsWith("Deep.java")) throw new StackOverflowError();
            return java.parse(path, text);
        }, BackupManager::new);

        RefactorRun run = refactorer.refactor(project, mapping, false);

        assertEquals(RunOutcome.APPLIED, run.outcome());
        assertEquals(1, run.failures().size());
        assertEquals(deep, run.failures().get(0).path());
        assertTrue(run.failures().get(0).message().contains("StackOverflowError"));
        assertEquals(List.of(card), run.written());
        assertEquals(CARD.replace("class Card ", "class Deep "), read(deep));
    }

    @Test
    void veryDeepExpressionDoesNotAbortTheRun() throws Exception {
        write("src/main/java/app/Card.java", CARD);
        StringBuilder chain = new StringBuilder("\"\"");
        for (int i = 0; i < 20_000; i++) chain.append(" + \"x\"");
        write("src/main/java/app/Chain.java", "class Chain {\n"
                + "  static Object s() { return " + chain + " + AppColors.primaryBlue; }\n"
                + "}\n");

        RefactorRun run = new CodeRefactorer().refactor(project, mapping, true);

        assertEquals(RunOutcome.PLANNED, run.outcome());
        assertEquals(2, run.filesScanned());
        assertTrue(run.fileResults().stream().anyMatch(r -> r.path().endsWith("Card.java")));
    }

    @Test
    void failedBackupWritesNothing() throws Exception {
        Path card = write("src/main/java/app/Card.java", CARD);
        Path other = write("src/main/java/app/Other.java", CARD.replace("class Card ", "class Other "));
        CodeRefactorer refactorer = new CodeRefactorer(new JavaSourceParser(), root -> new BackupManager(root) {
            @Override
            public BackupManifest createBackup(Collection<Path> paths) throws BackupException {
                throw new BackupException("disk full");
            }
        });

        BackupException e = assertThrows(BackupException.class, () -> refactorer.refactor(project, mapping, false));

        assertEquals("disk full", e.getMessage());
        assertEquals(CARD, read(card));
        assertEquals(CARD.replace("class Card ", "class Other "), read(other));
    }

    @Test
    void unmappedReferencesAreCountedNotRewritten() throws Exception {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 10; i++) body.append("    paint(AppColors.legacyGrey);\n");
        for (int i = 0; i < 3; i++) body.append("    paint(AppColors.oldRed);\n");
        body.append("    paint(AppColors.debugPink);\n");
        body.append("    paint(AppColors.lonely);\n");
        Path screen = write("src/main/java/app/Screen.java", "import ui.material.Theme;\n"
                + "class Screen extends StatelessWidget {\n"
                + "  Object build(BuildContext context) {\n"
                + body
                + "    return new Box(AppColors.primaryBlue);\n"
                + "  }\n"
                + "}\n");
        MappingTable table = new MappingTable()
                .strict("AppColors.primaryBlue", "colorScheme.primary")
                .preserve("AppColors.debugPink");

        RefactorRun run = new CodeRefactorer().refactor(project, table, false);

        assertEquals(RunOutcome.APPLIED, run.outcome());
        assertTrue(run.validation().isValid());
        assertEquals(1, run.totalChangeCount());
        List<UnmappedConstant> unmapped = run.unmapped();
        assertEquals(3, unmapped.size());
        assertEquals("AppColors.legacyGrey", unmapped.get(0).qualifiedName());
        assertEquals(10, unmapped.get(0).usageCount());
        assertEquals(UnmappedConstant.Level.CRITICAL, unmapped.get(0).level());
        assertEquals("src/main/java/app/Screen.java:4", unmapped.get(0).locations().get(0));
        assertEquals(UnmappedConstant.Level.WARNING, unmapped.get(1).level());
        assertEquals("AppColors.lonely", unmapped.get(2).qualifiedName());
        assertEquals(UnmappedConstant.Level.INFO, unmapped.get(2).level());
        assertTrue(read(screen).contains("paint(AppColors.legacyGrey);"));
    }
}
