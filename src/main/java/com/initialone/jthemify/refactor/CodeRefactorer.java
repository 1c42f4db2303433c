package com.initialone.jthemify.refactor;

import com.initialone.jthemify.ast.SourceParseException;
import com.initialone.jthemify.ast.SourceParser;
import com.initialone.jthemify.ast.SourceUnit;
import com.initialone.jthemify.ast.java.JavaSourceParser;
import com.initialone.jthemify.backup.BackupException;
import com.initialone.jthemify.backup.BackupManager;
import com.initialone.jthemify.backup.BackupManifest;
import com.initialone.jthemify.model.FileFailure;
import com.initialone.jthemify.model.FileRefactorResult;
import com.initialone.jthemify.model.MappingTable;
import com.initialone.jthemify.model.RefactorRun;
import com.initialone.jthemify.model.RunMode;
import com.initialone.jthemify.model.RunOutcome;
import com.initialone.jthemify.model.ValidationReport;
import com.initialone.jthemify.util.SourceFiles;
import com.initialone.jthemify.util.Tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs the rewrite over a project:
 * plan every file (resolve, analyze, splice) -> validate the planned buffers ->
 * in apply mode: block on validation errors unless forced, snapshot every file about to change,
 * then write.
 *
 * Files are handled one at a time in batches; a file that cannot be read, parsed or rewritten is
 * recorded as a failure and left out. An interrupted thread stops the run between files.
 */
public class CodeRefactorer {
    public static final int DEFAULT_BATCH = Integer.getInteger("jthemify.refactor.batch", 50);

    private final SourceParser parser;
    private final Function<Path, BackupManager> backups;
    private final ReferenceResolver resolver = new ReferenceResolver();
    private int batchSize = DEFAULT_BATCH;
    private List<String> excludes = List.of();

    public CodeRefactorer() {
        this(new JavaSourceParser(), BackupManager::new);
    }

    public CodeRefactorer(SourceParser parser, Function<Path, BackupManager> backups) {
        this.parser = parser;
        this.backups = backups;
    }

    public CodeRefactorer batchSize(int batchSize) {
        this.batchSize = Math.max(1, batchSize);
        return this;
    }

    /** glob，按项目相对路径匹配 */
    public CodeRefactorer excludes(List<String> excludes) {
        this.excludes = excludes == null ? List.of() : List.copyOf(excludes);
        return this;
    }

    /** Rewrites every eligible .java file under {@code projectRoot}. */
    public RefactorRun refactor(Path projectRoot, MappingTable mapping, boolean dryRun) throws IOException {
        return refactor(projectRoot, mapping, dryRun, false);
    }

    public RefactorRun refactor(Path projectRoot, MappingTable mapping, boolean dryRun, boolean force) throws IOException {
        Path root = projectRoot.toAbsolutePath().normalize();
        SourceFiles.Listing listing = SourceFiles.scan(root, excludes, backups.apply(root).backupRoot());
        return execute(root, listing.files(), listing.failures(), mapping, dryRun, force);
    }

    /**
     * @param force write even when the validator reports errors
     * @throws BackupException when the snapshot cannot be taken; nothing has been written then
     */
    public RefactorRun refactor(Path projectRoot, List<Path> files, MappingTable mapping,
                                boolean dryRun, boolean force) throws BackupException {
        return execute(projectRoot.toAbsolutePath().normalize(), files, List.of(), mapping, dryRun, force);
    }

    private RefactorRun execute(Path root, List<Path> files, List<FileFailure> unreadable, MappingTable mapping,
                                boolean dryRun, boolean force) throws BackupException {
        RefactorRun run = new RefactorRun(root, dryRun ? RunMode.DRY_RUN : RunMode.APPLY);
        for (FileFailure f : unreadable) {
            fail(run, f.path(), RefactorValidator.displayName(root, f.path()), f.message());
        }
        TransformationEngine engine = new TransformationEngine(mapping.conventionOrDefault());
        RefactorValidator validator = new RefactorValidator(parser, mapping.conventionOrDefault());

        List<List<Path>> batches = Tools.chunk(files, batchSize);
        System.out.println("[refactor] " + (dryRun ? "previewing" : "applying")
                + " files=" + files.size() + " batches=" + batches.size());

        for (int i = 0; i < batches.size(); i++) {
            List<Path> batch = batches.get(i);
            System.out.println("[refactor] batch " + (i + 1) + "/" + batches.size() + " items=" + batch.size());
            for (Path p : batch) {
                if (Thread.currentThread().isInterrupted()) {
                    return cancelled(run, "while planning");
                }
                planFile(root, p.toAbsolutePath().normalize(), mapping, engine, run);
            }
        }

        ValidationReport report = validator.validate(run);
        run.setValidation(report);

        if (dryRun) {
            run.setOutcome(RunOutcome.PLANNED);
            summary(run);
            return run;
        }
        if (!report.isValid() && !force) {
            run.setOutcome(RunOutcome.BLOCKED);
            System.err.println("[refactor] BLOCKED: " + report.errors().size()
                    + " validation errors; review with --dry-run or re-run with --force");
            summary(run);
            return run;
        }
        if (run.fileResults().isEmpty()) {
            run.setOutcome(RunOutcome.APPLIED);
            summary(run);
            return run;
        }

        List<Path> targets = new ArrayList<>();
        for (FileRefactorResult r : run.fileResults()) targets.add(r.path());
        BackupManifest manifest = backups.apply(root).createBackup(targets);
        run.setBackupId(manifest.id());

        for (FileRefactorResult r : run.fileResults()) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(run, "while writing");
            }
            try {
                Files.writeString(r.path(), r.rewrittenText(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
                run.markWritten(r.path());
            } catch (IOException e) {
                System.err.println("[refactor] write failed: " + r.path() + " : " + e);
                run.addFailure(new FileFailure(r.path(), "write failed: " + e.getMessage()));
            }
        }
        run.setOutcome(RunOutcome.APPLIED);
        summary(run);
        return run;
    }

    private void planFile(Path root, Path file, MappingTable mapping, TransformationEngine engine, RefactorRun run) {
        run.fileScanned();
        String rel = RefactorValidator.displayName(root, file);
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            fail(run, file, rel, "read failed: " + e);
            return;
        }
        try {
            SourceUnit unit = parser.parse(file, text);
            List<SymbolReference> refs = resolver.resolve(unit, mapping);
            for (SymbolReference ref : refs) {
                if (ref.resolution().kind() == ResolutionKind.UNMAPPED) {
                    run.recordUnmapped(ref.qualifiedName(), rel + ":" + ref.line());
                }
            }
            FileRefactorResult result = engine.rewrite(unit, refs);
            if (result.hasChanges()) {
                run.addResult(result);
                System.out.println("[refactor]   " + rel + ": " + result.changeCount() + " changes");
            }
        } catch (SourceParseException e) {
            fail(run, file, rel, e.getMessage());
        } catch (IllegalArgumentException e) {
            fail(run, file, rel, "rewrite rejected: " + e.getMessage());
        } catch (Throwable t) {
            // 单个文件（比如超深表达式把解析器栈打爆）不拖垮整批
            fail(run, file, rel, "analysis failed: " + t);
        }
    }

    private static void fail(RefactorRun run, Path file, String rel, String message) {
        System.err.println("[refactor] file failed: " + rel + " : " + message);
        run.addFailure(new FileFailure(file, message));
    }

    private static RefactorRun cancelled(RefactorRun run, String phase) {
        run.setOutcome(RunOutcome.CANCELLED);
        System.err.println("[refactor] cancelled " + phase + "; written=" + run.written().size()
                + run.backupId().map(id -> ", rollback with backup " + id).orElse(""));
        summary(run);
        return run;
    }

    private static void summary(RefactorRun run) {
        System.out.println("[refactor] DONE. outcome=" + run.outcome()
                + " scanned=" + run.filesScanned()
                + " modified=" + run.modifiedFileCount()
                + " changes=" + run.totalChangeCount()
                + " failures=" + run.failures().size()
                + " unmapped=" + run.unmapped().size()
                + " errors=" + run.validation().errors().size()
                + " warnings=" + run.validation().warnings().size()
                + (run.isDryRun() ? " (dry-run)" : ""));
    }
}
