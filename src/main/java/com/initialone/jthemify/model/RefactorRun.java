package com.initialone.jthemify.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Aggregate of one refactor invocation over a project. */
public final class RefactorRun {
    private final Path projectRoot;
    private final RunMode mode;
    private final List<FileRefactorResult> fileResults = new ArrayList<>();
    private final List<FileFailure> failures = new ArrayList<>();
    private final List<Path> written = new ArrayList<>();
    private final Map<String, List<String>> unmapped = new LinkedHashMap<>();
    private int filesScanned;
    private RunOutcome outcome;
    private String backupId;
    private ValidationReport validation = ValidationReport.empty();

    public RefactorRun(Path projectRoot, RunMode mode) {
        this.projectRoot = projectRoot;
        this.mode = mode;
        this.outcome = mode == RunMode.DRY_RUN ? RunOutcome.PLANNED : RunOutcome.APPLIED;
    }

    public Path projectRoot() { return projectRoot; }
    public RunMode mode() { return mode; }
    public boolean isDryRun() { return mode == RunMode.DRY_RUN; }

    /** Only files with at least one transformation */
    public List<FileRefactorResult> fileResults() { return List.copyOf(fileResults); }
    public List<FileFailure> failures() { return List.copyOf(failures); }
    public List<Path> written() { return List.copyOf(written); }
    public int filesScanned() { return filesScanned; }
    public RunOutcome outcome() { return outcome; }
    public Optional<String> backupId() { return Optional.ofNullable(backupId); }
    public ValidationReport validation() { return validation; }

    /** Most used first */
    public List<UnmappedConstant> unmapped() {
        List<UnmappedConstant> out = new ArrayList<>();
        unmapped.forEach((name, locations) -> out.add(new UnmappedConstant(name, locations)));
        out.sort(Comparator.comparingInt(UnmappedConstant::usageCount).reversed()
                .thenComparing(UnmappedConstant::qualifiedName));
        return out;
    }

    public int modifiedFileCount() { return fileResults.size(); }

    public int totalChangeCount() {
        return fileResults.stream().mapToInt(FileRefactorResult::changeCount).sum();
    }

    public void addResult(FileRefactorResult result) {
        if (result.hasChanges()) fileResults.add(result);
    }

    public void addFailure(FileFailure failure) { failures.add(failure); }

    public void recordUnmapped(String qualifiedName, String location) {
        unmapped.computeIfAbsent(qualifiedName, k -> new ArrayList<>()).add(location);
    }

    public void markWritten(Path path) { written.add(path); }
    public void fileScanned() { filesScanned++; }
    public void setOutcome(RunOutcome outcome) { this.outcome = outcome; }
    public void setBackupId(String backupId) { this.backupId = backupId; }
    public void setValidation(ValidationReport validation) { this.validation = validation; }
}
