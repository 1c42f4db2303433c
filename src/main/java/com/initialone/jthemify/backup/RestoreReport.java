package com.initialone.jthemify.backup;

import com.initialone.jthemify.model.FileFailure;

import java.util.ArrayList;
import java.util.List;

/** Outcome of a best-effort restore. Paths are the manifest's relative paths. */
public final class RestoreReport {
    private final String backupId;
    private final List<String> restored = new ArrayList<>();
    private final List<String> missing = new ArrayList<>();
    private final List<String> corrupted = new ArrayList<>();
    private final List<FileFailure> failed = new ArrayList<>();

    RestoreReport(String backupId) {
        this.backupId = backupId;
    }

    public String backupId() { return backupId; }
    public List<String> restored() { return List.copyOf(restored); }
    /** 备份副本不存在；原文件不动 */
    public List<String> missing() { return List.copyOf(missing); }
    /** 副本哈希对不上；原文件不动 */
    public List<String> corrupted() { return List.copyOf(corrupted); }
    public List<FileFailure> failed() { return List.copyOf(failed); }

    public boolean isComplete() {
        return missing.isEmpty() && corrupted.isEmpty() && failed.isEmpty();
    }

    void restored(String rel) { restored.add(rel); }
    void missing(String rel) { missing.add(rel); }
    void corrupted(String rel) { corrupted.add(rel); }
    void failed(FileFailure f) { failed.add(f); }

    @Override
    public String toString() {
        return "restored=" + restored.size() + " missing=" + missing.size()
                + " corrupted=" + corrupted.size() + " failed=" + failed.size();
    }
}
