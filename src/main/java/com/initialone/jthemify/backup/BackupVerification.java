package com.initialone.jthemify.backup;

public final class BackupVerification {
    private final int verified;
    private final int missing;
    private final int corrupted;

    public BackupVerification(int verified, int missing, int corrupted) {
        this.verified = verified;
        this.missing = missing;
        this.corrupted = corrupted;
    }

    public int verified() { return verified; }
    public int missing() { return missing; }
    public int corrupted() { return corrupted; }
    public int total() { return verified + missing + corrupted; }

    public boolean isValid() {
        return missing == 0 && corrupted == 0;
    }

    @Override
    public String toString() {
        return "verified=" + verified + " missing=" + missing + " corrupted=" + corrupted;
    }
}
