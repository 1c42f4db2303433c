package com.initialone.jthemify.backup;

import java.io.IOException;

/** Backup could not be created, found or read. */
public class BackupException extends IOException {
    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
