package com.initialone.jthemify.util;

import com.initialone.jthemify.model.FileFailure;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Lists the .java files of a project that are eligible for rewriting.
 * Build output, VCS metadata, hidden and generated directories, test trees, the backup root
 * and any user glob (matched against the project-relative path) are skipped.
 * Paths that cannot be read are reported next to the files, the walk goes on.
 */
public final class SourceFiles {
    private static final Set<String> SKIP_DIRS = Set.of("target", "build", "out", "node_modules",
            "generated", "generated-sources", "generated-test-sources");

    private SourceFiles() {
    }

    /** Eligible files plus the paths the walk could not read */
    public static final class Listing {
        private final List<Path> files;
        private final List<FileFailure> failures;

        Listing(List<Path> files, List<FileFailure> failures) {
            this.files = List.copyOf(files);
            this.failures = List.copyOf(failures);
        }

        /** Sorted */
        public List<Path> files() { return files; }
        public List<FileFailure> failures() { return failures; }
    }

    /**
     * @throws IOException only when the root itself cannot be walked
     */
    public static Listing scan(Path root, List<String> excludes, Path backupRoot) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        Walker walker = new Walker(base, matchers(excludes), backupRoot == null ? null : backupRoot.toAbsolutePath().normalize());
        Files.walkFileTree(base, walker);
        walker.files.sort(Comparator.comparing(Path::toString));
        return new Listing(walker.files, walker.failures);
    }

    private static List<PathMatcher> matchers(List<String> excludes) {
        List<PathMatcher> out = new ArrayList<>();
        if (excludes == null) return out;
        for (String glob : excludes) {
            if (glob != null && !glob.isBlank()) {
                out.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.trim()));
            }
        }
        return out;
    }

    static final class Walker extends SimpleFileVisitor<Path> {
        private final Path base;
        private final List<PathMatcher> matchers;
        private final Path skipBackups;
        final List<Path> files = new ArrayList<>();
        final List<FileFailure> failures = new ArrayList<>();

        Walker(Path base, List<PathMatcher> matchers, Path skipBackups) {
            this.base = base;
            this.matchers = matchers;
            this.skipBackups = skipBackups;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (dir.equals(base)) return FileVisitResult.CONTINUE;
            String name = dir.getFileName().toString();
            if (name.startsWith(".") || SKIP_DIRS.contains(name)) return FileVisitResult.SKIP_SUBTREE;
            if (skipBackups != null && dir.equals(skipBackups)) return FileVisitResult.SKIP_SUBTREE;
            Path rel = base.relativize(dir);
            if (isTestTree(rel) || excluded(rel, matchers)) return FileVisitResult.SKIP_SUBTREE;
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile() || !file.getFileName().toString().endsWith(".java")) {
                return FileVisitResult.CONTINUE;
            }
            if (!excluded(base.relativize(file), matchers)) files.add(file);
            return FileVisitResult.CONTINUE;
        }

        // 读不了的目录/文件记下来，继续走
        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(base)) throw exc;
            failures.add(new FileFailure(file, "cannot read: " + exc));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc != null) {
                if (dir.equals(base)) throw exc;
                failures.add(new FileFailure(dir, "listing interrupted: " + exc));
            }
            return FileVisitResult.CONTINUE;
        }
    }

    /** src/test，或任意子模块的 src/test */
    private static boolean isTestTree(Path rel) {
        int n = rel.getNameCount();
        return n >= 2
                && rel.getName(n - 1).toString().equals("test")
                && rel.getName(n - 2).toString().equals("src");
    }

    private static boolean excluded(Path rel, List<PathMatcher> matchers) {
        Path unix = Path.of(Tools.unixPath(rel));
        for (PathMatcher m : matchers) {
            if (m.matches(rel) || m.matches(unix)) return true;
        }
        return false;
    }
}
