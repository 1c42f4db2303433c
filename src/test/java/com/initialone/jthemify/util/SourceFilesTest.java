package com.initialone.jthemify.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceFilesTest {

    @TempDir
    Path root;

    private void touch(String rel) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, "class X {}");
    }

    private List<String> listed(List<String> excludes, Path backupRoot) throws Exception {
        List<String> out = new ArrayList<>();
        for (Path p : SourceFiles.scan(root, excludes, backupRoot).files()) {
            out.add(Tools.unixPath(root.relativize(p)));
        }
        return out;
    }

    @Test
    void skipsBuildOutputHiddenTestAndBackupTrees() throws Exception {
        touch("src/main/java/app/B.java");
        touch("src/main/java/app/A.java");
        touch("src/main/java/app/notes.txt");
        touch("module/src/test/java/ATest.java");
        touch("target/classes/Gen.java");
        touch("build/generated/Gen.java");
        touch(".git/hooks/Hook.java");
        touch("snapshots/1/src/A.java");

        assertEquals(List.of("src/main/java/app/A.java", "src/main/java/app/B.java"),
                listed(List.of(), root.resolve("snapshots")));
    }

    @Test
    void userGlobsMatchRelativePaths() throws Exception {
        touch("src/main/java/app/A.java");
        touch("src/main/java/legacy/Old.java");
        touch("src/main/java/app/AGenerated.java");

        assertEquals(List.of("src/main/java/app/A.java"),
                listed(List.of("src/main/java/legacy/**", "**/*Generated.java", " "), null));
    }

    @Test
    void unreadablePathsAreCollectedAndTheWalkContinues() throws Exception {
        touch("src/main/java/app/A.java");
        Path locked = root.resolve("src/main/java/locked");
        SourceFiles.Walker walker = new SourceFiles.Walker(root, List.of(), null);

        assertEquals(FileVisitResult.CONTINUE,
                walker.visitFileFailed(locked, new AccessDeniedException(locked.toString())));
        assertEquals(FileVisitResult.CONTINUE,
                walker.postVisitDirectory(root.resolve("src"), new IOException("directory changed")));
        assertEquals(2, walker.failures.size());
        assertEquals(locked, walker.failures.get(0).path());
        assertTrue(walker.failures.get(0).message().contains("AccessDeniedException"));

        assertThrows(AccessDeniedException.class,
                () -> walker.visitFileFailed(root, new AccessDeniedException(root.toString())));
    }

    @Test
    void cleanTreeHasNoFailures() throws Exception {
        touch("src/main/java/app/A.java");
        assertTrue(SourceFiles.scan(root, List.of(), null).failures().isEmpty());
    }

    @Test
    void chunkSplitsIntoFixedSizeBatches() {
        assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), Tools.chunk(List.of(1, 2, 3, 4, 5), 2));
        assertTrue(Tools.chunk(List.of(), 3).isEmpty());
    }

    @Test
    void sha256OfKnownContent() throws Exception {
        Path f = Files.writeString(root.resolve("abc.txt"), "abc");
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", Tools.sha256Hex(f));
    }
}
