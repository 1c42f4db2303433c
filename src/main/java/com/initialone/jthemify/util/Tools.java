package com.initialone.jthemify.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Stream;

public class Tools {

    public static String sha256Hex(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            try (DigestInputStream dis = new DigestInputStream(in, md)) {
                dis.transferTo(OutputStream.nullOutputStream());
            }
            return HexFormat.of().formatHex(md.digest());
        } catch (java.security.NoSuchAlgorithmException e) {
            throw new IOException("Failed to compute sha256 for " + file, e);
        }
    }

    /** 相对路径统一用 '/'，跨平台稳定 */
    public static String unixPath(Path relative) {
        return relative.toString().replace('\\', '/');
    }

    /** 删除文件或整棵目录；不存在则什么也不做 */
    public static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) return;
        List<Path> all;
        try (Stream<Path> s = Files.walk(root)) {
            all = new ArrayList<>();
            s.forEach(all::add);
        }
        all.sort(Comparator.comparingInt(Path::getNameCount).reversed());
        for (Path p : all) Files.deleteIfExists(p);
    }

    public static <T> List<List<T>> chunk(List<T> in, int n) {
        List<List<T>> batches = new ArrayList<>();
        int size = Math.max(1, n);
        int i = 0;
        while (i < in.size()) {
            int j = Math.min(i + size, in.size());
            batches.add(in.subList(i, j));
            i = j;
        }
        return batches;
    }
}
