package com.initialone.jthemify.refactor;

import com.initialone.jthemify.model.FileRefactorResult;
import com.initialone.jthemify.model.RefactorRun;
import com.initialone.jthemify.model.Transformation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** Review output for planned rewrites: a unified-style text diff and a standalone HTML page. */
public class DiffGenerator {

    public String unifiedDiff(FileRefactorResult result) {
        return unifiedDiff(result.path() == null ? "<memory>" : result.path().toString(), result);
    }

    public String unifiedDiff(String name, FileRefactorResult result) {
        if (!result.hasChanges()) return "";
        StringBuilder sb = new StringBuilder();
        sb.append("--- ").append(name).append('\n');
        sb.append("+++ ").append(name).append('\n');
        sb.append("@@ Changes: ").append(result.changeCount()).append(" @@\n\n");
        for (Transformation t : result.transformations()) {
            sb.append("@ line ").append(lineOf(result.originalText(), t.offset())).append('\n');
            sb.append("- ").append(t.oldText()).append('\n');
            sb.append("+ ").append(t.newText()).append('\n');
            sb.append("  // ").append(t.description());
            if (t.availability() != null) sb.append(" [").append(t.availability()).append(']');
            sb.append("\n\n");
        }
        return sb.toString();
    }

    /** All changed files of the run, in the order they were planned */
    public String unifiedDiff(RefactorRun run) {
        StringBuilder sb = new StringBuilder();
        for (FileRefactorResult r : run.fileResults()) {
            sb.append(unifiedDiff(RefactorValidator.displayName(run.projectRoot(), r.path()), r));
        }
        return sb.toString();
    }

    public String htmlReport(RefactorRun run) {
        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n<html>\n<head>\n  <meta charset=\"utf-8\">\n");
        sb.append("  <title>Refactoring Diff Report</title>\n  <style>\n").append(STYLES).append("  </style>\n");
        sb.append("</head>\n<body>\n  <h1>Refactoring Diff Report</h1>\n");

        sb.append("  <div class=\"summary\">\n    <h2>Summary</h2>\n");
        sb.append("    <p><strong>Mode:</strong> ").append(run.mode()).append(" (").append(run.outcome()).append(")</p>\n");
        sb.append("    <p><strong>Files Scanned:</strong> ").append(run.filesScanned()).append("</p>\n");
        sb.append("    <p><strong>Files Modified:</strong> ").append(run.modifiedFileCount()).append("</p>\n");
        sb.append("    <p><strong>Total Changes:</strong> ").append(run.totalChangeCount()).append("</p>\n");
        run.backupId().ifPresent(id -> sb.append("    <p><strong>Backup:</strong> ").append(escape(id)).append("</p>\n"));
        sb.append("    <p><strong>Generated:</strong> ")
                .append(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("</p>\n");
        sb.append("  </div>\n");

        for (FileRefactorResult r : run.fileResults()) {
            if (!r.hasChanges()) continue;
            String name = RefactorValidator.displayName(run.projectRoot(), r.path());
            sb.append("  <div class=\"file-diff\">\n");
            sb.append("    <h3>").append(escape(name)).append("</h3>\n");
            sb.append("    <p class=\"change-count\">").append(r.changeCount()).append(" changes</p>\n");
            for (Transformation t : r.transformations()) {
                sb.append("    <div class=\"diff-block\">\n");
                sb.append("      <div class=\"line\">line ").append(lineOf(r.originalText(), t.offset())).append("</div>\n");
                sb.append("      <div class=\"old-code\">- ").append(escape(t.oldText())).append("</div>\n");
                sb.append("      <div class=\"new-code\">+ ").append(escape(t.newText())).append("</div>\n");
                sb.append("      <div class=\"description\">").append(escape(t.description()));
                if (t.availability() != null) sb.append(" [").append(t.availability()).append(']');
                sb.append("</div>\n    </div>\n");
            }
            sb.append("  </div>\n");
        }
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }

    public void writeHtmlReport(RefactorRun run, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(out, htmlReport(run), StandardCharsets.UTF_8);
        System.out.println("[refactor] HTML diff report saved to: " + out.toAbsolutePath());
    }

    static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
            } else if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') i++;
                line++;
            }
        }
        return line;
    }

    static String escape(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }

    private static final String STYLES =
            "    body { font-family: -apple-system, 'Segoe UI', Arial, sans-serif; max-width: 1200px; margin: 40px auto; padding: 20px; background: #f5f5f5; }\n"
            + "    h1 { color: #1976D2; }\n"
            + "    .summary, .file-diff { background: white; padding: 20px; border-radius: 8px; margin-bottom: 20px; box-shadow: 0 2px 4px rgba(0,0,0,0.1); }\n"
            + "    .change-count, .line { color: #666; font-size: 13px; }\n"
            + "    .diff-block { margin: 15px 0; font-family: 'Courier New', monospace; font-size: 14px; }\n"
            + "    .old-code { background: #ffebee; color: #c62828; padding: 8px; border-left: 3px solid #c62828; }\n"
            + "    .new-code { background: #e8f5e9; color: #2e7d32; padding: 8px; border-left: 3px solid #2e7d32; }\n"
            + "    .description { color: #666; font-style: italic; padding: 4px 8px; font-size: 12px; }\n";
}
