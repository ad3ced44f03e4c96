package com.repo.codepath;

import com.repo.codepath.core.FileLinter;
import com.repo.codepath.core.FileReport;
import com.repo.codepath.core.LinterConfig;
import com.repo.codepath.report.CsvReporter;
import com.repo.codepath.rules.Violation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public class App {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Lints the tree dumps under the given path.
     *
     * @return 0 when no violation was found, 1 when some were, 2 on usage or
     *         I/O errors
     */
    static int run(String[] args) {
        System.out.println("=== Code Path Analyzer ===");

        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: java -jar codepath-analyzer.jar <tree_dump_or_dir> [config_root]");
            return 2;
        }

        Path target = Path.of(args[0]);
        if (!Files.exists(target)) {
            System.err.println("No such file or directory: " + target);
            return 2;
        }
        Path configRoot = args.length == 2 ? Path.of(args[1])
                : Files.isDirectory(target) ? target : target.toAbsolutePath().getParent();
        LinterConfig config = LinterConfig.load(configRoot);

        List<Path> files;
        try {
            files = collectFiles(target, config);
        } catch (IOException e) {
            System.err.println("Could not list " + target + ": " + e.getMessage());
            return 2;
        }

        FileLinter linter = new FileLinter(config);
        List<FileReport> reports = new ArrayList<>();

        System.out.println("\n| %-50s | %-5s | %-7s | %-6s | %-11s | %-10s |".formatted(
                "File", "Units", "TotalCC", "MaxCC", "Unreachable", "Violations"));
        System.out.println("|" + "-".repeat(52) + "|" + "-".repeat(7) + "|" + "-".repeat(9) + "|" + "-".repeat(8)
                + "|" + "-".repeat(13) + "|" + "-".repeat(12) + "|");

        for (Path file : files) {
            Optional<FileReport> result = linter.lint(file);
            if (result.isEmpty()) {
                continue;
            }
            FileReport r = result.get();
            reports.add(r);
            System.out.println("| %-50s | %-5d | %-7d | %-6d | %-11d | %-10d |".formatted(
                    truncate(r.filePath(), 50),
                    r.functionCount(),
                    r.totalComplexity(),
                    r.maxComplexity(),
                    r.unreachableCount(),
                    r.violations().size()));
        }

        int violationCount = 0;
        for (FileReport r : reports) {
            if (r.isClean()) {
                continue;
            }
            System.out.println("\n" + r.filePath());
            for (Violation v : r.violations()) {
                System.out.println("  %-8s %s  %s".formatted(v.location(), v.message(), v.rule()));
                violationCount++;
            }
        }

        System.out.println("\n%d file(s) linted, %d violation(s).".formatted(reports.size(), violationCount));
        new CsvReporter().generate(reports, Path.of("codepath-report.csv"));

        return violationCount > 0 ? 1 : 0;
    }

    static List<Path> collectFiles(Path target, LinterConfig config) throws IOException {
        if (!Files.isDirectory(target)) {
            return List.of(target);
        }
        try (Stream<Path> paths = Files.walk(target)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(FileLinter::isTreeDump)
                    .filter(path -> !config.shouldExclude(path))
                    .sorted()
                    .toList();
        }
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }
}
