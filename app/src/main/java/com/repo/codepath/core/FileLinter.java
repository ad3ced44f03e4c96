package com.repo.codepath.core;

import com.repo.codepath.codepath.CodePath;
import com.repo.codepath.codepath.CodePathAnalyzer;
import com.repo.codepath.codepath.DotPrinter;
import com.repo.codepath.rules.ComplexityRule;
import com.repo.codepath.rules.ComplexityRule.UnitComplexity;
import com.repo.codepath.rules.NoUnreachableRule;
import com.repo.codepath.rules.RuleEngine;
import com.repo.codepath.rules.Violation;
import com.repo.codepath.tree.FileContext;
import com.repo.codepath.tree.SyntaxNode;
import com.repo.codepath.tree.SyntaxTreeReader;
import com.repo.codepath.tree.TreeFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * One file's lint pass: reads the tree dump, builds the code paths, runs the
 * rules and summarizes the result.
 */
public class FileLinter {

    /** Extensions of tree dump files. */
    public static final Set<String> EXTENSIONS = Set.of(".ast", ".sexp");

    private static final Logger LOG = LoggerFactory.getLogger(FileLinter.class);

    private final LinterConfig config;
    private final RuleEngine ruleEngine;
    private final Path graphsDir;

    public FileLinter(LinterConfig config) {
        this(config, Path.of("."));
    }

    /**
     * @param outputRoot directory the configured graphs directory is resolved
     *                   against
     */
    public FileLinter(LinterConfig config, Path outputRoot) {
        this.config = config;
        this.ruleEngine = new RuleEngine(config);
        this.graphsDir = outputRoot.resolve(config.getGraphsDir());
    }

    public static boolean isTreeDump(Path file) {
        String name = file.getFileName().toString();
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    /**
     * Lints a tree dump file.
     *
     * @return the report, or empty if the file could not be read or analyzed
     */
    public Optional<FileReport> lint(Path file) {
        try {
            SyntaxNode root = SyntaxTreeReader.read(file);
            return Optional.of(lint(file.toString(), root));
        } catch (IOException e) {
            LOG.error("Could not read {}: {}", file, e.getMessage());
            return Optional.empty();
        } catch (TreeFormatException e) {
            LOG.error("Malformed tree dump {} at offset {}: {}", file, e.getOffset(), e.getMessage());
            return Optional.empty();
        } catch (IllegalStateException e) {
            LOG.error("Code path analysis failed for {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Lints an already parsed tree.
     *
     * @throws IllegalStateException if the tree breaks the analyzer's
     *                               structural expectations
     */
    public FileReport lint(String fileName, SyntaxNode root) {
        FileContext context = new FileContext(fileName, root);
        CodePathAnalyzer analyzer = CodePathAnalyzer.forFile(context);

        List<Violation> violations = ruleEngine.run(context);
        List<UnitComplexity> units = ComplexityRule.measure(context);

        int total = 0;
        int max = 0;
        List<String> complexFunctions = new ArrayList<>();
        for (UnitComplexity unit : units) {
            total += unit.complexity();
            max = Math.max(max, unit.complexity());
            if (unit.complexity() > config.getComplexityMax()) {
                complexFunctions.add(unit.name());
            }
        }
        int unreachable = (int) violations.stream()
                .filter(violation -> violation.rule().equals(NoUnreachableRule.NAME))
                .count();

        if (config.isDumpDot()) {
            writeGraphs(fileName, analyzer);
        }

        LOG.debug("{}: {} units, {} violations", fileName, units.size(), violations.size());
        return new FileReport(fileName, analyzer.codePaths().size(), units.size(), total, max,
                complexFunctions, unreachable, violations);
    }

    private void writeGraphs(String fileName, CodePathAnalyzer analyzer) {
        String baseName = Path.of(fileName).getFileName().toString().replaceAll("\\.[^.]*$", "");
        try {
            Files.createDirectories(graphsDir);
            for (CodePath codePath : analyzer.codePaths()) {
                Path dotFile = graphsDir.resolve(baseName + "_" + codePath.id() + ".dot");
                Files.writeString(dotFile, DotPrinter.dot(codePath));
            }
            LOG.info("Code path graphs for {} written to {}", fileName, graphsDir.toAbsolutePath());
        } catch (IOException e) {
            LOG.warn("Could not write code path graphs for {}: {}", fileName, e.getMessage());
        }
    }
}
