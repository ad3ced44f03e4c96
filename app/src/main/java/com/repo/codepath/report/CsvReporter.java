package com.repo.codepath.report;

import com.repo.codepath.core.FileReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class CsvReporter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvReporter.class);

    static final String HEADER =
            "File,Code Paths,Units,Total CC,Max CC,Unreachable,Violations,Complex Units\n";

    public void generate(List<FileReport> reports, Path outputPath) {
        try {
            Files.writeString(outputPath, render(reports));
            System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
        } catch (IOException e) {
            LOG.error("Could not write CSV report {}: {}", outputPath, e.getMessage());
        }
    }

    public String render(List<FileReport> reports) {
        StringBuilder csv = new StringBuilder(HEADER);
        for (FileReport r : reports) {
            csv.append(String.format("%s,%d,%d,%d,%d,%d,%d,%s\n",
                    escape(r.filePath()),
                    r.codePathCount(),
                    r.functionCount(),
                    r.totalComplexity(),
                    r.maxComplexity(),
                    r.unreachableCount(),
                    r.violations().size(),
                    escape(String.join(";", r.complexFunctions()))));
        }
        return csv.toString();
    }

    private String escape(String s) {
        if (s == null)
            return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
