package com.example.logtriage.cli;

import com.example.logtriage.config.OutputConfig;
import com.example.logtriage.config.TriageConfig;
import com.example.logtriage.exception.LogInputNotFoundException;
import com.example.logtriage.model.ReportLimits;
import com.example.logtriage.model.TriageReport;
import com.example.logtriage.service.JsonReportWriter;
import com.example.logtriage.service.ReportRenderer;
import com.example.logtriage.service.TriageWorkflow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * CLI интерфейс для разбора лога из командной строки.
 *
 * Примеры использования:
 *
 * java -jar log-triage-agent.jar --log=./build/test-run.log
 *
 * java -jar log-triage-agent.jar --log=./test-run.log --format=json --output=./triage.json
 *
 * java -jar log-triage-agent.jar --log=./test-run.log --top-mentions=20 --dedup-cap=10
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandLineRunner implements ApplicationRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final TriageWorkflow triageWorkflow;
    private final ReportRenderer reportRenderer;
    private final JsonReportWriter jsonReportWriter;
    private final TriageConfig triageConfig;
    private final OutputConfig outputConfig;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("log")) {
            log.info("No --log=<path> option given, nothing to analyze.");
            return;
        }

        int exitCode = execute(args, System.out, System.err);
        System.exit(exitCode);
    }

    /**
     * Выполняет разбор и возвращает код завершения процесса.
     */
    int execute(ApplicationArguments args, PrintStream out, PrintStream err) {
        try {
            runCli(args, out);
            return EXIT_OK;
        } catch (LogInputNotFoundException e) {
            log.error("Log input not found: {}", e.getLocation());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("CLI execution failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void runCli(ApplicationArguments args, PrintStream out) {
        Path logFile = Path.of(getRequiredOption(args, "log"));
        OutputConfig.Format format = parseFormat(getOption(args, "format", outputConfig.getFormat().name()));
        String output = getOption(args, "output", outputConfig.getPath());

        ReportLimits limits = ReportLimits.builder()
                .topMentions(getIntOption(args, "top-mentions", triageConfig.getTopNMentions()))
                .topOrigins(getIntOption(args, "top-origins", triageConfig.getTopNOrigins()))
                .dedupCap(getIntOption(args, "dedup-cap", triageConfig.getDedupCap()))
                .build();

        TriageReport report = triageWorkflow.analyze(logFile, limits);

        String content = format == OutputConfig.Format.JSON
                ? jsonReportWriter.write(report)
                : reportRenderer.render(report);

        if (output == null || output.isBlank()) {
            out.print(content);
            out.flush();
            return;
        }

        Path outputPath = Path.of(output);
        try {
            Path parent = outputPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, content, StandardCharsets.UTF_8);
            log.info("Report saved to: {}", outputPath.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to save report", e);
            throw new IllegalStateException("Failed to save report: " + e.getMessage(), e);
        }
    }

    private OutputConfig.Format parseFormat(String value) {
        try {
            return OutputConfig.Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported format: " + value + " (expected text or json)", e);
        }
    }

    private String getRequiredOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name) || args.getOptionValues(name).isEmpty()) {
            throw new IllegalArgumentException("Required option --" + name + " is missing");
        }
        return args.getOptionValues(name).get(0);
    }

    private String getOption(ApplicationArguments args, String name, String defaultValue) {
        if (args.containsOption(name) && !args.getOptionValues(name).isEmpty()) {
            return args.getOptionValues(name).get(0);
        }
        return defaultValue;
    }

    private int getIntOption(ApplicationArguments args, String name, int defaultValue) {
        String value = getOption(args, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException("Option --" + name + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option --" + name + " must be a number: " + value, e);
        }
    }
}
