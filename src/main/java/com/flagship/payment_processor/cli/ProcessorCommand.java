package com.flagship.payment_processor.cli;

import com.flagship.payment_processor.config.ProcessorProperties;
import com.flagship.payment_processor.io.BalanceReportWriter;
import com.flagship.payment_processor.ledger.ClientBalance;
import com.flagship.payment_processor.processing.PaymentEventProcessor;
import com.flagship.payment_processor.processing.ProcessingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point: {@code payment-processor [--verbose] <input.csv>}.
 *
 * The balance report goes to stdout; everything else (rejections, summary) is logged to
 * stderr and only shown with {@code --verbose}.
 *
 * Disabled with {@code processor.cli.enabled=false}, which tests use to start the
 * context without running a file.
 */
@Component
@ConditionalOnProperty(name = "processor.cli.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ProcessorCommand implements ApplicationRunner {

    static final String VERBOSE_OPTION = "verbose";
    private static final String BASE_PACKAGE = "com.flagship.payment_processor";

    private final PaymentEventProcessor processor;
    private final BalanceReportWriter reportWriter;
    private final ProcessorProperties properties;
    private final LoggingSystem loggingSystem;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(VERBOSE_OPTION) || properties.isVerbose()) {
            loggingSystem.setLogLevel(BASE_PACKAGE, LogLevel.INFO);
        }

        List<String> files = args.getNonOptionArgs();
        if (files.size() != 1) {
            throw new IllegalArgumentException(
                "Usage: payment-processor [--verbose] <input.csv>, got " + files.size() + " input files");
        }
        Path input = Path.of(files.get(0));
        if (!Files.isReadable(input)) {
            throw new IllegalArgumentException("Input file is not readable: " + input);
        }

        run(input, System.out);
    }

    /**
     * Processes {@code input} and writes the balance report to {@code out}.
     */
    public ProcessingReport run(Path input, PrintStream out) {
        log.info("Processing {} with {} worker(s)", input, properties.getWorkers());
        ProcessingReport report;
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            report = processor.process(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + input, e);
        }

        List<ClientBalance> rows = report.getBalances().stream()
            .map(balance -> balance.withScale(properties.getAmountScale()))
            .toList();
        Writer output = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        reportWriter.write(rows, output);
        try {
            output.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write balance report", e);
        }

        if (report.getRejectedCount() > 0) {
            log.info("Rejected records by reason: {}", report.getRejections());
        }
        return report;
    }
}
