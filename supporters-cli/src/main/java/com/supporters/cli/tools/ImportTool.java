package com.supporters.cli.tools;

import com.supporters.application.ports.ConfigPort;
import com.supporters.cli.bootstrap.Bootstrap;
import com.supporters.domain.DomainException;
import com.supporters.infrastructure.config.FileConfigService;
import com.supporters.infrastructure.csv.PaymentCsvImporter;
import com.supporters.infrastructure.csv.PaymentImportException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Appends payments from a CSV file to the ledger.
 *
 * Usage:
 *   java -jar supporters-cli.jar import --file payments.csv [--db PATH] [--profile NAME]
 */
public final class ImportTool {

    private ImportTool() {}

    public static int run(String[] args) {
        return run(args, System.out, System.err);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs a;
        try {
            a = CliArgs.parse(args, List.of("--file", "--db", "--profile"), List.of("--verbose"));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 2;
        }

        String file = a.value("--file");
        if (file == null || file.isBlank()) {
            err.println("Missing --file <payments.csv>");
            return 2;
        }
        Path path = Path.of(file);
        if (!Files.isRegularFile(path)) {
            err.println("File not found: " + path);
            return 2;
        }

        try {
            ConfigPort config = FileConfigService.defaultFromWorkingDir(a.value("--profile"));
            Bootstrap.applyLogLevel(config);
            int n = new PaymentCsvImporter(Bootstrap.createLedger(config, a.value("--db"))).importFile(path);
            out.println("Imported " + n + " payment(s) from " + path);
            return 0;
        } catch (PaymentImportException e) {
            err.println("Import rejected, nothing recorded: " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            err.println("Configuration problem: " + e.getMessage());
            return 2;
        } catch (DomainException | IOException e) {
            err.println("Import failed: " + e.getMessage());
            if (a.flag("--verbose")) e.printStackTrace(err);
            return 1;
        }
    }
}
