package com.supporters.cli;

import com.supporters.cli.tools.ConfigDoctor;
import com.supporters.cli.tools.ImportTool;
import com.supporters.cli.tools.ReportTool;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;

public class Main {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length == 0) {
            printHelp(System.err);
            return 2;
        }

        String cmd = args[0].trim().toLowerCase(Locale.ROOT);
        String[] tail = Arrays.copyOfRange(args, 1, args.length);

        switch (cmd) {
            case "returning-report":
            case "returning":
                return ReportTool.run(ReportTool.Kind.RETURNING, tail);

            case "status-report":
            case "status":
                return ReportTool.run(ReportTool.Kind.STATUS, tail);

            case "import":
                return ImportTool.run(tail);

            case "validate-config":
            case "doctor":
                return ConfigDoctor.run(tail);

            case "help":
            case "--help":
            case "-h":
                printHelp(System.out);
                return 0;

            default:
                System.err.println("Unknown command: " + args[0]);
                printHelp(System.err);
                return 2;
        }
    }

    private static void printHelp(PrintStream out) {
        out.println("Supporters CLI");
        out.println("Usage:");
        out.println("  java -jar supporters-cli.jar returning-report [--start-month YYYY-MM] [--end-month YYYY-MM] [--format csv|json] [--db PATH] [--profile NAME]");
        out.println("  java -jar supporters-cli.jar status-report    [--start-month YYYY-MM] [--end-month YYYY-MM] [--format csv|json] [--db PATH] [--profile NAME]");
        out.println("  java -jar supporters-cli.jar import --file payments.csv [--db PATH] [--profile NAME]");
        out.println("  java -jar supporters-cli.jar validate-config [--profile NAME] [--json]");
        out.println();
        out.println("Start month defaults to the earliest payment, end month to the current month.");
    }
}
