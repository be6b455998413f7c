package com.harden.dispatch.cli;

import com.harden.core.model.ErrorEntry;
import com.harden.core.model.PipelineSnapshot;
import com.harden.core.model.Unit;
import com.harden.core.model.UnitStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the harden CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HARDEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void unitStatus(String unitName, UnitStatus status) {
        String color = switch (status) {
            case VERIFIED, HARDENED, ANALYZED -> "fg(green)";
            case ERROR -> "fg(red)";
            case SKIPPED -> "fg(white)";
            default -> "fg(blue)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-10s", status.wireName()) + "|@ " + unitName));
    }

    /**
     * Prints the phase, a per-unit table and the error log.
     */
    public static void snapshot(PipelineSnapshot snapshot) {
        System.out.println();
        info("Phase: " + snapshot.phase().wireName());
        if (snapshot.startedAt() != null) {
            info("Started: " + snapshot.startedAt());
        }
        if (snapshot.completedAt() != null) {
            info("Completed: " + snapshot.completedAt());
        }

        if (!snapshot.units().isEmpty()) {
            System.out.println();
            System.out.printf("  %-32s %-10s %-8s %s%n", "UNIT", "STATUS", "RISK", "FINDINGS");
            System.out.println("  " + "-".repeat(64));
            for (Unit unit : snapshot.units().values()) {
                System.out.printf("  %-32s %-10s %-8s %s%n",
                        truncate(unit.name(), 32), unit.status().wireName(),
                        risk(unit), findingCount(unit));
            }
        }

        if (!snapshot.errors().isEmpty()) {
            System.out.println();
            error("Errors (" + snapshot.errors().size() + "):");
            for (ErrorEntry e : snapshot.errors()) {
                error("  " + e.at() + " " + e.message());
            }
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "snapshot" -> "@|fg(cyan) [SNAPSHOT]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    private static String risk(Unit unit) {
        if (unit.analysis() == null || !unit.analysis().hasNonNull("overall_risk")) return "-";
        return unit.analysis().get("overall_risk").asText();
    }

    private static String findingCount(Unit unit) {
        if (unit.analysis() == null || !unit.analysis().path("findings").isArray()) return "-";
        return String.valueOf(unit.analysis().get("findings").size());
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
