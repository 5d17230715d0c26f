package com.github.alvarosanchez.spr.command;

import picocli.CommandLine.Help.Ansi;

/**
 * Shared CLI output helpers.
 */
public final class Cli {

    private Cli() {
    }

    /**
     * Prints raw text to standard output.
     *
     * @param message message to print
     */
    public static void print(String message) {
        System.out.println(message);
    }

    /**
     * Prints an informational message.
     *
     * @param message message to print
     */
    public static void info(String message) {
        System.out.println(styled("fg(blue)", message));
    }

    /**
     * Prints a success message.
     *
     * @param message message to print
     */
    public static void success(String message) {
        System.out.println(styled("fg(green)", message));
    }

    /**
     * Prints a warning message.
     *
     * @param message message to print
     */
    public static void warning(String message) {
        System.out.println(styled("fg(yellow)", message));
    }

    /**
     * Prints an error message to standard error.
     *
     * @param message message to print
     */
    public static void error(String message) {
        System.err.println(styled("fg(red)", "Error:") + " " + message);
    }

    static String styled(String style, String text) {
        if (!Ansi.AUTO.enabled()) {
            return text;
        }
        return Ansi.AUTO.string("@|" + style + " " + text.replace("|@", "| @") + "|@");
    }
}
