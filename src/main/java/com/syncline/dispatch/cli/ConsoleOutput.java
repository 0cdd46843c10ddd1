package com.syncline.dispatch.cli;

import com.syncline.core.model.Message;
import com.syncline.core.model.Part;
import com.syncline.core.store.StreamSnapshot;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Syncline CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SYNCLINE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SYNCLINE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void stream(StreamSnapshot snapshot) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold STREAM " + snapshot.session().id() + "|@  (" + snapshot.session().directory() + ")"));
        if (snapshot.status() != null) {
            System.out.println("  Status: " + snapshot.status().type());
        }
        for (StreamSnapshot.MessageView view : snapshot.messages()) {
            Message m = view.message();
            String marker = m.isOptimistic() ? " @|fg(magenta) (optimistic)|@" : "";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(blue) [" + m.role().wireName() + "]|@ " + m.id() + marker));
            for (Part part : view.parts()) {
                System.out.println("      " + part.type() + " " + part.id() + summarize(part));
            }
        }
    }

    private static String summarize(Part part) {
        if (part.isToolType()) {
            String status = part.state() != null ? part.state().status() : "?";
            return ": " + part.tool() + " [" + status + "]";
        }
        if (part.text() != null) {
            String text = part.text().replace('\n', ' ');
            return ": " + (text.length() > 60 ? text.substring(0, 57) + "..." : text);
        }
        return "";
    }
}
