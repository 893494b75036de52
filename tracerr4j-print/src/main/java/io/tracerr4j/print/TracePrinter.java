/*
 * Copyright (c) 2025 Tracerr4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.tracerr4j.print;

import io.tracerr4j.core.api.Tracerr;
import io.tracerr4j.core.api.model.Frame;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders a traced error as text: the message, then one line per captured frame, optionally
 * followed by the numbered source lines around the frame's line.
 *
 * <pre>
 * payment declined
 *
 * com/acme/Billing.java:42 com.acme.Billing.charge()
 *    40 |     Card card = wallet.primary();
 *    41 |     if (!card.valid()) {
 * &gt;  42 |         throw Tracerr.newError("payment declined");
 *    43 |     }
 * </pre>
 *
 * Errors without a trace render as their message only. Unreadable sources render a placeholder line.
 */
public final class TracePrinter {
    static final String RESET = "\u001B[0m";
    static final String BOLD = "\u001B[1m";
    static final String RED = "\u001B[1;31m";

    private final PrintOptions options;
    private final SourceCache sources;

    public TracePrinter(PrintOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.sources = new SourceCache(options.sourceRoots());
    }

    /** Message and frames only. */
    public static TracePrinter plain() {
        return new TracePrinter(PrintOptions.defaults());
    }

    /** Six lines of source before and two after each frame. */
    public static TracePrinter withSource() {
        return new TracePrinter(PrintOptions.defaults().withSource(6, 2));
    }

    /** Like {@link #withSource()} with ANSI colours. */
    public static TracePrinter withSourceColor() {
        return new TracePrinter(PrintOptions.defaults().withSource(6, 2).withColorize(true));
    }

    public PrintOptions options() {
        return options;
    }

    /** Empty string for {@code null}. */
    public String sprint(Throwable error) {
        if (error == null) return "";
        StringBuilder sb = new StringBuilder(256);
        sb.append(messageOf(error));

        int printed = 0, omitted = 0;
        for (Frame f : Tracerr.stackTrace(error)) {
            if (isHidden(f.function())) {
                omitted++;
                continue;
            }
            if (options.maxFrames() > 0 && printed >= options.maxFrames()) {
                omitted++;
                continue;
            }
            if (options.showSource()) sb.append('\n');
            sb.append('\n').append(color(BOLD, f.describe()));
            if (options.showSource()) appendSource(sb, f);
            printed++;
        }
        if (omitted > 0) {
            sb.append('\n').append(" (").append(omitted).append(" frames omitted)");
        }
        return sb.toString();
    }

    /** Writes {@link #sprint(Throwable)} and a line separator; nothing for {@code null}. */
    public void print(Throwable error, PrintStream out) {
        if (error == null) return;
        out.println(sprint(error));
    }

    // ---------------- source ----------------

    private void appendSource(StringBuilder sb, Frame f) {
        Optional<List<String>> file =
                Frame.UNKNOWN_SOURCE.equals(f.path()) ? Optional.empty() : sources.lines(f.path());
        if (file.isEmpty()) {
            sb.append('\n').append("(source unavailable: ").append(f.path()).append(')');
            return;
        }
        List<String> lines = file.get();
        if (f.line() < 1 || f.line() > lines.size()) {
            sb.append('\n')
                    .append("(line ")
                    .append(f.line())
                    .append(" out of range in ")
                    .append(f.path())
                    .append(')');
            return;
        }

        int from = Math.max(1, f.line() - options.sourceBefore());
        int to = Math.min(lines.size(), f.line() + options.sourceAfter());
        int width = String.valueOf(to).length();
        for (int n = from; n <= to; n++) {
            boolean current = n == f.line();
            String row = (current ? "> " : "  ") + pad(n, width) + " | " + lines.get(n - 1);
            sb.append('\n').append(current ? color(RED, row) : row);
        }
    }

    // ---------------- helpers ----------------

    private boolean isHidden(String function) {
        for (String p : options.hidePackages()) if (function.startsWith(p)) return true;
        return false;
    }

    private String color(String code, String text) {
        return options.colorize() ? code + text + RESET : text;
    }

    private static String messageOf(Throwable error) {
        Throwable shown = Objects.requireNonNullElse(Tracerr.unwrap(error), error);
        String msg = shown.getMessage();
        return msg == null ? shown.toString() : msg;
    }

    private static String pad(int n, int width) {
        String s = String.valueOf(n);
        return " ".repeat(width - s.length()) + s;
    }
}
