package org.tricoteuses.amendment.error;

import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Diagnostic message rendered against the amendment sentence it refers to.
 *
 * <p>Example output:
 * <pre>
 * error: unrecognized amendment
 *   --> block mod-3:1:21
 *    |
 *  1 | Le II de l'article 3 est bidouillé.
 *    |                      ^ expected 'est remplacé par' or 'est abrogé'
 *    |
 * </pre>
 *
 * @param severity severity level
 * @param message  primary message
 * @param span     offsets in the source the diagnostic points at
 * @param labels   labeled spans shown under the source line
 * @param notes    additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span providing additional context.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public Diagnostic {
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, message, span, List.of(), List.of());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Diagnostic withLabel(String label) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, label));
        return new Diagnostic(severity, message, span, newLabels, notes);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String label) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, label));
        return new Diagnostic(severity, message, span, newLabels, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, span, labels, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic against its source.
     *
     * @param source the text the span offsets refer to
     * @param origin name shown in the location line (block id, file name), may be empty
     */
    public String format(String source, String origin) {
        var sb = new StringBuilder();
        sb.append(severity.display()).append(": ").append(message).append("\n");

        var lines = source.split("\n", -1);
        var lineStarts = lineStarts(lines);
        int startLine = lineOf(lineStarts, span.start());
        int endLine = lineOf(lineStarts, span.stop());
        for (var label : labels) {
            startLine = Math.min(startLine, lineOf(lineStarts, label.span().start()));
            endLine = Math.max(endLine, lineOf(lineStarts, label.span().stop()));
        }

        sb.append("  --> ");
        if (!origin.isEmpty()) {
            sb.append(origin).append(":");
        }
        sb.append(startLine + 1).append(":").append(span.start() - lineStarts[lineOf(lineStarts, span.start())] + 1).append("\n");

        int gutter = String.valueOf(endLine + 1).length();
        sb.append(" ".repeat(gutter + 1)).append("|\n");
        for (int line = startLine; line <= endLine && line < lines.length; line++) {
            sb.append(String.format("%" + gutter + "d", line + 1)).append(" | ").append(lines[line]).append("\n");
            var onLine = labelsOnLine(lineStarts, lines, line);
            if (!onLine.isEmpty()) {
                sb.append(" ".repeat(gutter)).append(" | ")
                  .append(underlines(lineStarts[line], lines[line].length(), onLine))
                  .append("\n");
            }
        }
        sb.append(" ".repeat(gutter + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutter + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line format for logs.
     */
    public String formatSimple() {
        return severity.display() + " at " + span + ": " + message;
    }

    private List<Label> labelsOnLine(int[] lineStarts, String[] lines, int line) {
        var lineStart = lineStarts[line];
        var lineEnd = lineStart + lines[line].length();
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && span.start() <= lineEnd && span.stop() >= lineStart) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (label.span().start() <= lineEnd && label.span().stop() >= lineStart) {
                result.add(label);
            }
        }
        return result;
    }

    private static String underlines(int lineStart, int lineLength, List<Label> onLine) {
        var sb = new StringBuilder();
        int column = 0;
        var sorted = onLine.stream()
                           .sorted(Comparator.comparingInt(label -> label.span().start()))
                           .toList();
        for (var label : sorted) {
            int from = Math.max(0, label.span().start() - lineStart);
            int to = Math.min(lineLength, label.span().stop() - lineStart);
            while (column < from) {
                sb.append(' ');
                column++;
            }
            int width = Math.max(1, to - from);
            sb.append(String.valueOf(label.primary() ? '^' : '-').repeat(width));
            column += width;
            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
            }
        }
        return sb.toString();
    }

    private static int[] lineStarts(String[] lines) {
        var starts = new int[lines.length];
        int offset = 0;
        for (int i = 0; i < lines.length; i++) {
            starts[i] = offset;
            offset += lines[i].length() + 1;
        }
        return starts;
    }

    private static int lineOf(int[] lineStarts, int offset) {
        int line = 0;
        while (line + 1 < lineStarts.length && lineStarts[line + 1] <= offset) {
            line++;
        }
        return line;
    }
}
