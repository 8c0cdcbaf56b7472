package org.pragmatica.alang.error;

import org.pragmatica.alang.tree.Position;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rust-style error report: coded header, location line and the offending source lines with
 * their labeled spans underlined.
 *
 * <p>Example output:
 * <pre>
 * error[E0001]: unexpected '&lt;'
 *   --> main.a:2:15
 *   |
 * 2 |     if (a &lt; b &lt; c) {
 *   |           -   ^ comparisons do not chain
 *   |           |
 *   |           first comparison
 *   |
 *   = help: parenthesize one of the comparisons
 * </pre>
 *
 * @param code     stable error code, e.g. {@code E0001}
 * @param message  headline
 * @param position span the report is anchored at
 * @param labels   labeled spans; the primary ones are underlined with {@code ^}, the others with {@code -}
 * @param notes    trailing {@code = ...} lines
 */
public record Diagnostic(
    String code,
    String message,
    Position position,
    List<Label> labels,
    List<String> notes
) {
    private static final String DEFAULT_FILENAME = "input";

    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(position, "position");
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    public record Label(Position position, String message, boolean primary) {}

    public static Diagnostic error(String code, String message, Position position) {
        return new Diagnostic(code, message, position, List.of(), List.of());
    }

    /**
     * Label the diagnostic's own span.
     */
    public Diagnostic withLabel(String text) {
        return withLabel(new Label(position, text, true));
    }

    /**
     * Label a related span, e.g. an earlier token that makes the current one wrong.
     */
    public Diagnostic withSecondaryLabel(Position labelPosition, String text) {
        return withLabel(new Label(labelPosition, text, false));
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, position, labels, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    private Diagnostic withLabel(Label label) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(label);
        return new Diagnostic(code, message, position, newLabels, notes);
    }

    /**
     * Multi-line report with a source excerpt.
     *
     * @param filename name shown in the location line, {@code input} when null
     */
    public String format(String source, String filename) {
        var lines = source.split("\n", -1);
        int firstLine = position.startLine();
        int lastLine = position.endLine();
        for (var label : labels) {
            firstLine = Math.min(firstLine, label.position().startLine());
            lastLine = Math.max(lastLine, label.position().endLine());
        }
        var gutter = " ".repeat(String.valueOf(lastLine).length());

        var out = new StringBuilder();
        out.append("error[").append(code).append("]: ").append(message).append('\n');
        out.append("  --> ").append(filename == null ? DEFAULT_FILENAME : filename)
           .append(':').append(position.startLine())
           .append(':').append(position.startCol())
           .append('\n');
        out.append(gutter).append(" |\n");

        for (int line = Math.max(1, firstLine); line <= Math.min(lastLine, lines.length); line++) {
            var text = lines[line - 1];
            out.append(String.format("%" + gutter.length() + "d | ", line)).append(text).append('\n');
            var marks = marksOn(line, text);
            if (!marks.isEmpty()) {
                appendMarks(marks, gutter, out);
            }
        }

        out.append(gutter).append(" |\n");
        for (var note : notes) {
            out.append(gutter).append(" = ").append(note).append('\n');
        }
        return out.toString();
    }

    /**
     * Single-line report: {@code input:line:col: error: message (label)}.
     */
    public String formatSimple() {
        return formatSimple(DEFAULT_FILENAME);
    }

    public String formatSimple(String filename) {
        var out = new StringBuilder(String.format("%s:%d:%d: error: %s",
                                                  filename, position.startLine(), position.startCol(), message));
        for (var label : labels) {
            if (label.primary() && !label.message().isEmpty()) {
                out.append(" (").append(label.message()).append(")");
            }
        }
        return out.toString();
    }

    /**
     * One underline segment on a source line; columns are 1-based.
     */
    private record Mark(int start, int length, boolean primary, String message) {}

    private List<Mark> marksOn(int line, String text) {
        var onLine = new ArrayList<Label>();
        // unlabeled diagnostics still underline their own span
        if (labels.isEmpty()) {
            onLine.add(new Label(position, "", true));
        }
        onLine.addAll(labels);

        var marks = new ArrayList<Mark>();
        for (var label : onLine) {
            var span = label.position();
            if (span.startLine() > line || span.endLine() < line) {
                continue;
            }
            int start = span.startLine() == line ? span.startCol() : 1;
            int end = span.endLine() == line ? span.endCol() : text.length() + 1;
            marks.add(new Mark(start, Math.max(1, end - start), label.primary(), label.message()));
        }
        marks.sort(Comparator.comparingInt(Mark::start));
        return marks;
    }

    /**
     * Underline row carrying the rightmost message; every other message hangs below its mark.
     */
    private static void appendMarks(List<Mark> marks, String gutter, StringBuilder out) {
        var row = new StringBuilder();
        for (var mark : marks) {
            padTo(row, mark.start());
            row.append(String.valueOf(mark.primary() ? '^' : '-').repeat(mark.length()));
        }
        var rightmost = marks.get(marks.size() - 1);
        if (!rightmost.message().isEmpty()) {
            row.append(' ').append(rightmost.message());
        }
        appendRow(gutter, row, out);

        var hanging = new ArrayList<Mark>();
        for (var mark : marks.subList(0, marks.size() - 1)) {
            if (!mark.message().isEmpty()) {
                hanging.add(mark);
            }
        }
        for (int i = hanging.size() - 1; i >= 0; i--) {
            appendRow(gutter, pipes(hanging.subList(0, i + 1)), out);
            var messageRow = pipes(hanging.subList(0, i));
            padTo(messageRow, hanging.get(i).start());
            messageRow.append(hanging.get(i).message());
            appendRow(gutter, messageRow, out);
        }
    }

    private static StringBuilder pipes(List<Mark> marks) {
        var row = new StringBuilder();
        for (var mark : marks) {
            padTo(row, mark.start());
            row.append('|');
        }
        return row;
    }

    private static void padTo(StringBuilder row, int column) {
        while (row.length() < column - 1) {
            row.append(' ');
        }
    }

    private static void appendRow(String gutter, CharSequence row, StringBuilder out) {
        out.append(gutter).append(" | ").append(row).append('\n');
    }
}
