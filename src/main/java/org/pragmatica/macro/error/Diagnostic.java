package org.pragmatica.macro.error;

import org.pragmatica.macro.token.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable rendering of an {@link ExpansionError} in the Rust style.
 *
 * <p>Example output:
 * <pre>
 * error[E0003]: no rules of macro `list` expected `;` (rule #1 expected `,`)
 *   --> input.rs:3:15
 *    |
 *  3 |     list!(1, 2; 3)
 *    |               ^ no rules expected `;`
 *    |
 *    = help: while trying to match `,`
 *    = note: in this expansion of `outer!` (rule #2) at 7:5
 * </pre>
 *
 * @param severity Error severity level
 * @param code     Error code, {@code null} when absent
 * @param message  Primary error message
 * @param span     Source span where the error occurred
 * @param labels   Labeled spans for context
 * @param notes    Notes and suggestions, rendered in order
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        NOTE("note");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span; the primary label is underlined with {@code ^^^}, secondary ones with {@code ---}.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, message));
        return new Diagnostic(severity, code, this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, message));
        return new Diagnostic(severity, code, this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Render without source text: header, location and notes only.
     */
    public String format() {
        var sb = new StringBuilder();
        appendHeader(sb, null);
        for (var label : labels) {
            if (!label.message().isEmpty()) {
                sb.append("   = ").append(label.message()).append("\n");
            }
        }
        for (var note : notes) {
            sb.append("   = ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Render with an excerpt of the source the tokens were lexed from.
     *
     * @param source   source text
     * @param filename file name for display, may be {@code null}
     */
    public String format(String source, String filename) {
        if (!span.isKnown()) {
            return format();
        }
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        appendHeader(sb, filename);

        int minLine = span.start().line();
        int maxLine = span.end().line();
        for (var label : labels) {
            if (label.span().isKnown()) {
                minLine = Math.min(minLine, label.span().start().line());
                maxLine = Math.max(maxLine, label.span().end().line());
            }
        }
        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append("\n");

            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth))
                  .append(" | ")
                  .append(underlines(lineNum, lineContent, lineLabels))
                  .append("\n");
            }
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    private void appendHeader(StringBuilder sb, String filename) {
        sb.append(severity.display());
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        if (span.isKnown()) {
            sb.append("  --> ");
            if (filename != null) {
                sb.append(filename).append(":");
            }
            sb.append(span.start().line()).append(":").append(span.start().column()).append("\n");
        }
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && span.start().line() <= lineNum && span.end().line() >= lineNum) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (label.span().start().line() <= lineNum && label.span().end().line() >= lineNum) {
                result.add(label);
            }
        }
        return result;
    }

    private String underlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;

        var sorted = lineLabels.stream()
                               .sorted((a, b) -> Integer.compare(a.span().start().column(),
                                                                 b.span().start().column()))
                               .toList();

        for (var label : sorted) {
            int startCol = label.span().start().line() == lineNum ? label.span().start().column() : 1;
            int endCol = label.span().end().line() == lineNum
                         ? label.span().end().column()
                         : lineContent.length() + 1;

            while (currentCol < startCol) {
                sb.append(" ");
                currentCol++;
            }

            char underlineChar = label.primary() ? '^' : '-';
            int underlineLen = Math.max(1, endCol - startCol);
            sb.append(String.valueOf(underlineChar).repeat(underlineLen));
            currentCol += underlineLen;

            if (!label.message().isEmpty()) {
                sb.append(" ").append(label.message());
            }
        }
        return sb.toString();
    }
}
