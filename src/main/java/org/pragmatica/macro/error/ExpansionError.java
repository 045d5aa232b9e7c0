package org.pragmatica.macro.error;

import org.pragmatica.macro.token.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Every way a definition or an expansion can fail. Each error carries the offending location and the
 * chain of expansions active when it happened, oldest first.
 */
public sealed interface ExpansionError {

    String code();

    String message();

    SourceSpan span();

    List<ExpansionFrame> frames();

    /**
     * Copy with the given frame chain. Errors that already carry a chain keep it, since it was
     * recorded closer to the failure.
     */
    ExpansionError withFrames(List<ExpansionFrame> frames);

    /**
     * Diagnostic for this error, with one note per active expansion, oldest first.
     */
    default Diagnostic toDiagnostic() {
        var diagnostic = baseDiagnostic();
        for (var frame : frames()) {
            diagnostic = diagnostic.withNote("note: " + frame.describe());
        }
        return diagnostic;
    }

    default Diagnostic baseDiagnostic() {
        return Diagnostic.error(code(), message(), span());
    }

    record NotFound(String macroName, SourceSpan span, List<ExpansionFrame> frames) implements ExpansionError {
        public NotFound {
            frames = List.copyOf(frames);
        }

        @Override
        public String code() {
            return "E0001";
        }

        @Override
        public String message() {
            return "cannot find macro `" + macroName + "` in this scope";
        }

        @Override
        public ExpansionError withFrames(List<ExpansionFrame> chain) {
            return frames.isEmpty() ? new NotFound(macroName, span, chain) : this;
        }
    }

    record DuplicateDefinition(String macroName, SourceSpan span, List<ExpansionFrame> frames) implements ExpansionError {
        public DuplicateDefinition {
            frames = List.copyOf(frames);
        }

        @Override
        public String code() {
            return "E0002";
        }

        @Override
        public String message() {
            return "macro `" + macroName + "` is defined multiple times in the same scope";
        }

        @Override
        public ExpansionError withFrames(List<ExpansionFrame> chain) {
            return frames.isEmpty() ? new DuplicateDefinition(macroName, span, chain) : this;
        }
    }

    /**
     * No rule matched; {@code ruleIndex}, {@code expected} and {@code found} describe the rule that got furthest.
     */
    record NoMatchingRule(String macroName,
                          SourceSpan span,
                          int ruleIndex,
                          String expected,
                          String found,
                          List<ExpansionFrame> frames) implements ExpansionError {
        public NoMatchingRule {
            frames = List.copyOf(frames);
        }

        @Override
        public String code() {
            return "E0003";
        }

        @Override
        public String message() {
            return "no rules of macro `" + macroName + "` expected " + found
                   + " (rule #" + (ruleIndex + 1) + " expected " + expected + ")";
        }

        @Override
        public ExpansionError withFrames(List<ExpansionFrame> chain) {
            return frames.isEmpty() ? new NoMatchingRule(macroName, span, ruleIndex, expected, found, chain) : this;
        }

        @Override
        public Diagnostic baseDiagnostic() {
            return Diagnostic.error(code(), message(), span)
                             .withLabel("no rules expected " + found)
                             .withHelp("while trying to match " + expected);
        }
    }

    record DuplicateMetavariableBinding(String metavariable, SourceSpan span, List<ExpansionFrame> frames) implements ExpansionError {
        public DuplicateMetavariableBinding {
            frames = List.copyOf(frames);
        }

        @Override
        public String code() {
            return "E0004";
        }

        @Override
        public String message() {
            return "duplicate matcher binding `$" + metavariable + "`";
        }

        @Override
        public ExpansionError withFrames(List<ExpansionFrame> chain) {
            return frames.isEmpty() ? new DuplicateMetavariableBinding(metavariable, span, chain) : this;
        }
    }

    /**
     * Metavariables driving one repetition echo were captured a different number of times.
     * {@code lengths} keeps metavariable names in template order.
     */
    record RepetitionCountMismatch(SourceSpan span, Map<String, Integer> lengths, List<ExpansionFrame> frames) implements ExpansionError {
        public RepetitionCountMismatch {
            lengths = Collections.unmodifiableMap(new LinkedHashMap<>(lengths));
            frames = List.copyOf(frames);
        }

        @Override
        public String code() {
            return "E0005";
        }

        @Override
        public String message() {
            return "meta-variable repetitions do not match in length: "
                   + lengths.entrySet()
                            .stream()
                            .map(entry -> "`$" + entry.getKey() + "` repeats " + entry.getValue() + " times")
                            .collect(Collectors.joining(", "));
        }

        @Override
        public ExpansionError withFrames(List<ExpansionFrame> chain) {
            return frames.isEmpty() ? new RepetitionCountMismatch(span, lengths, chain) : this;
        }
    }

    record RecursionLimitExceeded(String macroName, int limit, SourceSpan span, List<ExpansionFrame> frames) implements ExpansionError {
        public RecursionLimitExceeded {
            frames = List.copyOf(frames);
        }

        @Override
        public String code() {
            return "E0006";
        }

        @Override
        public String message() {
            return "recursion limit reached while expanding `" + macroName + "!` (limit " + limit + ")";
        }

        @Override
        public ExpansionError withFrames(List<ExpansionFrame> chain) {
            return frames.isEmpty() ? new RecursionLimitExceeded(macroName, limit, span, chain) : this;
        }
    }

    /**
     * The fragment grammar started parsing a metavariable capture and rejected it.
     */
    record MalformedFragment(String metavariable,
                             String fragment,
                             SourceSpan span,
                             String found,
                             String reason,
                             List<ExpansionFrame> frames) implements ExpansionError {
        public MalformedFragment {
            frames = List.copyOf(frames);
        }

        @Override
        public String code() {
            return "E0007";
        }

        @Override
        public String message() {
            return "malformed `" + fragment + "` fragment for `$" + metavariable + "` at " + found + ": " + reason;
        }

        @Override
        public ExpansionError withFrames(List<ExpansionFrame> chain) {
            return frames.isEmpty() ? new MalformedFragment(metavariable, fragment, span, found, reason, chain) : this;
        }
    }

    record InvalidDefinition(String reason, SourceSpan span, List<ExpansionFrame> frames) implements ExpansionError {
        public InvalidDefinition {
            frames = List.copyOf(frames);
        }

        public static InvalidDefinition at(SourceSpan span, String reason) {
            return new InvalidDefinition(reason, span, List.of());
        }

        @Override
        public String code() {
            return "E0008";
        }

        @Override
        public String message() {
            return "invalid macro definition: " + reason;
        }

        @Override
        public ExpansionError withFrames(List<ExpansionFrame> chain) {
            return frames.isEmpty() ? new InvalidDefinition(reason, span, chain) : this;
        }
    }

    /**
     * A metavariable was used at a repetition depth that does not correspond to how it was captured.
     */
    record RepetitionDepthMismatch(String metavariable, SourceSpan span, String reason, List<ExpansionFrame> frames) implements ExpansionError {
        public RepetitionDepthMismatch {
            frames = List.copyOf(frames);
        }

        @Override
        public String code() {
            return "E0009";
        }

        @Override
        public String message() {
            return metavariable.isEmpty()
                   ? reason
                   : "variable `$" + metavariable + "` " + reason;
        }

        @Override
        public ExpansionError withFrames(List<ExpansionFrame> chain) {
            return frames.isEmpty() ? new RepetitionDepthMismatch(metavariable, span, reason, chain) : this;
        }
    }
}
