package org.pragmatica.macro.definition;

import org.pragmatica.macro.token.SourceSpan;

import java.util.List;

/**
 * One {@code (pattern) => {template}} arm of a macro definition.
 */
public record MacroRule(List<PatternNode> pattern, List<TemplateNode> template, SourceSpan span) {
    public MacroRule {
        pattern = List.copyOf(pattern);
        template = List.copyOf(template);
    }

    public static MacroRule of(List<PatternNode> pattern, List<TemplateNode> template) {
        return new MacroRule(pattern, template, SourceSpan.UNKNOWN);
    }
}
