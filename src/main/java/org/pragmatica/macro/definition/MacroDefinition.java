package org.pragmatica.macro.definition;

import java.util.List;

/**
 * Ordered rules of a declarative macro, tried top to bottom. Never empty.
 */
public record MacroDefinition(List<MacroRule> rules) {
    public MacroDefinition {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Macro definition requires at least one rule");
        }
        rules = List.copyOf(rules);
    }

    public static MacroDefinition of(MacroRule... rules) {
        return new MacroDefinition(List.of(rules));
    }

    public MacroRule rule(int index) {
        return rules.get(index);
    }

    public int size() {
        return rules.size();
    }
}
