package org.pragmatica.macro.definition;

import org.pragmatica.macro.token.Delimiter;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.Token;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Element of a rule's left-hand side.
 */
public sealed interface PatternNode {

    SourceSpan span();

    /**
     * Token that must appear verbatim (compared by spelling).
     */
    record Literal(Token token) implements PatternNode {
        @Override
        public SourceSpan span() {
            return token.span();
        }
    }

    /**
     * {@code $name:fragment}
     */
    record Metavariable(String name, FragmentSpecifier fragment, SourceSpan span) implements PatternNode {}

    /**
     * {@code $( body ) separator? quantifier}
     */
    record Repetition(List<PatternNode> body,
                      Optional<Token> separator,
                      Quantifier quantifier,
                      SourceSpan span) implements PatternNode {
        public Repetition {
            body = List.copyOf(body);
        }
    }

    /**
     * Delimited sub-pattern, matching only a group with the same delimiter.
     */
    record Group(Delimiter delimiter, List<PatternNode> inner, SourceSpan span) implements PatternNode {
        public Group {
            inner = List.copyOf(inner);
        }
    }

    /**
     * Names of all metavariables declared in the given nodes, at any depth, in declaration order.
     */
    static Set<String> declaredNames(List<PatternNode> nodes) {
        var names = new LinkedHashSet<String>();
        collectNames(nodes, names);
        return names;
    }

    private static void collectNames(List<PatternNode> nodes, Set<String> names) {
        for (var node : nodes) {
            if (node instanceof Metavariable metavariable) {
                names.add(metavariable.name());
            } else if (node instanceof Repetition repetition) {
                collectNames(repetition.body(), names);
            } else if (node instanceof Group group) {
                collectNames(group.inner(), names);
            }
        }
    }
}
