package org.pragmatica.macro.definition;

import org.pragmatica.macro.token.Delimiter;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.Token;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Element of a rule's right-hand side.
 */
public sealed interface TemplateNode {

    SourceSpan span();

    /**
     * Token emitted as-is, stamped with the expansion's hygiene id.
     */
    record Literal(Token token) implements TemplateNode {
        @Override
        public SourceSpan span() {
            return token.span();
        }
    }

    /**
     * {@code $name}: replaced by the captured tokens.
     */
    record MetavariableRef(String name, SourceSpan span) implements TemplateNode {}

    /**
     * {@code $( body ) separator? quantifier}: emitted once per captured iteration.
     */
    record RepetitionEcho(List<TemplateNode> body, Optional<Token> separator, SourceSpan span) implements TemplateNode {
        public RepetitionEcho {
            body = List.copyOf(body);
        }
    }

    record Group(Delimiter delimiter, List<TemplateNode> inner, SourceSpan span) implements TemplateNode {
        public Group {
            inner = List.copyOf(inner);
        }
    }

    /**
     * Names of all metavariables referenced in the given nodes, at any depth, in order of first use.
     */
    static Set<String> referencedNames(List<TemplateNode> nodes) {
        var names = new LinkedHashSet<String>();
        collectNames(nodes, names);
        return names;
    }

    private static void collectNames(List<TemplateNode> nodes, Set<String> names) {
        for (var node : nodes) {
            if (node instanceof MetavariableRef ref) {
                names.add(ref.name());
            } else if (node instanceof RepetitionEcho echo) {
                collectNames(echo.body(), names);
            } else if (node instanceof Group group) {
                collectNames(group.inner(), names);
            }
        }
    }
}
