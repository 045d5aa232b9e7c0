package org.pragmatica.macro.expander;

import org.pragmatica.macro.definition.FragmentSpecifier;
import org.pragmatica.macro.token.TokenStream;

import java.util.List;

/**
 * Tokens captured by one metavariable: a single fragment, or one nested binding per repetition iteration.
 */
public sealed interface Binding {

    /**
     * Repetition nesting depth of this binding: 0 for a fragment.
     */
    int depth();

    /**
     * Captured fragment. {@code tokens} is a view into the invocation's token stream.
     */
    record Fragment(FragmentSpecifier kind, TokenStream tokens) implements Binding {
        @Override
        public int depth() {
            return 0;
        }
    }

    /**
     * One binding per iteration of the enclosing repetition; may be empty for {@code *} and {@code ?}.
     */
    record Repeated(List<Binding> iterations) implements Binding {
        public Repeated {
            iterations = List.copyOf(iterations);
        }

        public int size() {
            return iterations.size();
        }

        public Binding get(int index) {
            return iterations.get(index);
        }

        @Override
        public int depth() {
            return 1 + iterations.stream()
                                 .mapToInt(Binding::depth)
                                 .max()
                                 .orElse(0);
        }
    }
}
