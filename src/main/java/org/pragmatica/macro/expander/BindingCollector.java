package org.pragmatica.macro.expander;

import org.pragmatica.macro.error.ExpansionError;
import org.pragmatica.macro.error.ExpansionError.DuplicateMetavariableBinding;
import org.pragmatica.macro.token.SourceSpan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulates captures while the matcher walks a pattern.
 *
 * <p>Each repetition iteration is collected by a {@link #fork() fork}; when the repetition ends the forks are
 * folded into one {@link Binding.Repeated} per metavariable declared in the repetition body.
 */
final class BindingCollector {

    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    BindingCollector fork() {
        return new BindingCollector();
    }

    /**
     * Record a capture. A name may be bound once per collector.
     */
    Optional<ExpansionError> bind(String name, Binding binding, SourceSpan span) {
        if (bindings.containsKey(name)) {
            return Optional.of(new DuplicateMetavariableBinding(name, span, List.of()));
        }
        bindings.put(name, binding);
        return Optional.empty();
    }

    /**
     * Fold the iterations of a finished repetition into this collector.
     *
     * @param names      metavariables declared by the repetition body
     * @param iterations one collector per successful iteration, in order
     */
    Optional<ExpansionError> bindRepetition(Set<String> names, List<BindingCollector> iterations, SourceSpan span) {
        for (var name : names) {
            var perIteration = new ArrayList<Binding>(iterations.size());
            for (var iteration : iterations) {
                var captured = iteration.bindings.get(name);
                if (captured == null) {
                    throw new IllegalStateException("Repetition iteration did not bind `$" + name + "`");
                }
                perIteration.add(captured);
            }
            var failure = bind(name, new Binding.Repeated(perIteration), span);
            if (failure.isPresent()) {
                return failure;
            }
        }
        return Optional.empty();
    }

    BindingEnvironment toEnvironment() {
        return BindingEnvironment.of(bindings);
    }
}
