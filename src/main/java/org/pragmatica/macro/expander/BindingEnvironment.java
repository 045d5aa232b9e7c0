package org.pragmatica.macro.expander;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Metavariable bindings produced by a successful match, keyed by metavariable name.
 */
public final class BindingEnvironment {

    private static final BindingEnvironment EMPTY = new BindingEnvironment(Map.of());

    private final Map<String, Binding> bindings;

    private BindingEnvironment(Map<String, Binding> bindings) {
        this.bindings = bindings;
    }

    public static BindingEnvironment empty() {
        return EMPTY;
    }

    static BindingEnvironment of(Map<String, Binding> bindings) {
        return bindings.isEmpty()
               ? EMPTY
               : new BindingEnvironment(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)));
    }

    public Optional<Binding> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public Set<String> names() {
        return bindings.keySet();
    }

    public int size() {
        return bindings.size();
    }

    @Override
    public String toString() {
        return "BindingEnvironment" + bindings;
    }
}
