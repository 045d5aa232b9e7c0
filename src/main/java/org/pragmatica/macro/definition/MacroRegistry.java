package org.pragmatica.macro.definition;

import org.pragmatica.macro.error.ExpansionError.DuplicateDefinition;
import org.pragmatica.macro.error.ExpansionError.NotFound;
import org.pragmatica.macro.error.Outcome;
import org.pragmatica.macro.token.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Macro definitions keyed by name.
 *
 * <p>A registry is assembled through a {@link Builder} and is immutable once built, so it can be shared
 * between threads expanding independent invocations. A registry built with a parent forms a nested
 * scope: lookups fall back to the parent, and a child may shadow a parent's name.
 */
public final class MacroRegistry {
    private static final Logger log = LoggerFactory.getLogger(MacroRegistry.class);

    private final Map<String, MacroDefinition> macros;
    private final Optional<MacroRegistry> parent;

    private MacroRegistry(Map<String, MacroDefinition> macros, Optional<MacroRegistry> parent) {
        this.macros = macros;
        this.parent = parent;
    }

    public static Builder builder() {
        return new Builder(Optional.empty());
    }

    /**
     * Builder for a scope nested inside {@code parent}.
     */
    public static Builder builder(MacroRegistry parent) {
        return new Builder(Optional.of(parent));
    }

    public static MacroRegistry empty() {
        return builder().build();
    }

    public Outcome<MacroDefinition> lookup(String name) {
        return find(name).<Outcome<MacroDefinition>>map(Outcome::success)
                         .orElseGet(() -> Outcome.failure(new NotFound(name, SourceSpan.UNKNOWN, List.of())));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * Names visible from this scope, own names first.
     */
    public Set<String> names() {
        var names = new LinkedHashSet<>(macros.keySet());
        parent.ifPresent(p -> names.addAll(p.names()));
        return Collections.unmodifiableSet(names);
    }

    private Optional<MacroDefinition> find(String name) {
        var own = macros.get(name);
        if (own != null) {
            return Optional.of(own);
        }
        return parent.flatMap(p -> p.find(name));
    }

    public static final class Builder {
        private final Optional<MacroRegistry> parent;
        private final Map<String, MacroDefinition> macros = new LinkedHashMap<>();

        private Builder(Optional<MacroRegistry> parent) {
            this.parent = parent;
        }

        /**
         * Register a definition. Fails with {@code DuplicateDefinition} when this scope already has the name.
         */
        public Outcome<MacroDefinition> define(String name, MacroDefinition definition) {
            if (macros.containsKey(name)) {
                return Outcome.failure(new DuplicateDefinition(name, SourceSpan.UNKNOWN, List.of()));
            }
            macros.put(name, definition);
            return Outcome.success(definition);
        }

        /**
         * Immutable snapshot of the definitions registered so far.
         */
        public MacroRegistry build() {
            log.debug("Built macro registry with {} definition(s){}", macros.size(),
                      parent.isPresent() ? " in nested scope" : "");
            return new MacroRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(macros)), parent);
        }
    }
}
