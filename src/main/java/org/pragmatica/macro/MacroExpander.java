package org.pragmatica.macro;

import org.pragmatica.macro.definition.MacroDefinition;
import org.pragmatica.macro.definition.MacroRegistry;
import org.pragmatica.macro.definition.MacroRulesParser;
import org.pragmatica.macro.error.Outcome;
import org.pragmatica.macro.expander.Expander;
import org.pragmatica.macro.expander.ExpanderConfig;
import org.pragmatica.macro.expander.ExpansionEngine;
import org.pragmatica.macro.fragment.DefaultFragmentGrammar;
import org.pragmatica.macro.fragment.FragmentParser;
import org.pragmatica.macro.token.TokenStream;

/**
 * Entry point for creating macro expanders.
 *
 * <p>Example usage:
 * <pre>{@code
 * var registry = MacroRegistry.builder();
 * registry.define("square", MacroExpander.parseDefinition(rulesBody).unwrap());
 *
 * var expander = MacroExpander.create(registry.build());
 * var result = expander.expand("square", arguments);
 * }</pre>
 */
public final class MacroExpander {
    private MacroExpander() {}

    /**
     * Create an expander over the given registry with default configuration.
     */
    public static Expander create(MacroRegistry registry) {
        return create(registry, ExpanderConfig.DEFAULT);
    }

    /**
     * Create an expander over the given registry with custom configuration.
     */
    public static Expander create(MacroRegistry registry, ExpanderConfig config) {
        return ExpansionEngine.create(registry, config);
    }

    /**
     * Parse the body of a rules definition: {@code (pattern) => { template };} repeated.
     */
    public static Outcome<MacroDefinition> parseDefinition(TokenStream body) {
        return MacroRulesParser.parse(body);
    }

    /**
     * Create a builder for more complex expander configuration.
     */
    public static Builder builder(MacroRegistry registry) {
        return new Builder(registry);
    }

    public static final class Builder {
        private final MacroRegistry registry;
        private int recursionLimit = ExpanderConfig.DEFAULT_RECURSION_LIMIT;
        private boolean expandNested = true;
        private FragmentParser fragmentParser = DefaultFragmentGrammar.INSTANCE;

        private Builder(MacroRegistry registry) {
            this.registry = registry;
        }

        public Builder recursionLimit(int limit) {
            this.recursionLimit = limit;
            return this;
        }

        public Builder expandNested(boolean enabled) {
            this.expandNested = enabled;
            return this;
        }

        public Builder fragmentParser(FragmentParser parser) {
            this.fragmentParser = parser;
            return this;
        }

        public Expander build() {
            return create(registry, new ExpanderConfig(recursionLimit, expandNested, fragmentParser));
        }
    }
}
