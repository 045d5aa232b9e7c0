package org.pragmatica.macro.expander;

import org.pragmatica.macro.error.Outcome;
import org.pragmatica.macro.token.SourceSpan;
import org.pragmatica.macro.token.TokenStream;

/**
 * Expander interface - expands macro invocations into token streams.
 *
 * <p>Expansion either fully succeeds or fully fails: a failure never comes with partial output.
 */
public interface Expander {

    /**
     * Expand one invocation of {@code macroName} whose argument group contained {@code arguments}.
     */
    Outcome<TokenStream> expand(String macroName, TokenStream arguments);

    /**
     * Expand one invocation, reporting {@code callSite} as its location in diagnostics.
     */
    Outcome<TokenStream> expand(String macroName, TokenStream arguments, SourceSpan callSite);

    /**
     * Expand every {@code name!(...)} invocation of a registered macro found anywhere in {@code tokens}.
     */
    Outcome<TokenStream> expandAll(TokenStream tokens);
}
