package org.pragmatica.macro.error;

import org.pragmatica.macro.token.SourceSpan;

/**
 * One in-progress macro expansion: which macro, where it was invoked and which rule was selected.
 */
public record ExpansionFrame(String macroName, SourceSpan callSite, int ruleIndex) {

    public static final int NO_RULE = -1;

    public static ExpansionFrame enter(String macroName, SourceSpan callSite) {
        return new ExpansionFrame(macroName, callSite, NO_RULE);
    }

    public ExpansionFrame withRule(int index) {
        return new ExpansionFrame(macroName, callSite, index);
    }

    public boolean hasRule() {
        return ruleIndex != NO_RULE;
    }

    /**
     * Note line as shown under a diagnostic.
     */
    public String describe() {
        var sb = new StringBuilder("in this expansion of `").append(macroName).append("!`");
        if (hasRule()) {
            sb.append(" (rule #").append(ruleIndex + 1).append(")");
        }
        if (callSite.isKnown()) {
            sb.append(" at ").append(callSite.start());
        }
        return sb.toString();
    }
}
