package org.pragmatica.macro.definition;

import java.util.Optional;

/**
 * Grammar category a metavariable may capture, written after the colon in {@code $name:kind}.
 */
public enum FragmentSpecifier {
    EXPR("expr", "expression"),
    IDENT("ident", "identifier"),
    LITERAL("literal", "literal"),
    TY("ty", "type"),
    PATH("path", "path"),
    PAT("pat", "pattern"),
    BLOCK("block", "block"),
    STMT("stmt", "statement"),
    TT("tt", "token tree"),
    VIS("vis", "visibility");

    private final String keyword;
    private final String description;

    FragmentSpecifier(String keyword, String description) {
        this.keyword = keyword;
        this.description = description;
    }

    public String keyword() {
        return keyword;
    }

    public String description() {
        return description;
    }

    public static Optional<FragmentSpecifier> fromKeyword(String keyword) {
        for (var specifier : values()) {
            if (specifier.keyword.equals(keyword)) {
                return Optional.of(specifier);
            }
        }
        return Optional.empty();
    }
}
