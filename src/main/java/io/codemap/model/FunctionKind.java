package io.codemap.model;

/**
 * Definition macro that declared a function clause.
 */
public enum FunctionKind {
    DEF("def"),
    DEFP("defp"),
    DEFMACRO("defmacro"),
    DEFMACROP("defmacrop");

    private final String keyword;

    FunctionKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Returns the kind for a definition keyword, or null if the keyword does not define a function.
     */
    public static FunctionKind fromKeyword(String keyword) {
        for (FunctionKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        return null;
    }
}
