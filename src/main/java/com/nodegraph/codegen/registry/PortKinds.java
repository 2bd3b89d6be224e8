package com.nodegraph.codegen.registry;

/**
 * The two reserved port kind names. Every other kind string is an ordinary data
 * type, compared by string equality.
 */
public final class PortKinds {
    /** Control flow: "run the target after the source". */
    public static final String EXEC = "exec";
    /** Wildcard data input that accepts any data producer. */
    public static final String DATA = "data";

    private PortKinds() {
        // Constants holder
    }

    public static boolean isExec(String kind) {
        return EXEC.equals(kind);
    }

    public static boolean isWildcard(String kind) {
        return DATA.equals(kind);
    }
}
