package io.svparse;

import java.util.*;

import static io.svparse.SystemVerilogLexer.*;

/**
 * Category-code predicates shared by the lexical context and its helper
 * state machines, plus printable names for diagnostics.
 */
public final class VerilogTokenClassifications {

    // begin-like and end-like keywords that may be followed by ": label"
    private static final Set<Integer> LABELABLE_KEYWORDS = Set.of(
        KW_BEGIN, KW_FORK, KW_GENERATE,
        KW_END, KW_ENDGENERATE, KW_ENDCASE, KW_ENDCONFIG, KW_ENDFUNCTION,
        KW_ENDMODULE, KW_ENDPRIMITIVE, KW_ENDSPECIFY, KW_ENDTABLE, KW_ENDTASK,
        KW_ENDCLASS, KW_ENDCLOCKING, KW_ENDGROUP, KW_ENDINTERFACE, KW_ENDPACKAGE,
        KW_ENDPROGRAM, KW_ENDPROPERTY, KW_ENDSEQUENCE, KW_ENDCHECKER,
        KW_ENDCONNECTRULES, KW_ENDDISCIPLINE, KW_ENDNATURE, KW_ENDPARAMSET,
        KW_JOIN, KW_JOIN_ANY, KW_JOIN_NONE
    );

    private static final Set<Integer> PROCEDURAL_CONSTRUCT_KEYWORDS = Set.of(
        KW_INITIAL, KW_ALWAYS, KW_ALWAYS_COMB, KW_ALWAYS_FF, KW_ALWAYS_LATCH, KW_FINAL
    );

    private static final Set<Integer> FLOW_CONTROL_KEYWORDS = Set.of(
        KW_IF, KW_FOR, KW_CASE, KW_CASEX, KW_CASEZ
    );

    private VerilogTokenClassifications() {}

    /**
     * Returns true for raw categories that the lexer cannot classify on its
     * own. Every such token must be re-tagged before parsing.
     */
    public static boolean isAmbiguous(int tokenType) {
        return tokenType == RARROW;
    }

    public static boolean keywordAcceptsOptionalLabel(int tokenType) {
        return LABELABLE_KEYWORDS.contains(tokenType);
    }

    /** initial, final, and the always family. */
    public static boolean isProceduralConstructKeyword(int tokenType) {
        return PROCEDURAL_CONSTRUCT_KEYWORDS.contains(tokenType);
    }

    public static boolean isFlowControlKeyword(int tokenType) {
        return FLOW_CONTROL_KEYWORDS.contains(tokenType);
    }

    public static String symbolName(int tokenType) {
        String name = VOCABULARY.getSymbolicName(tokenType);
        if (name == null) {
            name = VOCABULARY.getLiteralName(tokenType);
        }
        return name != null ? name : "UNKNOWN_" + tokenType;
    }
}
