package org.tensorscript.compiler.frontend.parser.ast;

/**
 * The operators of the script language, as they appear in the source.
 */
public enum Operator {
    ADD("+"),
    SUB("-"),
    MULT("*"),
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%"),
    POW("**"),
    MAT_MULT("@"),
    BIT_AND("&"),
    BIT_OR("|"),
    AND("and"),
    OR("or"),
    NOT("not"),
    USUB("-"),
    UADD("+"),
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LT_E("<="),
    GT(">"),
    GT_E(">=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The source spelling of the operator.
     */
    public String symbol() {
        return symbol;
    }
}
