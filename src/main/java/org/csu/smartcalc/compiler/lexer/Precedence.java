package org.csu.smartcalc.compiler.lexer;

/**
 * 运算符优先级层次，数值越大结合越紧。
 */
public enum Precedence {
    ADDITIVE(1),
    MULTIPLICATIVE(2),
    EXPONENTIAL(3);

    private final int level;

    Precedence(int level) {
        this.level = level;
    }

    /**
     * 左结合：同层的栈顶运算符要先于新运算符出栈。
     */
    public boolean bindsAtLeastAsTightAs(Precedence other) {
        return this.level >= other.level;
    }
}
