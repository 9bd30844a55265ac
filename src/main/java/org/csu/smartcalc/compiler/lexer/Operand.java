package org.csu.smartcalc.compiler.lexer;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 操作数：整数常量或变量名，二者有且仅有一个不为 null。
 *
 * @param name    变量名，原样保存，求值时再到变量环境中查找
 * @param literal 整数常量
 */
public record Operand(String name, BigInteger literal) implements Token {

    public Operand {
        if ((name == null) == (literal == null)) {
            throw new IllegalArgumentException("Operand must have exactly one of name or literal.");
        }
    }

    public static Operand literal(BigInteger value) {
        return new Operand(null, Objects.requireNonNull(value));
    }

    public static Operand identifier(String name) {
        return new Operand(Objects.requireNonNull(name), null);
    }

    public boolean isIdentifier() {
        return name != null;
    }

    @Override
    public String lexeme() {
        return isIdentifier() ? name : literal.toString();
    }

    @Override
    public String toString() {
        return lexeme();
    }
}
