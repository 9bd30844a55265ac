package org.csu.smartcalc.compiler.lexer;

import java.math.BigInteger;
import java.util.function.BinaryOperator;

/**
 * 运算符。括号只用于结构，没有优先级也没有运算函数，永远不会被求值。
 *
 * 优先级使用显式的 {@link Precedence}，不依赖枚举的声明顺序。
 */
public enum Operator implements Token {
    LEFT_PAREN('(', null, null),
    ADD('+', Precedence.ADDITIVE, BigInteger::add),
    SUBTRACT('-', Precedence.ADDITIVE, BigInteger::subtract),
    MULTIPLY('*', Precedence.MULTIPLICATIVE, BigInteger::multiply),
    DIVIDE('/', Precedence.MULTIPLICATIVE, Operator::divide),
    POWER('^', Precedence.EXPONENTIAL, Operator::power),
    RIGHT_PAREN(')', null, null);

    private final char symbol;
    private final Precedence precedence;
    private final BinaryOperator<BigInteger> function;

    Operator(char symbol, Precedence precedence, BinaryOperator<BigInteger> function) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.function = function;
    }

    public Precedence precedence() {
        if (precedence == null) {
            throw new UnsupportedOperationException("Parenthesis has no precedence: " + symbol);
        }
        return precedence;
    }

    public boolean isParenthesis() {
        return this == LEFT_PAREN || this == RIGHT_PAREN;
    }

    /**
     * 计算 a op b。
     * @throws ArithmeticException 除零或指数非法
     */
    public BigInteger apply(BigInteger a, BigInteger b) {
        if (function == null) {
            throw new UnsupportedOperationException("Parenthesis cannot be evaluated: " + symbol);
        }
        return function.apply(a, b);
    }

    @Override
    public String lexeme() {
        return String.valueOf(symbol);
    }

    @Override
    public String toString() {
        return lexeme();
    }

    private static BigInteger divide(BigInteger a, BigInteger b) {
        if (b.signum() == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return a.divide(b);
    }

    private static BigInteger power(BigInteger a, BigInteger b) {
        if (b.signum() < 0 || b.bitLength() >= Integer.SIZE) {
            throw new ArithmeticException("Invalid exponent");
        }
        try {
            return a.pow(b.intValue());
        } catch (ArithmeticException e) {
            // 结果超出 BigInteger 的表示范围
            throw new ArithmeticException("Invalid exponent");
        }
    }
}
