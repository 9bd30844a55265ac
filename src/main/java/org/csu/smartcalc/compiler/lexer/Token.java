package org.csu.smartcalc.compiler.lexer;

/**
 * 词法单元：要么是操作数 ({@link Operand})，要么是运算符 ({@link Operator})。
 */
public interface Token {

    /**
     * @return 用于打印后缀表达式和调试日志的文本
     */
    String lexeme();
}
