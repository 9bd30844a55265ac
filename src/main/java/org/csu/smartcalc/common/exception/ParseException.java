package org.csu.smartcalc.common.exception;

import org.csu.smartcalc.compiler.lexer.Token;

/**
 * 词法分析和中缀转后缀阶段的异常。
 */
public class ParseException extends CalculatorException {

    public ParseException(ErrorType errorType, String message) {
        super(errorType, message);
    }

    /**
     * 当前位置没有任何规则能匹配。
     * @param column 剩余串在原始输入中的起始列 (从1开始)
     * @param fragment 未能识别的剩余串
     */
    public static ParseException lexFailure(int column, String fragment) {
        return new ParseException(ErrorType.LEX_FAILURE,
                String.format("Syntax Error at column %d: no token matches '%s'", column, fragment));
    }

    public static ParseException unbalanced(Token token, int level) {
        return new ParseException(ErrorType.UNBALANCED_PARENTHESES,
                String.format("Unbalanced parentheses near '%s' (nesting level %d)", token, level));
    }

    public static ParseException unbalanced(int level) {
        return new ParseException(ErrorType.UNBALANCED_PARENTHESES,
                "Unbalanced parentheses at end of input (nesting level " + level + ")");
    }
}
