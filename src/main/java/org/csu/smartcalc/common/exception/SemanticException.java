package org.csu.smartcalc.common.exception;

/**
 * 变量相关的错误：引用了未定义的变量，或赋值左侧不是合法标识符。
 */
public class SemanticException extends CalculatorException {

    public SemanticException(ErrorType errorType, String message) {
        super(errorType, message);
    }

    public static SemanticException unknownVariable(String name) {
        return new SemanticException(ErrorType.UNKNOWN_IDENTIFIER, "Variable '" + name + "' is not defined.");
    }

    public static SemanticException invalidIdentifier(String text) {
        return new SemanticException(ErrorType.INVALID_IDENTIFIER, "'" + text + "' is not a valid identifier.");
    }
}
