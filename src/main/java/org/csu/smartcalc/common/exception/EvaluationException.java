package org.csu.smartcalc.common.exception;

/**
 * 后缀表达式求值阶段的异常：栈下溢，或除零、非法指数等算术错误。
 */
public class EvaluationException extends CalculatorException {

    public EvaluationException(ErrorType errorType, String message) {
        super(errorType, message);
    }

    public EvaluationException(ErrorType errorType, String message, Throwable cause) {
        super(errorType, message, cause);
    }

    public static EvaluationException stackUnderflow(String detail) {
        return new EvaluationException(ErrorType.STACK_UNDERFLOW, detail);
    }

    public static EvaluationException arithmeticFault(ArithmeticException cause) {
        return new EvaluationException(ErrorType.ARITHMETIC_FAULT, cause.getMessage(), cause);
    }

    /**
     * 算术错误直接把具体原因 (例如 "Division by zero") 告诉用户。
     */
    @Override
    public String getUserMessage() {
        if (getErrorType() == ErrorType.ARITHMETIC_FAULT && getMessage() != null) {
            return getMessage();
        }
        return super.getUserMessage();
    }
}
