package org.csu.smartcalc.common.exception;

/**
 * 计算器所有错误的基类。
 *
 * 每个错误只影响当前输入行：由 LineProcessor 捕获后打印 {@link #getUserMessage()}，然后继续读下一行。
 */
public abstract class CalculatorException extends RuntimeException {

    private final ErrorType errorType;

    protected CalculatorException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected CalculatorException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * 打印给用户的单行提示。
     */
    public String getUserMessage() {
        return errorType.getUserMessage();
    }
}
