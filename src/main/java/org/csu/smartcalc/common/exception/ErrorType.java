package org.csu.smartcalc.common.exception;

/**
 * 单行处理中可能出现的错误种类，以及打印给用户的提示信息。
 */
public enum ErrorType {
    LEX_FAILURE("Invalid expression"),             // 当前位置没有任何词法规则能匹配
    UNBALANCED_PARENTHESES("Invalid expression"),  // 括号不配对
    STACK_UNDERFLOW("Invalid expression"),         // 后缀表达式求值时操作数不足或有剩余
    UNKNOWN_IDENTIFIER("Unknown variable"),
    INVALID_IDENTIFIER("Invalid identifier"),
    ARITHMETIC_FAULT("Arithmetic error");          // 除零、非法指数，具体信息见异常 message

    private final String userMessage;

    ErrorType(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
