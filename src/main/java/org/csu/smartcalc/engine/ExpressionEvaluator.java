package org.csu.smartcalc.engine;

import org.csu.smartcalc.common.exception.EvaluationException;
import org.csu.smartcalc.common.exception.SemanticException;
import org.csu.smartcalc.compiler.lexer.Lexer;
import org.csu.smartcalc.compiler.lexer.Operand;
import org.csu.smartcalc.compiler.lexer.Operator;
import org.csu.smartcalc.compiler.lexer.Token;
import org.csu.smartcalc.compiler.parser.PostfixExpression;
import org.csu.smartcalc.compiler.parser.ShuntingYardParser;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * 表达式求值器。
 * 对后缀表达式用一个值栈从左到右求值，操作数在变量环境中解析。
 */
public class ExpressionEvaluator {

    private static final Pattern NUMBER = Pattern.compile(Lexer.NUMBER_REGEX);
    private static final Pattern IDENTIFIER = Pattern.compile(Lexer.IDENTIFIER_REGEX);

    /**
     * 完整流程：词法分析 -> 转后缀 -> 求值
     */
    public static BigInteger evaluate(String expression, VariableEnvironment environment) {
        Lexer lexer = new Lexer(expression);
        ShuntingYardParser parser = new ShuntingYardParser(lexer.tokenize());
        return evaluate(parser.parse(), environment);
    }

    /**
     * @return 表达式的值
     * @throws SemanticException   引用了未定义的变量
     * @throws EvaluationException 操作数不足/有剩余，或算术错误
     */
    public static BigInteger evaluate(PostfixExpression postfix, VariableEnvironment environment) {
        Deque<BigInteger> stack = new ArrayDeque<>();
        for (Token token : postfix.tokens()) {
            if (token instanceof Operand operand) {
                stack.push(resolveOperand(operand, environment));
            } else if (token instanceof Operator operator) {
                if (stack.size() < 2) {
                    throw EvaluationException.stackUnderflow(
                            "Operator '" + operator + "' needs two operands in: " + postfix);
                }
                BigInteger b = stack.pop();
                BigInteger a = stack.pop();
                try {
                    stack.push(operator.apply(a, b));
                } catch (ArithmeticException e) {
                    throw EvaluationException.arithmeticFault(e);
                }
            }
        }
        if (stack.size() != 1) {
            throw EvaluationException.stackUnderflow(
                    stack.size() + " values left on the stack after evaluating: " + postfix);
        }
        return stack.pop();
    }

    // 常量直接返回，变量到环境中查找
    public static BigInteger resolveOperand(Operand operand, VariableEnvironment environment) {
        return operand.isIdentifier() ? environment.get(operand.name()) : operand.literal();
    }

    /**
     * 解析单个操作数文本 (赋值右侧、单独一个数字的行)，不支持完整表达式。
     * @throws SemanticException 既不是整数也不是标识符，或变量未定义
     */
    public static BigInteger resolve(String text, VariableEnvironment environment) {
        String trimmed = text.trim();
        if (NUMBER.matcher(trimmed).matches()) {
            return resolveOperand(Operand.literal(new BigInteger(trimmed)), environment);
        }
        if (IDENTIFIER.matcher(trimmed).matches()) {
            return resolveOperand(Operand.identifier(trimmed), environment);
        }
        throw SemanticException.invalidIdentifier(trimmed);
    }

    public static boolean isIdentifier(String text) {
        return IDENTIFIER.matcher(text).matches();
    }
}
