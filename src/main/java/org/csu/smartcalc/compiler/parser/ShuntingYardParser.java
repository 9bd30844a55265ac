package org.csu.smartcalc.compiler.parser;

import lombok.extern.slf4j.Slf4j;
import org.csu.smartcalc.common.exception.ParseException;
import org.csu.smartcalc.compiler.lexer.Operand;
import org.csu.smartcalc.compiler.lexer.Operator;
import org.csu.smartcalc.compiler.lexer.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 调度场算法：把中缀 Token 序列转换为后缀形式，同时检查括号是否配对。
 *
 * 使用一个运算符栈和一个嵌套层数计数器。每处理一个 Token 都检查层数，
 * 层数为负立即中止；全部处理完后层数必须恰好回到 0。
 */
@Slf4j
public class ShuntingYardParser {

    private final List<Token> tokens;
    private final Deque<Operator> operators = new ArrayDeque<>();
    private final List<Token> output = new ArrayList<>();
    private int level = 0;

    public ShuntingYardParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * @return 后缀表达式
     * @throws ParseException 括号不配对
     */
    public PostfixExpression parse() {
        for (Token token : tokens) {
            if (token instanceof Operand operand) {
                output.add(operand);
            } else if (token instanceof Operator operator) {
                acceptOperator(operator);
            } else {
                throw new IllegalStateException("Unsupported token type: " + token.getClass().getSimpleName());
            }
            if (level < 0) {
                throw ParseException.unbalanced(token, level);
            }
            log.debug("Operators: {}", operators);
        }
        if (level != 0) {
            throw ParseException.unbalanced(level);
        }
        while (!operators.isEmpty()) {
            output.add(operators.pop());
        }
        PostfixExpression postfix = new PostfixExpression(output);
        log.debug("PostFix: {}", postfix);
        return postfix;
    }

    private void acceptOperator(Operator operator) {
        switch (operator) {
            case LEFT_PAREN -> {
                operators.push(operator);
                level++;
            }
            case RIGHT_PAREN -> {
                level--;
                while (!operators.isEmpty() && operators.peek() != Operator.LEFT_PAREN) {
                    output.add(operators.pop());
                }
                if (operators.isEmpty()) {
                    // 没有对应的 '('
                    throw ParseException.unbalanced(operator, level);
                }
                operators.pop();
            }
            default -> {
                while (!operators.isEmpty()
                        && !operators.peek().isParenthesis()
                        && operators.peek().precedence().bindsAtLeastAsTightAs(operator.precedence())) {
                    output.add(operators.pop());
                }
                operators.push(operator);
            }
        }
    }
}
