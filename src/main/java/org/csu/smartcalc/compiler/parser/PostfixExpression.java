package org.csu.smartcalc.compiler.parser;

import org.csu.smartcalc.compiler.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 后缀 (逆波兰) 形式的表达式，不含括号。
 */
public record PostfixExpression(List<Token> tokens) {

    public PostfixExpression {
        tokens = List.copyOf(tokens);
    }

    @Override
    public String toString() {
        return tokens.stream().map(Token::lexeme).collect(Collectors.joining(" "));
    }
}
