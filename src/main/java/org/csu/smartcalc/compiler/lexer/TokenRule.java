package org.csu.smartcalc.compiler.lexer;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 一条词法规则：一个锚定在当前位置的模式，加上把匹配文本构造成 Token 的函数。
 *
 * @param name        规则名，用于调试日志
 * @param pattern     编译后的模式
 * @param constructor 由匹配到的文本构造 Token
 */
public record TokenRule(String name, Pattern pattern, Function<String, Token> constructor) {

    /**
     * 除括号以外的 Token 后面必须是边界：输入结尾、括号、或 (可能隔着空白的) 单词边界。
     * 只做前瞻，不消耗字符。
     */
    static final String BOUNDARY = "(?=\\s*(?:\\b|[()]|$))";

    public static TokenRule operator(Operator operator, String regex, boolean needsBoundary) {
        return new TokenRule(operator.name(),
                Pattern.compile(needsBoundary ? regex + BOUNDARY : regex),
                text -> operator);
    }

    public static TokenRule operand(String name, String regex, Function<String, Token> constructor) {
        return new TokenRule(name, Pattern.compile(regex + BOUNDARY), constructor);
    }

    /**
     * 在 input 的 position 处尝试匹配。
     * @return 匹配到的文本，不匹配时返回 null
     */
    public String matchAt(String input, int position) {
        Matcher matcher = pattern.matcher(input);
        matcher.region(position, input.length());
        return matcher.lookingAt() ? matcher.group() : null;
    }
}
