package org.csu.smartcalc.compiler.lexer;

import lombok.extern.slf4j.Slf4j;
import org.csu.smartcalc.common.exception.ParseException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 词法分析器 (Lexer/Scanner)
 *
 * 从剩余串的开头反复剥离一个 Token，直到剩余串为空。规则按固定顺序尝试：
 * 先括号，再其余运算符，最后才是操作数，保证括号和单字符运算符不会被当成操作数。
 * 任何位置都没有规则能匹配时整行作废，不返回部分结果。
 */
@Slf4j
public class Lexer {

    /** 整数常量：带可选符号的数字串 */
    public static final String NUMBER_REGEX = "[+-]?\\d+";
    /** 标识符：只由字母组成 */
    public static final String IDENTIFIER_REGEX = "[a-zA-Z]+";

    // 顺序即优先级，只用于消除重叠模式的歧义，与运算符优先级无关
    private static final List<TokenRule> RULES = List.of(
            TokenRule.operator(Operator.LEFT_PAREN, "\\(", false),
            TokenRule.operator(Operator.RIGHT_PAREN, "\\)", false),
            // 一串 '+'，或偶数个 '-' (两两抵消)；符号之间允许有空白
            TokenRule.operator(Operator.ADD, "(?:\\+(?:\\s*\\+)*|-\\s*-(?:\\s*-\\s*-)*)", true),
            // 奇数个 '-'
            TokenRule.operator(Operator.SUBTRACT, "-(?:\\s*-\\s*-)*", true),
            TokenRule.operator(Operator.MULTIPLY, "\\*", true),
            TokenRule.operator(Operator.DIVIDE, "/", true),
            TokenRule.operator(Operator.POWER, "\\^", true),
            TokenRule.operand("NUMBER", NUMBER_REGEX, text -> Operand.literal(new BigInteger(text))),
            TokenRule.operand("IDENTIFIER", IDENTIFIER_REGEX, Operand::identifier)
    );

    private final String input;
    private int position = 0; // 剩余串在 input 中的起始位置

    public Lexer(String input) {
        this.input = input;
        skipWhitespace();
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表
     * @throws ParseException 某个位置没有规则能匹配
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(nextToken());
        }
        return tokens;
    }

    public boolean hasNext() {
        return position < input.length();
    }

    /**
     * 剥离剩余串开头的一个 Token，并去掉其后的空白。
     */
    public Token nextToken() {
        if (log.isDebugEnabled()) {
            log.debug("Remainder: {}", input.substring(position));
        }
        for (TokenRule rule : RULES) {
            String matched = rule.matchAt(input, position);
            if (matched != null) {
                Token token = rule.constructor().apply(matched);
                log.debug("{}: {}", rule.name(), token);
                position += matched.length();
                skipWhitespace();
                return token;
            }
        }
        throw ParseException.lexFailure(position + 1, input.substring(position));
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }
}
