package org.csu.smartcalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.csu.smartcalc.common.exception.SemanticException;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * 处理 {@code 标识符 = 右值} 形式的赋值命令。
 *
 * 右值只能是单个整数常量或已定义的变量。任何一步失败都不修改变量环境。
 */
@Slf4j
public class AssignmentHandler {

    private static final Pattern ASSIGN = Pattern.compile("\\s*=\\s*");

    /**
     * @return 赋给变量的值
     * @throws SemanticException 左侧不是合法标识符，或右值无法解析
     */
    public static BigInteger assign(String line, VariableEnvironment environment) {
        String[] parts = ASSIGN.split(line, 2);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Not an assignment: " + line);
        }
        String name = parts[0].trim();
        if (!ExpressionEvaluator.isIdentifier(name)) {
            throw SemanticException.invalidIdentifier(name);
        }
        BigInteger value = ExpressionEvaluator.resolve(parts[1], environment);
        environment.assign(name, value);
        log.debug("Assigned {} = {}", name, value);
        return value;
    }
}
