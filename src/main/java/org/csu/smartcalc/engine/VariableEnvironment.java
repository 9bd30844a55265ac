package org.csu.smartcalc.engine;

import org.csu.smartcalc.common.exception.SemanticException;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 变量环境：变量名到大整数的映射。
 *
 * 由会话持有并显式传给求值器和赋值处理器。变量第一次赋值成功时创建，之后只会被覆盖，不会被删除。
 * 只在单线程中使用。
 */
public class VariableEnvironment {

    private final Map<String, BigInteger> variables = new TreeMap<>();

    /**
     * @throws SemanticException 变量未定义
     */
    public BigInteger get(String name) {
        BigInteger value = variables.get(name);
        if (value == null) {
            throw SemanticException.unknownVariable(name);
        }
        return value;
    }

    public void assign(String name, BigInteger value) {
        variables.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
    }

    public int size() {
        return variables.size();
    }

    /**
     * @return 按变量名排序的只读视图
     */
    public Map<String, BigInteger> asMap() {
        return Collections.unmodifiableMap(variables);
    }
}
