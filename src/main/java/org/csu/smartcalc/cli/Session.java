package org.csu.smartcalc.cli;

import lombok.Getter;
import org.csu.smartcalc.engine.VariableEnvironment;

import java.math.BigInteger;
import java.util.Map;

/**
 * 代表一次交互会话，持有本次会话的变量环境。
 */
@Getter
public class Session {
    private final VariableEnvironment environment;

    public Session() {
        this(new VariableEnvironment());
    }

    public Session(VariableEnvironment environment) {
        this.environment = environment;
    }

    /**
     * @return 已定义变量的只读视图，按变量名排序
     */
    public Map<String, BigInteger> getVariables() {
        return environment.asMap();
    }
}
