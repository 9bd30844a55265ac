package org.csu.smartcalc.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 计算器的可配置项，对应 application.properties 中 {@code calculator.*}。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "calculator")
public class CalculatorProperties {

    /** 每行输入前打印的提示符，默认不打印 */
    private String prompt = "";

    /** 启动时打印一次，为空则不打印 */
    private String greeting = "";

    private String helpMessage = String.join(System.lineSeparator(),
            "The program evaluates integer expressions of any size.",
            "Operators: + - * / ^ and parentheses; a run of minus signs collapses to + or -.",
            "Assign variables with 'name = value' (letters only) and use them in expressions.",
            "Commands: /help, /exit");

    private String farewellMessage = "Bye!";

    private Shell shell = new Shell();

    @Getter
    @Setter
    public static class Shell {
        /** 关闭后 Spring 上下文启动时不会从标准输入读取 */
        private boolean enabled = true;
    }
}
