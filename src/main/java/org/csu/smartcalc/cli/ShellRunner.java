package org.csu.smartcalc.cli;

import org.csu.smartcalc.config.CalculatorProperties;
import org.csu.smartcalc.engine.LineProcessor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * 应用启动后在标准输入/输出上运行交互式计算器。
 */
@Component
@ConditionalOnProperty(prefix = "calculator.shell", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ShellRunner implements CommandLineRunner {

    private final LineProcessor processor;
    private final CalculatorProperties properties;

    public ShellRunner(LineProcessor processor, CalculatorProperties properties) {
        this.processor = processor;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws Exception {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(System.out, true);
        new InteractiveShell(processor, properties, new Session()).run(in, out);
    }
}
