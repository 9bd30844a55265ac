package org.csu.smartcalc.cli;

import org.csu.smartcalc.config.CalculatorProperties;
import org.csu.smartcalc.engine.LineProcessor;
import org.csu.smartcalc.engine.LineResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;

/**
 * 读一行、处理一行、打印结果，直到 /exit 或输入结束。
 */
public class InteractiveShell {

    private final LineProcessor processor;
    private final CalculatorProperties properties;
    private final Session session;

    public InteractiveShell(LineProcessor processor, CalculatorProperties properties, Session session) {
        this.processor = processor;
        this.properties = properties;
        this.session = session;
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        if (!properties.getGreeting().isBlank()) {
            out.println(properties.getGreeting());
        }
        while (true) {
            if (!properties.getPrompt().isEmpty()) {
                out.print(properties.getPrompt());
                out.flush();
            }
            String line = in.readLine();
            if (line == null) {
                break;
            }
            LineResult result = processor.process(line, session);
            if (result.hasOutput()) {
                out.println(result.output());
            }
            out.flush();
            if (result.exit()) {
                break;
            }
        }
        out.flush();
    }
}
