package org.csu.smartcalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.csu.smartcalc.cli.InputType;
import org.csu.smartcalc.cli.Session;
import org.csu.smartcalc.common.exception.CalculatorException;
import org.csu.smartcalc.config.CalculatorProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * 对一行输入分类并分派：命令、赋值、单个数字或表达式。
 *
 * 所有错误只影响当前行，转成一条提示信息返回。
 */
@Slf4j
@Component
public class LineProcessor {

    private final CalculatorProperties properties;

    public LineProcessor(CalculatorProperties properties) {
        this.properties = properties;
    }

    public LineResult process(String rawLine, Session session) {
        String line = rawLine.trim();
        InputType type = InputType.classify(line);
        log.debug("Line '{}' classified as {}", line, type);
        try {
            return switch (type) {
                case HELP -> LineResult.output(properties.getHelpMessage());
                case EXIT -> LineResult.exit(properties.getFarewellMessage());
                case ASSIGNMENT -> {
                    AssignmentHandler.assign(line, session.getEnvironment());
                    yield LineResult.silent();
                }
                case SINGLE_NUMBER -> LineResult.output(
                        ExpressionEvaluator.resolve(line, session.getEnvironment()).toString());
                case EMPTY_LINE -> LineResult.silent();
                case EXPRESSION -> {
                    BigInteger result = ExpressionEvaluator.evaluate(line, session.getEnvironment());
                    yield LineResult.output(result.toString());
                }
                case UNKNOWN_COMMAND -> LineResult.output("Unknown command");
            };
        } catch (CalculatorException e) {
            log.debug("{} on line '{}': {}", e.getErrorType(), line, e.getMessage());
            return LineResult.output(e.getUserMessage());
        }
    }
}
