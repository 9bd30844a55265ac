package org.csu.smartcalc.cli;

import java.util.regex.Pattern;

/**
 * 输入行的分类，按声明顺序依次匹配 (输入已去掉首尾空白)。
 */
public enum InputType {
    HELP("/help"),
    EXIT("/exit"),
    ASSIGNMENT("\\w+\\s*=.*"),
    SINGLE_NUMBER("[+-]?\\d+"),
    EMPTY_LINE("\\s*"),
    EXPRESSION("[^/].*"),
    UNKNOWN_COMMAND(".*");

    private final Pattern pattern;

    InputType(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    public static InputType classify(String line) {
        for (InputType type : values()) {
            if (type.pattern.matcher(line).matches()) {
                return type;
            }
        }
        return UNKNOWN_COMMAND;
    }
}
