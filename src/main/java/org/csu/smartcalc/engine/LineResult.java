package org.csu.smartcalc.engine;

/**
 * 处理一行输入的结果。
 *
 * @param output 要打印的文本，为 null 表示不打印
 * @param exit   是否结束会话
 */
public record LineResult(String output, boolean exit) {

    public static LineResult output(String output) {
        return new LineResult(output, false);
    }

    public static LineResult silent() {
        return new LineResult(null, false);
    }

    public static LineResult exit(String farewell) {
        return new LineResult(farewell, true);
    }

    public boolean hasOutput() {
        return output != null;
    }
}
