package dev.chi.tui.watchdog.spawn;

import java.util.ArrayList;
import java.util.List;

/**
 * 按 POSIX shell 的引号规则切分命令行（不是 shell：不做管道/重定向/通配符）。
 * <ul>
 *     <li>空白分隔参数</li>
 *     <li>单引号内原样保留</li>
 *     <li>双引号内仅 \" \\ \$ \` 可转义</li>
 *     <li>引号外反斜杠转义下一个字符</li>
 * </ul>
 */
public final class CommandLineSplitter {

    private CommandLineSplitter() {
    }

    /**
     * @throws IllegalArgumentException on an unterminated quote or a trailing backslash
     */
    public static List<String> split(String line) {
        List<String> out = new ArrayList<>();
        if (line == null) return out;

        StringBuilder cur = new StringBuilder();
        boolean inToken = false;
        int i = 0;
        int n = line.length();
        while (i < n) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inToken) {
                    out.add(cur.toString());
                    cur.setLength(0);
                    inToken = false;
                }
                i++;
            } else if (c == '\'') {
                int end = line.indexOf('\'', i + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("unterminated single quote");
                }
                cur.append(line, i + 1, end);
                inToken = true;
                i = end + 1;
            } else if (c == '"') {
                i++;
                boolean closed = false;
                while (i < n) {
                    char d = line.charAt(i);
                    if (d == '"') {
                        closed = true;
                        i++;
                        break;
                    }
                    if (d == '\\' && i + 1 < n && "\"\\$`".indexOf(line.charAt(i + 1)) >= 0) {
                        cur.append(line.charAt(i + 1));
                        i += 2;
                        continue;
                    }
                    cur.append(d);
                    i++;
                }
                if (!closed) {
                    throw new IllegalArgumentException("unterminated double quote");
                }
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= n) {
                    throw new IllegalArgumentException("trailing backslash");
                }
                cur.append(line.charAt(i + 1));
                inToken = true;
                i += 2;
            } else {
                cur.append(c);
                inToken = true;
                i++;
            }
        }
        if (inToken) {
            out.add(cur.toString());
        }
        return out;
    }
}
