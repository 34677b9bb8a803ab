package com.mini.csvtools.reader;

import com.mini.csvtools.exception.MalformedRowException;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 分隔文本记录解析器
 * 处理引号、双引号转义以及引号内的分隔符和换行；默认跳过空行
 */
public class CsvLineParser {

    private final BufferedReader reader;
    private final char delimiter;
    private final char quote;

    /** 已读取的物理行数 */
    private long lineNumber = 0;

    /** 单列文件中空行表示一个 null 值，不能跳过 */
    private boolean skipBlankLines = true;

    public CsvLineParser(BufferedReader reader, char delimiter, char quote) {
        this.reader = reader;
        this.delimiter = delimiter;
        this.quote = quote;
    }

    /**
     * 解析后的一条记录
     */
    public static class Record {
        private final List<String> fields;
        private final List<Boolean> quoted;
        private final long lineNumber;

        Record(List<String> fields, List<Boolean> quoted, long lineNumber) {
            this.fields = fields;
            this.quoted = quoted;
            this.lineNumber = lineNumber;
        }

        public List<String> getFields() {
            return fields;
        }

        public String getField(int i) {
            return fields.get(i);
        }

        /**
         * 字段是否带引号（带引号的字段不做 null 识别和类型推断）
         */
        public boolean isQuoted(int i) {
            return quoted.get(i);
        }

        public int size() {
            return fields.size();
        }

        /**
         * 记录起始的物理行号（从 1 开始）
         */
        public long getLineNumber() {
            return lineNumber;
        }
    }

    /**
     * 读取下一条记录
     *
     * @return 记录，到达文件末尾返回 null
     */
    public Record next() throws IOException {
        String line = reader.readLine();
        lineNumber++;
        while (skipBlankLines && line != null && line.isEmpty()) {
            line = reader.readLine();
            lineNumber++;
        }
        if (line == null) {
            lineNumber--;
            return null;
        }

        long startLine = lineNumber;
        List<String> fields = new ArrayList<>();
        List<Boolean> quotedFlags = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean fieldQuoted = false;

        while (true) {
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (inQuotes) {
                    if (c == quote) {
                        if (i + 1 < line.length() && line.charAt(i + 1) == quote) {
                            // 双引号转义
                            current.append(quote);
                            i++;
                        } else {
                            inQuotes = false;
                        }
                    } else {
                        current.append(c);
                    }
                } else if (c == quote && current.length() == 0 && !fieldQuoted) {
                    inQuotes = true;
                    fieldQuoted = true;
                } else if (c == delimiter) {
                    fields.add(current.toString());
                    quotedFlags.add(fieldQuoted);
                    current.setLength(0);
                    fieldQuoted = false;
                } else {
                    current.append(c);
                }
            }
            if (!inQuotes) {
                break;
            }
            // 引号内换行，继续读取下一物理行
            line = reader.readLine();
            if (line == null) {
                throw new MalformedRowException(
                        "Unterminated quoted field starting at line " + startLine, startLine, -1);
            }
            lineNumber++;
            current.append('\n');
        }

        fields.add(current.toString());
        quotedFlags.add(fieldQuoted);
        return new Record(fields, quotedFlags, startLine);
    }

    public void setSkipBlankLines(boolean skipBlankLines) {
        this.skipBlankLines = skipBlankLines;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
