package com.mini.csvtools.options;

import com.mini.csvtools.exception.ConfigurationException;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * 分隔文本格式选项
 */
public class CsvOptions {

    /** 字段分隔符，默认逗号 */
    private final char delimiter;

    /** 引号字符，默认双引号 */
    private final char quote;

    /** 表示 null 的文本，默认空串 */
    private final String nullValue;

    private final Charset charset;

    /** 严格模式：字段数与表头不一致时报错；宽松模式下补齐或截断 */
    private final boolean strictRows;

    /** 是否把未加引号的整数/小数解析为 Long/Double */
    private final boolean inferTypes;

    public CsvOptions() {
        this(',', '"', "", StandardCharsets.UTF_8, true, false);
    }

    public CsvOptions(char delimiter, char quote, String nullValue, Charset charset,
                      boolean strictRows, boolean inferTypes) {
        this.delimiter = delimiter;
        this.quote = quote;
        this.nullValue = nullValue;
        this.charset = charset;
        this.strictRows = strictRows;
        this.inferTypes = inferTypes;
    }

    public static CsvOptions defaults() {
        return new CsvOptions();
    }

    public char getDelimiter() {
        return delimiter;
    }

    public char getQuote() {
        return quote;
    }

    public String getNullValue() {
        return nullValue;
    }

    public Charset getCharset() {
        return charset;
    }

    public boolean isStrictRows() {
        return strictRows;
    }

    public boolean isInferTypes() {
        return inferTypes;
    }

    public Builder toBuilder() {
        return new Builder()
                .delimiter(delimiter)
                .quote(quote)
                .nullValue(nullValue)
                .charset(charset)
                .strictRows(strictRows)
                .inferTypes(inferTypes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private char delimiter = ',';
        private char quote = '"';
        private String nullValue = "";
        private Charset charset = StandardCharsets.UTF_8;
        private boolean strictRows = true;
        private boolean inferTypes = false;

        public Builder delimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder quote(char quote) {
            this.quote = quote;
            return this;
        }

        public Builder nullValue(String nullValue) {
            this.nullValue = nullValue;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder strictRows(boolean strictRows) {
            this.strictRows = strictRows;
            return this;
        }

        public Builder inferTypes(boolean inferTypes) {
            this.inferTypes = inferTypes;
            return this;
        }

        public CsvOptions build() {
            if (delimiter == quote) {
                throw new ConfigurationException("Delimiter and quote character must differ: '" + delimiter + "'");
            }
            if (delimiter == '\n' || delimiter == '\r' || quote == '\n' || quote == '\r') {
                throw new ConfigurationException("Line breaks cannot be used as delimiter or quote");
            }
            if (nullValue == null) {
                throw new ConfigurationException("Null representation cannot be null");
            }
            if (charset == null) {
                throw new ConfigurationException("Charset cannot be null");
            }
            return new CsvOptions(delimiter, quote, nullValue, charset, strictRows, inferTypes);
        }
    }

    @Override
    public String toString() {
        return "CsvOptions{" +
                "delimiter='" + delimiter + '\'' +
                ", quote='" + quote + '\'' +
                ", nullValue='" + nullValue + '\'' +
                ", charset=" + charset +
                ", strictRows=" + strictRows +
                ", inferTypes=" + inferTypes +
                '}';
    }
}
