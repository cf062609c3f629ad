package com.pipeline.cachingdb.core;

import java.util.Locale;

/**
 * 驱动占位符风格（沿用DB-API的paramstyle命名）。
 *
 * 查询模板中以 {@value #MARKER} 标记参数位置，执行前替换为当前后端的占位符，
 * 使同一条模板可以同时用于缓存库和远程库。
 */
public enum ParamStyle {
    QMARK("qmark", "?"),
    NUMERIC("numeric", null),
    NAMED("named", null),
    FORMAT("format", "%s"),
    PYFORMAT("pyformat", "%s");

    /** 模板中的占位符标记 */
    public static final String MARKER = "{ps}";

    private final String conventionName;
    private final String symbol;

    ParamStyle(String conventionName, String symbol) {
        this.conventionName = conventionName;
        this.symbol = symbol;
    }

    public String getConventionName() {
        return conventionName;
    }

    /**
     * @throws CachingDbException UNSUPPORTED_PARAM_STYLE，该风格没有可替换的单一占位符
     */
    public String symbol() {
        if (symbol == null) {
            throw new CachingDbException(ErrorKind.UNSUPPORTED_PARAM_STYLE,
                    "Unsupported paramstyle " + conventionName);
        }
        return symbol;
    }

    /**
     * 根据驱动报告的风格名解析占位符。
     *
     * @param convention 风格名，如 "qmark"、"format"
     * @return "?" 或 "%s"
     * @throws CachingDbException UNSUPPORTED_PARAM_STYLE
     */
    public static String resolveSymbol(String convention) {
        if (convention != null) {
            String normalized = convention.trim().toLowerCase(Locale.ROOT);
            for (ParamStyle style : values()) {
                if (style.conventionName.equals(normalized)) {
                    return style.symbol();
                }
            }
        }
        throw new CachingDbException(ErrorKind.UNSUPPORTED_PARAM_STYLE,
                "Unsupported paramstyle " + convention);
    }

    /** 把模板中所有占位符标记替换为给定符号 */
    public static String substitute(String template, String symbol) {
        return template.replace(MARKER, symbol);
    }
}
