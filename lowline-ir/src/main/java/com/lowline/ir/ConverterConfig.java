package com.lowline.ir;

import com.lowline.compiler.formatter.PrintMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 转换器配置。可以直接设置，也可以从 properties 读取（未设置的键取默认值）。
 */
public class ConverterConfig {

    public static final String RESOURCE_NAME = "lowline.properties";

    private boolean useSpaces = false;
    private int maxLineLength = 70;
    private int maxLines = 20;
    private boolean shortenNames = true;
    private boolean compactBlocks = false;
    private int maxMacroInsertions = 1000;
    private int maxIncludes = 50;
    private boolean debug = false;

    public ConverterConfig() {
    }

    public ConverterConfig(Properties props) {
        this.useSpaces = Boolean.parseBoolean(props.getProperty("converter.use_spaces", "false"));
        this.maxLineLength = Integer.parseInt(props.getProperty("converter.max_line_length", "70").trim());
        this.maxLines = Integer.parseInt(props.getProperty("converter.max_lines", "20").trim());
        this.shortenNames = Boolean.parseBoolean(props.getProperty("converter.shorten_names", "true"));
        this.compactBlocks = Boolean.parseBoolean(props.getProperty("converter.compact_blocks", "false"));
        this.maxMacroInsertions = Integer.parseInt(props.getProperty("converter.max_macro_insertions", "1000").trim());
        this.maxIncludes = Integer.parseInt(props.getProperty("converter.max_includes", "50").trim());
        this.debug = Boolean.parseBoolean(props.getProperty("converter.debug", "false"));
    }

    /**
     * 从 classpath 上的 lowline.properties 加载配置，不存在时使用默认值
     */
    public static ConverterConfig load() {
        Properties props = new Properties();
        try (InputStream in = ConverterConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        return new ConverterConfig(props);
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    public PrintMode getPrintMode() {
        return useSpaces ? PrintMode.COMPACT : PrintMode.SPACELESS;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public void setMaxLineLength(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    public int getMaxLines() {
        return maxLines;
    }

    public void setMaxLines(int maxLines) {
        this.maxLines = maxLines;
    }

    public boolean isShortenNames() {
        return shortenNames;
    }

    public void setShortenNames(boolean shortenNames) {
        this.shortenNames = shortenNames;
    }

    /**
     * 单行即可容纳的 if/while 是否输出为行内形式
     */
    public boolean isCompactBlocks() {
        return compactBlocks;
    }

    public void setCompactBlocks(boolean compactBlocks) {
        this.compactBlocks = compactBlocks;
    }

    public int getMaxMacroInsertions() {
        return maxMacroInsertions;
    }

    public void setMaxMacroInsertions(int maxMacroInsertions) {
        this.maxMacroInsertions = maxMacroInsertions;
    }

    public int getMaxIncludes() {
        return maxIncludes;
    }

    public void setMaxIncludes(int maxIncludes) {
        this.maxIncludes = maxIncludes;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}
