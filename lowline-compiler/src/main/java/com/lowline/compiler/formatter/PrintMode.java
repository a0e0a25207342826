package com.lowline.compiler.formatter;

/**
 * 输出空白模式
 */
public enum PrintMode {
    /** 只保留词法上必须的空格 */
    SPACELESS,
    /** 运算符两侧留空，便于阅读 */
    COMPACT
}
