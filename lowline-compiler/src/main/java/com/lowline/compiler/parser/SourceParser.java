package com.lowline.compiler.parser;

import com.lowline.compiler.ast.decl.Program;

/**
 * 扩展语言解析器边界。转换器只通过此接口解析主文件和被包含的文件。
 */
@FunctionalInterface
public interface SourceParser {

    /**
     * 解析源码。
     *
     * @param source   源码文本
     * @param fileName 文件名（用于位置信息）
     * @return 扩展语言 AST
     * @throws ParseException 语法错误
     */
    Program parse(String source, String fileName);
}
