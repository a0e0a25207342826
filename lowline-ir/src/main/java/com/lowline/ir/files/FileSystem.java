package com.lowline.ir.files;

import java.io.IOException;

/**
 * 源文件提供者（include 指令通过它读取被包含的文件）
 */
@FunctionalInterface
public interface FileSystem {

    /**
     * 读取文件内容
     *
     * @throws IOException 文件不存在或无法读取
     */
    String get(String name) throws IOException;
}
