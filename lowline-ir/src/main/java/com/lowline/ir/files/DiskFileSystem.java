package com.lowline.ir.files;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从磁盘读取文件，相对路径以给定目录为基准
 */
public class DiskFileSystem implements FileSystem {

    private final Path dir;

    public DiskFileSystem(Path dir) {
        this.dir = dir;
    }

    @Override
    public String get(String name) throws IOException {
        Path path = dir.resolve(name);
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }
}
