package com.lowline.ir.files;

import java.io.FileNotFoundException;
import java.util.HashMap;
import java.util.Map;

/**
 * 内存中的文件集合（测试、编辑器集成等不落盘的场景）
 */
public class MemoryFileSystem implements FileSystem {

    private final Map<String, String> files = new HashMap<>();

    public MemoryFileSystem() {
    }

    public MemoryFileSystem(Map<String, String> files) {
        this.files.putAll(files);
    }

    public MemoryFileSystem put(String name, String content) {
        files.put(name, content);
        return this;
    }

    @Override
    public String get(String name) throws FileNotFoundException {
        String content = files.get(name);
        if (content == null) {
            throw new FileNotFoundException("File not found: " + name);
        }
        return content;
    }
}
