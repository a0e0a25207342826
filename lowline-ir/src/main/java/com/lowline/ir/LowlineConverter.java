package com.lowline.ir;

import com.lowline.compiler.ast.base.LineProgram;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.formatter.LinePrinter;
import com.lowline.compiler.parser.SourceParser;
import com.lowline.ir.files.DiskFileSystem;
import com.lowline.ir.files.FileSystem;
import com.lowline.ir.pass.PassPipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 转换器门面。
 * 管线：扩展语言 AST → 结构降级 → 标签解析与行合并 → 基础语言行程序。
 * 每次转换使用新的 {@link ConversionContext}，实例本身可以重复使用。
 */
public class LowlineConverter {

    private static final Logger LOG = Logger.getLogger(LowlineConverter.class.getName());

    private final ConverterConfig config;
    private final PassPipeline pipeline;
    private SourceParser parser;
    private ConversionContext lastContext;

    public LowlineConverter() {
        this(ConverterConfig.load());
    }

    public LowlineConverter(ConverterConfig config) {
        this(config, PassPipeline.createDefault());
    }

    public LowlineConverter(ConverterConfig config, PassPipeline pipeline) {
        this.config = config;
        this.pipeline = pipeline;
    }

    public ConverterConfig getConfig() {
        return config;
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    /**
     * 设置解析器（include 与 {@link #convertFile} 需要）
     */
    public void setParser(SourceParser parser) {
        this.parser = parser;
    }

    /**
     * 转换已解析的程序。程序树在转换过程中被就地修改。
     *
     * @param program 扩展语言程序
     * @param files   include 使用的文件系统，可以为 null
     * @return 基础语言程序
     * @throws IOException include 的文件无法读取
     */
    public LineProgram convert(Program program, FileSystem files) throws IOException {
        ConversionContext ctx = new ConversionContext(config, files, parser);
        lastContext = ctx;
        try {
            LineProgram result = pipeline.execute(program, ctx);
            LOG.fine("Converted " + program.getLocation().getFile() + " into " + result.size() + " line(s)");
            return result;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * 读取、解析并转换文件
     */
    public LineProgram convertFile(String mainFile, FileSystem files) throws IOException {
        if (parser == null) {
            throw new IllegalStateException("No parser configured");
        }
        String source = files.get(mainFile);
        return convert(parser.parse(source, mainFile), files);
    }

    /**
     * 转换磁盘上的文件，include 相对于该文件所在目录
     */
    public LineProgram convertFile(Path file) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        return convertFile(file.getFileName().toString(), new DiskFileSystem(dir));
    }

    /**
     * 上一次转换的变量短名 → 原名
     */
    public Map<String, String> getVariableTranslations() {
        if (lastContext == null) {
            return Collections.emptyMap();
        }
        return lastContext.getVariableTranslations();
    }

    /**
     * 按配置的输出模式打印
     */
    public String print(LineProgram program) {
        return new LinePrinter(config.getPrintMode()).print(program);
    }
}
