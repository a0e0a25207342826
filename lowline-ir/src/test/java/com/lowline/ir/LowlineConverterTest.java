package com.lowline.ir;

import com.lowline.compiler.CompileException;
import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.base.LineProgram;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.ir.files.MemoryFileSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.lowline.compiler.ast.expr.BinaryOperator.*;
import static com.lowline.ir.Trees.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("转换器")
class LowlineConverterTest {

    private ConverterConfig config;
    private MemoryFileSystem files;
    private MapSourceParser parser;

    @BeforeEach
    void setUp() {
        config = new ConverterConfig();
        files = new MemoryFileSystem();
        parser = new MapSourceParser();
    }

    private LowlineConverter converter() {
        LowlineConverter converter = new LowlineConverter(config);
        converter.setParser(parser);
        return converter;
    }

    private String convert(Element... elements) throws IOException {
        LowlineConverter converter = converter();
        return converter.print(converter.convert(program(elements), files));
    }

    private static Element[] ownLines(int count) {
        Element[] lines = new Element[count];
        for (int i = 0; i < count; i++) {
            lines[i] = ownLine(inc("x"));
        }
        return lines;
    }

    @Nested
    @DisplayName("完整流程")
    class EndToEnd {

        @Test
        @DisplayName("带 break 的循环")
        void testLoopWithBreak() throws IOException {
            LowlineConverter converter = converter();
            LineProgram result = converter.convert(program(
                    line(assign("x", num(0))),
                    whileLoop(bin(ref("x"), LT, num(10)), line(inc("x")), line(brk())),
                    line(assign("y", num(1)))), files);

            assertThat(converter.print(result)).isEqualTo(
                    "b=0\n"
                            + "if b>=10 then goto 3 end b++\n"
                            + "c=1 goto 1\n");
            assertThat(converter.getVariableTranslations())
                    .containsEntry("a", "_time")
                    .containsEntry("b", "x")
                    .containsEntry("c", "y");
        }

        @Test
        @DisplayName("if/else 合并到三行")
        void testIfElse() throws IOException {
            assertThat(convert(
                    line(assign("x", ref(":input"))),
                    ifElse(bin(ref("x"), GT, num(5)),
                            Collections.<Element>singletonList(line(assign("y", num(1)))),
                            Collections.<Element>singletonList(line(assign("y", num(2))))),
                    line(assign(":out", ref("y"))))).isEqualTo(
                    "b=:input if b<=5 then goto 2 end c=1 goto 3\n"
                            + "c=2\n"
                            + ":out=c goto 1\n");
        }

        @Test
        @DisplayName("wait 折叠成一行忙等")
        void testWait() throws IOException {
            assertThat(convert(waitUntil(bin(ref("x"), GT, num(0)))))
                    .isEqualTo("if b>0 then goto 1 end goto 1\n");
        }

        @Test
        @DisplayName("常量与 include")
        void testDefinitionsAndInclude() throws IOException {
            files.put("lib", "LIB");
            parser.put("LIB", program(line(assign("y", ref("LIMIT")))));
            assertThat(convert(
                    define("LIMIT", num(5)),
                    include("lib"),
                    line(assign("x", bin(ref("limit"), MUL, num(2))))))
                    .isEqualTo("b=5 c=10 goto 1\n");
        }

        @Test
        @DisplayName("空程序得到空输出")
        void testEmptyProgram() throws IOException {
            LowlineConverter converter = converter();
            assertThat(converter.convert(program(), files).size()).isZero();
        }

        @Test
        @DisplayName("调试输出不影响结果")
        void testDebug() throws IOException {
            config.setDebug(true);
            assertThat(convert(line(assign("x", num(1))))).isEqualTo("b=1 goto 1\n");
        }
    }

    @Nested
    @DisplayName("line() 与 time()")
    class TimeTracking {

        @Test
        @DisplayName("line() 替换为行号后再次折叠")
        void testLineRefolded() throws IOException {
            assertThat(convert(line(assign("r", bin(call("line"), EQ, num(1))))))
                    .isEqualTo("a++ b=1 goto 1\n");
        }

        @Test
        @DisplayName("每行都带计数器自增")
        void testCounterOnEveryLine() throws IOException {
            assertThat(convert(line(assign("x", num(0))), ownLine(assign("r", call("line")))))
                    .isEqualTo("a++ b=0\na++ c=2 goto 1\n");
        }

        @Test
        @DisplayName("保留变量优先占用最短的名字")
        void testReservedVariable() throws IOException {
            LowlineConverter converter = converter();
            converter.convert(program(line(assign("t", call("time")))), files);
            assertThat(converter.getVariableTranslations()).containsEntry("a", "_time");
        }
    }

    @Nested
    @DisplayName("行数上限")
    class LineLimit {

        @Test
        @DisplayName("恰好 20 行时去掉最后的 goto 1")
        void testExactlyMaxLines() throws IOException {
            String output = convert(ownLines(20));
            String[] lines = output.split("\n");
            assertThat(lines).hasSize(20);
            assertThat(lines[19]).isEqualTo("b++");
        }

        @Test
        @DisplayName("多出的只有 goto 1 的一行被去掉")
        void testExtraJumpLineDropped() throws IOException {
            List<Element> elements = new ArrayList<>(Arrays.asList(ownLines(19)));
            elements.add(new StatementLine(LOC, null, Collections.singletonList(inc("x")), true, true));
            String output = convert(elements.toArray(new Element[0]));
            String[] lines = output.split("\n");
            assertThat(lines).hasSize(20);
            assertThat(lines[19]).isEqualTo("b++");
        }

        @Test
        @DisplayName("超过 20 行报错")
        void testTooLarge() {
            assertThatThrownBy(() -> convert(ownLines(21)))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("Program is too large to be compiled into 20 lines (needs 21)");
        }

        @Test
        @DisplayName("行数上限为 1 时 wait 不需要跳回")
        void testSingleLine() throws IOException {
            config.setMaxLines(1);
            assertThat(convert(waitUntil(bin(ref("x"), GT, num(0)))))
                    .isEqualTo("if b>0 then goto 1 end\n");
        }
    }

    @Nested
    @DisplayName("文件")
    class FileAccess {

        @Test
        @DisplayName("include 的文件不存在时抛出 IOException")
        void testMissingInclude() {
            assertThatThrownBy(() -> convert(include("missing.ll")))
                    .isInstanceOf(FileNotFoundException.class)
                    .hasMessageContaining("missing.ll");
        }

        @Test
        @DisplayName("没有解析器时不能转换文件")
        void testNoParser() {
            LowlineConverter converter = new LowlineConverter(config);
            assertThatThrownBy(() -> converter.convertFile("main.ll", files))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("No parser configured");
        }

        @Test
        @DisplayName("从磁盘读取并转换")
        void testConvertPath(@TempDir Path dir) throws IOException {
            Path main = dir.resolve("main.ll");
            Files.write(main, "MAIN".getBytes(StandardCharsets.UTF_8));
            Files.write(dir.resolve("lib.ll"), "LIB".getBytes(StandardCharsets.UTF_8));
            parser.put("MAIN", program(include("lib.ll"), line(assign("x", num(1)))));
            parser.put("LIB", program(line(assign("y", num(2)))));

            LowlineConverter converter = converter();
            assertThat(converter.print(converter.convertFile(main))).isEqualTo("b=2 c=1 goto 1\n");
        }
    }

    @Test
    @DisplayName("无参构造使用 classpath 上的配置")
    void testDefaultConfigLoaded() {
        ConverterConfig loaded = new LowlineConverter().getConfig();
        assertThat(loaded.getMaxMacroInsertions()).isEqualTo(500);
        assertThat(loaded.getMaxIncludes()).isEqualTo(20);
    }

    @Test
    @DisplayName("未转换过时变量对照表为空")
    void testTranslationsBeforeConvert() {
        assertThat(new LowlineConverter().getVariableTranslations()).isEmpty();
    }

    @Test
    @DisplayName("每次转换互不影响")
    void testIndependentRuns() throws IOException {
        LowlineConverter converter = converter();
        Program first = program(whileLoop(bin(ref("x"), LT, num(3)), line(inc("x"))));
        Program second = first.copy();
        String a = converter.print(converter.convert(first, files));
        String b = converter.print(converter.convert(second, files));
        assertThat(b).isEqualTo(a);
    }
}
