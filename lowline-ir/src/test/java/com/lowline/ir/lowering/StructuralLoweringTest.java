package com.lowline.ir.lowering;

import com.lowline.compiler.CompileException;
import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.block.StructuredIf;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.stmt.GoToStatement;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.ConverterConfig;
import com.lowline.ir.MapSourceParser;
import com.lowline.ir.files.MemoryFileSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.lowline.compiler.ast.expr.BinaryOperator.*;
import static com.lowline.ir.Trees.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("结构降级")
class StructuralLoweringTest {

    private ConverterConfig config;
    private MemoryFileSystem files;
    private MapSourceParser parser;
    private ConversionContext ctx;

    @BeforeEach
    void setUp() {
        config = new ConverterConfig();
        config.setShortenNames(false);
        files = new MemoryFileSystem();
        parser = new MapSourceParser();
    }

    private List<String> lower(Element... elements) {
        ctx = new ConversionContext(config, files, parser);
        Program program = program(elements);
        new StructuralLowering().run(program, ctx);
        return dump(program);
    }

    private static List<Element> block(Element... elements) {
        return Arrays.asList(elements);
    }

    @Nested
    @DisplayName("while / break / continue")
    class Loops {

        @Test
        @DisplayName("含 break 的 while：头标签、取反跳转、跳到结尾、跳回头部、尾标签")
        void testWhileWithBreak() {
            assertThat(lower(whileLoop(bin(ref("x"), LT, num(10)), line(brk())))).containsExactly(
                    "$while1: if x>=10 then goto $endwhile1 end",
                    "goto $endwhile1",
                    "goto $while1",
                    "$endwhile1:");
            assertThat(ctx.currentLoop()).isEqualTo(-1);
        }

        @Test
        @DisplayName("continue 跳回循环头部")
        void testContinue() {
            assertThat(lower(whileLoop(bin(ref("x"), LT, num(10)), line(inc("x")), line(cont()))))
                    .containsExactly(
                            "$while1: if x>=10 then goto $endwhile1 end",
                            "x++",
                            "goto $while1",
                            "goto $while1",
                            "$endwhile1:");
        }

        @Test
        @DisplayName("break 只跳出最内层循环")
        void testNestedLoops() {
            assertThat(lower(whileLoop(bin(ref("x"), LT, num(1)),
                    whileLoop(bin(ref("y"), LT, num(1)), line(brk())),
                    line(brk())))).containsExactly(
                    "$while1: if x>=1 then goto $endwhile1 end",
                    "$while2: if y>=1 then goto $endwhile2 end",
                    "goto $endwhile2",
                    "goto $while2",
                    "$endwhile2:",
                    "goto $endwhile1",
                    "goto $while1",
                    "$endwhile1:");
        }

        @Test
        @DisplayName("恒真条件不生成退出跳转")
        void testInfiniteLoop() {
            assertThat(lower(whileLoop(num(1), line(inc("x"))))).containsExactly(
                    "$while1:", "x++", "goto $while1", "$endwhile1:");
        }

        @Test
        @DisplayName("循环外的 break/continue 是结构性错误")
        void testOutsideLoop() {
            assertThatThrownBy(() -> lower(line(brk())))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("break is only allowed inside a loop");
            assertThatThrownBy(() -> lower(line(cont())))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("continue is only allowed inside a loop");
        }
    }

    @Nested
    @DisplayName("if / elseif / else")
    class Conditionals {

        @Test
        @DisplayName("单分支：条件取反后跳到结尾")
        void testIfThen() {
            assertThat(lower(ifThen(bin(ref("x"), GT, num(1)), line(assign("y", num(1))))))
                    .containsExactly("if x<=1 then goto $endif1 end", "y=1", "$endif1:");
        }

        @Test
        @DisplayName("多分支展开为平坦的跳转序列")
        void testElseIfChain() {
            StructuredIf chain = new StructuredIf(LOC,
                    Arrays.asList(bin(ref("x"), EQ, num(1)), bin(ref("x"), EQ, num(2))),
                    Arrays.asList(block(line(assign("y", num(1)))), block(line(assign("y", num(2))))),
                    block(line(assign("y", num(3)))));
            assertThat(lower(chain)).containsExactly(
                    "if x!=1 then goto $if1_0 end",
                    "y=1",
                    "goto $endif1",
                    "$if1_0:",
                    "if x!=2 then goto $if1_1 end",
                    "y=2",
                    "goto $endif1",
                    "$if1_1:",
                    "y=3",
                    "$endif1:");
        }

        @Test
        @DisplayName("嵌套 if 各自使用独立的编号")
        void testNestedIf() {
            List<String> lines = lower(ifThen(ref("a"), ifThen(ref("b"), line(assign("c", num(1))))));
            assertThat(lines).containsExactly(
                    "if not a then goto $endif2 end",
                    "if not b then goto $endif1 end",
                    "c=1",
                    "$endif1:",
                    "$endif2:");
        }
    }

    @Test
    @DisplayName("wait 展开为 4 个元素、2 个标签的忙等")
    void testWait() {
        assertThat(lower(waitUntil(bin(ref("x"), GT, num(0))))).containsExactly(
                "$wait1:",
                "if x>0 then goto $endwait1 end",
                "goto $wait1",
                "$endwait1:");
    }

    @Nested
    @DisplayName("常量定义")
    class Definitions {

        @Test
        @DisplayName("引用替换为常量值并折叠")
        void testConstant() {
            assertThat(lower(define("LIMIT", num(5)), line(assign("x", bin(ref("limit"), MUL, num(2))))))
                    .containsExactly("x=10");
        }

        @Test
        @DisplayName("变量别名可以赋值和自增")
        void testAlias() {
            assertThat(lower(define("door", ref(":Door")), line(assign("DOOR", num(1))), line(inc("door"))))
                    .containsExactly(":door=1", ":door++");
        }

        @Test
        @DisplayName("不能给常量赋值或自增")
        void testAssignToConstant() {
            assertThatThrownBy(() -> lower(define("k", num(3)), line(assign("k", num(4)))))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("Can not assign to the constant 'k'");
            assertThatThrownBy(() -> lower(define("k", num(3)), line(inc("k"))))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("Can not increment or decrement the constant 'k'");
        }

        @Test
        @DisplayName("同名定义覆盖之前的值")
        void testRedefinition() {
            assertThat(lower(define("k", num(3)), line(assign("x", ref("k"))),
                    define("K", num(4)), line(assign("y", ref("k")))))
                    .containsExactly("x=3", "y=4");
        }
    }

    @Nested
    @DisplayName("宏")
    class Macros {

        @Test
        @DisplayName("连续调用两次：标签各自独立，调用栈最终为空")
        void testTwoInsertions() {
            List<String> lines = lower(
                    macro("bump", Collections.singletonList("v"),
                            line("top", inc("v")),
                            line(jumpIf(bin(ref("v"), LT, num(3)), "top"))),
                    insert(5, "bump", ref("x")),
                    insert(6, "bump", ref("y")));

            assertThat(lines).containsExactly(
                    "top$1: x++",
                    "if x<3 then goto top$1 end",
                    "top$2: y++",
                    "if y<3 then goto top$2 end");
            assertThat(ctx.getMacroStack()).isEmpty();
            assertThat(ctx.getMacroInsertions()).isEqualTo(2);
        }

        @Test
        @DisplayName("宏体内含常量定义时可以多次展开")
        void testDefinitionInsideMacro() {
            List<String> lines = lower(
                    macro("m", Collections.singletonList("v"),
                            define("k", num(3)),
                            line(assign("v", ref("k")))),
                    insert(5, "m", ref("x")),
                    insert(6, "m", ref("y")));

            assertThat(lines).containsExactly("x=3", "y=3");
            assertThat(ctx.getMacroStack()).isEmpty();
        }

        @Test
        @DisplayName("宏体内含宏定义时可以多次展开")
        void testMacroInsideMacro() {
            List<String> lines = lower(
                    macro("outer", Collections.<String>emptyList(),
                            macro("inner", Collections.<String>emptyList(), line(inc("z"))),
                            insert(2, "inner")),
                    insert(5, "outer"),
                    insert(6, "outer"));

            assertThat(lines).containsExactly("z++", "z++");
            assertThat(ctx.getMacroInsertions()).isEqualTo(4);
        }

        @Test
        @DisplayName("宏体内的循环每次展开得到新的编号")
        void testGeneratedLabelsPerInsertion() {
            List<String> lines = lower(
                    macro("spin", Collections.<String>emptyList(), whileLoop(bin(ref("x"), LT, num(3)), line(inc("x")))),
                    insert(1, "spin"),
                    insert(2, "spin"));

            assertThat(lines).contains("$while1: if x>=3 then goto $endwhile1 end", "$endwhile1:",
                    "$while2: if x>=3 then goto $endwhile2 end", "$endwhile2:");
        }

        @Test
        @DisplayName("形参可以作为赋值目标")
        void testAssignmentTarget() {
            assertThat(lower(
                    macro("set", Arrays.asList("target", "value"), line(assign("target", ref("value")))),
                    insert(1, "set", ref("y"), num(4)))).containsExactly("y=4");
        }

        @Test
        @DisplayName("赋值目标的实参必须是变量")
        void testAssignmentTargetNotVariable() {
            assertThatThrownBy(() -> lower(
                    macro("set", Arrays.asList("target", "value"), line(assign("target", ref("value")))),
                    insert(1, "set", num(1), num(2))))
                    .isInstanceOf(CompileException.class)
                    .hasMessageContaining("must be a variable to be assigned to");
        }

        @Test
        @DisplayName("宏内的 break 跳出调用处所在的循环")
        void testBreakInsideMacro() {
            List<String> lines = lower(
                    macro("leave", Collections.<String>emptyList(), line(brk())),
                    whileLoop(bin(ref("x"), LT, num(1)), insert(2, "leave")));
            assertThat(lines).contains("goto $endwhile1");
        }

        @Test
        @DisplayName("未知宏与参数个数不符")
        void testUnknownAndArity() {
            assertThatThrownBy(() -> lower(insert(1, "nope")))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("Unknown macro 'nope'");
            assertThatThrownBy(() -> lower(
                    macro("one", Collections.singletonList("a"), line(inc("a"))),
                    insert(1, "one")))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("Macro 'one' expects 1 argument(s), got 0");
        }

        @Test
        @DisplayName("递归宏超过展开上限")
        void testRecursion() {
            config.setMaxMacroInsertions(10);
            assertThatThrownBy(() -> lower(
                    macro("loop", Collections.<String>emptyList(), insert(3, "loop")),
                    insert(1, "loop")))
                    .isInstanceOf(CompileException.class)
                    .hasMessageContaining("Too many macro insertions (limit 10)");
        }

        @Test
        @DisplayName("宏内的错误附带宏调用栈")
        void testErrorTrace() {
            assertThatThrownBy(() -> lower(
                    macro("inner", Collections.<String>emptyList(), line(brk())),
                    macro("outer", Collections.<String>emptyList(), insert(3, "inner")),
                    insert(9, "outer")))
                    .isInstanceOf(CompileException.class)
                    .satisfies(e -> assertThat(((CompileException) e).getRawMessage())
                            .isEqualTo("break is only allowed inside a loop in macro: outer:9 > inner:3"));
        }
    }

    @Nested
    @DisplayName("include")
    class Includes {

        @Test
        @DisplayName("被包含文件的顶层元素原地展开")
        void testInclude() {
            files.put("lib.ll", "LIB");
            parser.put("LIB", program(line(assign("y", num(1)))));
            assertThat(lower(include("lib.ll"), line(assign("x", num(2))))).containsExactly("y=1", "x=2");
        }

        @Test
        @DisplayName("被包含文件中的定义对后续代码可见")
        void testIncludedDefinitions() {
            files.put("defs.ll", "DEFS");
            parser.put("DEFS", program(define("speed", num(3))));
            assertThat(lower(include("defs.ll"), line(assign("x", ref("speed"))))).containsExactly("x=3");
        }

        @Test
        @DisplayName("循环包含超过上限")
        void testIncludeLimit() {
            config.setMaxIncludes(3);
            files.put("self.ll", "SELF");
            parser.put("SELF", program(include("self.ll")));
            assertThatThrownBy(() -> lower(include("self.ll")))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("Too many includes (limit 3)");
        }

        @Test
        @DisplayName("没有文件系统时无法包含")
        void testNoFileSystem() {
            ctx = new ConversionContext(config, null, null);
            Program program = program(include("lib.ll"));
            assertThatThrownBy(() -> new StructuralLowering().run(program, ctx))
                    .isInstanceOf(CompileException.class)
                    .hasMessageContaining("without a file system");
        }
    }

    @Nested
    @DisplayName("内置函数")
    class Builtins {

        @Test
        @DisplayName("line() 替换为占位符并启用行号计数")
        void testLine() {
            assertThat(lower(line(assign("l", call("line"))))).containsExactly("l=line()");
            assertThat(ctx.isTimeTracking()).isTrue();
        }

        @Test
        @DisplayName("time() 读取保留的计数变量")
        void testTime() {
            assertThat(lower(line(assign("t", call("TIME"))))).containsExactly("t=_time");
            assertThat(ctx.isTimeTracking()).isTrue();
        }

        @Test
        @DisplayName("不使用内置函数时不启用行号计数")
        void testNoTimeTracking() {
            lower(line(assign("x", num(1))));
            assertThat(ctx.isTimeTracking()).isFalse();
        }

        @Test
        @DisplayName("未知函数或多余参数是结构性错误")
        void testInvalidCalls() {
            assertThatThrownBy(() -> lower(line(assign("x", call("random")))))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("Unknown function 'random'");
            assertThatThrownBy(() -> lower(line(assign("x", call("line", num(1))))))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("Function 'line' takes no arguments");
        }

        @Test
        @DisplayName("源码中不允许直接跳转到行号")
        void testNumericGoto() {
            assertThatThrownBy(() -> lower(line(new GoToStatement(LOC, num(1)))))
                    .isInstanceOf(CompileException.class)
                    .hasMessageStartingWith("Jumping to line numbers is not supported");
        }
    }

    @Test
    @DisplayName("常量子表达式在降级时折叠")
    void testFolding() {
        assertThat(lower(line(assign("x", bin(num(2), ADD, num(3)))))).containsExactly("x=5");
    }

    @Nested
    @DisplayName("行内形式")
    class Compaction {

        @BeforeEach
        void enable() {
            config.setCompactBlocks(true);
        }

        @Test
        @DisplayName("单分支 if/else 输出为一行")
        void testInlineIf() {
            assertThat(lower(ifElse(bin(ref("x"), GT, num(1)),
                    block(line(assign("y", num(1)))), block(line(assign("y", num(2)))))))
                    .containsExactly("if x>1 then y=1 else y=2 end");
        }

        @Test
        @DisplayName("短循环体输出为一行")
        void testInlineWhile() {
            assertThat(lower(whileLoop(bin(ref("x"), LT, num(3)), line(inc("x")))))
                    .containsExactly("$while1: if x<3 then x++ goto $while1 end", "$endwhile1:");
        }

        @Test
        @DisplayName("放不下时退回跳转形式")
        void testFallback() {
            String longText = "0123456789012345678901234567890123456789012345678901234567";
            List<String> lines = lower(ifThen(bin(ref("x"), GT, num(1)), line(assign("y", str(longText)))));
            assertThat(lines).hasSize(3);
            assertThat(lines.get(0)).isEqualTo("if x<=1 then goto $endif1 end");
        }
    }
}
