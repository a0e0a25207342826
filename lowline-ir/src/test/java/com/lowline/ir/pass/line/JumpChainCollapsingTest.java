package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.decl.Program;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.ConverterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.lowline.ir.Trees.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("跳转链折叠")
class JumpChainCollapsingTest {

    private ConversionContext ctx;
    private final JumpChainCollapsing pass = new JumpChainCollapsing();

    @BeforeEach
    void setUp() {
        ConverterConfig config = new ConverterConfig();
        config.setShortenNames(false);
        ctx = new ConversionContext(config, null, null);
    }

    @Test
    @DisplayName("跳转链直接指向最终目标")
    void testChain() {
        Program program = program(
                line(jump("a")),
                line("a", jump("b")),
                line("b", jump("c")),
                line("c", inc("x")));
        pass.run(program, ctx);
        assertThat(dump(program)).containsExactly("goto c", "a: goto c", "b: goto c", "c: x++");
    }

    @Test
    @DisplayName("条件跳转的目标同样折叠")
    void testConditionalJump() {
        Program program = program(
                line(jumpIf(ref("x"), "a")),
                line("a", jump("b")),
                line("b", inc("x")));
        pass.run(program, ctx);
        assertThat(dump(program).get(0)).isEqualTo("if x then goto b end");
    }

    @Test
    @DisplayName("空的标签行落到下一行的跳转")
    void testEmptyLabelLine() {
        Program program = program(
                line(jump("e")),
                line("e"),
                line(jump("z")),
                line("z", inc("x")));
        pass.run(program, ctx);
        assertThat(dump(program).get(0)).isEqualTo("goto z");
    }

    @Test
    @DisplayName("跳转环不会死循环，再次执行结果不变")
    void testCycle() {
        Program program = program(
                line("a", jump("b")),
                line("b", jump("a")),
                line(jump("a")));
        pass.run(program, ctx);
        assertThat(dump(program)).containsExactly("a: goto a", "b: goto b", "goto b");

        pass.run(program, ctx);
        assertThat(dump(program)).containsExactly("a: goto a", "b: goto b", "goto b");
    }

    @Test
    @DisplayName("目标行不止一条语句时不折叠")
    void testNoCollapse() {
        Program program = program(
                line(jump("a")),
                line("a", inc("x"), jump("a")));
        pass.run(program, ctx);
        assertThat(dump(program)).containsExactly("goto a", "a: x++ goto a");
    }
}
