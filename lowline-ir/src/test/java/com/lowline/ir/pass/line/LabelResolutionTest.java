package com.lowline.ir.pass.line;

import com.lowline.compiler.CompileException;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.ConverterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.lowline.ir.Trees.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("标签解析")
class LabelResolutionTest {

    private ConversionContext ctx;

    @BeforeEach
    void setUp() {
        ConverterConfig config = new ConverterConfig();
        config.setShortenNames(false);
        ctx = new ConversionContext(config, null, null);
    }

    @Test
    @DisplayName("标签按最终行序编号，跳转替换为行号")
    void testResolve() {
        Program program = program(
                line(inc("x")),
                line("loop", inc("y")),
                line(jumpIf(ref("y"), "loop"), jump("loop")));
        new LabelTableBuilding().run(program, ctx);
        new JumpTargetSubstitution().run(program, ctx);

        assertThat(ctx.getJumpLabels()).containsEntry("loop", 2).hasSize(1);
        assertThat(dump(program).get(2)).isEqualTo("if y then goto 2 end goto 2");
    }

    @Test
    @DisplayName("重复标签")
    void testDuplicateLabel() {
        Program program = program(line("a", inc("x")), line("A", inc("y")));
        assertThatThrownBy(() -> new LabelTableBuilding().run(program, ctx))
                .isInstanceOf(CompileException.class)
                .hasMessageStartingWith("Duplicate label 'a'");
    }

    @Test
    @DisplayName("跳转到不存在的标签")
    void testUnknownLabel() {
        ctx.setJumpLabels(Collections.singletonMap("a", 1));
        Program program = program(line("a", inc("x")), line(jump("b")));
        assertThatThrownBy(() -> new JumpTargetSubstitution().run(program, ctx))
                .isInstanceOf(CompileException.class)
                .hasMessageStartingWith("Unknown jump-label 'b'");
    }

    @Test
    @DisplayName("未被引用的标签被去掉")
    void testUnusedLabel() {
        Program program = program(line("a", inc("x")), line("b", jump("b")));
        new UnusedLabelRemoval().run(program, ctx);
        assertThat(dump(program)).containsExactly("x++", "b: goto b");
    }

    @Test
    @DisplayName("末尾追加跳回首行，首行无标签时补上")
    void testTerminalJump() {
        Program program = program(line(inc("x")), line(inc("y")));
        new TerminalJumpInsertion().run(program, ctx);
        assertThat(dump(program)).containsExactly("$start: x++", "y++", "goto $start");

        Program empty = program();
        new TerminalJumpInsertion().run(empty, ctx);
        assertThat(empty.getElements()).isEmpty();
    }
}
