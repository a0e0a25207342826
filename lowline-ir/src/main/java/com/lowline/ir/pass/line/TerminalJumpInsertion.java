package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.Nodes;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.List;

/**
 * 在末尾追加跳回第一行的跳转，模拟执行到末尾后回到开头。
 * 第一行没有标签时补一个。
 */
public class TerminalJumpInsertion implements LinePass {

    public static final String START_LABEL = "$start";

    @Override
    public String getName() {
        return "TerminalJumpInsertion";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        List<StatementLine> lines = Lines.of(program);
        if (lines.isEmpty()) return program;
        StatementLine first = lines.get(0);
        if (!first.hasLabel()) {
            first.setLabel(START_LABEL);
        }
        StatementLine last = lines.get(lines.size() - 1);
        program.getElements().add(Nodes.line(last.getLocation(), null,
                Nodes.gotoLabel(last.getLocation(), first.getLabel())));
        return program;
    }
}
