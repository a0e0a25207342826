package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 去掉没有任何跳转引用的标签，行内语句不变
 */
public class UnusedLabelRemoval implements LinePass {

    @Override
    public String getName() {
        return "UnusedLabelRemoval";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        List<StatementLine> lines = Lines.of(program);
        Set<String> referenced = new HashSet<>();
        for (GoToLabelStatement jump : Lines.jumps(lines)) {
            referenced.add(jump.getLabel());
        }
        for (StatementLine line : lines) {
            if (line.hasLabel() && !referenced.contains(line.getLabel())) {
                line.setLabel(null);
            }
        }
        return program;
    }
}
