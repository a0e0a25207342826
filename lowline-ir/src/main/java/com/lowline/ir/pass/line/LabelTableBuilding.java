package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 按最终行序建立 标签 → 行号（从 1 开始）
 */
public class LabelTableBuilding implements LinePass {

    @Override
    public String getName() {
        return "LabelTableBuilding";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        List<StatementLine> lines = Lines.of(program);
        Map<String, Integer> table = new HashMap<>();
        for (Map.Entry<String, Integer> entry : Lines.labelIndex(lines, ctx).entrySet()) {
            table.put(entry.getKey(), entry.getValue() + 1);
        }
        ctx.setJumpLabels(table);
        return program;
    }
}
