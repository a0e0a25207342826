package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.decl.Program;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

/**
 * 按当前预算贪心合并行
 */
public class LineMerging implements LinePass {

    @Override
    public String getName() {
        return "LineMerging";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        program.setElements(ctx.createPacker().pack(Lines.of(program)));
        return program;
    }
}
