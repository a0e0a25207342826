package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.decl.Program;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

/**
 * 代入行号后再整体折叠一次常量
 */
public class ConstantRefolding implements LinePass {

    @Override
    public String getName() {
        return "ConstantRefolding";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        ctx.getStaticOptimizer().optimize(program);
        return program;
    }
}
