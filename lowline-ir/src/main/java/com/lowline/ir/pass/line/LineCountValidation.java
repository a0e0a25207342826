package com.lowline.ir.pass.line;

import com.lowline.compiler.CompileException;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.List;

/**
 * 行数上限检查
 */
public class LineCountValidation implements LinePass {

    @Override
    public String getName() {
        return "LineCountValidation";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        List<StatementLine> lines = Lines.of(program);
        int maxLines = ctx.getConfig().getMaxLines();
        if (lines.size() > maxLines) {
            SourceLocation span = SourceLocation.span(lines.get(0).getLocation(),
                    lines.get(lines.size() - 1).getLocation());
            throw new CompileException("Program is too large to be compiled into " + maxLines
                    + " lines (needs " + lines.size() + ")", span);
        }
        return program;
    }
}
