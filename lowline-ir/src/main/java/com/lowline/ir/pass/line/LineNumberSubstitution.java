package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.Nodes;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.expr.LinePlaceholder;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.List;

/**
 * line() 占位符 → 所在物理行的行号
 */
public class LineNumberSubstitution implements LinePass {

    @Override
    public String getName() {
        return "LineNumberSubstitution";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        List<StatementLine> lines = Lines.of(program);
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            lines.get(i).accept((AstNode node, VisitType type) -> {
                if (type == VisitType.PRE && node instanceof LinePlaceholder) {
                    return VisitResult.replaceAndSkip(Nodes.number(node.getLocation(), lineNumber));
                }
                return VisitResult.UNCHANGED;
            });
        }
        return program;
    }
}
