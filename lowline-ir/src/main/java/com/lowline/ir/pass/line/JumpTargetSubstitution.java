package com.lowline.ir.pass.line;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.Nodes;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.compiler.ast.stmt.GoToStatement;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.pass.LinePass;

import java.util.Map;

/**
 * 把标签跳转替换为行号跳转。标签不存在是结构性错误。
 */
public class JumpTargetSubstitution implements LinePass {

    @Override
    public String getName() {
        return "JumpTargetSubstitution";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        Map<String, Integer> table = ctx.getJumpLabels();
        program.accept((AstNode node, VisitType type) -> {
            if (type != VisitType.PRE || !(node instanceof GoToLabelStatement)) {
                return VisitResult.UNCHANGED;
            }
            GoToLabelStatement jump = (GoToLabelStatement) node;
            Integer line = table.get(jump.getLabel());
            if (line == null) {
                throw ctx.error("Unknown jump-label '" + jump.getLabel() + "'", jump.getLocation());
            }
            return VisitResult.replaceAndSkip(
                    new GoToStatement(jump.getLocation(), Nodes.number(jump.getLocation(), line)));
        });
        return program;
    }
}
