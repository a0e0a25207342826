package com.lowline.ir.pass;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.base.Line;
import com.lowline.compiler.ast.base.LineProgram;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.expr.FuncCall;
import com.lowline.compiler.ast.expr.LinePlaceholder;
import com.lowline.compiler.ast.stmt.BreakStatement;
import com.lowline.compiler.ast.stmt.ContinueStatement;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句行 → 基础语言程序。此时残留任何扩展语言节点都是转换器自身的缺陷。
 */
public class ProgramEmitter {

    public LineProgram emit(Program program) {
        List<Line> lines = new ArrayList<>(program.getElements().size());
        for (Element element : program.getElements()) {
            if (!(element instanceof StatementLine)) {
                throw new IllegalStateException("Unconverted element reached emission: "
                        + element.getClass().getSimpleName());
            }
            StatementLine line = (StatementLine) element;
            line.accept(ProgramEmitter::checkBaseNode);
            lines.add(new Line(line.getLocation(), line.getStatements()));
        }
        return new LineProgram(lines);
    }

    private static VisitResult checkBaseNode(AstNode node, VisitType type) {
        if (node instanceof GoToLabelStatement || node instanceof BreakStatement
                || node instanceof ContinueStatement || node instanceof LinePlaceholder
                || node instanceof FuncCall) {
            throw new IllegalStateException("Unconverted " + node.getClass().getSimpleName()
                    + " reached emission at " + node.getLocation());
        }
        return VisitResult.UNCHANGED;
    }
}
