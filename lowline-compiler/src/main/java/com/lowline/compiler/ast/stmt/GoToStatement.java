package com.lowline.compiler.ast.stmt;

import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.expr.NumberConstant;

/**
 * 基础语言的行号跳转：goto expr
 */
public class GoToStatement extends Statement {
    private Expression line;

    public GoToStatement(SourceLocation location, Expression line) {
        super(location);
        this.line = line;
    }

    public Expression getLine() {
        return line;
    }

    /**
     * 目标为常量时返回行号，否则返回 -1
     */
    public int getConstantLine() {
        if (line instanceof NumberConstant) {
            return ((NumberConstant) line).getValue().intValue();
        }
        return -1;
    }

    @Override
    public boolean isUnconditionalJump() {
        return true;
    }

    @Override
    public VisitResult accept(NodeVisitor visitor) {
        VisitResult pre = visitor.visit(this, VisitType.PRE);
        if (pre.isReplacement()) return pre;
        line = NodeLists.acceptOne(line, Expression.class, visitor);
        return visitor.visit(this, VisitType.POST);
    }

    @Override
    public GoToStatement copy() {
        return new GoToStatement(location, line.copy());
    }
}
