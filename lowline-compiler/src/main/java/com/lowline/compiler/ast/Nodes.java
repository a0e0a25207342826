package com.lowline.compiler.ast;

import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.expr.BinaryOperation;
import com.lowline.compiler.ast.expr.BinaryOperator;
import com.lowline.compiler.ast.expr.Dereference;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.expr.NumberConstant;
import com.lowline.compiler.ast.expr.StringConstant;
import com.lowline.compiler.ast.expr.UnaryOperation;
import com.lowline.compiler.ast.expr.UnaryOperator;
import com.lowline.compiler.ast.stmt.AssignOperator;
import com.lowline.compiler.ast.stmt.Assignment;
import com.lowline.compiler.ast.stmt.ExpressionStatement;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.compiler.ast.stmt.IfStatement;
import com.lowline.compiler.ast.stmt.Statement;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 节点构造辅助方法（降级时批量生成语句行、跳转等）。
 */
public final class Nodes {

    private Nodes() {
    }

    public static NumberConstant number(SourceLocation loc, long value) {
        return new NumberConstant(loc, value);
    }

    public static NumberConstant number(SourceLocation loc, String value) {
        return new NumberConstant(loc, new BigDecimal(value));
    }

    public static StringConstant string(SourceLocation loc, String value) {
        return new StringConstant(loc, value);
    }

    public static Dereference variable(SourceLocation loc, String name) {
        return new Dereference(loc, name);
    }

    public static BinaryOperation binary(SourceLocation loc, BinaryOperator op, Expression left, Expression right) {
        return new BinaryOperation(loc, op, left, right);
    }

    public static UnaryOperation unary(SourceLocation loc, UnaryOperator op, Expression operand) {
        return new UnaryOperation(loc, op, operand);
    }

    public static Assignment assign(SourceLocation loc, String variable, Expression value) {
        return new Assignment(loc, variable, AssignOperator.ASSIGN, value);
    }

    /**
     * 后缀自增语句：name++
     */
    public static ExpressionStatement increment(SourceLocation loc, String variable) {
        return new ExpressionStatement(loc, new Dereference(loc, variable, Dereference.Step.INCREMENT, false));
    }

    public static GoToLabelStatement gotoLabel(SourceLocation loc, String label) {
        return new GoToLabelStatement(loc, label);
    }

    /**
     * 条件跳转：if cond then goto label end
     */
    public static IfStatement conditionalJump(SourceLocation loc, Expression condition, String label) {
        return new IfStatement(loc, condition,
                Collections.<Statement>singletonList(gotoLabel(loc, label)), null);
    }

    public static StatementLine line(SourceLocation loc, String label, Statement... statements) {
        return new StatementLine(loc, label, Arrays.asList(statements));
    }

    public static StatementLine line(SourceLocation loc, String label, List<Statement> statements) {
        return new StatementLine(loc, label, statements);
    }

    /**
     * 仅含标签的空行
     */
    public static StatementLine labelLine(SourceLocation loc, String label) {
        return new StatementLine(loc, label, Collections.<Statement>emptyList());
    }
}
