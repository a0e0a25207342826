package com.lowline.ir.lowering;

import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.Nodes;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.block.StructuredIf;
import com.lowline.compiler.ast.block.WaitDirective;
import com.lowline.compiler.ast.block.WhileLoop;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.expr.NumberConstant;
import com.lowline.compiler.ast.stmt.IfStatement;
import com.lowline.compiler.ast.stmt.Statement;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.packing.LinePacker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 结构化控制流 → 标签 + 跳转。
 * <p>
 * 调用时子节点都已降级完毕，块中只剩语句行。生成的标签以 '$' 开头，不会与用户标签冲突。
 */
public class ControlFlowLowering {

    private final ConversionContext ctx;

    public ControlFlowLowering(ConversionContext ctx) {
        this.ctx = ctx;
    }

    public static String loopHead(int id) {
        return "$while" + id;
    }

    public static String loopEnd(int id) {
        return "$endwhile" + id;
    }

    // ============ if / elseif / else ============

    /**
     * <pre>
     *   if not c0 then goto $ifN_0 end
     *   body0
     *   goto $endifN
     * $ifN_0:
     *   ...
     *   else 块
     * $endifN:
     * </pre>
     */
    public List<StatementLine> lowerIf(StructuredIf node) {
        int id = ctx.nextIfId();
        if (ctx.getConfig().isCompactBlocks() && node.getConditions().size() == 1) {
            StatementLine inline = compactIf(node);
            if (inline != null) {
                return Collections.singletonList(inline);
            }
        }

        SourceLocation loc = node.getLocation();
        String end = "$endif" + id;
        List<StatementLine> out = new ArrayList<>();
        int branches = node.getConditions().size();
        for (int i = 0; i < branches; i++) {
            boolean fallsToEnd = i == branches - 1 && !node.hasElse();
            String next = fallsToEnd ? end : "$if" + id + "_" + i;
            Expression condition = node.getConditions().get(i);

            Statement skip = jumpUnless(condition, next);
            if (skip != null) {
                out.add(Nodes.line(condition.getLocation(), null, skip));
            }
            out.addAll(lines(node.getBlocks().get(i)));
            if (!fallsToEnd) {
                out.add(Nodes.line(loc, null, Nodes.gotoLabel(loc, end)));
                out.add(Nodes.labelLine(loc, next));
            }
        }
        if (node.hasElse()) {
            out.addAll(lines(node.getElseBlock()));
        }
        out.add(Nodes.labelLine(loc, end));
        return out;
    }

    private StatementLine compactIf(StructuredIf node) {
        List<Statement> body = LinePacker.join(lines(node.getBlocks().get(0)));
        if (body == null) return null;
        List<Statement> elseBody = null;
        if (node.hasElse()) {
            elseBody = LinePacker.join(lines(node.getElseBlock()));
            if (elseBody == null) return null;
            if (elseBody.isEmpty()) elseBody = null;
        }
        SourceLocation loc = node.getLocation();
        IfStatement inline = new IfStatement(loc, node.getConditions().get(0), body, elseBody);
        StatementLine line = Nodes.line(loc, null, inline);
        return fitsCompact(line) ? line : null;
    }

    // ============ while ============

    /**
     * <pre>
     * $whileN: if not c then goto $endwhileN end
     *   body
     *   goto $whileN
     * $endwhileN:
     * </pre>
     */
    public List<StatementLine> lowerWhile(WhileLoop node, int id) {
        SourceLocation loc = node.getLocation();
        String head = loopHead(id);
        String end = loopEnd(id);
        List<StatementLine> body = lines(node.getBody());

        if (ctx.getConfig().isCompactBlocks()) {
            List<StatementLine> inline = compactWhile(node, body, head, end);
            if (inline != null) return inline;
        }

        List<StatementLine> out = new ArrayList<>();
        Statement exit = jumpUnless(node.getCondition(), end);
        out.add(exit != null ? Nodes.line(loc, head, exit) : Nodes.labelLine(loc, head));
        out.addAll(body);
        out.add(Nodes.line(loc, null, Nodes.gotoLabel(loc, head)));
        out.add(Nodes.labelLine(loc, end));
        return out;
    }

    private List<StatementLine> compactWhile(WhileLoop node, List<StatementLine> body, String head, String end) {
        List<Statement> joined = LinePacker.join(body);
        if (joined == null) return null;
        SourceLocation loc = node.getLocation();
        List<Statement> statements = new ArrayList<>(joined);
        if (statements.isEmpty() || !statements.get(statements.size() - 1).isUnconditionalJump()) {
            statements.add(Nodes.gotoLabel(loc, head));
        }
        StatementLine headLine;
        if (isConstantFalse(invert(node.getCondition()))) {
            headLine = Nodes.line(loc, head, statements);
        } else {
            headLine = Nodes.line(loc, head, new IfStatement(loc, node.getCondition(), statements, null));
        }
        if (!fitsCompact(headLine)) return null;
        return Arrays.asList(headLine, Nodes.labelLine(loc, end));
    }

    // ============ wait ============

    /**
     * <pre>
     * $waitN:
     *   if c then goto $endwaitN end
     *   goto $waitN
     * $endwaitN:
     * </pre>
     */
    public List<StatementLine> lowerWait(WaitDirective node) {
        int id = ctx.nextWaitId();
        SourceLocation loc = node.getLocation();
        String start = "$wait" + id;
        String end = "$endwait" + id;
        return Arrays.asList(
                Nodes.labelLine(loc, start),
                Nodes.line(loc, null, Nodes.conditionalJump(loc, node.getCondition(), end)),
                Nodes.line(loc, null, Nodes.gotoLabel(loc, start)),
                Nodes.labelLine(loc, end));
    }

    // ============ 辅助 ============

    /**
     * 条件不成立时跳到 label。取反后恒假返回 null（永不跳转），恒真则为无条件跳转。
     */
    private Statement jumpUnless(Expression condition, String label) {
        SourceLocation loc = condition.getLocation();
        Expression inverted = invert(condition);
        if (inverted instanceof NumberConstant) {
            return ((NumberConstant) inverted).isZero() ? null : Nodes.gotoLabel(loc, label);
        }
        return Nodes.conditionalJump(loc, inverted, label);
    }

    private Expression invert(Expression condition) {
        Expression inverted = ctx.getInversionOptimizer().invert(condition.copy());
        return ctx.getStaticOptimizer().optimize(inverted);
    }

    private static boolean isConstantFalse(Expression expr) {
        return expr instanceof NumberConstant && ((NumberConstant) expr).isZero();
    }

    /**
     * 行内形式在降级时就确定了，此时可能还不知道是否启用行号计数，按保守预算判断
     */
    private boolean fitsCompact(StatementLine line) {
        int budget = ctx.getConfig().getMaxLineLength() - ctx.timeCounterWidth();
        return ctx.createEstimator().lengthOf(line) <= budget;
    }

    static List<StatementLine> lines(List<Element> block) {
        List<StatementLine> lines = new ArrayList<>(block.size());
        for (Element element : block) {
            if (!(element instanceof StatementLine)) {
                throw new IllegalStateException("Unconverted element in lowered block: "
                        + element.getClass().getSimpleName());
            }
            lines.add((StatementLine) element);
        }
        return lines;
    }
}
