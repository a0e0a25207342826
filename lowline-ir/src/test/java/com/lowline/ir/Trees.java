package com.lowline.ir;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.Nodes;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.block.MacroInsertion;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.block.StructuredIf;
import com.lowline.compiler.ast.block.WaitDirective;
import com.lowline.compiler.ast.block.WhileLoop;
import com.lowline.compiler.ast.decl.Definition;
import com.lowline.compiler.ast.decl.IncludeDirective;
import com.lowline.compiler.ast.decl.MacroDefinition;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.expr.BinaryOperator;
import com.lowline.compiler.ast.expr.Dereference;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.expr.FuncCall;
import com.lowline.compiler.ast.expr.LinePlaceholder;
import com.lowline.compiler.ast.stmt.BreakStatement;
import com.lowline.compiler.ast.stmt.ContinueStatement;
import com.lowline.compiler.ast.stmt.ExpressionStatement;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.compiler.ast.stmt.Statement;
import com.lowline.compiler.formatter.LinePrinter;
import com.lowline.compiler.formatter.PrinterContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 测试用的树构造与输出辅助方法（解析器不在本项目范围内）
 */
public final class Trees {

    public static final String FILE = "main.ll";
    public static final SourceLocation LOC = SourceLocation.at(FILE, 1, 1);

    private Trees() {
    }

    public static SourceLocation at(int line) {
        return SourceLocation.at(FILE, line, 1);
    }

    public static Program program(Element... elements) {
        return new Program(LOC, Arrays.asList(elements));
    }

    // ============ 表达式 ============

    public static Expression num(long value) {
        return Nodes.number(LOC, value);
    }

    public static Expression str(String value) {
        return Nodes.string(LOC, value);
    }

    public static Dereference ref(String name) {
        return Nodes.variable(LOC, name);
    }

    public static Expression bin(Expression left, BinaryOperator op, Expression right) {
        return Nodes.binary(LOC, op, left, right);
    }

    public static Expression call(String function, Expression... args) {
        return new FuncCall(LOC, function, Arrays.asList(args));
    }

    // ============ 语句 ============

    public static Statement assign(String variable, Expression value) {
        return Nodes.assign(LOC, variable, value);
    }

    public static Statement inc(String variable) {
        return new ExpressionStatement(LOC, new Dereference(LOC, variable, Dereference.Step.INCREMENT, false));
    }

    public static Statement jump(String label) {
        return Nodes.gotoLabel(LOC, label);
    }

    public static Statement jumpIf(Expression condition, String label) {
        return Nodes.conditionalJump(LOC, condition, label);
    }

    public static Statement brk() {
        return new BreakStatement(LOC);
    }

    public static Statement cont() {
        return new ContinueStatement(LOC);
    }

    // ============ 元素 ============

    public static StatementLine line(Statement... statements) {
        return Nodes.line(LOC, null, statements);
    }

    public static StatementLine line(String label, Statement... statements) {
        return Nodes.line(LOC, label, statements);
    }

    /** 带 BOL 标记，不会并入前一行 */
    public static StatementLine ownLine(Statement... statements) {
        return new StatementLine(LOC, null, Arrays.asList(statements), true, false);
    }

    public static WhileLoop whileLoop(Expression condition, Element... body) {
        return new WhileLoop(LOC, condition, Arrays.asList(body));
    }

    public static StructuredIf ifThen(Expression condition, Element... body) {
        return new StructuredIf(LOC, Collections.singletonList(condition),
                Collections.singletonList(Arrays.asList(body)), null);
    }

    public static StructuredIf ifElse(Expression condition, List<Element> body, List<Element> elseBody) {
        return new StructuredIf(LOC, Collections.singletonList(condition),
                Collections.singletonList(body), elseBody);
    }

    public static WaitDirective waitUntil(Expression condition) {
        return new WaitDirective(LOC, condition);
    }

    public static Definition define(String name, Expression value) {
        return new Definition(LOC, name, value);
    }

    public static MacroDefinition macro(String name, List<String> params, Element... body) {
        return new MacroDefinition(LOC, name, params, Arrays.asList(body));
    }

    public static MacroInsertion insert(int line, String name, Expression... args) {
        return new MacroInsertion(at(line), name, Arrays.asList(args));
    }

    public static IncludeDirective include(String file) {
        return new IncludeDirective(LOC, file);
    }

    // ============ 输出 ============

    /**
     * 每行输出为 "label: 语句"，未解析的跳转显示目标标签
     */
    public static List<String> dump(Program program) {
        LinePrinter printer = new LinePrinter();
        printer.setExtension(Trees::printUnresolved);
        List<String> lines = new ArrayList<>();
        for (Element element : program.getElements()) {
            StatementLine line = (StatementLine) element;
            String text = printer.printLine(line.getStatements());
            if (line.hasLabel()) {
                lines.add(text.isEmpty() ? line.getLabel() + ":" : line.getLabel() + ": " + text);
            } else {
                lines.add(text);
            }
        }
        return lines;
    }

    private static boolean printUnresolved(AstNode node, PrinterContext ctx) {
        if (node instanceof GoToLabelStatement) {
            ctx.append("goto " + ((GoToLabelStatement) node).getLabel());
            return true;
        }
        if (node instanceof LinePlaceholder) {
            ctx.append("line()");
            return true;
        }
        return false;
    }
}
