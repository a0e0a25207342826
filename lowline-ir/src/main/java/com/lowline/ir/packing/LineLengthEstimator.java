package com.lowline.ir.packing;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.expr.LinePlaceholder;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.compiler.ast.stmt.Statement;
import com.lowline.compiler.formatter.LinePrinter;
import com.lowline.compiler.formatter.PrintMode;
import com.lowline.compiler.formatter.PrinterContext;

import java.util.List;

/**
 * 估算一行打印后的长度。
 * <p>
 * 未解析的跳转目标和行号引用都按最大行号的位数输出占位，
 * 因此估算值不会小于代入真实值后的长度。
 */
public class LineLengthEstimator {

    private final LinePrinter printer;
    private final String jumpPlaceholder;
    private final String linePlaceholder;

    public LineLengthEstimator(PrintMode mode, int maxLines) {
        int width = String.valueOf(maxLines).length();
        this.jumpPlaceholder = repeat('X', width);
        this.linePlaceholder = repeat('0', width);
        this.printer = new LinePrinter(mode);
        this.printer.setExtension(this::printPlaceholder);
    }

    public int lengthOf(List<Statement> statements) {
        return printer.printLine(statements).length();
    }

    public int lengthOf(StatementLine line) {
        return lengthOf(line.getStatements());
    }

    public String render(List<Statement> statements) {
        return printer.printLine(statements);
    }

    private boolean printPlaceholder(AstNode node, PrinterContext ctx) {
        if (node instanceof GoToLabelStatement) {
            ctx.append("goto");
            ctx.append(jumpPlaceholder);
            return true;
        }
        if (node instanceof LinePlaceholder) {
            ctx.append(linePlaceholder);
            return true;
        }
        return false;
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
