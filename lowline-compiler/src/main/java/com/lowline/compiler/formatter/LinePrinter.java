package com.lowline.compiler.formatter;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.base.Line;
import com.lowline.compiler.ast.base.LineProgram;
import com.lowline.compiler.ast.expr.BinaryOperation;
import com.lowline.compiler.ast.expr.Dereference;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.expr.NumberConstant;
import com.lowline.compiler.ast.expr.StringConstant;
import com.lowline.compiler.ast.expr.UnaryOperation;
import com.lowline.compiler.ast.expr.UnaryOperator;
import com.lowline.compiler.ast.stmt.Assignment;
import com.lowline.compiler.ast.stmt.ExpressionStatement;
import com.lowline.compiler.ast.stmt.GoToStatement;
import com.lowline.compiler.ast.stmt.IfStatement;
import com.lowline.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 基础语言打印器
 *
 * <p>把平坦语句输出为基础语言源码。括号只在优先级需要时添加。
 * 扩展语言专有节点只能经由 {@link PrinterExtension} 输出，否则视为内部错误。</p>
 */
public class LinePrinter {

    private static final int ATOM_PRECEDENCE = 10;

    private final PrintMode mode;
    private PrinterExtension extension;

    public LinePrinter(PrintMode mode) {
        this.mode = mode;
    }

    public LinePrinter() {
        this(PrintMode.SPACELESS);
    }

    public PrintMode getMode() {
        return mode;
    }

    public void setExtension(PrinterExtension extension) {
        this.extension = extension;
    }

    /**
     * 打印整个程序，行之间以换行分隔
     */
    public String print(LineProgram program) {
        StringBuilder sb = new StringBuilder();
        for (Line line : program.getLines()) {
            sb.append(printLine(line.getStatements())).append('\n');
        }
        return sb.toString();
    }

    /**
     * 打印一行语句
     */
    public String printLine(List<Statement> statements) {
        PrinterContext ctx = new PrinterContext(mode);
        printStatements(statements, ctx);
        return ctx.getOutput();
    }

    public String printStatement(Statement statement) {
        PrinterContext ctx = new PrinterContext(mode);
        printStatement(statement, ctx);
        return ctx.getOutput();
    }

    public String printExpression(Expression expression) {
        PrinterContext ctx = new PrinterContext(mode);
        printExpression(expression, ctx);
        return ctx.getOutput();
    }

    // ============ 语句 ============

    private void printStatements(List<Statement> statements, PrinterContext ctx) {
        for (int i = 0; i < statements.size(); i++) {
            if (i > 0) {
                ctx.statementBreak();
            }
            printStatement(statements.get(i), ctx);
        }
    }

    private void printStatement(Statement stmt, PrinterContext ctx) {
        if (handledByExtension(stmt, ctx)) return;

        if (stmt instanceof Assignment) {
            Assignment assign = (Assignment) stmt;
            ctx.append(assign.getVariable());
            ctx.append(assign.getOperator().getSymbol());
            printExpression(assign.getValue(), ctx);
        } else if (stmt instanceof ExpressionStatement) {
            printExpression(((ExpressionStatement) stmt).getExpression(), ctx);
        } else if (stmt instanceof GoToStatement) {
            ctx.append("goto");
            printExpression(((GoToStatement) stmt).getLine(), ctx);
        } else if (stmt instanceof IfStatement) {
            IfStatement ifStmt = (IfStatement) stmt;
            ctx.append("if");
            printExpression(ifStmt.getCondition(), ctx);
            ctx.append("then");
            printStatements(ifStmt.getIfBlock(), ctx);
            if (ifStmt.hasElse()) {
                ctx.append("else");
                printStatements(ifStmt.getElseBlock(), ctx);
            }
            ctx.append("end");
        } else {
            throw unprintable(stmt);
        }
    }

    // ============ 表达式 ============

    private void printExpression(Expression expr, PrinterContext ctx) {
        if (handledByExtension(expr, ctx)) return;

        if (expr instanceof NumberConstant) {
            ctx.append(expr.toString());
        } else if (expr instanceof StringConstant) {
            ctx.append(expr.toString());
        } else if (expr instanceof Dereference) {
            ctx.append(expr.toString());
        } else if (expr instanceof UnaryOperation) {
            UnaryOperation unary = (UnaryOperation) expr;
            UnaryOperator op = unary.getOperator();
            ctx.append(op.getSymbol());
            if (op.isKeyword() && op != UnaryOperator.NOT) {
                ctx.glue();
                printParenthesized(unary.getOperand(), ctx);
            } else {
                int operandPrec = precedenceOf(unary.getOperand());
                boolean parens = operandPrec < op.getPrecedence();
                if (op == UnaryOperator.NEGATE) {
                    ctx.glue();
                    // -(-x)，不能输出成 --x
                    parens = parens || operandPrec == op.getPrecedence();
                }
                printOperand(unary.getOperand(), parens, ctx);
            }
        } else if (expr instanceof BinaryOperation) {
            BinaryOperation bin = (BinaryOperation) expr;
            int prec = bin.getOperator().getPrecedence();
            printOperand(bin.getLeft(), precedenceOf(bin.getLeft()) < prec, ctx);
            ctx.append(bin.getOperator().getSymbol());
            printOperand(bin.getRight(), precedenceOf(bin.getRight()) <= prec, ctx);
        } else {
            throw unprintable(expr);
        }
    }

    private void printOperand(Expression operand, boolean parenthesize, PrinterContext ctx) {
        if (parenthesize) {
            printParenthesized(operand, ctx);
        } else {
            printExpression(operand, ctx);
        }
    }

    private void printParenthesized(Expression expr, PrinterContext ctx) {
        ctx.append("(");
        printExpression(expr, ctx);
        ctx.append(")");
    }

    /**
     * 表达式的绑定优先级，原子为最高
     */
    static int precedenceOf(Expression expr) {
        if (expr instanceof BinaryOperation) {
            return ((BinaryOperation) expr).getOperator().getPrecedence();
        }
        if (expr instanceof UnaryOperation) {
            return ((UnaryOperation) expr).getOperator().getPrecedence();
        }
        if (expr instanceof NumberConstant && ((NumberConstant) expr).getValue().signum() < 0) {
            return UnaryOperator.NEGATE.getPrecedence();
        }
        return ATOM_PRECEDENCE;
    }

    private boolean handledByExtension(AstNode node, PrinterContext ctx) {
        return extension != null && extension.print(node, ctx);
    }

    private static IllegalStateException unprintable(AstNode node) {
        return new IllegalStateException("Cannot print node of type "
                + node.getClass().getSimpleName() + " as base-language code");
    }
}
