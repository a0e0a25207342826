package com.lowline.ir.lowering;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.NodeLists;
import com.lowline.compiler.ast.NodeVisitor;
import com.lowline.compiler.ast.Nodes;
import com.lowline.compiler.ast.VisitResult;
import com.lowline.compiler.ast.VisitType;
import com.lowline.compiler.ast.block.MacroExitMarker;
import com.lowline.compiler.ast.block.MacroInsertion;
import com.lowline.compiler.ast.block.StructuredIf;
import com.lowline.compiler.ast.block.WaitDirective;
import com.lowline.compiler.ast.block.WhileLoop;
import com.lowline.compiler.ast.decl.Definition;
import com.lowline.compiler.ast.decl.IncludeDirective;
import com.lowline.compiler.ast.decl.MacroDefinition;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.expr.BinaryOperation;
import com.lowline.compiler.ast.expr.Dereference;
import com.lowline.compiler.ast.expr.Expression;
import com.lowline.compiler.ast.expr.FuncCall;
import com.lowline.compiler.ast.expr.LinePlaceholder;
import com.lowline.compiler.ast.stmt.Assignment;
import com.lowline.compiler.ast.stmt.BreakStatement;
import com.lowline.compiler.ast.stmt.ContinueStatement;
import com.lowline.compiler.ast.stmt.GoToStatement;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.files.FileSystem;
import com.lowline.ir.pass.LinePass;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.logging.Logger;

/**
 * 扩展语言 → 语句行。
 * <p>
 * 一次遍历完成：常量与宏的登记和替换、include 展开、结构化控制流降级、
 * 内置函数替换、变量改名以及单节点常量折叠。结束后程序中只剩 {@link com.lowline.compiler.ast.block.StatementLine}。
 */
public class StructuralLowering implements LinePass {

    private static final Logger LOG = Logger.getLogger(StructuralLowering.class.getName());

    @Override
    public String getName() {
        return "StructuralLowering";
    }

    @Override
    public Program run(Program program, ConversionContext ctx) {
        if (usesTimeBuiltins(program)) {
            ctx.setTimeTracking(true);
        }
        program.accept(new Lowerer(ctx));
        if (!ctx.getMacroStack().isEmpty()) {
            throw new IllegalStateException("Macro call stack not empty after lowering: " + ctx.getMacroStack());
        }
        if (ctx.currentLoop() != -1) {
            throw new IllegalStateException("Loop stack not empty after lowering");
        }
        // 确认只剩语句行
        ControlFlowLowering.lines(program.getElements());
        return program;
    }

    /**
     * 预先扫描 line()/time()，宏体内的调用也算
     */
    private static boolean usesTimeBuiltins(Program program) {
        boolean[] found = {false};
        program.accept((node, type) -> {
            if (type == VisitType.PRE && node instanceof FuncCall && isTimeBuiltin((FuncCall) node)) {
                found[0] = true;
            }
            return VisitResult.UNCHANGED;
        });
        return found[0];
    }

    private static boolean isTimeBuiltin(FuncCall call) {
        String name = call.getFunction().toLowerCase();
        return "line".equals(name) || "time".equals(name);
    }

    private static final class Lowerer implements NodeVisitor {

        private final ConversionContext ctx;
        private final ControlFlowLowering controlFlow;
        private final MacroExpander macros;

        Lowerer(ConversionContext ctx) {
            this.ctx = ctx;
            this.controlFlow = new ControlFlowLowering(ctx);
            this.macros = new MacroExpander(ctx);
        }

        @Override
        public VisitResult visit(AstNode node, VisitType type) {
            return type == VisitType.PRE ? pre(node) : post(node);
        }

        private VisitResult pre(AstNode node) {
            if (node instanceof Definition) {
                return define((Definition) node);
            }
            if (node instanceof MacroDefinition) {
                ctx.addMacro((MacroDefinition) node);
                return VisitResult.remove();
            }
            if (node instanceof MacroInsertion) {
                return VisitResult.replace(macros.expand((MacroInsertion) node));
            }
            if (node instanceof MacroExitMarker) {
                ctx.popMacroFrame();
                return VisitResult.remove();
            }
            if (node instanceof IncludeDirective) {
                return include((IncludeDirective) node);
            }
            if (node instanceof WhileLoop) {
                ctx.pushLoop();
                return VisitResult.UNCHANGED;
            }
            if (node instanceof BreakStatement || node instanceof ContinueStatement) {
                return loopJump(node);
            }
            if (node instanceof GoToStatement) {
                throw ctx.error("Jumping to line numbers is not supported, jump to a label instead",
                        node.getLocation());
            }
            if (node instanceof FuncCall) {
                return builtin((FuncCall) node);
            }
            if (node instanceof Dereference) {
                return dereference((Dereference) node);
            }
            return VisitResult.UNCHANGED;
        }

        private VisitResult post(AstNode node) {
            if (node instanceof Assignment) {
                assign((Assignment) node);
            } else if (node instanceof BinaryOperation) {
                Expression folded = ctx.getStaticOptimizer().optimizeNonRecursive((Expression) node);
                if (folded != null) return VisitResult.replaceAndSkip(folded);
            } else if (node instanceof StructuredIf) {
                return VisitResult.replaceAndSkip(controlFlow.lowerIf((StructuredIf) node));
            } else if (node instanceof WhileLoop) {
                int id = ctx.popLoop();
                return VisitResult.replaceAndSkip(controlFlow.lowerWhile((WhileLoop) node, id));
            } else if (node instanceof WaitDirective) {
                return VisitResult.replaceAndSkip(controlFlow.lowerWait((WaitDirective) node));
            }
            return VisitResult.UNCHANGED;
        }

        // ============ 常量 ============

        private VisitResult define(Definition def) {
            def.setValue(NodeLists.acceptOne(def.getValue(), Expression.class, this));
            ctx.addDefinition(def);
            return VisitResult.remove();
        }

        private VisitResult dereference(Dereference deref) {
            Definition def = ctx.getDefinition(deref.getVariable());
            if (def == null) {
                deref.setVariable(ctx.renameVariable(deref.getVariable()));
                return VisitResult.UNCHANGED;
            }
            Expression value = def.getValue().copy();
            if (deref.hasStep()) {
                if (!(value instanceof Dereference) || ((Dereference) value).hasStep()) {
                    throw ctx.error("Can not increment or decrement the constant '"
                            + deref.getVariable() + "'", deref.getLocation());
                }
                ((Dereference) value).setStep(deref.getStep(), deref.isPrefix());
            }
            return VisitResult.replaceAndSkip(value);
        }

        private void assign(Assignment assign) {
            Definition def = ctx.getDefinition(assign.getVariable());
            if (def == null) {
                assign.setVariable(ctx.renameVariable(assign.getVariable()));
                return;
            }
            Expression value = def.getValue();
            if (!(value instanceof Dereference) || ((Dereference) value).hasStep()) {
                throw ctx.error("Can not assign to the constant '" + assign.getVariable() + "'",
                        assign.getLocation());
            }
            assign.setVariable(((Dereference) value).getVariable());
        }

        // ============ include ============

        private VisitResult include(IncludeDirective node) {
            FileSystem files = ctx.getFileSystem();
            if (files == null || ctx.getParser() == null) {
                throw ctx.error("Can not include '" + node.getFile()
                        + "' without a file system and a parser", node.getLocation());
            }
            int limit = ctx.getConfig().getMaxIncludes();
            if (ctx.nextInclude() > limit) {
                throw ctx.error("Too many includes (limit " + limit + "), is '"
                        + node.getFile() + "' included recursively?", node.getLocation());
            }
            String source;
            try {
                source = files.get(node.getFile());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            LOG.fine("Including " + node.getFile());
            Program included = ctx.getParser().parse(source, node.getFile());
            return VisitResult.replace(included.getElements());
        }

        // ============ 循环跳转与内置函数 ============

        private VisitResult loopJump(AstNode node) {
            int loop = ctx.currentLoop();
            boolean isBreak = node instanceof BreakStatement;
            if (loop == -1) {
                throw ctx.error((isBreak ? "break" : "continue") + " is only allowed inside a loop",
                        node.getLocation());
            }
            String target = isBreak ? ControlFlowLowering.loopEnd(loop) : ControlFlowLowering.loopHead(loop);
            return VisitResult.replaceAndSkip(Nodes.gotoLabel(node.getLocation(), target));
        }

        private VisitResult builtin(FuncCall call) {
            if (!isTimeBuiltin(call)) {
                throw ctx.error("Unknown function '" + call.getFunction() + "'", call.getLocation());
            }
            if (!call.getArguments().isEmpty()) {
                throw ctx.error("Function '" + call.getFunction() + "' takes no arguments", call.getLocation());
            }
            ctx.setTimeTracking(true);
            if ("line".equals(call.getFunction().toLowerCase())) {
                return VisitResult.replaceAndSkip(new LinePlaceholder(call.getLocation()));
            }
            return VisitResult.replaceAndSkip(Nodes.variable(call.getLocation(), ctx.getTimeVariable()));
        }
    }
}
