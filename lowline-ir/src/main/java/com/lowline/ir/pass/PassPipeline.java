package com.lowline.ir.pass;

import com.lowline.compiler.ast.AstNode;
import com.lowline.compiler.ast.Element;
import com.lowline.compiler.ast.base.LineProgram;
import com.lowline.compiler.ast.block.StatementLine;
import com.lowline.compiler.ast.decl.Program;
import com.lowline.compiler.ast.expr.LinePlaceholder;
import com.lowline.compiler.ast.stmt.GoToLabelStatement;
import com.lowline.compiler.formatter.LinePrinter;
import com.lowline.compiler.formatter.PrinterContext;
import com.lowline.ir.ConversionContext;
import com.lowline.ir.lowering.StructuralLowering;
import com.lowline.ir.pass.line.ConstantRefolding;
import com.lowline.ir.pass.line.FallthroughJumpRemoval;
import com.lowline.ir.pass.line.JumpChainCollapsing;
import com.lowline.ir.pass.line.JumpTargetSubstitution;
import com.lowline.ir.pass.line.LabelTableBuilding;
import com.lowline.ir.pass.line.LineCountValidation;
import com.lowline.ir.pass.line.LineMerging;
import com.lowline.ir.pass.line.LineNumberSubstitution;
import com.lowline.ir.pass.line.TerminalJumpElision;
import com.lowline.ir.pass.line.TerminalJumpInsertion;
import com.lowline.ir.pass.line.TimeTrackingInjection;
import com.lowline.ir.pass.line.UnusedLabelRemoval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 转换 pass 管线。
 * 串联完整流程：扩展语言 → 语句行 → 标签解析与合并 → 基础语言程序。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<LinePass> passes = new ArrayList<>();
    private final ProgramEmitter emitter = new ProgramEmitter();

    public PassPipeline() {
    }

    /**
     * 创建默认管线，顺序不可调换：行号只有在合并和清理之后才确定。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new StructuralLowering());
        pipeline.addPass(new TerminalJumpInsertion());
        pipeline.addPass(new JumpChainCollapsing());
        pipeline.addPass(new UnusedLabelRemoval());
        pipeline.addPass(new LineMerging());
        pipeline.addPass(new FallthroughJumpRemoval());
        pipeline.addPass(new LabelTableBuilding());
        pipeline.addPass(new JumpTargetSubstitution());
        pipeline.addPass(new LineNumberSubstitution());
        pipeline.addPass(new ConstantRefolding());
        pipeline.addPass(new TimeTrackingInjection());
        pipeline.addPass(new TerminalJumpElision());
        pipeline.addPass(new LineCountValidation());
        return pipeline;
    }

    public void addPass(LinePass pass) {
        passes.add(pass);
    }

    public List<LinePass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * 依次执行所有 pass，然后输出基础语言程序。
     * 任何 pass 抛出的异常都会终止整个转换。
     * 开启 debug 时，在行合并之后和转换结束时各输出一次语句行。
     */
    public LineProgram execute(Program program, ConversionContext ctx) {
        for (LinePass pass : passes) {
            program = pass.run(program, ctx);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(pass.getName() + ": " + program.getElements().size() + " element(s)");
            }
            if (ctx.getConfig().isDebug() && pass instanceof LineMerging) {
                LOG.info("===== after " + pass.getName() + " =====\n" + dump(program, ctx));
            }
        }
        if (ctx.getConfig().isDebug()) {
            LOG.info("===== final program =====\n" + dump(program, ctx));
        }
        return emitter.emit(program);
    }

    /**
     * 输出语句行（调试用），未解析的标签和行号引用按原样显示
     */
    private static String dump(Program program, ConversionContext ctx) {
        LinePrinter printer = new LinePrinter(ctx.getConfig().getPrintMode());
        printer.setExtension(PassPipeline::printUnresolved);
        StringBuilder sb = new StringBuilder();
        for (Element element : program.getElements()) {
            if (!(element instanceof StatementLine)) {
                sb.append("<").append(element.getClass().getSimpleName()).append(">\n");
                continue;
            }
            StatementLine line = (StatementLine) element;
            if (line.hasLabel()) {
                sb.append(line.getLabel()).append(": ");
            }
            sb.append(printer.printLine(line.getStatements())).append('\n');
        }
        return sb.toString();
    }

    private static boolean printUnresolved(AstNode node, PrinterContext ctx) {
        if (node instanceof GoToLabelStatement) {
            ctx.append("goto");
            ctx.append(((GoToLabelStatement) node).getLabel());
            return true;
        }
        if (node instanceof LinePlaceholder) {
            ctx.append("line()");
            return true;
        }
        return false;
    }
}
