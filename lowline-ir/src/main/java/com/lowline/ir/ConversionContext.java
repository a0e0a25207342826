package com.lowline.ir;

import com.lowline.compiler.CompileException;
import com.lowline.compiler.ast.SourceLocation;
import com.lowline.compiler.ast.decl.Definition;
import com.lowline.compiler.ast.decl.MacroDefinition;
import com.lowline.compiler.optimizer.ExpressionInversionOptimizer;
import com.lowline.compiler.optimizer.StaticExpressionOptimizer;
import com.lowline.compiler.optimizer.VariableNameOptimizer;
import com.lowline.compiler.parser.SourceParser;
import com.lowline.ir.files.FileSystem;
import com.lowline.ir.packing.LineLengthEstimator;
import com.lowline.ir.packing.LinePacker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次转换的全部状态：计数器、循环栈、宏调用栈、常量与宏表，以及协作者。
 * 每次转换新建一个，不在转换之间共享。
 */
public class ConversionContext {

    /** 行号计数器使用的保留变量 */
    public static final String TIME_VARIABLE = "_time";

    private final ConverterConfig config;
    private final FileSystem fileSystem;
    private final SourceParser parser;

    private final StaticExpressionOptimizer staticOptimizer = new StaticExpressionOptimizer();
    private final ExpressionInversionOptimizer inversionOptimizer = new ExpressionInversionOptimizer();
    private final VariableNameOptimizer nameOptimizer = new VariableNameOptimizer();

    private final Map<String, Definition> definitions = new HashMap<>();
    private final Map<String, MacroDefinition> macros = new HashMap<>();
    private final List<Integer> loopStack = new ArrayList<>();
    private final List<String> macroStack = new ArrayList<>();

    private int ifCounter = 0;
    private int loopCounter = 0;
    private int waitCounter = 0;
    private int macroInsertions = 0;
    private int includes = 0;

    private boolean timeTracking = false;
    private final String timeVariable;
    private Map<String, Integer> jumpLabels = Collections.emptyMap();

    public ConversionContext(ConverterConfig config, FileSystem fileSystem, SourceParser parser) {
        this.config = config;
        this.fileSystem = fileSystem;
        this.parser = parser;
        // 先占用保留变量，保证它拿到最短的名字
        this.timeVariable = renameVariable(TIME_VARIABLE);
    }

    public ConverterConfig getConfig() {
        return config;
    }

    public FileSystem getFileSystem() {
        return fileSystem;
    }

    public SourceParser getParser() {
        return parser;
    }

    public StaticExpressionOptimizer getStaticOptimizer() {
        return staticOptimizer;
    }

    public ExpressionInversionOptimizer getInversionOptimizer() {
        return inversionOptimizer;
    }

    /**
     * 变量改名：启用缩短时取短名，否则只转小写
     */
    public String renameVariable(String name) {
        if (config.isShortenNames()) {
            return nameOptimizer.optimizeVarName(name);
        }
        return name.toLowerCase();
    }

    /**
     * 短名 → 原名
     */
    public Map<String, String> getVariableTranslations() {
        return nameOptimizer.getReversalTable();
    }

    // ============ 常量与宏 ============

    public Definition getDefinition(String name) {
        return definitions.get(name.toLowerCase());
    }

    /**
     * 同名时覆盖先前的定义
     */
    public void addDefinition(Definition definition) {
        definitions.put(definition.getName().toLowerCase(), definition);
    }

    public MacroDefinition getMacro(String name) {
        return macros.get(name.toLowerCase());
    }

    /**
     * 同名时覆盖先前的宏
     */
    public void addMacro(MacroDefinition macro) {
        macros.put(macro.getName().toLowerCase(), macro);
    }

    // ============ 计数器 ============

    public int nextIfId() {
        return ++ifCounter;
    }

    public int nextWaitId() {
        return ++waitCounter;
    }

    public int nextMacroInsertion() {
        return ++macroInsertions;
    }

    public int getMacroInsertions() {
        return macroInsertions;
    }

    public int nextInclude() {
        return ++includes;
    }

    // ============ 循环栈 ============

    /**
     * 分配新的循环 id 并压栈
     */
    public int pushLoop() {
        int id = ++loopCounter;
        loopStack.add(id);
        return id;
    }

    public int popLoop() {
        if (loopStack.isEmpty()) {
            throw new IllegalStateException("Loop stack underflow");
        }
        return loopStack.remove(loopStack.size() - 1);
    }

    /**
     * 当前最内层循环 id，不在循环内时返回 -1
     */
    public int currentLoop() {
        return loopStack.isEmpty() ? -1 : loopStack.get(loopStack.size() - 1);
    }

    // ============ 宏调用栈 ============

    public void pushMacroFrame(String frame) {
        macroStack.add(frame);
    }

    public String popMacroFrame() {
        if (macroStack.isEmpty()) {
            throw new IllegalStateException("Macro exit marker without active macro");
        }
        return macroStack.remove(macroStack.size() - 1);
    }

    public List<String> getMacroStack() {
        return Collections.unmodifiableList(macroStack);
    }

    /**
     * 构造结构性错误，在宏展开内部时附带宏调用栈
     */
    public CompileException error(String message, SourceLocation location) {
        if (macroStack.isEmpty()) {
            return new CompileException(message, location);
        }
        return new CompileException(message + " in macro: " + String.join(" > ", macroStack), location);
    }

    // ============ 行号计数 ============

    public boolean isTimeTracking() {
        return timeTracking;
    }

    public void setTimeTracking(boolean timeTracking) {
        this.timeTracking = timeTracking;
    }

    public String getTimeVariable() {
        return timeVariable;
    }

    /**
     * 行首计数语句及其分隔符占用的字符数
     */
    public int timeCounterWidth() {
        return timeVariable.length() + 3;
    }

    /**
     * 当前生效的单行字符预算
     */
    public int getLineBudget() {
        int budget = config.getMaxLineLength();
        return timeTracking ? budget - timeCounterWidth() : budget;
    }

    // ============ 标签表 ============

    public Map<String, Integer> getJumpLabels() {
        return jumpLabels;
    }

    public void setJumpLabels(Map<String, Integer> jumpLabels) {
        this.jumpLabels = Collections.unmodifiableMap(jumpLabels);
    }

    // ============ 打包 ============

    public LineLengthEstimator createEstimator() {
        return new LineLengthEstimator(config.getPrintMode(), config.getMaxLines());
    }

    public LinePacker createPacker() {
        return new LinePacker(getLineBudget(), createEstimator());
    }
}
