package org.minic.compiler;

import org.minic.compiler.api.CompilationException;
import org.minic.compiler.api.CompilerErrorCode;
import org.minic.compiler.api.IAstLowering;
import org.minic.compiler.config.ConfigLoader;
import org.minic.compiler.config.LoweringConfig;
import org.minic.compiler.diagnostics.CompilerLogger;
import org.minic.compiler.diagnostics.Diagnostic;
import org.minic.compiler.diagnostics.DiagnosticsEngine;
import org.minic.compiler.frontend.ast.AstInvariantException;
import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.ast.AstOperatorType;
import org.minic.compiler.frontend.ast.AstPrinter;
import org.minic.compiler.frontend.ast.AstValidator;
import org.minic.compiler.frontend.cst.CompileUnitContext;
import org.minic.compiler.frontend.lowering.CstToAstTransformer;
import org.minic.compiler.frontend.lowering.LoweringException;

/**
 * The lowering stage of the compiler. It runs the CST-to-AST transformation, optionally validates
 * the result and converts every failure into a {@link CompilationException}.
 * <p>
 * Diagnostics are collected per call, so one instance can lower several compile units
 * concurrently. Only the verbosity set through {@link #setVerbosity(int)} is shared.
 */
public class AstLowering implements IAstLowering {

    private final LoweringConfig config;
    private final CstToAstTransformer transformer;
    private final AstValidator validator = new AstValidator();
    private volatile int verbosity = -1;

    /**
     * Creates a lowering stage configured from {@code minic.conf} and {@code reference.conf}.
     */
    public AstLowering() {
        this(LoweringConfig.fromConfig(ConfigLoader.load()));
    }

    /**
     * Creates a lowering stage with explicit settings.
     * @param config The lowering settings.
     */
    public AstLowering(LoweringConfig config) {
        this(config, new CstToAstTransformer());
    }

    /**
     * Creates a lowering stage with explicit settings and transformer.
     * @param config The lowering settings.
     * @param transformer The transformer to run.
     */
    public AstLowering(LoweringConfig config, CstToAstTransformer transformer) {
        this.config = config;
        this.transformer = transformer;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Lowering stops at the first error; the exception message is the diagnostics summary.
     */
    @Override
    public AstNode lower(CompileUnitContext root, String unitName) throws CompilationException {
        int level = verbosity >= 0 ? verbosity : config.verbosity();
        if (level >= 0) {
            CompilerLogger.setLevel(level);
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        AstNode ast = null;
        try {
            ast = transformer.transform(root, unitName, diagnostics);
        } catch (LoweringException e) {
            diagnostics.reportError(e.getCode(), e.getMessage(), unitName, e.getLine());
        } catch (AstInvariantException e) {
            diagnostics.reportError(CompilerErrorCode.INTERNAL_INVARIANT_VIOLATION, e.getMessage(), unitName, e.getLine());
        } catch (StackOverflowError e) {
            reportTooDeep(diagnostics, unitName, "lowering");
        } catch (RuntimeException e) {
            // Anything else is a defect in the transformer; keep the cause for the stack trace.
            diagnostics.reportError(CompilerErrorCode.UNKNOWN_ERROR,
                    "Unexpected failure while lowering: " + e, unitName, AstNode.NO_LINE);
            CompilerLogger.error(diagnostics.summary());
            throw new CompilationException(diagnostics.summary(), e);
        }

        if (ast != null && config.validateAst()) {
            try {
                for (String violation : validator.validate(ast)) {
                    diagnostics.reportError(CompilerErrorCode.AST_VALIDATION_FAILED, violation, unitName, AstNode.NO_LINE);
                }
            } catch (StackOverflowError e) {
                reportTooDeep(diagnostics, unitName, "validation");
            }
        }

        if (diagnostics.hasErrors()) {
            CompilerLogger.error(diagnostics.summary());
            throw new CompilationException(diagnostics.summary());
        }

        for (Diagnostic warning : diagnostics.getDiagnostics()) {
            CompilerLogger.warn(warning.toString());
        }
        CompilerLogger.debug(summarize(ast, unitName));
        if (config.dumpAst() && CompilerLogger.isEnabled(CompilerLogger.DEBUG)) {
            try {
                CompilerLogger.debug(AstPrinter.dump(ast));
            } catch (StackOverflowError e) {
                reportTooDeep(diagnostics, unitName, "AST dump");
                CompilerLogger.error(diagnostics.summary());
                throw new CompilationException(diagnostics.summary());
            }
        }
        return ast;
    }

    /**
     * The tree passes are recursive; input nested deeper than the thread stack allows ends up here.
     */
    private static void reportTooDeep(DiagnosticsEngine diagnostics, String unitName, String phase) {
        diagnostics.reportError(CompilerErrorCode.NESTING_TOO_DEEP,
                "Expression nesting too deep for " + phase, unitName, AstNode.NO_LINE);
    }

    private static String summarize(AstNode ast, String unitName) {
        long globals = ast.children().stream().filter(n -> n.kind() == AstOperatorType.DECL_STMT).count();
        long functions = ast.children().stream().filter(n -> n.kind() == AstOperatorType.FUNC_DEF).count();
        return String.format("AstLowering: %s lowered, %d global declaration(s), %d function(s)", unitName, globals, functions);
    }

    /**
     * {@inheritDoc}
     * <p>
     * A level set here takes precedence over the configured verbosity; -1 restores the configured one.
     */
    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
