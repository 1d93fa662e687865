package org.minic.compiler.config;

import com.typesafe.config.Config;

/**
 * Settings of the lowering stage, read from the {@code minic.lowering} section.
 *
 * @param validateAst Whether the tree is re-checked by the AST validator after lowering.
 * @param dumpAst     Whether the indented AST dump is logged after a successful run.
 * @param verbosity   The compiler logger level to apply, or -1 to keep the current level.
 */
public record LoweringConfig(boolean validateAst, boolean dumpAst, int verbosity) {

    /** The configuration path of the lowering section. */
    public static final String SECTION = "minic.lowering";

    /** Defaults matching {@code reference.conf}. */
    public static final LoweringConfig DEFAULT = new LoweringConfig(false, false, -1);

    /**
     * Reads the lowering section. Missing keys fall back to {@link #DEFAULT}.
     *
     * @param config The root configuration.
     * @return The lowering settings.
     */
    public static LoweringConfig fromConfig(Config config) {
        if (!config.hasPath(SECTION)) {
            return DEFAULT;
        }
        Config section = config.getConfig(SECTION);
        boolean validate = section.hasPath("validate-ast") ? section.getBoolean("validate-ast") : DEFAULT.validateAst();
        boolean dump = section.hasPath("dump-ast") ? section.getBoolean("dump-ast") : DEFAULT.dumpAst();
        int verbosity = section.hasPath("verbosity") ? section.getInt("verbosity") : DEFAULT.verbosity();
        return new LoweringConfig(validate, dump, verbosity);
    }
}
