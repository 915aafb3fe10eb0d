/**
 * Static single assignment form over the statements of a scope.
 * <p>
 * The form does not rewrite the syntax tree. Instead, every definition and use of a
 * variable at a statement is given a {@link io.github.luanext.core.ssa.SsaVar version},
 * and {@link io.github.luanext.core.ssa.PhiFunction phi functions} are recorded at the
 * start of the blocks where versions meet. Version {@code 0} of a name stands for
 * its value on entry to the scope.
 * <p>
 * Only names defined somewhere in the scope are tracked. Function parameters, globals
 * and upvalues are read as version {@code 0} or not at all.
 */
package io.github.luanext.core.ssa;
