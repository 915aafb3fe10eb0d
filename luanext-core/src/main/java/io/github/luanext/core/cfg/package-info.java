/**
 * Control-flow graphs of scopes, built by {@link io.github.luanext.core.cfg.CfgBuilder}.
 * <p>
 * Every graph has an entry block {@link io.github.luanext.core.cfg.BlockId#ENTRY B0} and an
 * exit block {@link io.github.luanext.core.cfg.BlockId#EXIT B1}, which holds no statements.
 * Blocks refer to statements by their index in a {@link io.github.luanext.core.cfg.StatementIndex}.
 */
package io.github.luanext.core.cfg;
