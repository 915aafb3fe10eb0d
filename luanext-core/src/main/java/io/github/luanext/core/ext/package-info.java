/**
 * {@link io.github.luanext.core.ext.Ext Exts}, typed keys for attaching analysis results
 * to the units they were computed for.
 */
package io.github.luanext.core.ext;
