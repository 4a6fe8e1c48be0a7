/**
 * MTL text-format engine: scanner, lexer, value caster, parser, and the metadata store that runs them.
 *
 * <p>The pipeline is lazy up to the parser, which collects records eagerly so it can reject empty documents.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.landsat.application.metadata;
