package com.example.cuneiform.pipeline.normalize;

/**
 * One text-to-text step of the normaliser. Rules see the whole record text at once.
 */
@FunctionalInterface
public interface RewriteRule {

    String apply(String text, RewriteContext context);
}
