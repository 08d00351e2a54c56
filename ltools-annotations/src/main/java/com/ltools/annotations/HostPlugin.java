package com.ltools.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the identity of a host plugin capability. The plugin module reads this annotation
 * when building plugin metadata, so builtin plugins keep their id, name and menu flags next to
 * the implementation instead of in a separate descriptor.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface HostPlugin {

    /** Globally unique plugin id (e.g. {@code datetime.builtin}). Also used in {@code /plugins/<id>} routes. */
    String id();

    /** Display name for menus and the plugin market. */
    String name();

    String version() default "1.0.0";

    String author() default "";

    String description() default "";

    /** Icon key; empty means the host resolves one from its icon table. */
    String icon() default "";

    /** Search keywords used for plugin discovery. */
    String[] keywords() default {};

    /** Whether the plugin has its own page. Plugins without a page never appear in the menu. */
    boolean hasPage() default true;

    /** Whether the plugin page is listed in the navigation menu. */
    boolean showInMenu() default true;
}
