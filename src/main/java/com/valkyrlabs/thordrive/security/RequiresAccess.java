package com.valkyrlabs.thordrive.security;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.valkyrlabs.model.NodeKind;

/**
 * One access requirement of a guarded operation. Used inside
 * {@link AccessGuarded#value()}.
 *
 * <p>
 * {@link #node()} and {@link #user()} are SpEL expressions evaluated against
 * the method arguments, e.g. {@code "#fileId"}.
 * </p>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({})
public @interface RequiresAccess {

    NodeKind kind();

    /** Expression yielding the node id. */
    String node();

    /** Expression yielding the acting user id. */
    String user() default "#asUser";

    /** When true, a null node id means there is nothing to check. */
    boolean optional() default false;
}
