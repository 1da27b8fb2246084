package com.valkyrlabs.thordrive.security;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a hierarchy operation: the body runs under the hierarchy lock and only
 * after every listed {@link RequiresAccess} has passed.
 *
 * @see AccessGuardAspect
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface AccessGuarded {

    /** Requirements, checked in declaration order. */
    RequiresAccess[] value() default {};

    /** Exclusive lock when true, shared lock otherwise. */
    boolean mutates() default true;
}
