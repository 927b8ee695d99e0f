package com.obsinity.invoker.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares that a parameter accepts any one of several types.
 *
 * <p>Acceptance against a union is strict per member: a {@code @UnionOf({String.class, Integer.class})} parameter
 * takes a {@code String} or an {@code Integer} as-is and rejects a {@code Double}, where a plain {@code int}
 * parameter would have coerced a numeric string. Every member must be assignable to the declared parameter type,
 * which is usually {@link Object}.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface UnionOf {
	Class<?>[] value();
}
