package com.obsinity.invoker.annotations;

import org.springframework.core.annotation.AliasFor;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a URI variable to a handler parameter under an explicit key.
 *
 * <p>Usage:
 *
 * <pre>
 *   &#64;Invoke
 *   public UserResource load(&#64;UriVar("id") StringUserId userId, &#64;UriVar(name = "companyId") CompanyId company) {
 *       // ...
 *   }
 * </pre>
 *
 * <p>Without this annotation a parameter is still bound when its own name matches a URI variable. An explicit key
 * always wins for the parameter it is placed on.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface UriVar {

	/** URI variable name (shorthand). */
	@AliasFor("name")
	String value() default "";

	/** Same as {@link #value()}. */
	@AliasFor("value")
	String name() default "";
}
