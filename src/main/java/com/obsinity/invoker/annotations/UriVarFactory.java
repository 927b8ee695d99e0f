package com.obsinity.invoker.annotations;

import org.springframework.core.annotation.AliasFor;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the single static factory used to build a value object from a raw URI variable.
 *
 * <p>When present, the named method is the only construction strategy considered for the type; constructors and
 * other factories are ignored. The method must be public, static, not overloaded, and take exactly one required
 * parameter.
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * @UriVarFactory("fromString")
 * public final class CompanyId {
 *     public CompanyId(String value) { ... }
 *     public static CompanyId fromString(String value) { ... }
 *     public static CompanyId of(String value) { ... }   // never used for URI binding
 * }
 * }</pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface UriVarFactory {

	/** Factory method name (shorthand). */
	@AliasFor("method")
	String value() default "";

	/** Same as {@link #value()}. */
	@AliasFor("value")
	String method() default "";
}
