package com.obsinity.invoker.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the entry point of an invokable processor or provider.
 *
 * <p>A registered handler that does not implement the fixed {@code StateProcessor} / {@code StateProvider} contract
 * but exposes exactly one public {@code @Invoke} method (or, lacking any, exactly one public method named
 * {@code invoke}) is called through dynamic parameter binding.
 *
 * <pre>{@code
 * @Component
 * public class CreateUserProcessor {
 *     @Invoke
 *     public UserResource create(UserResource data, @UriVar("companyId") CompanyId companyId) { ... }
 * }
 * }</pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Invoke {}
