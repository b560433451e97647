package works.tessera.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares a method as a test definition whose parameters are fixtures,
 * resolved the same way as the parameters of a {@link Fixture} method.
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface Case {
	/**
	 * Defaults to the method name.
	 */
	String name() default "";

	/**
	 * The body is expected to fail. A failure then counts as a success, and a normal return as a failure.
	 */
	boolean expectFailure() default false;

	boolean ignore() default false;

	/**
	 * The name of a no-argument method in the same class returning {@code boolean};
	 * if it returns true at collection time, the case is ignored.
	 */
	String ignoreIf() default "";

	/**
	 * Why the case is ignored.
	 */
	String reason() default "";
}
