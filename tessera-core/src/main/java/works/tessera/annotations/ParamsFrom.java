package works.tessera.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Makes a {@link Fixture} parametrized.
 * Every case depending on it, directly or indirectly, is expanded once per value in the domain.
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface ParamsFrom {
	/**
	 * The name of a no-argument method in the same class returning the parameter domain,
	 * as a {@link java.util.Collection} or an array.
	 */
	String value();
}
