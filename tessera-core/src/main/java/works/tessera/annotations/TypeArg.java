package works.tessera.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a parameter of a {@link Fixture} method as a type parameter,
 * making the fixture a template.
 * The parameter receives the value of the fixture named by the corresponding type argument,
 * and the parameter's type is that type parameter's bound.
 */
@Retention(RUNTIME)
@Target(PARAMETER)
public @interface TypeArg {
	/**
	 * The instantiation provides whatever this type argument provides,
	 * rather than the method's declared return type.
	 */
	boolean providesSame() default false;
}
