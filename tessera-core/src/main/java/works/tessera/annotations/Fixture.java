package works.tessera.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import works.tessera.Scope;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares a method as the constructor of a fixture.
 * <p>
 * Each parameter of the method is a dependency on another fixture,
 * named by {@link Use} or, by default, by the parameter's own name.
 * The parameter's type is the capability the dependency must provide.
 * A parameter annotated with {@link Param} receives the fixture's own parameter value instead,
 * and one annotated with {@link TypeArg} makes the fixture a template.
 * <p>
 * If the method's value implements {@link AutoCloseable} and there's no {@link #teardown},
 * the value is closed as its teardown.
 *
 * @see works.tessera.FixtureScanner
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface Fixture {
	/**
	 * Defaults to the method name.
	 */
	String name() default "";

	Scope scope() default Scope.FRESH;

	/**
	 * The name of a method in the same class, taking the fixture value as its only parameter,
	 * to be called to tear the value down.
	 */
	String teardown() default "";
}
