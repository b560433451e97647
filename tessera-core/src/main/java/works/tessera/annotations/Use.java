package works.tessera.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Names the fixture that provides a parameter's value,
 * for when it differs from the parameter name or is an instantiation of a template.
 * <p>
 * For example, {@code @Use(value = "Global", of = "database")} names {@code Global<database>}.
 */
@Retention(RUNTIME)
@Target(PARAMETER)
public @interface Use {
	String value();

	/**
	 * The type arguments, if the fixture is a template.
	 */
	String[] of() default {};
}
