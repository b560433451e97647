package works.tessera.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks the parameter of a {@link Fixture} method that receives the value
 * chosen from the fixture's {@link ParamsFrom parameter domain} for the current case.
 */
@Retention(RUNTIME)
@Target(PARAMETER)
public @interface Param {
}
