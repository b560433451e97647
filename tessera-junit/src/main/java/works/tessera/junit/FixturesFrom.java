package works.tessera.junit;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Names the classes whose {@link works.tessera.annotations.Fixture @Fixture} methods
 * provide the parameters of the {@link FixtureTest} methods in a test class.
 * <p>
 * Annotations on superclasses are included too.
 * All the named classes share one registry, so fixtures in one can depend on fixtures in another.
 *
 * @see FixtureTest
 */
@Retention(RUNTIME)
@Target(TYPE)
public @interface FixturesFrom {
	Class<?>[] value();
}
