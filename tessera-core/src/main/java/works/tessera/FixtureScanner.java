package works.tessera;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.annotations.Case;
import works.tessera.annotations.Fixture;
import works.tessera.annotations.Param;
import works.tessera.annotations.ParamsFrom;
import works.tessera.annotations.TypeArg;
import works.tessera.annotations.Use;
import works.tessera.exceptions.InvalidDeclarationException;

import static java.lang.reflect.Modifier.isPrivate;
import static java.lang.reflect.Modifier.isStatic;
import static works.tessera.util.ReflectionHelpers.getDeclaredMethodsInOrder;

/**
 * Finds methods annotated with {@link Fixture} and {@link Case} and turns them into
 * {@link FixtureSpec}s, {@link FixtureTemplate}s, and {@link TestDefinition}s.
 * <p>
 * Methods are scanned in declaration order, subclass first, then each superclass.
 * Static methods are called without a receiver; instance methods are called on the receiver object.
 */
public final class FixtureScanner {
	private final Object receiver;
	private final Class<?> receiverClass;
	private final List<FixtureSpec> fixtures = new ArrayList<>();
	private final List<FixtureTemplate> templates = new ArrayList<>();
	private final List<TestDefinition> definitions = new ArrayList<>();

	private FixtureScanner(@Nullable Object receiver, Class<?> receiverClass) {
		this.receiver = receiver;
		this.receiverClass = receiverClass;
	}

	public static Declarations scan(Object receiver) throws InvalidDeclarationException {
		return new FixtureScanner(receiver, receiver.getClass()).scan();
	}

	/**
	 * If {@code type} has any annotated instance methods,
	 * it is instantiated with its no-argument constructor to serve as the receiver.
	 */
	public static Declarations scan(Class<?> type) throws InvalidDeclarationException {
		Object receiver = null;
		if (hasAnnotatedInstanceMethods(type)) {
			try {
				Constructor<?> ctor = type.getDeclaredConstructor();
				ctor.setAccessible(true);
				receiver = ctor.newInstance();
			} catch (NoSuchMethodException e) {
				throw new InvalidDeclarationException("Class with fixture or case instance methods must have a no-argument constructor: " + type, e);
			} catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
				throw new InvalidDeclarationException("Unable to instantiate " + type, e);
			}
		}
		return new FixtureScanner(receiver, type).scan();
	}

	private Declarations scan() throws InvalidDeclarationException {
		for (Class<?> c = receiverClass; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Method method: getDeclaredMethodsInOrder(c)) {
				Fixture fixture = method.getAnnotation(Fixture.class);
				Case testCase = method.getAnnotation(Case.class);
				if (fixture == null && testCase == null) {
					continue;
				}
				if (fixture != null && testCase != null) {
					throw new InvalidDeclarationException("Method can't be both a fixture and a case: " + method);
				} else if (isPrivate(method.getModifiers())) {
					throw new InvalidDeclarationException("Fixture or case method cannot be private: " + method);
				}

				try {
					if (fixture != null) {
						declareFixture(method, fixture);
					} else {
						declareCase(method, testCase);
					}
				} catch (InvalidDeclarationException e) {
					throw new InvalidDeclarationException("Unable to declare " + c.getSimpleName() + "." + method.getName() + ": " + e.getMessage(), e);
				}
			}
		}
		if (fixtures.isEmpty() && templates.isEmpty() && definitions.isEmpty()) {
			LOGGER.warn("Found no fixture or case methods in {}; may be misconfigured", receiverClass.getSimpleName());
		} else {
			LOGGER.debug("Found {} fixture(s), {} template(s), and {} case(s) in {}",
				fixtures.size(), templates.size(), definitions.size(), receiverClass.getSimpleName());
		}
		return new Declarations(fixtures, templates, definitions);
	}

	private void declareFixture(Method method, Fixture annotation) throws InvalidDeclarationException {
		String name = annotation.name().isEmpty() ? method.getName() : annotation.name();
		Class<?> returnType = method.getReturnType();
		if (returnType == void.class) {
			throw new InvalidDeclarationException("Fixture method must return a value");
		}

		// Type arguments come first in the arguments of an instantiated template
		Parameter[] parameters = method.getParameters();
		List<Parameter> typeArgs = new ArrayList<>();
		List<Parameter> dependencies = new ArrayList<>();
		Parameter paramParameter = null;
		for (Parameter p: parameters) {
			if (p.isAnnotationPresent(Param.class)) {
				if (paramParameter != null) {
					throw new InvalidDeclarationException("Only one parameter can be annotated @" + Param.class.getSimpleName());
				}
				paramParameter = p;
			} else if (p.isAnnotationPresent(TypeArg.class)) {
				typeArgs.add(p);
			} else {
				dependencies.add(p);
			}
		}

		ParamsFrom paramsFrom = method.getAnnotation(ParamsFrom.class);
		List<Object> domain = null;
		if (paramsFrom != null) {
			domain = parameterDomain(paramsFrom.value());
		} else if (paramParameter != null) {
			throw new InvalidDeclarationException("Parameter annotated @" + Param.class.getSimpleName()
				+ " requires the method to be annotated @" + ParamsFrom.class.getSimpleName());
		}

		List<FixtureKey> dependencyKeys = new ArrayList<>(dependencies.size());
		for (Parameter p: dependencies) {
			dependencyKeys.add(keyFor(p));
		}

		// Map each method parameter to where its value comes from
		MethodHandle handle = handleFor(method);
		List<Function<FixtureArguments, Object>> argumentFunctions = new ArrayList<>(parameters.length);
		for (Parameter p: parameters) {
			int typeArgIndex = typeArgs.indexOf(p);
			int dependencyIndex = dependencies.indexOf(p);
			if (p.equals(paramParameter)) {
				argumentFunctions.add(FixtureArguments::param);
			} else if (typeArgIndex >= 0) {
				argumentFunctions.add(args -> args.get(typeArgIndex));
			} else {
				FixtureKey key = dependencyKeys.get(dependencyIndex);
				argumentFunctions.add(args -> args.get(key));
			}
		}
		FixtureConstructor constructor = args -> {
			List<Object> arguments = new ArrayList<>(argumentFunctions.size());
			argumentFunctions.forEach(f -> arguments.add(f.apply(args)));
			return invoke(handle, arguments);
		};
		Teardown teardown = teardownFor(annotation, returnType);

		try {
			if (typeArgs.isEmpty()) {
				fixtures.add(fixtureSpec(name, annotation, returnType, dependencies, dependencyKeys, constructor, teardown, domain));
			} else {
				templates.add(fixtureTemplate(name, annotation, returnType, typeArgs, dependencyKeys, constructor, teardown, domain));
			}
		} catch (IllegalArgumentException e) {
			throw new InvalidDeclarationException(e.getMessage(), e);
		}
	}

	private static FixtureSpec fixtureSpec(
		String name,
		Fixture annotation,
		Class<?> returnType,
		List<Parameter> dependencies,
		List<FixtureKey> dependencyKeys,
		FixtureConstructor constructor,
		@Nullable Teardown teardown,
		@Nullable List<Object> domain
	) throws InvalidDeclarationException {
		FixtureSpec.Builder builder = FixtureSpec.builder(key(name))
			.scope(annotation.scope())
			.provides(wrap(returnType))
			.constructor(constructor);
		for (int i = 0; i < dependencies.size(); i++) {
			builder.dependsOn(dependencyKeys.get(i), wrap(dependencies.get(i).getType()));
		}
		if (teardown != null) {
			builder.teardown(teardown);
		}
		if (domain != null) {
			builder.parameters(domain);
		}
		return builder.build();
	}

	private static FixtureTemplate fixtureTemplate(
		String name,
		Fixture annotation,
		Class<?> returnType,
		List<Parameter> typeArgs,
		List<FixtureKey> dependencyKeys,
		FixtureConstructor constructor,
		@Nullable Teardown teardown,
		@Nullable List<Object> domain
	) {
		FixtureTemplate.Builder builder = FixtureTemplate.builder(name)
			.scope(annotation.scope())
			.provides(wrap(returnType))
			.constructor(constructor);
		for (int i = 0; i < typeArgs.size(); i++) {
			Parameter p = typeArgs.get(i);
			builder.typeParameter(wrap(p.getType()));
			if (p.getAnnotation(TypeArg.class).providesSame()) {
				builder.providesTypeArgument(i);
			}
		}
		dependencyKeys.forEach(builder::dependsOn);
		if (teardown != null) {
			builder.teardown(teardown);
		}
		if (domain != null) {
			builder.parameters(domain);
		}
		return builder.build();
	}

	private void declareCase(Method method, Case annotation) throws InvalidDeclarationException {
		String name = annotation.name().isEmpty() ? method.getName() : annotation.name();
		TestDefinition.Builder builder;
		try {
			builder = TestDefinition.builder(name);
			for (Parameter p: method.getParameters()) {
				if (p.isAnnotationPresent(Param.class) || p.isAnnotationPresent(TypeArg.class)) {
					throw new InvalidDeclarationException("Case parameters can only be fixtures: " + p);
				}
				builder.uses(keyFor(p));
			}
		} catch (IllegalArgumentException e) {
			throw new InvalidDeclarationException(e.getMessage(), e);
		}

		MethodHandle handle = handleFor(method);
		builder.body(args -> {
			List<Object> arguments = new ArrayList<>(args.size());
			for (int i = 0; i < args.size(); i++) {
				arguments.add(args.get(i));
			}
			handle.invokeWithArguments(arguments);
		});
		builder.expectFailure(annotation.expectFailure());

		String reason = annotation.reason().isEmpty() ? null : annotation.reason();
		if (annotation.ignore()) {
			builder.ignoredIf(() -> true, reason);
		} else if (!annotation.ignoreIf().isEmpty()) {
			MethodHandle condition = handleFor(findMethod(annotation.ignoreIf(), 0));
			if (condition.type().returnType() != boolean.class) {
				throw new InvalidDeclarationException("Method " + annotation.ignoreIf() + " must return boolean");
			}
			builder.ignoredIf(() -> {
				try {
					return (boolean) condition.invoke();
				} catch (Throwable e) {
					throw new IllegalStateException("Unable to evaluate ignore condition \"" + annotation.ignoreIf() + "\"", e);
				}
			}, reason);
		}
		definitions.add(builder.build());
	}

	private List<Object> parameterDomain(String methodName) throws InvalidDeclarationException {
		MethodHandle handle = handleFor(findMethod(methodName, 0));
		Object result;
		try {
			result = handle.invoke();
		} catch (Throwable e) {
			throw new InvalidDeclarationException("Unable to compute parameter domain from \"" + methodName + "\"", e);
		}
		List<Object> domain;
		if (result instanceof Collection<?> c) {
			domain = new ArrayList<>(c);
		} else if (result != null && result.getClass().isArray()) {
			domain = new ArrayList<>();
			for (int i = 0; i < Array.getLength(result); i++) {
				domain.add(Array.get(result, i));
			}
		} else {
			throw new InvalidDeclarationException("Parameter domain method \"" + methodName + "\" must return a collection or an array");
		}
		if (domain.isEmpty() || domain.contains(null)) {
			throw new InvalidDeclarationException("Parameter domain from \"" + methodName + "\" must be non-empty and contain no nulls");
		}
		return domain;
	}

	private @Nullable Teardown teardownFor(Fixture annotation, Class<?> returnType) throws InvalidDeclarationException {
		if (!annotation.teardown().isEmpty()) {
			MethodHandle handle = handleFor(findMethod(annotation.teardown(), 1));
			return value -> invoke(handle, List.of(value));
		} else if (returnType.isPrimitive()) {
			return null;
		} else {
			return value -> {
				if (value instanceof AutoCloseable closeable) {
					closeable.close();
				}
			};
		}
	}

	private Method findMethod(String name, int parameterCount) throws InvalidDeclarationException {
		for (Class<?> c = receiverClass; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Method m: c.getDeclaredMethods()) {
				if (m.getName().equals(name) && m.getParameterCount() == parameterCount) {
					return m;
				}
			}
		}
		throw new InvalidDeclarationException("No method \"" + name + "\" with " + parameterCount + " parameter(s) in " + receiverClass.getSimpleName());
	}

	private MethodHandle handleFor(Method method) throws InvalidDeclarationException {
		MethodHandle handle;
		try {
			method.setAccessible(true);
			handle = LOOKUP.unreflect(method);
		} catch (IllegalAccessException | RuntimeException e) {
			throw new InvalidDeclarationException("Unable to access method " + method, e);
		}
		if (isStatic(method.getModifiers())) {
			return handle;
		} else if (receiver == null) {
			throw new InvalidDeclarationException("Instance method requires a receiver object: " + method);
		} else {
			return handle.bindTo(receiver);
		}
	}

	/**
	 * @return the key of the fixture that provides values for {@code p}, named by {@link Use} or by the parameter name
	 */
	public static FixtureKey keyFor(Parameter p) throws InvalidDeclarationException {
		Use use = p.getAnnotation(Use.class);
		if (use != null) {
			FixtureKey key = key(use.value());
			if (use.of().length == 0) {
				return key;
			}
			List<FixtureKey> typeArguments = new ArrayList<>(use.of().length);
			for (String arg: use.of()) {
				typeArguments.add(key(arg));
			}
			return key.instantiatedWith(typeArguments);
		} else if (p.isNamePresent()) {
			return key(p.getName());
		} else {
			throw new InvalidDeclarationException("Parameter name not available; compile with -parameters or annotate with @"
				+ Use.class.getSimpleName() + ": " + p);
		}
	}

	private static FixtureKey key(String name) throws InvalidDeclarationException {
		try {
			return FixtureKey.of(name);
		} catch (IllegalArgumentException e) {
			throw new InvalidDeclarationException(e.getMessage(), e);
		}
	}

	private static Object invoke(MethodHandle handle, List<Object> arguments) throws Exception {
		try {
			return handle.invokeWithArguments(arguments);
		} catch (Exception | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new UndeclaredThrowableException(e);
		}
	}

	private static boolean hasAnnotatedInstanceMethods(Class<?> type) {
		for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
			boolean found = Arrays.stream(c.getDeclaredMethods())
				.filter(m -> !isStatic(m.getModifiers()))
				.anyMatch(m -> m.isAnnotationPresent(Fixture.class)
					|| m.isAnnotationPresent(Case.class)
					|| m.isAnnotationPresent(ParamsFrom.class));
			if (found) {
				return true;
			}
		}
		return false;
	}

	private static Class<?> wrap(Class<?> type) {
		return MethodType.methodType(type).wrap().returnType();
	}

	private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();
	private static final Logger LOGGER = LoggerFactory.getLogger(FixtureScanner.class);
}
