package works.tessera.junit;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.Extension;
import org.junit.jupiter.api.extension.ExtensionConfigurationException;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.jupiter.api.extension.TestTemplateInvocationContext;
import org.junit.jupiter.api.extension.TestTemplateInvocationContextProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.FixtureArguments;
import works.tessera.FixtureKey;
import works.tessera.ScopeStore.CaseScope;
import works.tessera.TeardownFailure;
import works.tessera.TestCase;
import works.tessera.exceptions.FixtureConstructionException;
import works.tessera.exceptions.InvalidDeclarationException;
import works.tessera.exceptions.InvalidRegistryException;
import works.tessera.logging.MappedDiagnosticContext.MDCScope;

import static works.tessera.logging.MappedDiagnosticContext.setupMDC;

/**
 * Implements the {@link FixtureTest} annotation.
 */
public class FixtureInvocationContextProvider implements TestTemplateInvocationContextProvider {
	private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(FixtureInvocationContextProvider.class);

	@Override
	public boolean supportsTestTemplate(ExtensionContext context) {
		return context.getTestMethod().isPresent();
	}

	@Override
	public Stream<TestTemplateInvocationContext> provideTestTemplateInvocationContexts(ExtensionContext context) {
		Method method = context.getRequiredTestMethod();
		FixtureSession session = sessionFor(context);
		Map<Integer, FixtureKey> keysByIndex;
		try {
			keysByIndex = session.fixtureParameters(method);
		} catch (InvalidDeclarationException e) {
			throw new ExtensionConfigurationException("Invalid fixture parameter of " + method.getName() + ": " + e.getMessage(), e);
		}
		List<TestCase> cases = session.casesFor(method);
		LOGGER.debug("{} expands to {} case(s)", method.getName(), cases.size());
		return cases.stream().map(testCase -> new TestTemplateInvocationContext() {
			@Override
			public String getDisplayName(int invocationIndex) {
				return "[" + invocationIndex + "] " + testCase.name();
			}

			@Override
			public List<Extension> getAdditionalExtensions() {
				return List.of(new CaseParameterResolver(session, testCase, keysByIndex));
			}
		});
	}

	/**
	 * One session per test class, stored where JUnit will close it when the class completes.
	 */
	private static FixtureSession sessionFor(ExtensionContext context) {
		ExtensionContext classContext = context;
		while (classContext.getTestMethod().isPresent()) {
			classContext = classContext.getParent().orElseThrow();
		}
		Class<?> testClass = context.getRequiredTestClass();
		return classContext.getStore(NAMESPACE).getOrComputeIfAbsent(testClass, c -> {
			try {
				return FixtureSession.forClass(testClass);
			} catch (InvalidRegistryException e) {
				throw new ExtensionConfigurationException("Invalid fixtures for " + testClass.getSimpleName() + ": " + e.getMessage(), e);
			}
		}, FixtureSession.class);
	}

	/**
	 * Resolves all the fixture parameters of one invocation together on first demand,
	 * and tears them down after the invocation.
	 */
	private static final class CaseParameterResolver implements ParameterResolver, AfterEachCallback {
		private final FixtureSession session;
		private final TestCase testCase;
		private final Map<Integer, FixtureKey> keysByIndex;
		private CaseScope scope;
		private FixtureArguments arguments;
		private FixtureConstructionException failure;

		CaseParameterResolver(FixtureSession session, TestCase testCase, Map<Integer, FixtureKey> keysByIndex) {
			this.session = session;
			this.testCase = testCase;
			this.keysByIndex = keysByIndex;
		}

		@Override
		public boolean supportsParameter(ParameterContext pc, ExtensionContext ec) {
			return keysByIndex.containsKey(pc.getIndex());
		}

		@Override
		public Object resolveParameter(ParameterContext pc, ExtensionContext ec) throws ParameterResolutionException {
			FixtureKey key = keysByIndex.get(pc.getIndex());
			if (key == null) {
				throw new ParameterResolutionException("Parameter not bound: " + pc.getParameter());
			}
			if (scope == null) {
				scope = session.store().openCase(testCase);
				try (MDCScope ignored = setupMDC(testCase.name())) {
					arguments = scope.resolveParameters();
				} catch (FixtureConstructionException e) {
					LOGGER.warn("Setup failed for {}: {}", testCase.name(), e.getMessage());
					failure = e;
				}
			}
			if (failure != null) {
				throw new ParameterResolutionException(failure.getMessage(), failure);
			}
			return arguments.get(key);
		}

		@Override
		public void afterEach(ExtensionContext context) {
			if (scope == null) {
				return;
			}
			List<TeardownFailure> failures;
			try (MDCScope ignored = setupMDC(testCase.name())) {
				failures = scope.tearDown();
			}
			for (TeardownFailure f: failures) {
				LOGGER.warn("Teardown of {} failed after {}", f.key(), testCase.name(), f.cause());
				context.publishReportEntry("tessera.teardownFailure", f.key() + ": " + f.cause());
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FixtureInvocationContextProvider.class);
}
