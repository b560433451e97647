package works.tessera;

@FunctionalInterface
public interface Teardown {
	void tearDown(Object value) throws Exception;
}
