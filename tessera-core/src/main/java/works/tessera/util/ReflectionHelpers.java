package works.tessera.util;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Type;

import static org.objectweb.asm.Opcodes.ASM9;

public final class ReflectionHelpers {
	private ReflectionHelpers() { }

	/**
	 * Like {@link Class#getDeclaredMethods()}, but in the order they appear in the class file,
	 * which javac makes the same as the source order.
	 * Constructors and static initializers are not included.
	 *
	 * @throws IllegalArgumentException if the class file can't be read
	 */
	public static List<Method> getDeclaredMethodsInOrder(Class<?> type) {
		Map<String, Method> bySignature = new HashMap<>();
		for (Method m: type.getDeclaredMethods()) {
			bySignature.put(m.getName() + Type.getMethodDescriptor(m), m);
		}

		List<String> signaturesInOrder = new ArrayList<>();
		String resourceName = "/" + type.getName().replace('.', '/') + ".class";
		try (InputStream classFile = type.getResourceAsStream(resourceName)) {
			if (classFile == null) {
				throw new IllegalArgumentException("Can't find class file for " + type);
			}
			new ClassReader(classFile).accept(new ClassVisitor(ASM9) {
				@Override
				public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
					signaturesInOrder.add(name + descriptor);
					return null;
				}
			}, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
		} catch (IOException e) {
			throw new IllegalArgumentException("Can't read class file for " + type, e);
		}

		List<Method> result = new ArrayList<>(bySignature.size());
		for (String signature: signaturesInOrder) {
			Method m = bySignature.get(signature);
			if (m != null) {
				result.add(m);
			}
		}
		return result;
	}
}
