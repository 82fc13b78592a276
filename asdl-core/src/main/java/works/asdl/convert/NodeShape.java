package works.asdl.convert;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import works.asdl.exceptions.InvalidNodeTypeException;

import static java.lang.invoke.MethodType.methodType;

/**
 * The structure of one native node record type:
 * its components in declaration order, and a handle on its canonical constructor.
 *
 * @param name the record's simple name, which is also its grammar constructor name
 */
public record NodeShape(
	String name,
	Class<? extends Record> type,
	List<Component> components,
	MethodHandle constructor
) {
	public NodeShape {
		components = List.copyOf(components);
	}

	public static NodeShape of(Class<? extends Record> recordType, MethodHandles.Lookup lookup) {
		RecordComponent[] recordComponents = recordType.getRecordComponents();
		List<Component> components = IntStream.range(0, recordComponents.length)
			.mapToObj(i -> Component.of(recordComponents[i], i, lookup))
			.toList();
		MethodHandle mh;
		try {
			mh = lookup.findConstructor(recordType, methodType(void.class, Stream.of(recordComponents)
				.map(RecordComponent::getType).toArray(Class<?>[]::new)
			));
		} catch (NoSuchMethodException e) {
			throw new AssertionError("Canonical constructor must exist for " + recordType);
		} catch (IllegalAccessException e) {
			throw new InvalidNodeTypeException("Can't access canonical constructor of " + recordType, e);
		}
		MethodHandle spreader = mh
			.asSpreader(Object[].class, recordComponents.length)
			.asType(methodType(Object.class, Object[].class));
		return new NodeShape(recordType.getSimpleName(), recordType, components, spreader);
	}

	public Optional<Component> findComponent(String componentName) {
		return components.stream()
			.filter(c -> c.name().equals(componentName))
			.findFirst();
	}

	/**
	 * @param args one per component, in declaration order
	 */
	public Object instantiate(Object[] args) {
		try {
			return (Object) constructor.invokeExact(args);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unexpected exception constructing " + name, e);
		}
	}

	@Override
	public String toString() {
		return "NodeShape(" + name + ")";
	}

	/**
	 * @param index position of this component in the canonical constructor
	 */
	public record Component(
		String name,
		int index,
		Class<?> type,
		Type genericType,
		MethodHandle accessor
	) {
		static Component of(RecordComponent rc, int index, MethodHandles.Lookup lookup) {
			MethodHandle mh;
			try {
				mh = lookup.unreflect(rc.getAccessor());
			} catch (IllegalAccessException e) {
				throw new InvalidNodeTypeException("Can't access accessor " + rc.getAccessor() + " of " + rc.getDeclaringRecord(), e);
			}
			return new Component(
				rc.getName(),
				index,
				rc.getType(),
				rc.getGenericType(),
				mh.asType(methodType(Object.class, Object.class)));
		}

		public Object read(Object node) {
			try {
				return (Object) accessor.invokeExact(node);
			} catch (RuntimeException | Error e) {
				throw e;
			} catch (Throwable e) {
				throw new IllegalStateException("Unexpected exception reading " + name, e);
			}
		}
	}
}
