package confetti.lang;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@link DirectiveMapping} of a record class, derived from its components.
 *
 * <p>Components are read in declaration order and written in declaration
 * order, positional arguments first.
 */
final class RecordMapping<T> implements DirectiveMapping<T> {

    private static final Logger log = LoggerFactory.getLogger(RecordMapping.class);

    private final Class<T> type;
    private final Constructor<T> constructor;
    private final List<Method> accessors;
    private final List<FieldBinding> bindings;
    private final List<Integer> writeOrder;

    private RecordMapping(Class<T> type, Constructor<T> constructor, List<Method> accessors, List<FieldBinding> bindings) {
        this.type = type;
        this.constructor = constructor;
        this.accessors = accessors;
        this.bindings = bindings;

        var order = new ArrayList<Integer>();
        for (var i = 0; i < bindings.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingInt(i -> bindings.get(i) instanceof ArgumentBinding argument ? argument.getIndex() : Integer.MAX_VALUE));
        this.writeOrder = List.copyOf(order);
    }

    static <T> RecordMapping<T> of(Class<T> type, ConfMapper mapper) {
        if (!type.isRecord()) {
            throw new MapperException("Not a record: " + type.getName());
        }

        var components = type.getRecordComponents();
        var accessors = new ArrayList<Method>();
        var bindings = new ArrayList<FieldBinding>();
        var argumentIndexes = new ArrayList<Integer>();
        for (var component : components) {
            var accessor = component.getAccessor();
            accessor.setAccessible(true);
            accessors.add(accessor);

            var binding = bindingFor(type, component, mapper);
            if (binding instanceof ArgumentBinding argument) {
                argumentIndexes.add(argument.getIndex());
            }
            bindings.add(binding);
        }

        argumentIndexes.sort(null);
        for (var i = 0; i < argumentIndexes.size(); i++) {
            if (argumentIndexes.get(i) != i) {
                throw new MapperException("Argument indexes of " + type.getName() + " must run from 0 without gaps: " + argumentIndexes);
            }
        }

        try {
            var parameterTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
            var constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            log.trace("Derived mapping for {} with fields {}", type.getName(), bindings.stream().map(FieldBinding::name).toList());
            return new RecordMapping<>(type, constructor, List.copyOf(accessors), List.copyOf(bindings));
        } catch (NoSuchMethodException ex) {
            throw new MapperException("No canonical constructor for " + type.getName(), ex);
        }
    }

    @Override
    public T fromDirective(Directive directive, ConfMapper mapper) {
        checkUnknownFields(directive, mapper);

        var values = new Object[bindings.size()];
        for (var i = 0; i < bindings.size(); i++) {
            values[i] = bindings.get(i).read(directive, mapper);
        }

        try {
            return constructor.newInstance(values);
        } catch (InvocationTargetException ex) {
            var cause = ex.getCause();
            throw new MapperException("Cannot construct " + type.getSimpleName() + ": " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException ex) {
            throw new MapperException("Cannot construct " + type.getSimpleName(), ex);
        }
    }

    @Override
    public Directive toDirective(String name, T value, ConfMapper mapper) {
        var arguments = new ArrayList<Argument>();
        var children = new ArrayList<Directive>();
        for (var i : writeOrder) {
            bindings.get(i).write(read(accessors.get(i), value), arguments, children, mapper);
        }
        return new Directive(Argument.bare(name), arguments, true, children);
    }

    private void checkUnknownFields(Directive directive, ConfMapper mapper) {
        for (var child : directive.children()) {
            var known = bindings.stream().anyMatch(binding -> binding.claims(child.nameValue()));
            if (known) {
                continue;
            }
            if (mapper.getOptions().isStrict()) {
                throw new UnknownFieldException(child.nameValue(), type.getSimpleName());
            }
            log.debug("Ignoring unknown field '{}' in {}", child.nameValue(), type.getSimpleName());
        }
    }

    private Object read(Method accessor, T value) {
        try {
            return accessor.invoke(value);
        } catch (InvocationTargetException ex) {
            throw new SerializeException("Cannot read " + accessor.getName() + " of " + type.getSimpleName() + ": " + ex.getCause());
        } catch (IllegalAccessException ex) {
            throw new SerializeException("Cannot read " + accessor.getName() + " of " + type.getSimpleName() + ": " + ex.getMessage());
        }
    }

    //// binding derivation ////

    private static FieldBinding bindingFor(Class<?> owner, RecordComponent component, ConfMapper mapper) {
        var nameOverride = component.getAnnotation(ConfName.class);
        var name = nameOverride != null ? nameOverride.value() : mapper.getOptions().getNamingPolicy().apply(component.getName());

        var raw = component.getType();
        var optional = raw == Optional.class;
        var list = raw == List.class;
        var target = optional || list ? typeArgument(owner, component) : raw;

        var argument = component.getAnnotation(ConfArgument.class);
        if (argument != null) {
            if (list) {
                throw new MapperException("List component " + owner.getSimpleName() + "." + component.getName() + " cannot be an argument");
            }
            return new ArgumentBinding(name, argument.value(), converter(owner, component, target, mapper), optional);
        }

        if (list) {
            if (mapper.getConverters().supports(target)) {
                var repeated = component.isAnnotationPresent(ConfRepeated.class);
                return ListBinding.ofScalars(name, converter(owner, component, target, mapper), repeated);
            }
            return ListBinding.ofRecords(name, mapping(owner, component, target, mapper));
        }
        if (mapper.getConverters().supports(target)) {
            return new ScalarBinding(name, converter(owner, component, target, mapper), optional);
        }
        return new NestedBinding(name, mapping(owner, component, target, mapper), optional);
    }

    private static Class<?> typeArgument(Class<?> owner, RecordComponent component) {
        Type generic = component.getGenericType();
        if (generic instanceof ParameterizedType parameterized) {
            var argument = parameterized.getActualTypeArguments()[0];
            if (argument instanceof Class<?> clazz) {
                return clazz;
            }
            if (argument instanceof ParameterizedType nested && nested.getRawType() instanceof Class<?> clazz) {
                return clazz;
            }
        }
        throw new MapperException("Cannot determine element type of " + owner.getSimpleName() + "." + component.getName());
    }

    @SuppressWarnings("unchecked")
    private static ValueConverter<Object> converter(Class<?> owner, RecordComponent component, Class<?> target, ConfMapper mapper) {
        return (ValueConverter<Object>) mapper.getConverters().find(target)
            .orElseThrow(() -> new MapperException("No value converter for " + target.getName()
                + " in " + owner.getSimpleName() + "." + component.getName()));
    }

    @SuppressWarnings("unchecked")
    private static Lazy<DirectiveMapping<Object>> mapping(Class<?> owner, RecordComponent component, Class<?> target, ConfMapper mapper) {
        if (!target.isRecord() && !mapper.hasMapping(target)) {
            throw new MapperException("No value converter or mapping for " + target.getName()
                + " in " + owner.getSimpleName() + "." + component.getName());
        }
        return Lazy.lazy(() -> (DirectiveMapping<Object>) mapper.mappingFor(target));
    }
}
