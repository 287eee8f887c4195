package confetti.lang;

/**
 * Converts between a directive and a value of type {@code T}.
 *
 * <p>{@link RecordMapping} derives one for any record class by reflection;
 * other types can register their own with {@link ConfMapper#register}.
 */
public interface DirectiveMapping<T> {

    /**
     * @throws MapperException if a required field is missing or a value does not convert
     */
    T fromDirective(Directive directive, ConfMapper mapper);

    /**
     * @param name the name the resulting directive must carry
     */
    Directive toDirective(String name, T value, ConfMapper mapper);
}
