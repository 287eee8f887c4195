package confetti.lang;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a record component to a positional argument of the record's own
 * directive, as {@code name} in {@code upstream backend { ... }}.
 *
 * <p>Indexes of one record must be contiguous from zero.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface ConfArgument {
    int value() default 0;
}
