package confetti.lang;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Writes a list of scalars as one child directive per element
 * ({@code tag a; tag b;}) rather than as the arguments of a single child
 * directive ({@code tags a b;}).
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface ConfRepeated {
}
