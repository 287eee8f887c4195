package confetti.lang;

import lombok.Getter;

public class MissingFieldException extends MapperException {

    @Getter
    private final String field;

    public MissingFieldException(String field) {
        super("Missing required field: " + field);
        this.field = field;
    }
}
