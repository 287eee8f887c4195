package confetti.tool;

import java.io.IOException;
import java.nio.file.Path;

import confetti.lang.ConfettiException;
import lombok.Getter;

/**
 * Reading or writing a configuration file failed.
 */
public class ConfettiIoException extends ConfettiException {

    @Getter
    private final Path path;

    public ConfettiIoException(Path path, IOException cause) {
        super("Cannot access " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }
}
