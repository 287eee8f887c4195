package confetti.tool;

import static lombok.AccessLevel.PRIVATE;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import confetti.lang.ConfMapper;
import confetti.lang.Confetti;
import confetti.lang.DirectiveTree;
import confetti.lang.MapperOptions;
import confetti.lang.ParserOptions;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Loads and saves Confetti files as UTF-8 text.
 */
@RequiredArgsConstructor(access = PRIVATE)
public final class ConfettiFiles {

    private static final Logger log = LoggerFactory.getLogger(ConfettiFiles.class);

    public static String read(@NonNull Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConfettiIoException(path, ex);
        }
    }

    public static void write(@NonNull Path path, @NonNull String text) {
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
            log.debug("Wrote {} chars to {}", text.length(), path);
        } catch (IOException ex) {
            throw new ConfettiIoException(path, ex);
        }
    }

    public static DirectiveTree parseFile(@NonNull Path path, @NonNull ParserOptions options) {
        log.debug("Parsing {}", path);
        return Confetti.parse(read(path), options);
    }

    public static <T> T fromFile(@NonNull Path path, @NonNull Class<T> type, @NonNull ConfMapper mapper) {
        return mapper.fromTree(parseFile(path, mapper.getOptions().getParserOptions()), type);
    }

    public static void toFile(@NonNull Path path, @NonNull Object value, @NonNull ConfMapper mapper) {
        write(path, mapper.toText(value));
    }

    public static void writeTree(@NonNull Path path, @NonNull DirectiveTree tree, @NonNull MapperOptions options) {
        write(path, Confetti.serialize(tree, options));
    }
}
