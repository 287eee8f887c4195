package confetti.tool;

import java.util.concurrent.Callable;

import confetti.lang.ConfettiException;
import confetti.lang.Confetti;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "tokens",
    description = "Print the tokens of a file, one per line, comments included"
)
public class TokensCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "File to scan, - for standard input")
    private String file;

    @ParentCommand
    private ConfettiCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        try {
            var tokens = Confetti.tokenize(ConfettiCommand.readSource(file), parent.parserOptions());
            tokens.forEach(out::println);
            out.flush();
            return 0;
        } catch (ConfettiException ex) {
            err.println(file + ": " + ex.getMessage());
            err.flush();
            return 1;
        }
    }
}
