package confetti.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class SerializerTest {

    private static final ParserOptions EXPRESSIONS = ParserOptions.builder().allowExpressionArguments(true).build();

    @Test
    void layout() {
        var tree = Confetti.parse("Config { host \"localhost\"; port 8080; limits { } }");
        assertEquals("Config {\n"
            + "  host \"localhost\";\n"
            + "  port 8080;\n"
            + "  limits {\n"
            + "  }\n"
            + "}\n", Confetti.serialize(tree));
    }

    @Test
    void emptyTree() {
        assertEquals("", Confetti.serialize(DirectiveTree.empty()));
    }

    @Test
    void customIndent() {
        var options = MapperOptions.builder().indent("\t").build();
        var tree = Confetti.parse("a { b { c } }");
        assertEquals("a {\n\tb {\n\t\tc;\n\t}\n}\n", Confetti.serialize(tree, options));
    }

    @Test
    void indentMustBeBlank() {
        var serializer = new Serializer(MapperOptions.builder().indent("--").build());
        assertThrows(SerializeException.class, () -> serializer.serialize(Directive.of("a")));
    }

    @Test
    void requiresQuotes() {
        var options = ParserOptions.DEFAULT;
        assertFalse(Serializer.requiresQuotes("plain", options));
        assertFalse(Serializer.requiresQuotes("/var/www", options));
        assertFalse(Serializer.requiresQuotes("-12.5e3", options));
        assertTrue(Serializer.requiresQuotes("", options));
        assertTrue(Serializer.requiresQuotes("a b", options));
        assertTrue(Serializer.requiresQuotes("a,b", options));
        assertTrue(Serializer.requiresQuotes("a;b", options));
        assertTrue(Serializer.requiresQuotes("{", options));
        assertTrue(Serializer.requiresQuotes("#tag", options));
        assertTrue(Serializer.requiresQuotes("f(x)", options));
        assertTrue(Serializer.requiresQuotes("[0]", options));
        assertTrue(Serializer.requiresQuotes("//not-a-comment", options));
        assertTrue(Serializer.requiresQuotes("/*", options));
        assertTrue(Serializer.requiresQuotes("line\nbreak", options));
        assertTrue(Serializer.requiresQuotes("bell\u0007", options));

        assertFalse(Serializer.requiresQuotes("a=b", options));
        assertTrue(Serializer.requiresQuotes("a=b", options.toBuilder().customPunctuators(Set.of('=')).build()));
    }

    @Test
    void quote() {
        assertEquals("\"\"", Serializer.quote(""));
        assertEquals("\"say \\\"hi\\\"\"", Serializer.quote("say \"hi\""));
        assertEquals("\"a\\\\b\\n\\tc\"", Serializer.quote("a\\b\n\tc"));
        assertEquals("\"\\u0001\\u202E\"", Serializer.quote("\u0001\u202E"));
    }

    @Test
    void quotedArgumentsStayQuoted() {
        var directive = new Directive(Argument.bare("port"), List.of(Argument.quoted("8080")), false, List.of());
        assertEquals("port \"8080\";\n", new Serializer().serialize(directive));
    }

    @Test
    void bareArgumentsAreQuotedWhenNeeded() {
        var directive = Directive.of("name", "two words", "");
        assertEquals("name \"two words\" \"\";\n", new Serializer().serialize(directive));
    }

    @Test
    void quotedName() {
        var directive = new Directive(Argument.quoted("my key"), List.of(), false, List.of());
        assertEquals("\"my key\";\n", new Serializer().serialize(directive));
    }

    @Test
    void tripleQuoted() {
        var tree = Confetti.parse("text \"\"\"one\ntwo \\\"three\\\"\"\"\"");
        assertEquals("text \"\"\"one\ntwo \\\"three\\\"\"\"\";\n", Confetti.serialize(tree));

        var options = MapperOptions.builder()
            .parserOptions(ParserOptions.builder().allowTripleQuotes(false).build())
            .build();
        assertEquals("text \"one\\ntwo \\\"three\\\"\";\n", Confetti.serialize(tree, options));
    }

    @Test
    void expressions() {
        var tree = Confetti.parse("a (b (c d), e);", EXPRESSIONS);
        var withExpressions = MapperOptions.builder().parserOptions(EXPRESSIONS).build();
        assertEquals("a (b (c d) e);\n", Confetti.serialize(tree, withExpressions));
        assertEquals("a \"b (c d) e\";\n", Confetti.serialize(tree));
    }

    @Test
    void punctuators() {
        var parserOptions = ParserOptions.builder().customPunctuators(Set.of('=')).build();
        var tree = Confetti.parse("key=value", parserOptions);
        var options = MapperOptions.builder().parserOptions(parserOptions).build();
        assertEquals("key = value;\n", Confetti.serialize(tree, options));
    }

    @Test
    void serializationIsStable() {
        var tree = new DirectiveTree(List.of(
            Directive.of("values", "", "a b", "//c", "x,y", "line\nbreak", "say \"hi\"", "tab\there",
                "#hash", "{brace}", "caf\u00E9", "\u202E", "\u000B", "back\\slash"),
            Directive.block("\"odd name\"", List.of(new Argument("t\n\"q\"", Argument.Style.TRIPLE_QUOTED)), List.of(
                Directive.block("inner", List.of(new Argument("x y", Argument.Style.EXPRESSION)), List.of()),
                new Directive(Argument.bare("p"), List.of(new Argument("(", Argument.Style.PUNCTUATOR)), false, List.of())))));

        var once = Confetti.serialize(tree);
        var twice = Confetti.serialize(Confetti.parse(once));
        assertEquals(once, twice);

        var reparsed = Confetti.parse(once).directives().get(0);
        assertEquals(tree.directives().get(0).argumentValues(), reparsed.argumentValues());
    }
}
