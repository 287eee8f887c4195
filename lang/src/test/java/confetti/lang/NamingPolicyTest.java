package confetti.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class NamingPolicyTest {

    @Test
    void asDeclared() {
        assertEquals("maxConnections", NamingPolicy.AS_DECLARED.apply("maxConnections"));
    }

    @Test
    void kebabCase() {
        assertEquals("port", NamingPolicy.KEBAB_CASE.apply("port"));
        assertEquals("max-connections", NamingPolicy.KEBAB_CASE.apply("maxConnections"));
        assertEquals("http-port", NamingPolicy.KEBAB_CASE.apply("HTTPPort"));
        assertEquals("use-http", NamingPolicy.KEBAB_CASE.apply("useHTTP"));
        assertEquals("ip-v4-address", NamingPolicy.KEBAB_CASE.apply("ipV4Address"));
        assertEquals("read-only", NamingPolicy.KEBAB_CASE.apply("read_only"));
    }

    @Test
    void snakeCase() {
        assertEquals("max_connections", NamingPolicy.SNAKE_CASE.apply("maxConnections"));
        assertEquals("http_port", NamingPolicy.SNAKE_CASE.apply("HTTPPort"));
        assertEquals("read_only", NamingPolicy.SNAKE_CASE.apply("read-only"));
    }
}
