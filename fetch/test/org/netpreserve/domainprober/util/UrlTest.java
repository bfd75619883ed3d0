package org.netpreserve.domainprober.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlTest {
    @Test
    void forHost() {
        Url url = Url.forHost("http", "example", "com");
        assertEquals("http://example.com", url.toString());
        assertEquals("example.com", url.host());
        assertEquals("example", url.firstLabel());
    }

    @Test
    void equalityIsExactString() {
        assertEquals(new Url("http://foo.com"), new Url("http://foo.com"));
        assertNotEquals(new Url("http://foo.com"), new Url("http://FOO.com"));
        assertNotEquals(new Url("http://foo.com"), new Url("http://foo.com/"));
    }

    @Test
    void labelLength() {
        assertTrue(Url.isValidLabel("a".repeat(63)));
        assertFalse(Url.isValidLabel("a".repeat(64)));
        assertFalse(Url.isValidLabel(""));
    }

    @Test
    void labelCharacters() {
        assertTrue(Url.isValidLabel("my-site2"));
        assertTrue(Url.isValidLabel("ABC"));
        assertFalse(Url.isValidLabel("-site"));
        assertFalse(Url.isValidLabel("site-"));
        assertFalse(Url.isValidLabel("a.b"));
        assertFalse(Url.isValidLabel("127.0.0.1:8080/page#"));
        assertFalse(Url.isValidLabel("user@host"));
        assertFalse(Url.isValidLabel("what?"));
        assertFalse(Url.isValidLabel("under_score"));
        assertFalse(Url.isValidLabel("café"));
    }

    @Test
    void unparseableHost() {
        assertNull(new Url("http://bad host.com").host());
    }
}
