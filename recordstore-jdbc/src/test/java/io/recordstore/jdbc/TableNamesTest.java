package io.recordstore.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

    @Test
    void acceptsSqlIdentifiers() {
        assertEquals("oidc_access_token", TableNames.validate("oidc_access_token"));
        assertEquals("_t1", TableNames.validate("_t1"));
        assertEquals("Session", TableNames.validate("Session"));
    }

    @Test
    void rejectsAnythingElse() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("oidc.session"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("oidc_session;--"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("oidc session"));
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }
}
