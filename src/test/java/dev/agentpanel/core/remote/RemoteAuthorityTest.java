package dev.agentpanel.core.remote;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class RemoteAuthorityTest {
    @Test
    void acceptsUserAtHost() {
        var result = RemoteAuthority.parse("ssh-remote+user@host");
        assertTrue(result.isOk());
        assertEquals("user@host", result.value());
        assertEquals(Optional.of("user@host"), RemoteAuthority.extractTarget("ssh-remote+user@host"));
    }

    @Test
    void rejectsMissingPrefix() {
        assertEquals(RemoteAuthorityError.MISSING_PREFIX, RemoteAuthority.parse("user@host").error());
        assertEquals(RemoteAuthorityError.MISSING_PREFIX, RemoteAuthority.parse("SSH-REMOTE+user@host").error());
    }

    @Test
    void rejectsWhitespaceAnywhere() {
        assertEquals(RemoteAuthorityError.CONTAINS_WHITESPACE, RemoteAuthority.parse("ssh-remote+user@host name").error());
        assertEquals(RemoteAuthorityError.CONTAINS_WHITESPACE, RemoteAuthority.parse("ssh-remote+user@host\t").error());
        assertEquals(RemoteAuthorityError.CONTAINS_WHITESPACE, RemoteAuthority.parse("ssh-remote+ user@host").error());
    }

    @Test
    void rejectsEmptyTarget() {
        assertEquals(RemoteAuthorityError.MISSING_TARGET, RemoteAuthority.parse("ssh-remote+").error());
        assertTrue(RemoteAuthority.extractTarget("ssh-remote+").isEmpty());
    }

    @Test
    void rejectsOptionLikeTarget() {
        assertEquals(RemoteAuthorityError.TARGET_STARTS_WITH_DASH, RemoteAuthority.parse("ssh-remote+-oProxyCommand=x").error());
        assertEquals(RemoteAuthorityError.TARGET_STARTS_WITH_DASH, RemoteAuthority.parse("ssh-remote+ -x").error());
    }

    @Test
    void shellEscapesSingleQuotes() {
        assertEquals("'/Users/me/src'", RemoteAuthority.shellEscape("/Users/me/src"));
        assertEquals("'it'\\''s'", RemoteAuthority.shellEscape("it's"));
        assertEquals("''", RemoteAuthority.shellEscape(""));
    }
}
