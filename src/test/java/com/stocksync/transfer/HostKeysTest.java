package com.stocksync.transfer;

import com.jcraft.jsch.HostKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HostKeysTest {

    private static final String ED25519 = "ssh-ed25519 256 AAAAC3NzaC1lZDI1NTE5AAAAIOMqqnkVzrm0SdG6UOoqKLsabgH5C9okWi0dh2l9GKJl";

    @Test
    void parsesAlgorithmAndKey() {
        HostKey key = HostKeys.parse("sftp.example.net", 22, ED25519);

        assertEquals("sftp.example.net", key.getHost());
        assertEquals("ssh-ed25519", key.getType());
        assertEquals("AAAAC3NzaC1lZDI1NTE5AAAAIOMqqnkVzrm0SdG6UOoqKLsabgH5C9okWi0dh2l9GKJl", key.getKey());
    }

    @Test
    void nonStandardPortUsesBracketedHost() {
        assertEquals("[sftp.example.net]:2222", HostKeys.knownHostsName("sftp.example.net", 2222));
        assertEquals("[sftp.example.net]:2222", HostKeys.parse("sftp.example.net", 2222, ED25519).getHost());
    }

    @Test
    void malformedKeysAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> HostKeys.parse("h", 22, null));
        assertThrows(IllegalArgumentException.class, () -> HostKeys.parse("h", 22, "ssh-ed25519 AAAAC3NzaC1lZDI1NTE5AAAAIOMqqnkVzrm0SdG6UOoqKLsabgH5C9okWi0dh2l9GKJl"));
        assertThrows(IllegalArgumentException.class, () -> HostKeys.parse("h", 22, "ssh-foo 256 AAAAC3NzaC1lZDI1NTE5AAAAIOMqqnkVzrm0SdG6UOoqKLsabgH5C9okWi0dh2l9GKJl"));
        assertThrows(IllegalArgumentException.class, () -> HostKeys.parse("h", 22, "ssh-rsa 2048 not*base64"));
    }
}
