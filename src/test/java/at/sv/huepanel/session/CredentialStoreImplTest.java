package at.sv.huepanel.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialStoreImplTest {

    @TempDir
    Path tempDir;

    @Test
    void put_get_inMemory() {
        CredentialStoreImpl store = new CredentialStoreImpl();

        store.put("192.168.0.10", "key-1");

        assertThat(store.get("192.168.0.10")).contains("key-1");
        assertThat(store.has("192.168.0.10")).isTrue();
        assertThat(store.get("192.168.0.11")).isEmpty();
        assertThat(store.has("192.168.0.11")).isFalse();
    }

    @Test
    void put_sameBridgeTwice_replacesCredential() {
        CredentialStoreImpl store = new CredentialStoreImpl();

        store.put("192.168.0.10", "key-1");
        store.put("192.168.0.10", "key-2");

        assertThat(store.get("192.168.0.10")).contains("key-2");
    }

    @Test
    void remove_existing_true_unknown_false() {
        CredentialStoreImpl store = new CredentialStoreImpl();
        store.put("192.168.0.10", "key-1");

        assertThat(store.remove("192.168.0.10")).isTrue();
        assertThat(store.remove("192.168.0.10")).isFalse();
        assertThat(store.has("192.168.0.10")).isFalse();
    }

    @Test
    void getDefaultBridgeAddress_emptyStore_empty() {
        assertThat(new CredentialStoreImpl().getDefaultBridgeAddress()).isEmpty();
    }

    @Test
    void getDefaultBridgeAddress_returnsFirstAddress() {
        CredentialStoreImpl store = new CredentialStoreImpl();
        store.put("192.168.0.20", "key-2");
        store.put("192.168.0.10", "key-1");

        assertThat(store.getDefaultBridgeAddress()).contains("192.168.0.10");
    }

    @Test
    void persistsCredentials_loadedByNewInstance() {
        Path file = tempDir.resolve("data").resolve("bridge-credentials.json");
        CredentialStoreImpl store = new CredentialStoreImpl(file);
        store.put("192.168.0.10", "key-1");
        store.put("192.168.0.20", "key-2");
        store.remove("192.168.0.20");

        CredentialStoreImpl reloaded = new CredentialStoreImpl(file);

        assertThat(Files.exists(file)).isTrue();
        assertThat(reloaded.get("192.168.0.10")).contains("key-1");
        assertThat(reloaded.has("192.168.0.20")).isFalse();
    }

    @Test
    void corruptFile_startsEmpty_andOverwritesOnNextPut() throws IOException {
        Path file = tempDir.resolve("bridge-credentials.json");
        Files.writeString(file, "{ not json");

        CredentialStoreImpl store = new CredentialStoreImpl(file);

        assertThat(store.getDefaultBridgeAddress()).isEmpty();
        store.put("192.168.0.10", "key-1");
        assertThat(new CredentialStoreImpl(file).get("192.168.0.10")).contains("key-1");
    }

    @Test
    void emptyFile_startsEmpty() throws IOException {
        Path file = tempDir.resolve("bridge-credentials.json");
        Files.writeString(file, "");

        assertThat(new CredentialStoreImpl(file).getDefaultBridgeAddress()).isEmpty();
    }
}
