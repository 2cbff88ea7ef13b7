package at.sv.huepanel.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credential store backed by a concurrent map, optionally persisted as a JSON object to a file so that pairings
 * survive a restart. Failures to read or write the file are logged and otherwise ignored.
 */
@Slf4j
public final class CredentialStoreImpl implements CredentialStore {

    private final Path credentialsFile;
    private final ObjectMapper mapper;
    private final Map<String, String> credentials;
    private final Object fileLock = new Object();

    public CredentialStoreImpl() {
        this(null);
    }

    /**
     * @param credentialsFile the file to load and save credentials from, or null to keep them in memory only
     */
    public CredentialStoreImpl(Path credentialsFile) {
        this.credentialsFile = credentialsFile;
        mapper = new ObjectMapper();
        credentials = new ConcurrentHashMap<>();
        loadCredentials();
    }

    @Override
    public Optional<String> get(String bridgeAddress) {
        return Optional.ofNullable(credentials.get(bridgeAddress));
    }

    @Override
    public boolean has(String bridgeAddress) {
        return credentials.containsKey(bridgeAddress);
    }

    @Override
    public void put(String bridgeAddress, String credential) {
        String previous = credentials.put(bridgeAddress, credential);
        if (previous != null && !previous.equals(credential)) {
            log.info("Replaced stored credential for bridge {}", bridgeAddress);
        } else {
            log.info("Stored credential for bridge {}", bridgeAddress);
        }
        saveCredentials();
    }

    @Override
    public boolean remove(String bridgeAddress) {
        boolean existed = credentials.remove(bridgeAddress) != null;
        if (existed) {
            log.info("Cleared credential for bridge {}", bridgeAddress);
            saveCredentials();
        }
        return existed;
    }

    @Override
    public Optional<String> getDefaultBridgeAddress() {
        return credentials.keySet().stream().sorted().findFirst();
    }

    private void loadCredentials() {
        if (credentialsFile == null) {
            return;
        }
        if (!Files.isRegularFile(credentialsFile)) {
            log.debug("No credentials file found at '{}', starting fresh", credentialsFile);
            return;
        }
        try {
            String content = Files.readString(credentialsFile);
            if (content.isBlank()) {
                log.debug("Credentials file is empty, starting fresh");
                return;
            }
            Map<String, String> loaded = mapper.readValue(content, new TypeReference<>() {
            });
            credentials.putAll(loaded);
            log.info("Loaded credentials for {} bridge(s)", loaded.size());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load bridge credentials from '{}': {}", credentialsFile, e.getMessage());
        }
    }

    private void saveCredentials() {
        if (credentialsFile == null) {
            return;
        }
        synchronized (fileLock) {
            try {
                Path parent = credentialsFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Map<String, String> sorted = new LinkedHashMap<>();
                credentials.entrySet()
                           .stream()
                           .sorted(Map.Entry.comparingByKey())
                           .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
                mapper.writerWithDefaultPrettyPrinter().writeValue(credentialsFile.toFile(), sorted);
                log.trace("Saved bridge credentials to '{}'", credentialsFile);
            } catch (IOException e) {
                log.warn("Failed to save bridge credentials to '{}': {}", credentialsFile, e.getMessage());
            }
        }
    }
}
