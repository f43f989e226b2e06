package tech.yump.keyring.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.keyring.storage.FileSystemKeyValueStore;
import tech.yump.keyring.storage.InMemoryKeyValueStore;
import tech.yump.keyring.storage.KeyValueStore;

@Configuration
@Slf4j
public class StorageConfiguration {

    @Bean
    @ConditionalOnProperty(name = "keyring.storage.type", havingValue = "filesystem", matchIfMissing = true)
    public KeyValueStore fileSystemKeyValueStore(KeyringProperties properties) {
        String path = properties.storage().filesystem().path();
        log.info("Configuring filesystem key/value store at '{}'", path);
        return new FileSystemKeyValueStore(path);
    }

    @Bean
    @ConditionalOnProperty(name = "keyring.storage.type", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore() {
        log.warn("Configuring in-memory key/value store. Persisted public keys are lost on restart.");
        return new InMemoryKeyValueStore();
    }
}
