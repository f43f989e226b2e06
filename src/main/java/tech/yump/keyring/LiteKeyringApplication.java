package tech.yump.keyring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.keyring.config.KeyringProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(KeyringProperties.class)
public class LiteKeyringApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteKeyringApplication.class, args);
    log.info(">>> LiteKeyring Application Started <<<");
  }
}
