package com.codeheadsystems.keyshare.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {

  private ConfigurationLoader loader;

  @BeforeEach
  void setUp() {
    loader = new ConfigurationLoader();
  }

  @AfterEach
  void tearDown() {
    loader.close();
  }

  private static InputStream yaml(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void load_fixture() throws Exception {
    KeyshareGateConfiguration configuration;
    try (InputStream in = getClass().getResourceAsStream("/keyshare-gate-test.yml")) {
      configuration = loader.load(in);
    }

    assertThat(configuration.getEnclaveId()).isEqualTo("enclave-test-01");
    assertThat(configuration.getChainRpcEndpoint()).isEqualTo("http://127.0.0.1:9933");
    assertThat(configuration.getConnectTimeoutMillis()).isEqualTo(1500);
    assertThat(configuration.getRequestTimeoutMillis()).isEqualTo(3000);
    assertThat(configuration.getAdminWhitelist()).containsExactly(
        "5Cf8PBw7QiRFNPBTnUoks9Hvkzn8av1qfcgMtSppJvjYcxp6",
        "5GxffGgHzTFu8mmHCRbw9YZkkcwTZreL2FVLQHVb4FVgEPcE");
  }

  @Test
  void load_emptyDocumentFieldsKeepDefaults() throws Exception {
    KeyshareGateConfiguration configuration = loader.load(yaml("enclaveId: e1\n"));

    assertThat(configuration.getTokenGraceBlocks()).isEqualTo(3);
    assertThat(configuration.getAdminMaxValidationPeriod()).isEqualTo(20);
    assertThat(configuration.getAdminMaxBlockVariation()).isEqualTo(5);
    assertThat(configuration.getAdminWhitelist()).isEmpty();
    assertThat(configuration.getAttestationDevicePath()).isEqualTo("/dev/attestation");
    assertThat(configuration.getQuoteOutputPath()).isEqualTo("/quote/enclave.quote");
  }

  @Test
  void load_fromFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("gate.yml");
    Files.writeString(file, "enclaveId: from-file\nadminWhitelist: [a, b]\n");

    KeyshareGateConfiguration configuration = loader.load(file);

    assertThat(configuration.getEnclaveId()).isEqualTo("from-file");
    assertThat(configuration.getAdminWhitelist()).containsExactly("a", "b");
  }

  @Test
  void load_constraintViolations_areListed() {
    assertThatThrownBy(() -> loader.load(yaml("enclaveId: ''\nrequestTimeoutMillis: 0\ntokenGraceBlocks: -1\n")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("enclaveId")
        .hasMessageContaining("requestTimeoutMillis")
        .hasMessageContaining("tokenGraceBlocks");
  }

  @Test
  void load_unknownProperty_isRejected() {
    assertThatThrownBy(() -> loader.load(yaml("enclaveId: e1\nunknownKey: 1\n")))
        .isInstanceOf(JsonProcessingException.class);
  }

  @Test
  void loader_worksAsTryWithResources() throws Exception {
    KeyshareGateConfiguration configuration;
    try (ConfigurationLoader scoped = new ConfigurationLoader()) {
      configuration = scoped.load(yaml("enclaveId: scoped\n"));
    }
    assertThat(configuration.getEnclaveId()).isEqualTo("scoped");
    assertThat(loader).isInstanceOf(AutoCloseable.class);
  }
}
