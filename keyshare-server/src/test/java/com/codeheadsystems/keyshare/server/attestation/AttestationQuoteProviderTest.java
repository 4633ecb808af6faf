package com.codeheadsystems.keyshare.server.attestation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AttestationQuoteProviderTest {

  @TempDir Path tempDir;

  @Test
  void generateQuote_withoutDevice_returnsSentinel() {
    AttestationQuoteProvider provider = new AttestationQuoteProvider(
        tempDir.resolve("missing"), tempDir.resolve("out/enclave.quote"));

    assertThat(new String(provider.generateQuote(), StandardCharsets.UTF_8))
        .isEqualTo("This is NOT inside an Enclave!");
    assertThat(tempDir.resolve("out")).doesNotExist();
  }

  @Test
  void generateQuote_withDevice_writesReportAndDumpsQuote() throws Exception {
    Path device = Files.createDirectory(tempDir.resolve("attestation"));
    Files.write(device.resolve(AttestationQuoteProvider.USER_REPORT_DATA), new byte[]{1, 2, 3});
    Files.writeString(device.resolve(AttestationQuoteProvider.ATTESTATION_TYPE), "dcap\n");
    byte[] quote = {0x03, 0x00, 0x02, 0x00, (byte) 0x81, 0x7f};
    Files.write(device.resolve(AttestationQuoteProvider.QUOTE), quote);
    Path output = tempDir.resolve("quote/enclave.quote");

    byte[] result = new AttestationQuoteProvider(device, output).generateQuote();

    assertThat(result).isEqualTo(quote);
    assertThat(Files.readAllBytes(output)).isEqualTo(quote);
    assertThat(Files.readAllBytes(device.resolve(AttestationQuoteProvider.USER_REPORT_DATA)))
        .hasSize(AttestationQuoteProvider.REPORT_DATA_LENGTH)
        .containsOnly(0);
  }

  @Test
  void generateQuote_missingQuoteFile_throws() throws Exception {
    Path device = Files.createDirectory(tempDir.resolve("attestation"));
    Files.write(device.resolve(AttestationQuoteProvider.USER_REPORT_DATA), new byte[0]);
    Files.writeString(device.resolve(AttestationQuoteProvider.ATTESTATION_TYPE), "epid");

    AttestationQuoteProvider provider = new AttestationQuoteProvider(device, tempDir.resolve("enclave.quote"));

    assertThatThrownBy(provider::generateQuote).isInstanceOf(AttestationException.class);
  }
}
