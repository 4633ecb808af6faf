package com.codeheadsystems.keyshare.server.attestation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the enclave's attestation quote through the attestation pseudo-filesystem.
 * <p>
 * Inside an enclave the device directory holds {@code user_report_data},
 * {@code attestation_type} and {@code quote}. Writing the report data makes the platform
 * produce a fresh quote, which is read back and also dumped to the output path. Outside an
 * enclave the device is absent and a fixed sentinel is returned instead.
 */
public class AttestationQuoteProvider {

  public static final String NOT_IN_ENCLAVE = "This is NOT inside an Enclave!";
  public static final int REPORT_DATA_LENGTH = 64;

  static final String USER_REPORT_DATA = "user_report_data";
  static final String ATTESTATION_TYPE = "attestation_type";
  static final String QUOTE = "quote";

  private static final Logger log = LoggerFactory.getLogger(AttestationQuoteProvider.class);

  private final Path attestationDir;
  private final Path quoteOutput;

  /**
   * Instantiates a new Attestation quote provider.
   *
   * @param attestationDir the attestation device directory, usually {@code /dev/attestation}
   * @param quoteOutput    where the quote is dumped
   */
  public AttestationQuoteProvider(final Path attestationDir, final Path quoteOutput) {
    log.info("AttestationQuoteProvider({}, {})", attestationDir, quoteOutput);
    this.attestationDir = attestationDir;
    this.quoteOutput = quoteOutput;
  }

  /**
   * Generates a quote, or the sentinel outside an enclave.
   *
   * @return the raw quote bytes, or the UTF-8 sentinel
   * @throws AttestationException if the device or output cannot be accessed
   */
  public byte[] generateQuote() {
    final Path reportData = attestationDir.resolve(USER_REPORT_DATA);
    if (!Files.exists(reportData)) {
      log.info(NOT_IN_ENCLAVE);
      return NOT_IN_ENCLAVE.getBytes(StandardCharsets.UTF_8);
    }
    log.info("This is inside Enclave!");
    try {
      final String attestationType = Files.readString(attestationDir.resolve(ATTESTATION_TYPE), StandardCharsets.UTF_8);
      log.info("attestation type is : {}", attestationType.trim());

      Files.write(reportData, new byte[REPORT_DATA_LENGTH], StandardOpenOption.WRITE);

      log.info("Reading the quote");
      final byte[] quote = Files.readAllBytes(attestationDir.resolve(QUOTE));

      log.info("Dumping the quote to {}", quoteOutput);
      final Path parent = quoteOutput.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(quoteOutput, quote);
      return quote;
    } catch (IOException e) {
      throw new AttestationException("Unable to generate the attestation quote", e);
    }
  }
}
