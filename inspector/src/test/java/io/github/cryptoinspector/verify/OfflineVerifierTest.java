package io.github.cryptoinspector.verify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cryptoinspector.exception.ArchiveFormatException;
import io.github.cryptoinspector.exception.IntegrityException;
import io.github.cryptoinspector.helper.HashHelper;
import io.github.cryptoinspector.model.AuditEvent;
import io.github.cryptoinspector.model.AuditStatus;
import io.github.cryptoinspector.model.ImmutableAuditEvent;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OfflineVerifierTest {

  @TempDir
  Path tempDir;

  private HashHelper hashHelper;
  private ObjectMapper objectMapper;
  private OfflineVerifier verifier;

  @BeforeEach
  void setup() {
    hashHelper = new HashHelper();
    objectMapper = new ObjectMapper().findAndRegisterModules();
    verifier = new OfflineVerifier(hashHelper, new AuditChainVerifier(hashHelper), objectMapper);
  }

  private AuditEvent event(final String prev, final int n) {
    final String detail = "{\"n\":" + n + "}";
    return ImmutableAuditEvent.builder()
        .eventId("audit_" + n)
        .caseId("C1")
        .eventType("collect")
        .action("step")
        .status(AuditStatus.SUCCESS)
        .actor("tester")
        .source("OfflineVerifierTest")
        .detailJson(detail)
        .occurredAt(5_000L + n)
        .chainPrevHash(prev)
        .chainHash(hashHelper.chainHash(prev, "C1", "collect", "step", "success", 5_000L + n, detail))
        .build();
  }

  private String manifest(final List<AuditEvent> audits) throws IOException {
    return objectMapper.writeValueAsString(Map.of("schema", "test", "audits", audits));
  }

  private String validManifest() throws IOException {
    final AuditEvent first = event("", 0);
    return manifest(List.of(first, event(first.chainHash(), 1)));
  }

  private String hashLine(final String content, final String path) {
    return hashHelper.bytes(content.getBytes(StandardCharsets.UTF_8)).sha256() + "  " + path;
  }

  private Path zip(final Map<String, String> entries) throws IOException {
    final Path zipPath = Files.createTempFile(tempDir, "package", ".zip");
    try (OutputStream out = Files.newOutputStream(zipPath);
         ZipOutputStream zos = new ZipOutputStream(out)) {
      for (Map.Entry<String, String> e : entries.entrySet()) {
        zos.putNextEntry(new ZipEntry(e.getKey()));
        zos.write(e.getValue().getBytes(StandardCharsets.UTF_8));
        zos.closeEntry();
      }
    }
    return zipPath;
  }

  // ZipOutputStream refuses repeated names, so the placeholder name is patched in the raw bytes.
  private Path renameEntries(final Path zipPath, final String from, final String to) throws IOException {
    final byte[] data = Files.readAllBytes(zipPath);
    final byte[] source = from.getBytes(StandardCharsets.UTF_8);
    final byte[] target = to.getBytes(StandardCharsets.UTF_8);
    assertThat(source).hasSameSizeAs(target);
    for (int i = 0; i <= data.length - source.length; i++) {
      if (Arrays.equals(data, i, i + source.length, source, 0, source.length)) {
        System.arraycopy(target, 0, data, i, target.length);
      }
    }
    Files.write(zipPath, data);
    return zipPath;
  }

  private Map<String, String> validEntries() throws IOException {
    final String evidence = "{\"k\":1}";
    final String manifest = validManifest();
    final Map<String, String> entries = new LinkedHashMap<>();
    entries.put("evidence/C1/D1/a.json", evidence);
    entries.put(OfflineVerifier.MANIFEST_ENTRY, manifest);
    entries.put(OfflineVerifier.HASHES_ENTRY, "# sha256 list\n"
        + hashLine(evidence, "evidence/C1/D1/a.json") + "\n"
        + hashLine(manifest, OfflineVerifier.MANIFEST_ENTRY) + "\n");
    return entries;
  }

  @Test
  void verifyForensicZip_intactPackage() throws IOException {
    final ZipVerificationResult result = verifier.verifyForensicZip(zip(validEntries()));

    assertThat(result.ok()).isTrue();
    assertThat(result.total()).isEqualTo(2);
    assertThat(result.okCount()).isEqualTo(2);
    assertThat(result.diffs()).isEmpty();
    assertThat(result.auditChain()).hasValueSatisfying(c -> assertThat(c.total()).isEqualTo(2));
    assertThat(result.requireOk()).isSameAs(result);
  }

  @Test
  void verifyForensicZip_alteredEntry_isAMismatch() throws IOException {
    final Map<String, String> entries = validEntries();
    entries.put("evidence/C1/D1/a.json", "{\"k\":2}");

    final ZipVerificationResult result = verifier.verifyForensicZip(zip(entries));

    assertThat(result.ok()).isFalse();
    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.items())
        .filteredOn(i -> i.path().equals("evidence/C1/D1/a.json"))
        .singleElement()
        .satisfies(i -> assertThat(i.status()).isEqualTo(ZipEntryStatus.MISMATCH));
    assertThat(result.diffs()).containsExactly("mismatch: evidence/C1/D1/a.json (sha256 mismatch)");
    assertThatThrownBy(result::requireOk).isInstanceOf(IntegrityException.class);
  }

  @Test
  void verifyForensicZip_missingAndUnlistedEntries() throws IOException {
    final Map<String, String> entries = validEntries();
    final String evidence = entries.remove("evidence/C1/D1/a.json");
    entries.put("evidence/C1/D1/extra.json", evidence);

    final ZipVerificationResult result = verifier.verifyForensicZip(zip(entries));

    assertThat(result.ok()).isFalse();
    assertThat(result.items())
        .extracting(ZipEntryCheck::path, ZipEntryCheck::status)
        .contains(
            tuple("evidence/C1/D1/a.json", ZipEntryStatus.MISSING),
            tuple("evidence/C1/D1/extra.json", ZipEntryStatus.UNLISTED));
  }

  @Test
  void verifyForensicZip_repeatedEntryName_isADuplicate() throws IOException {
    final Map<String, String> valid = validEntries();
    final Map<String, String> entries = new LinkedHashMap<>();
    entries.put("evidence/C1/D1/X.json", "{\"k\":9}");
    entries.putAll(valid);
    final Path zipPath = renameEntries(zip(entries), "evidence/C1/D1/X.json", "evidence/C1/D1/a.json");

    final ZipVerificationResult result = verifier.verifyForensicZip(zipPath);

    assertThat(result.ok()).isFalse();
    assertThat(result.failed()).isPositive();
    assertThat(result.items())
        .filteredOn(i -> i.status() == ZipEntryStatus.DUPLICATE)
        .singleElement()
        .satisfies(i -> {
          assertThat(i.path()).isEqualTo("evidence/C1/D1/a.json");
          assertThat(i.message()).isEqualTo("2 entries share this name");
        });
    assertThat(result.diffs()).contains("duplicate: evidence/C1/D1/a.json (2 entries share this name)");
  }

  @Test
  void verifyForensicZip_brokenEmbeddedChain() throws IOException {
    final AuditEvent first = event("", 0);
    final AuditEvent second = ImmutableAuditEvent.copyOf(event(first.chainHash(), 1)).withAction("altered");
    final String manifest = manifest(List.of(first, second));
    final Map<String, String> entries = new LinkedHashMap<>();
    entries.put(OfflineVerifier.MANIFEST_ENTRY, manifest);
    entries.put(OfflineVerifier.HASHES_ENTRY, hashLine(manifest, OfflineVerifier.MANIFEST_ENTRY) + "\n");

    final ZipVerificationResult result = verifier.verifyForensicZip(zip(entries));

    assertThat(result.ok()).isFalse();
    assertThat(result.failed()).isZero();
    assertThat(result.auditChain()).hasValueSatisfying(c -> assertThat(c.chainHashFailed()).isEqualTo(1));
    assertThat(result.diffs()).containsExactly("audit_chain: chain_hash at index 1 (audit_1)");
  }

  @Test
  void verifyForensicZip_noHashList_isAFormatError() throws IOException {
    final Map<String, String> entries = validEntries();
    entries.remove(OfflineVerifier.HASHES_ENTRY);
    final Path zipPath = zip(entries);

    assertThatThrownBy(() -> verifier.verifyForensicZip(zipPath))
        .isInstanceOf(ArchiveFormatException.class)
        .hasMessageContaining(OfflineVerifier.HASHES_ENTRY);
  }

  @Test
  void verifyForensicZip_malformedHashLine_isAFormatError() throws IOException {
    final Map<String, String> entries = validEntries();
    entries.put(OfflineVerifier.HASHES_ENTRY, "not-a-hash  evidence/C1/D1/a.json\n");
    final Path zipPath = zip(entries);

    assertThatThrownBy(() -> verifier.verifyForensicZip(zipPath))
        .isInstanceOf(ArchiveFormatException.class)
        .hasMessageContaining("line 1");
  }

  @Test
  void verifyForensicZip_unparseableManifest_isAFormatError() throws IOException {
    final String manifest = "{ not json";
    final Map<String, String> entries = new LinkedHashMap<>();
    entries.put(OfflineVerifier.MANIFEST_ENTRY, manifest);
    entries.put(OfflineVerifier.HASHES_ENTRY, hashLine(manifest, OfflineVerifier.MANIFEST_ENTRY) + "\n");
    final Path zipPath = zip(entries);

    assertThatThrownBy(() -> verifier.verifyForensicZip(zipPath))
        .isInstanceOf(ArchiveFormatException.class);
  }
}
