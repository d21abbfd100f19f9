package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cryptoinspector.exception.ArchiveFormatException;
import io.github.cryptoinspector.helper.HashHelper;
import io.github.cryptoinspector.model.AuditEvent;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies a forensic package using nothing but the package: every entry is re-hashed against
 * {@code hashes.sha256}, and the audit chain embedded in {@code manifest.json} is walked again.
 */
@Singleton
public class OfflineVerifier {

  /**
   * Name of the digest list entry.
   */
  public static final String HASHES_ENTRY = "hashes.sha256";

  /**
   * Name of the manifest entry.
   */
  public static final String MANIFEST_ENTRY = "manifest.json";

  private static final Logger log = LoggerFactory.getLogger(OfflineVerifier.class);
  private static final Pattern HASH_LINE = Pattern.compile("^([0-9a-fA-F]{64})\\s+\\*?(.+)$");
  private static final TypeReference<List<AuditEvent>> AUDIT_LIST = new TypeReference<>() {
  };

  private final HashHelper hashHelper;
  private final AuditChainVerifier auditChainVerifier;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Offline verifier.
   *
   * @param hashHelper         the hash helper
   * @param auditChainVerifier the audit chain verifier
   * @param objectMapper       the object mapper
   */
  @Inject
  public OfflineVerifier(final HashHelper hashHelper,
                         final AuditChainVerifier auditChainVerifier,
                         final ObjectMapper objectMapper) {
    this.hashHelper = hashHelper;
    this.auditChainVerifier = auditChainVerifier;
    this.objectMapper = objectMapper;
  }

  /**
   * Verify a package.
   *
   * @param zipPath the package
   * @return the result
   * @throws IOException            if the archive cannot be opened
   * @throws ArchiveFormatException if the digest list is missing or malformed, or the manifest
   *                                cannot be parsed
   */
  public ZipVerificationResult verifyForensicZip(final Path zipPath) throws IOException {
    log.info("verifyForensicZip({})", zipPath);
    try (ZipFile zip = new ZipFile(zipPath.toFile())) {
      final Map<String, String> listed = readHashList(zip);

      // getEntry() resolves one copy of a name only, so repeated names are reported on their own
      final Map<String, Long> entryCounts = zip.stream()
          .filter(entry -> !entry.isDirectory())
          .collect(Collectors.groupingBy(ZipEntry::getName, TreeMap::new, Collectors.counting()));

      final List<ZipEntryCheck> items = new ArrayList<>();
      for (Map.Entry<String, String> e : listed.entrySet()) {
        items.add(checkListed(zip, e.getKey(), e.getValue()));
      }
      entryCounts.forEach((name, count) -> {
        if (count > 1) {
          items.add(ImmutableZipEntryCheck.builder()
              .path(name)
              .status(ZipEntryStatus.DUPLICATE)
              .message(count + " entries share this name")
              .build());
        }
      });
      final TreeSet<String> unlisted = entryCounts.keySet().stream()
          .filter(name -> !HASHES_ENTRY.equals(name) && !listed.containsKey(name))
          .collect(Collectors.toCollection(TreeSet::new));
      for (String name : unlisted) {
        items.add(ImmutableZipEntryCheck.builder()
            .path(name)
            .status(ZipEntryStatus.UNLISTED)
            .message("present in archive but not in " + HASHES_ENTRY)
            .build());
      }

      final Optional<ChainVerificationResult> chain = verifyManifestChain(zip);

      final List<String> diffs = new ArrayList<>();
      int okCount = 0;
      for (ZipEntryCheck item : items) {
        if (item.status() == ZipEntryStatus.OK) {
          okCount++;
        } else {
          diffs.add(item.status().value() + ": " + item.path()
              + (item.message().isEmpty() ? "" : " (" + item.message() + ")"));
        }
      }
      chain.filter(c -> !c.ok()).ifPresent(c -> c.failures().forEach(f ->
          diffs.add("audit_chain: " + f.kind().value() + " at index " + f.index() + " (" + f.eventId() + ")")));
      final int failed = items.size() - okCount;
      final ZipVerificationResult result = ImmutableZipVerificationResult.builder()
          .zipPath(zipPath.toString())
          .ok(failed == 0 && chain.map(ChainVerificationResult::ok).orElse(true))
          .total(items.size())
          .okCount(okCount)
          .failed(failed)
          .items(items)
          .diffs(diffs)
          .auditChain(chain)
          .build();
      log.info("verifyForensicZip({}): ok={} total={} failed={}", zipPath, result.ok(), result.total(), failed);
      return result;
    }
  }

  private Map<String, String> readHashList(final ZipFile zip) throws IOException {
    final ZipEntry entry = zip.getEntry(HASHES_ENTRY);
    if (entry == null) {
      throw new ArchiveFormatException(HASHES_ENTRY + " not found in archive");
    }
    final Map<String, String> listed = new TreeMap<>();
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(zip.getInputStream(entry), StandardCharsets.UTF_8))) {
      String line;
      int lineNo = 0;
      while ((line = reader.readLine()) != null) {
        lineNo++;
        final String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        final Matcher m = HASH_LINE.matcher(trimmed);
        if (!m.matches()) {
          throw new ArchiveFormatException(HASHES_ENTRY + " line " + lineNo + " is malformed");
        }
        final String path = m.group(2).trim();
        if (listed.put(path, m.group(1).toLowerCase(Locale.ROOT)) != null) {
          throw new ArchiveFormatException(HASHES_ENTRY + " lists " + path + " twice");
        }
      }
    }
    return listed;
  }

  private ZipEntryCheck checkListed(final ZipFile zip, final String path, final String expected) {
    final ImmutableZipEntryCheck.Builder builder = ImmutableZipEntryCheck.builder()
        .path(path)
        .expectedSha256(expected);
    final ZipEntry entry = zip.getEntry(path);
    if (entry == null) {
      return builder.status(ZipEntryStatus.MISSING).message("listed but not in archive").build();
    }
    final String actual;
    try (InputStream in = zip.getInputStream(entry)) {
      final MessageDigest digest = hashHelper.newDigest();
      final byte[] buffer = new byte[64 * 1024];
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
      actual = hashHelper.hex(digest);
    } catch (IOException e) {
      log.warn("checkListed({}): unreadable", path, e);
      return builder.status(ZipEntryStatus.ERROR).message("read failed: " + e.getMessage()).build();
    }
    builder.actualSha256(actual);
    if (!actual.equals(expected)) {
      return builder.status(ZipEntryStatus.MISMATCH).message("sha256 mismatch").build();
    }
    return builder.status(ZipEntryStatus.OK).message("").build();
  }

  private Optional<ChainVerificationResult> verifyManifestChain(final ZipFile zip) throws IOException {
    final ZipEntry entry = zip.getEntry(MANIFEST_ENTRY);
    if (entry == null) {
      return Optional.empty();
    }
    final JsonNode manifest;
    try (InputStream in = zip.getInputStream(entry)) {
      manifest = objectMapper.readTree(in);
    } catch (JsonProcessingException e) {
      throw new ArchiveFormatException(MANIFEST_ENTRY + " is not valid JSON", e);
    }
    final JsonNode audits = manifest == null ? null : manifest.get("audits");
    if (audits == null || !audits.isArray()) {
      throw new ArchiveFormatException(MANIFEST_ENTRY + " has no audits array");
    }
    final List<AuditEvent> events;
    try {
      events = objectMapper.convertValue(audits, AUDIT_LIST);
    } catch (IllegalArgumentException e) {
      throw new ArchiveFormatException(MANIFEST_ENTRY + " audits cannot be read", e);
    }
    return Optional.of(auditChainVerifier.verify(events));
  }
}
