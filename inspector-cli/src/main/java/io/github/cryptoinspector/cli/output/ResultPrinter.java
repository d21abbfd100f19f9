package io.github.cryptoinspector.cli.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.github.cryptoinspector.export.ExportResult;
import io.github.cryptoinspector.verify.ArtifactCheck;
import io.github.cryptoinspector.verify.ArtifactCheckStatus;
import io.github.cryptoinspector.verify.ArtifactVerificationResult;
import io.github.cryptoinspector.verify.ChainFailure;
import io.github.cryptoinspector.verify.ChainVerificationResult;
import io.github.cryptoinspector.verify.ZipVerificationResult;
import java.io.PrintWriter;

/**
 * Renders command results either as JSON or as a short text report with one line per diff.
 */
public class ResultPrinter {

  /**
   * Printed when a verification found nothing to report.
   */
  public static final String NO_DIFFS = "no diffs";

  private final ObjectWriter objectWriter;

  public ResultPrinter(final ObjectWriter objectWriter) {
    this.objectWriter = objectWriter;
  }

  /**
   * Print an offline package verification.
   *
   * @param out    the output
   * @param result the result
   * @param json   print JSON instead of text
   * @throws JsonProcessingException if the result cannot be serialized
   */
  public void print(final PrintWriter out, final ZipVerificationResult result, final boolean json)
      throws JsonProcessingException {
    if (json) {
      out.println(objectWriter.writeValueAsString(result));
      return;
    }
    out.printf("package: %s%n", result.zipPath());
    out.printf("entries: total=%d ok=%d failed=%d%n", result.total(), result.okCount(), result.failed());
    result.auditChain().ifPresent(chain ->
        out.printf("audit chain: total=%d failed=%d%n", chain.total(), chain.failed()));
    if (result.diffs().isEmpty()) {
      out.println(NO_DIFFS);
    } else {
      result.diffs().forEach(out::println);
    }
  }

  /**
   * Print an artifact verification.
   *
   * @param out    the output
   * @param result the result
   * @param json   print JSON instead of text
   * @throws JsonProcessingException if the result cannot be serialized
   */
  public void print(final PrintWriter out, final ArtifactVerificationResult result, final boolean json)
      throws JsonProcessingException {
    if (json) {
      out.println(objectWriter.writeValueAsString(result));
      return;
    }
    out.printf("artifacts: total=%d ok=%d mismatch=%d missing=%d error=%d%n",
        result.items().size(), result.okCount(), result.mismatchCount(), result.missingCount(),
        result.errorCount());
    boolean any = false;
    for (ArtifactCheck item : result.items()) {
      if (item.status() != ArtifactCheckStatus.OK) {
        out.printf("%s: %s %s (%s)%n", item.status().value(), item.artifactId(), item.snapshotPath(),
            item.message());
        any = true;
      }
    }
    if (!any) {
      out.println(NO_DIFFS);
    }
  }

  /**
   * Print an audit chain verification.
   *
   * @param out    the output
   * @param result the result
   * @param json   print JSON instead of text
   * @throws JsonProcessingException if the result cannot be serialized
   */
  public void print(final PrintWriter out, final ChainVerificationResult result, final boolean json)
      throws JsonProcessingException {
    if (json) {
      out.println(objectWriter.writeValueAsString(result));
      return;
    }
    out.printf("audit chain: total=%d failed=%d prev_hash_failed=%d chain_hash_failed=%d%n",
        result.total(), result.failed(), result.prevHashFailed(), result.chainHashFailed());
    out.printf("last chain hash: %s%n", result.lastChainHash());
    if (result.failures().isEmpty()) {
      out.println(NO_DIFFS);
      return;
    }
    for (ChainFailure failure : result.failures()) {
      out.printf("%s at index %d (%s): expected %s, found %s%n", failure.kind().value(), failure.index(),
          failure.eventId(), failure.expected(), failure.actual());
    }
  }

  /**
   * Print an export.
   *
   * @param out    the output
   * @param result the result
   * @param json   print JSON instead of text
   * @throws JsonProcessingException if the result cannot be serialized
   */
  public void print(final PrintWriter out, final ExportResult result, final boolean json)
      throws JsonProcessingException {
    if (json) {
      out.println(objectWriter.writeValueAsString(result));
      return;
    }
    out.printf("zip: %s%n", result.zipPath());
    out.printf("sha256: %s%n", result.zipSha256());
    out.printf("report: %s%n", result.reportId());
    result.warnings().forEach(w -> out.printf("warning: %s%n", w));
    if (result.cancelled()) {
      out.println("cancelled");
    }
  }
}
