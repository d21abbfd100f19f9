package io.github.cryptoinspector.cli.output;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cryptoinspector.verify.ChainFailureKind;
import io.github.cryptoinspector.verify.ImmutableChainFailure;
import io.github.cryptoinspector.verify.ImmutableChainVerificationResult;
import io.github.cryptoinspector.verify.ImmutableZipVerificationResult;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultPrinterTest {

  private ResultPrinter printer;
  private StringWriter buffer;
  private PrintWriter out;

  @BeforeEach
  void setup() {
    printer = new ResultPrinter(new ObjectMapper().findAndRegisterModules().writerWithDefaultPrettyPrinter());
    buffer = new StringWriter();
    out = new PrintWriter(buffer, true);
  }

  @Test
  void zipResult_listsEveryDiff() throws Exception {
    printer.print(out, ImmutableZipVerificationResult.builder()
        .zipPath("/tmp/p.zip")
        .ok(false)
        .total(3)
        .okCount(1)
        .failed(2)
        .addDiffs("mismatch: evidence/a.json (sha256 mismatch)", "missing: rules/r.yaml (listed but not in archive)")
        .build(), false);

    assertThat(buffer.toString())
        .contains("entries: total=3 ok=1 failed=2")
        .contains("mismatch: evidence/a.json (sha256 mismatch)")
        .contains("missing: rules/r.yaml")
        .doesNotContain(ResultPrinter.NO_DIFFS);
  }

  @Test
  void chainResult_text() throws Exception {
    printer.print(out, ImmutableChainVerificationResult.builder()
        .ok(false)
        .total(2)
        .failed(1)
        .prevHashFailed(0)
        .chainHashFailed(1)
        .lastChainHash("ab")
        .addFailures(ImmutableChainFailure.builder()
            .index(1)
            .eventId("audit_1")
            .kind(ChainFailureKind.CHAIN_HASH)
            .expected("aa")
            .actual("bb")
            .build())
        .build(), false);

    assertThat(buffer.toString()).contains("chain_hash at index 1 (audit_1): expected aa, found bb");
  }

  @Test
  void chainResult_json() throws Exception {
    printer.print(out, ImmutableChainVerificationResult.builder()
        .ok(true)
        .total(0)
        .failed(0)
        .prevHashFailed(0)
        .chainHashFailed(0)
        .lastChainHash("")
        .build(), true);

    assertThat(new ObjectMapper().readTree(buffer.toString()).get("ok").asBoolean()).isTrue();
  }
}
