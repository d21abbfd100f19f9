package io.github.cryptoinspector.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.cryptoinspector.endToEnd.BaseEndToEndTest;
import io.github.cryptoinspector.model.CaseDevice;
import io.github.cryptoinspector.model.ImmutableCaseDevice;
import org.junit.jupiter.api.Test;

class DeviceManagerTest extends BaseEndToEndTest {

  private static ImmutableCaseDevice device(final String caseId, final boolean authorized) {
    return ImmutableCaseDevice.builder()
        .deviceId("D1")
        .caseId(caseId)
        .osType("android")
        .deviceName("Pixel 7")
        .identifier("serial-hash-1")
        .connectionType("usb")
        .authorized(authorized)
        .authNote("")
        .build();
  }

  @Test
  void upsertDevice_registersThenRefreshes() throws Exception {
    final DeviceManager deviceManager = component.deviceManager();

    final CaseDevice created = deviceManager.upsertDevice(device("C1", false));
    Thread.sleep(5);
    final CaseDevice refreshed = deviceManager.upsertDevice(device("C1", true).withAuthNote("consent signed"));

    assertThat(created.firstSeenAt()).isPositive();
    assertThat(refreshed.firstSeenAt()).isEqualTo(created.firstSeenAt());
    assertThat(refreshed.lastSeenAt()).isGreaterThan(created.lastSeenAt());
    assertThat(deviceManager.listByCase("C1")).containsExactly(refreshed);
    assertThat(deviceManager.listByCase("C1").get(0).authorized()).isTrue();
  }

  @Test
  void upsertDevice_fromAnotherCase_isRejected() {
    final DeviceManager deviceManager = component.deviceManager();
    deviceManager.upsertDevice(device("C1", true));

    assertThatThrownBy(() -> deviceManager.upsertDevice(device("C2", true)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
