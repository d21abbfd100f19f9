package io.github.cryptoinspector.manager;

import io.github.cryptoinspector.dao.CaseDeviceDao;
import io.github.cryptoinspector.model.CaseDevice;
import io.github.cryptoinspector.model.ImmutableCaseDevice;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers devices against cases.
 */
@Singleton
public class DeviceManager {

  private static final Logger log = LoggerFactory.getLogger(DeviceManager.class);

  private final CaseDeviceDao caseDeviceDao;
  private final CaseManager caseManager;
  private final Clock clock;

  @Inject
  public DeviceManager(final CaseDeviceDao caseDeviceDao,
                       final CaseManager caseManager,
                       final Clock clock) {
    this.caseDeviceDao = caseDeviceDao;
    this.caseManager = caseManager;
    this.clock = clock;
  }

  /**
   * Insert the device, or refresh its name, connection, authorization and last seen time if it
   * is already registered. The first seen time of a known device never changes.
   *
   * @param device the device; its seen times are ignored
   * @return the device as stored
   */
  public CaseDevice upsertDevice(final CaseDevice device) {
    caseManager.ensureCase(device.caseId());
    final long now = clock.millis();
    final Optional<CaseDevice> existing = caseDeviceDao.find(device.deviceId());
    if (existing.isPresent()) {
      if (!existing.get().caseId().equals(device.caseId())) {
        throw new IllegalArgumentException("device " + device.deviceId() + " belongs to another case");
      }
      final CaseDevice refreshed = ImmutableCaseDevice.copyOf(device)
          .withFirstSeenAt(existing.get().firstSeenAt())
          .withLastSeenAt(now);
      caseDeviceDao.touch(refreshed);
      return refreshed;
    }
    final CaseDevice created = ImmutableCaseDevice.copyOf(device)
        .withFirstSeenAt(now)
        .withLastSeenAt(now);
    caseDeviceDao.insert(created);
    log.info("upsertDevice({}, {}): registered", device.caseId(), device.deviceId());
    return created;
  }

  public List<CaseDevice> listByCase(final String caseId) {
    return caseDeviceDao.listByCase(caseId);
  }
}
