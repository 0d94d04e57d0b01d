package com.phillippitts.saleshud.service.audio;

/**
 * Per-start capture options.
 *
 * @param deviceName input device override; {@code null} uses the configured or system default
 * @param noiseGate  zero samples below the gate threshold
 * @param autoGain   scale frames toward the target peak
 */
public record DeviceConstraints(String deviceName, boolean noiseGate, boolean autoGain) {

    public DeviceConstraints {
        deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public static DeviceConstraints defaults() {
        return new DeviceConstraints(null, true, true);
    }
}
