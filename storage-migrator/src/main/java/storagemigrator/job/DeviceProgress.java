package storagemigrator.job;

/**
 * Reported progress of one device during a poll tick.
 *
 * @param device the target device
 * @param percent reported percentage, 0 to 100
 * @param complete whether the device's copy has been seen complete
 */
public record DeviceProgress(String device, int percent, boolean complete) {

    @Override
    public String toString() {
        return device + " -- " + percent + "%";
    }
}
