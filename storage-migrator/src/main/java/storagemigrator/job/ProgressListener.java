package storagemigrator.job;

import java.util.List;

/**
 * Receives consolidated progress once per poll tick.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    /**
     * Called after every device has been polled in a tick.
     *
     * @param progress one entry per monitored device, in the order they were given
     */
    void onTick(List<DeviceProgress> progress);
}
