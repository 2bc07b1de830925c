package storagemigrator.session;

import storagemigrator.job.DeviceProgress;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The operator's side of a session: what they read and what they are asked.
 *
 * @see TerminalConsole
 */
public interface OperatorConsole {

    /**
     * Shows one line of text.
     *
     * @param line the text
     */
    void println(String line);

    /**
     * Asks a yes/no question. Anything but an explicit yes is a no.
     *
     * @param question the question, without the answer hint
     * @return true only if the operator answered yes
     */
    boolean confirm(String question);

    /**
     * Shows consolidated block-copy progress for one poll tick.
     *
     * @param progress per-device progress
     */
    default void progress(List<DeviceProgress> progress) {
        println(formatProgress(progress));
    }

    static String formatProgress(List<DeviceProgress> progress) {
        return progress.stream()
                .map(p -> "Migrating " + p)
                .collect(Collectors.joining(" | "));
    }
}
