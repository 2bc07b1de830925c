package storagemigrator.session;

import storagemigrator.job.DeviceProgress;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link OperatorConsole} on a terminal. Progress is redrawn in place on one line.
 */
public final class TerminalConsole implements OperatorConsole {

    private final BufferedReader in;
    private final PrintStream out;
    private boolean progressLineOpen;

    public TerminalConsole(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(Objects.requireNonNull(in, "in"), StandardCharsets.UTF_8));
        this.out = Objects.requireNonNull(out, "out");
    }

    /** Console on {@code System.in} and {@code System.out}. */
    public static TerminalConsole system() {
        return new TerminalConsole(System.in, System.out);
    }

    @Override
    public void println(String line) {
        closeProgressLine();
        out.println(line);
    }

    @Override
    public boolean confirm(String question) {
        closeProgressLine();
        out.print(question + " (y/N): ");
        out.flush();
        try {
            String answer = in.readLine();
            return isYes(answer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read operator answer", e);
        }
    }

    @Override
    public void progress(List<DeviceProgress> progress) {
        out.print("\r" + OperatorConsole.formatProgress(progress));
        out.flush();
        progressLineOpen = true;
        if (progress.stream().allMatch(DeviceProgress::complete)) {
            closeProgressLine();
        }
    }

    static boolean isYes(String answer) {
        if (answer == null) {
            return false;
        }
        String a = answer.trim().toLowerCase(Locale.ROOT);
        return a.equals("y") || a.equals("yes");
    }

    private void closeProgressLine() {
        if (progressLineOpen) {
            out.println();
            progressLineOpen = false;
        }
    }
}
