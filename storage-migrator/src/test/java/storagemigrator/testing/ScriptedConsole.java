package storagemigrator.testing;

import storagemigrator.job.DeviceProgress;
import storagemigrator.session.OperatorConsole;

import java.util.ArrayList;
import java.util.List;

/** Console with a fixed answer that keeps everything it was shown. */
public final class ScriptedConsole implements OperatorConsole {

    private final boolean answer;
    private final List<String> lines = new ArrayList<>();
    private final List<String> questions = new ArrayList<>();
    private final List<List<DeviceProgress>> ticks = new ArrayList<>();

    public ScriptedConsole(boolean answer) {
        this.answer = answer;
    }

    public static ScriptedConsole answering(boolean answer) {
        return new ScriptedConsole(answer);
    }

    @Override
    public void println(String line) {
        lines.add(line);
    }

    @Override
    public boolean confirm(String question) {
        questions.add(question);
        return answer;
    }

    @Override
    public void progress(List<DeviceProgress> progress) {
        ticks.add(progress);
        OperatorConsole.super.progress(progress);
    }

    public List<String> lines() {
        return lines;
    }

    public List<String> questions() {
        return questions;
    }

    public List<List<DeviceProgress>> ticks() {
        return ticks;
    }

    public String output() {
        return String.join("\n", lines);
    }
}
