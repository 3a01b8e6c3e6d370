package com.phillippitts.visqol.service.backend.visqolcli;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.exception.MeasurementCancelledException;
import com.phillippitts.visqol.exception.MeasurementException;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.visqol.service.backend.visqolcli.NativeTestDoubles.FailingProcessFactory;
import static com.phillippitts.visqol.service.backend.visqolcli.NativeTestDoubles.ProcessBehavior;
import static com.phillippitts.visqol.service.backend.visqolcli.NativeTestDoubles.StubProcessFactory;
import static com.phillippitts.visqol.service.backend.visqolcli.NativeTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VisqolProcessManagerHermeticTest {

    private static final List<String> COMMAND = List.of("/opt/visqol/visqol", "--reference_file", "r.wav");

    private static NativeVisqolConfig cfg(int timeoutSeconds, int maxStdoutBytes) {
        return new NativeVisqolConfig(true, "/opt/visqol/visqol", "/opt/visqol/audio.txt",
                "/opt/visqol/speech.tflite", timeoutSeconds, maxStdoutBytes);
    }

    @Test
    void successReturnsStdout() {
        TestProcess tp = new TestProcess(ProcessBehavior.ok("MOS-LQO:\t\t4.21"));
        StubProcessFactory factory = new StubProcessFactory(tp);
        VisqolProcessManager mgr = new VisqolProcessManager(factory);

        String out = mgr.run(COMMAND, Path.of("/tmp"), cfg(2, 1 << 20));

        assertThat(out).contains("MOS-LQO:\t\t4.21");
        assertThat(factory.lastCommand).isEqualTo(COMMAND);
        assertThat(factory.lastWorkingDir).isEqualTo(Path.of("/tmp"));
        assertThat(mgr.runningCount()).isZero();
    }

    @Test
    void nonZeroExitThrowsWithStderrSnippet() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "Failed to read reference", 3, 0));
        VisqolProcessManager mgr = new VisqolProcessManager(new StubProcessFactory(tp));

        assertThatThrownBy(() -> mgr.run(COMMAND, null, cfg(2, 1 << 20)))
                .isInstanceOf(MeasurementException.class)
                .hasMessageContaining("Non-zero exit: 3")
                .hasMessageContaining("exitCode=3")
                .hasMessageContaining("stderr=Failed to read reference")
                .hasMessageContaining("backend: visqol-native");
    }

    @Test
    void timeoutKillsProcessAndThrows() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, -1));
        VisqolProcessManager mgr = new VisqolProcessManager(new StubProcessFactory(tp));

        long start = System.nanoTime();
        assertThatThrownBy(() -> mgr.run(COMMAND, null, cfg(1, 1 << 20)))
                .isInstanceOf(MeasurementException.class)
                .hasMessageContaining("Timeout after 1s");
        long durationMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(durationMs).isLessThan(5000);
        assertThat(tp.wasDestroyCalled()).isTrue();
        assertThat(mgr.runningCount()).isZero();
    }

    @Test
    void startFailureIsReportedAsMeasurementError() {
        VisqolProcessManager mgr = new VisqolProcessManager(new FailingProcessFactory());

        assertThatThrownBy(() -> mgr.run(COMMAND, null, cfg(2, 1 << 20)))
                .isInstanceOf(MeasurementException.class)
                .hasMessageContaining("Failed to start process: No such file or directory")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void stdoutIsCappedAtConfiguredSize() {
        String longLine = "x".repeat(500);
        TestProcess tp = new TestProcess(ProcessBehavior.ok(longLine + "\n" + longLine));
        VisqolProcessManager mgr = new VisqolProcessManager(new StubProcessFactory(tp));

        String out = mgr.run(COMMAND, null, cfg(2, 100));

        assertThat(out).hasSize(100);
    }

    @Test
    void closeTerminatesRunningProcess() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, -1));
        VisqolProcessManager mgr = new VisqolProcessManager(new StubProcessFactory(tp));

        CompletableFuture<String> run = CompletableFuture.supplyAsync(() -> mgr.run(COMMAND, null, cfg(30, 1 << 20)));
        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> mgr.runningCount() == 1);

        mgr.close();

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(run::isDone);
        assertThat(tp.wasDestroyCalled()).isTrue();
        assertThat(mgr.runningCount()).isZero();
    }

    @Test
    void interruptWhileWaitingCancelsAndDestroys() throws Exception {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, -1));
        VisqolProcessManager mgr = new VisqolProcessManager(new StubProcessFactory(tp));
        CompletableFuture<Throwable> failure = new CompletableFuture<>();

        Thread worker = new Thread(() -> {
            try {
                mgr.run(COMMAND, null, cfg(30, 1 << 20));
                failure.complete(null);
            } catch (RuntimeException e) {
                failure.complete(e);
            }
        });
        worker.start();
        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> mgr.runningCount() == 1);
        worker.interrupt();

        assertThat(failure.get(5, TimeUnit.SECONDS)).isInstanceOf(MeasurementCancelledException.class);
        assertThat(tp.wasDestroyCalled()).isTrue();
    }

    @Test
    void relativePathsResolveAgainstWorkingDirectory() {
        assertThat(VisqolProcessManager.resolvePath("/abs/visqol")).isEqualTo(Path.of("/abs/visqol"));
        assertThat(VisqolProcessManager.resolvePath("tools/visqol").isAbsolute()).isTrue();
        assertThat(VisqolProcessManager.resolvePath("tools/visqol")).endsWith(Path.of("tools", "visqol"));
    }
}
