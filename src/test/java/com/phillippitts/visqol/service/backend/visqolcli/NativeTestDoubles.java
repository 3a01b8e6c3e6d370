package com.phillippitts.visqol.service.backend.visqolcli;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fake processes for exercising the native backend without the real binary.
 */
final class NativeTestDoubles {

    private NativeTestDoubles() {}

    /**
     * @param stdout            stdout content
     * @param stderr            stderr content
     * @param exitCode          process exit code
     * @param finishAfterMillis delay before the process exits by itself (-1 means never)
     */
    record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        static ProcessBehavior ok(String stdout) {
            return new ProcessBehavior(stdout, "", 0, 0);
        }
    }

    /**
     * Returns a pre-built process and remembers how it was started.
     */
    static class StubProcessFactory implements ProcessFactory {
        private final Process process;
        volatile List<String> lastCommand;
        volatile Path lastWorkingDir;

        StubProcessFactory(Process process) {
            this.process = process;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            this.lastCommand = List.copyOf(command);
            this.lastWorkingDir = workingDir;
            onStart(command);
            return process;
        }

        /**
         * Hook run before the process is handed back, while the working directory still exists.
         */
        void onStart(List<String> command) throws IOException {
        }
    }

    /**
     * Writes a fixed debug JSON to the path named after {@code --output_debug}, like the real
     * binary does on success.
     */
    static final class DebugWritingProcessFactory extends StubProcessFactory {
        private final String debugJson;
        volatile boolean inputsExisted;

        DebugWritingProcessFactory(Process process, String debugJson) {
            super(process);
            this.debugJson = debugJson;
        }

        @Override
        void onStart(List<String> command) throws IOException {
            inputsExisted = Files.isRegularFile(Path.of(valueOf(command, NativeVisqolConstants.FLAG_REFERENCE)))
                    && Files.isRegularFile(Path.of(valueOf(command, NativeVisqolConstants.FLAG_DEGRADED)));
            if (debugJson != null) {
                Files.writeString(Path.of(valueOf(command, NativeVisqolConstants.FLAG_OUTPUT_DEBUG)), debugJson);
            }
        }
    }

    static final class FailingProcessFactory implements ProcessFactory {
        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            throw new IOException("No such file or directory");
        }
    }

    static String valueOf(List<String> command, String flag) {
        int i = command.indexOf(flag);
        if (i < 0 || i + 1 >= command.size()) {
            throw new IllegalArgumentException("flag " + flag + " not in " + command);
        }
        return command.get(i + 1);
    }

    /**
     * Process with scripted output, exit code and lifetime. {@link #waitFor(long, TimeUnit)} returns
     * as soon as the process finishes or is destroyed.
     */
    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private volatile boolean alive = true;
        private volatile boolean destroyCalled = false;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            long finishAfterMillis = behavior.finishAfterMillis();

            if (finishAfterMillis == 0) {
                this.alive = false;
            } else if (finishAfterMillis > 0) {
                Thread finisher = new Thread(() -> {
                    try {
                        Thread.sleep(finishAfterMillis);
                        alive = false;
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                }, "visqol-test-proc-finisher");
                finisher.setDaemon(true);
                finisher.start();
            }
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() throws InterruptedException {
            while (alive) {
                Thread.sleep(5);
            }
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long deadline = System.nanoTime() + unit.toNanos(timeout);
            while (alive) {
                if (System.nanoTime() >= deadline) {
                    return false;
                }
                Thread.sleep(5);
            }
            return true;
        }

        @Override
        public int exitValue() {
            if (alive) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
